package org.background.task.engine.core.monitor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.lang.management.ManagementFactory;
import java.lang.management.MemoryMXBean;
import java.lang.management.OperatingSystemMXBean;
import java.nio.file.FileStore;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Samples the host through the platform management beans. Disk figures describe the file store
 * holding the working directory.
 */
@Component
public class JvmSystemMetricsSampler implements SystemMetricsSampler {

    private static final Logger logger = LoggerFactory.getLogger(JvmSystemMetricsSampler.class);

    private final OperatingSystemMXBean osBean = ManagementFactory.getOperatingSystemMXBean();
    private final MemoryMXBean memoryBean = ManagementFactory.getMemoryMXBean();
    private final Path diskRoot = Paths.get("").toAbsolutePath();

    @Override
    public double cpuUsagePercent() {
        double load;
        if (osBean instanceof com.sun.management.OperatingSystemMXBean sunBean) {
            load = sunBean.getCpuLoad() * 100.0;
        } else {
            load = osBean.getSystemLoadAverage() / Math.max(1, osBean.getAvailableProcessors()) * 100.0;
        }
        // Not available on every platform
        if (load < 0 || Double.isNaN(load)) {
            return 0.0;
        }
        return Math.min(100.0, load);
    }

    @Override
    public long systemMemoryUsedBytes() {
        if (osBean instanceof com.sun.management.OperatingSystemMXBean sunBean) {
            return Math.max(0, sunBean.getTotalMemorySize() - sunBean.getFreeMemorySize());
        }
        return processMemoryUsedBytes();
    }

    @Override
    public long systemMemoryTotalBytes() {
        if (osBean instanceof com.sun.management.OperatingSystemMXBean sunBean) {
            return sunBean.getTotalMemorySize();
        }
        return Runtime.getRuntime().maxMemory();
    }

    @Override
    public long processMemoryUsedBytes() {
        return memoryBean.getHeapMemoryUsage().getUsed() + memoryBean.getNonHeapMemoryUsage().getUsed();
    }

    @Override
    public long diskUsedBytes() {
        try {
            FileStore store = Files.getFileStore(diskRoot);
            return store.getTotalSpace() - store.getUnallocatedSpace();
        } catch (IOException e) {
            logger.debug("Unable to read disk usage for {}: {}", diskRoot, e.getMessage());
            return 0;
        }
    }

    @Override
    public long diskTotalBytes() {
        try {
            return Files.getFileStore(diskRoot).getTotalSpace();
        } catch (IOException e) {
            logger.debug("Unable to read disk capacity for {}: {}", diskRoot, e.getMessage());
            return 0;
        }
    }

    @Override
    public int availableProcessors() {
        return Runtime.getRuntime().availableProcessors();
    }
}

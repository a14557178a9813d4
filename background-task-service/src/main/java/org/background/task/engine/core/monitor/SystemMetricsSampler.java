package org.background.task.engine.core.monitor;

/**
 * Source of raw host measurements. The monitor never talks to the operating system directly.
 */
public interface SystemMetricsSampler {

    /** Whole-system CPU usage in percent, 0 when unavailable. */
    double cpuUsagePercent();

    long systemMemoryUsedBytes();

    long systemMemoryTotalBytes();

    /** Memory held by this process; checked against the memory ceiling on admission. */
    long processMemoryUsedBytes();

    long diskUsedBytes();

    long diskTotalBytes();

    int availableProcessors();
}

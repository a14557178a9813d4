package org.background.task.engine.core.health;

import org.background.task.engine.config.TaskEngineConfig;
import org.background.task.engine.core.engine.BackgroundTaskEngine;
import org.background.task.engine.core.monitor.ResourceLimits;
import org.background.task.engine.core.monitor.ResourceMonitor;
import org.background.task.engine.core.monitor.SystemSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;

/**
 * Combines engine statistics and resource monitor readings into a health view, and performs
 * emergency cleanup when the host is under pressure.
 */
@Service
public class SystemHealthService {

    private static final Logger logger = LoggerFactory.getLogger(SystemHealthService.class);

    private final BackgroundTaskEngine engine;
    private final ResourceMonitor monitor;
    private final TaskEngineConfig config;

    public SystemHealthService(BackgroundTaskEngine engine, ResourceMonitor monitor, TaskEngineConfig config) {
        this.engine = engine;
        this.monitor = monitor;
        this.config = config;
    }

    public HealthSummary healthSummary() {
        SystemSnapshot snapshot = monitor.getSystemSnapshot();
        ResourceLimits limits = monitor.getLimits();
        return new HealthSummary(
                ResourceMonitor.evaluateHealth(snapshot),
                snapshot,
                engine.getSystemStats(),
                limits,
                ResourceMonitor.recommend(snapshot, limits),
                Instant.now());
    }

    /**
     * Cancels every running non-critical task, switches to the low-memory preset and prunes the
     * metrics history.
     */
    public EmergencyCleanupResult emergencyCleanup() {
        logger.warn("Emergency cleanup requested");
        int cancelled = engine.cancelNonCriticalTasks();
        ResourceLimits limits = monitor.optimizeForLowMemory();
        int removed = monitor.cleanupOldMetrics(config.getCompletedHistoryCap());
        logger.warn("Emergency cleanup completed - cancelled {} tasks, pruned {} metrics, limits now {}",
                cancelled, removed, limits);
        return new EmergencyCleanupResult(cancelled, removed, limits);
    }
}

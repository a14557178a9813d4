package org.background.task.engine.core.monitor;

import java.time.Duration;
import java.time.Instant;

/**
 * Point-in-time view of host resources and task accounting.
 *
 * @param averageTaskDuration mean duration in milliseconds over the retained history
 * @param uptime              time since monitoring started
 */
public record SystemSnapshot(
        double cpuUsagePercent,
        long memoryUsedBytes,
        long memoryTotalBytes,
        long diskUsedBytes,
        long diskTotalBytes,
        int activeTasks,
        int completedTasks,
        double averageTaskDuration,
        Duration uptime,
        Instant sampledAt) {

    public double memoryUsageRatio() {
        return memoryTotalBytes > 0 ? (double) memoryUsedBytes / memoryTotalBytes : 0.0;
    }

    public static SystemSnapshot empty() {
        return new SystemSnapshot(0.0, 0, 0, 0, 0, 0, 0, 0.0, Duration.ZERO, Instant.now());
    }
}

package org.background.task.engine.core.model;

/**
 * Aggregate view over the task registry and the worker pool.
 *
 * @param successRate completed / total * 100, or 0 when no tasks are known
 */
public record SystemStats(
        int totalTasks,
        int completedTasks,
        int failedTasks,
        int cancelledTasks,
        int runningTasks,
        int queuedTasks,
        int activeWorkers,
        int maxWorkers,
        double successRate) {

    public static double successRate(int completed, int total) {
        return total > 0 ? (completed * 100.0) / total : 0.0;
    }
}

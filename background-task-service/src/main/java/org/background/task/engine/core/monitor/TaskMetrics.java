package org.background.task.engine.core.monitor;

import org.background.task.engine.core.model.TaskKind;
import org.background.task.engine.core.model.TaskStatus;

import java.time.Instant;

/**
 * Resource accounting for one task, recorded when the monitor admits it.
 *
 * @param memoryPeak bytes in use when the task started
 * @param cpuPeak    CPU percentage when the task started
 */
public record TaskMetrics(
        String taskId,
        TaskKind kind,
        Instant startTime,
        Instant endTime,
        Long durationMs,
        long memoryPeak,
        double cpuPeak,
        TaskStatus status) {

    public static TaskMetrics started(String taskId, TaskKind kind, long memoryBytes, double cpuPercent) {
        return new TaskMetrics(taskId, kind, Instant.now(), null, null, memoryBytes, cpuPercent, TaskStatus.RUNNING);
    }

    public TaskMetrics finish(TaskStatus finalStatus) {
        Instant end = Instant.now();
        long duration = Math.max(0, end.toEpochMilli() - startTime.toEpochMilli());
        return new TaskMetrics(taskId, kind, startTime, end, duration, memoryPeak, cpuPeak, finalStatus);
    }
}

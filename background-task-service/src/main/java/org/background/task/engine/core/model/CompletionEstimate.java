package org.background.task.engine.core.model;

/**
 * Rough completion estimate for a task of a given kind submitted now.
 *
 * @param estimatedMinutes base minutes of the kind scaled by current load
 * @param queuePosition    position the task would take, counting from 1
 * @param loadMultiplier   1 + 0.1 per queued task + 0.2 per running task
 */
public record CompletionEstimate(
        TaskKind kind,
        double estimatedMinutes,
        int queuePosition,
        int queueLength,
        int activeTasks,
        double loadMultiplier) {
}

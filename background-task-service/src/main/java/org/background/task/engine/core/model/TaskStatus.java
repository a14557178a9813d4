package org.background.task.engine.core.model;

/**
 * Lifecycle state of a background task.
 *
 * <p>Transitions only move forward: QUEUED to RUNNING, CANCELLED or FAILED, and RUNNING to any
 * terminal state. Nothing leaves a terminal state.
 */
public enum TaskStatus {
    QUEUED,
    RUNNING,
    COMPLETED,
    FAILED,
    CANCELLED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }

    public boolean canTransitionTo(TaskStatus target) {
        if (target == null || isTerminal()) {
            return false;
        }
        return switch (this) {
            case QUEUED -> target == RUNNING || target == CANCELLED || target == FAILED;
            case RUNNING -> target.isTerminal();
            default -> false;
        };
    }
}

package org.background.task.engine.api.exception;

/**
 * Thrown inside processors once they observe that their task was cancelled.
 */
public class TaskCancelledException extends Exception {
    private final String reason;

    public TaskCancelledException(String reason) {
        super("Task was cancelled: " + reason);
        this.reason = reason;
    }

    public String getReason() {
        return reason;
    }
}

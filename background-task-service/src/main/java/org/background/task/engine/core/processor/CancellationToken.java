package org.background.task.engine.core.processor;

import org.background.task.engine.api.exception.TaskCancelledException;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Cooperative cancellation flag shared between the engine and the processor running a task.
 *
 * <p>A token is settled exactly once: either cancelled, or finished by the worker that ran the
 * task to a successful or failed end. Whichever happens first wins.
 */
public class CancellationToken {

    private static final int ACTIVE = 0;
    private static final int CANCELLED = 1;
    private static final int FINISHED = 2;

    private final String taskId;
    private final AtomicInteger state = new AtomicInteger(ACTIVE);
    private volatile String reason;

    public CancellationToken(String taskId) {
        this.taskId = taskId;
    }

    public String getTaskId() {
        return taskId;
    }

    /**
     * Requests cancellation.
     *
     * @return {@code true} for the first call, {@code false} if cancellation was already requested
     *         or the task has finished
     */
    public boolean cancel(String reason) {
        if (state.compareAndSet(ACTIVE, CANCELLED)) {
            this.reason = reason;
            return true;
        }
        return false;
    }

    /**
     * Claims the token for the worker's own terminal write.
     *
     * @return {@code false} if cancellation got there first
     */
    public boolean finish() {
        return state.compareAndSet(ACTIVE, FINISHED) || state.get() == FINISHED;
    }

    public boolean isCancelled() {
        return state.get() == CANCELLED;
    }

    public boolean isFinished() {
        return state.get() == FINISHED;
    }

    public String getReason() {
        return reason;
    }

    /**
     * @throws TaskCancelledException if cancellation was requested or the current thread was interrupted
     */
    public void throwIfCancelled() throws TaskCancelledException {
        if (isCancelled()) {
            throw new TaskCancelledException(reason != null ? reason : "cancelled");
        }
        if (Thread.currentThread().isInterrupted()) {
            throw new TaskCancelledException("thread interrupted");
        }
    }
}

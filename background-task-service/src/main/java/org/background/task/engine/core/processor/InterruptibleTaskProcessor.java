package org.background.task.engine.core.processor;

/**
 * Extension of {@link TaskProcessor} that wants to hear about cancellation directly.
 * <p>
 * The engine calls {@link #cancelTask(String)} as soon as cancellation of a task of this
 * processor's kind is requested, before the cancel command is applied to the registry. This lets
 * implementations release external resources or stop blocking work early.
 * </p>
 */
public interface InterruptibleTaskProcessor extends TaskProcessor {

    /**
     * Called when a task should stop. The default implementation does nothing.
     *
     * @param taskId id of the task being cancelled
     */
    default void cancelTask(String taskId) {
    }
}

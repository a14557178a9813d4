package org.background.task.engine.core.processor;

import org.background.task.engine.core.model.TaskKind;

/**
 * Executes the payload of one {@link TaskKind}.
 *
 * <p>A normal return marks the task completed; any exception marks it failed with the exception
 * message. Implementations should call {@link TaskExecutionContext#checkCancelled()} between
 * sub-steps.
 */
public interface TaskProcessor {

    TaskKind getTaskKind();

    void process(TaskExecutionContext context) throws Exception;
}

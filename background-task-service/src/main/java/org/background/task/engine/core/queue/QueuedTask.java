package org.background.task.engine.core.queue;

import org.background.task.engine.core.model.TaskKind;
import org.background.task.engine.core.model.TaskPriority;
import org.background.task.engine.core.processor.CancellationToken;

import java.time.Instant;
import java.util.Comparator;

/**
 * Queue entry for a task awaiting admission.
 *
 * @param sequence arrival order, used to keep equal priorities first in first out
 */
public record QueuedTask(
        String taskId,
        TaskKind kind,
        TaskPriority priority,
        long sequence,
        Instant enqueuedAt,
        CancellationToken token) {

    /** Highest priority first, then lowest sequence. */
    public static final Comparator<QueuedTask> ADMISSION_ORDER =
            Comparator.comparingInt((QueuedTask task) -> task.priority().getLevel()).reversed()
                    .thenComparingLong(QueuedTask::sequence);

    public boolean isCancelled() {
        return token != null && token.isCancelled();
    }
}

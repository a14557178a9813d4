package org.background.task.engine.core.processor;

import org.background.task.engine.api.exception.TaskCancelledException;
import org.background.task.engine.core.model.TaskKind;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * Everything a processor gets to see of the task it runs.
 *
 * @param metadata snapshot of the task metadata taken at admission
 */
public record TaskExecutionContext(
        String taskId,
        TaskKind kind,
        Map<String, Object> metadata,
        ProgressReporter progressReporter,
        CancellationToken cancellationToken) {

    public TaskExecutionContext {
        metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new HashMap<>(metadata));
    }

    public void reportProgress(double progress, String message) {
        progressReporter.report(progress, message);
    }

    public void reportProgress(double progress, String message, Map<String, Object> extra) {
        progressReporter.report(progress, message, extra);
    }

    public void checkCancelled() throws TaskCancelledException {
        cancellationToken.throwIfCancelled();
    }
}

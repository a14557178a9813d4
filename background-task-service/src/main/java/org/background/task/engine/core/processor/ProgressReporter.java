package org.background.task.engine.core.processor;

import java.util.Map;

/**
 * Sink for progress updates emitted by a running processor. Updates are applied asynchronously.
 */
@FunctionalInterface
public interface ProgressReporter {

    void report(double progress, String message, Map<String, Object> metadata);

    default void report(double progress, String message) {
        report(progress, message, Map.of());
    }
}

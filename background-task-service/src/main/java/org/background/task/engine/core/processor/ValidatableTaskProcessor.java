package org.background.task.engine.core.processor;

import java.util.Map;

public interface ValidatableTaskProcessor {
    /**
     * Validates task metadata before the task is queued.
     * @param metadata the submitted metadata, never null
     * @throws IllegalArgumentException if validation fails
     */
    void validateTask(Map<String, Object> metadata) throws IllegalArgumentException;
}

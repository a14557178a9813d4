package org.background.task.engine.core.model;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * Progress event delivered through the progress channel.
 *
 * @param taskId   the task the event belongs to
 * @param progress percentage, clamped to [0, 100]; NaN becomes 0
 * @param message  human readable status line
 * @param metadata entries merged into the task's metadata, never null
 */
public record TaskProgress(String taskId, double progress, String message, Map<String, Object> metadata) {

    public TaskProgress {
        if (Double.isNaN(progress)) {
            progress = 0.0;
        }
        progress = Math.max(0.0, Math.min(100.0, progress));
        metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new HashMap<>(metadata));
    }

    public TaskProgress(String taskId, double progress, String message) {
        this(taskId, progress, message, Map.of());
    }
}

package org.background.task.engine.api.dto;

import org.background.task.engine.core.model.TaskStatus;

import java.time.Instant;
import java.util.Map;

/**
 * Read model of a task as returned by the REST API.
 *
 * @param taskType wire name of the kind, e.g. {@code web_scraping}
 */
public record TaskView(
        String id,
        String taskType,
        String priority,
        TaskStatus status,
        double progress,
        String message,
        Map<String, Object> metadata,
        Instant createdAt,
        Instant startedAt,
        Instant completedAt,
        String errorMessage) {
}

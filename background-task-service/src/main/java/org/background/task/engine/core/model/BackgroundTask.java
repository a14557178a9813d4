package org.background.task.engine.core.model;

import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * Registry record of a single unit of background work.
 *
 * <p>Instances held by the registry are mutated only under the registry write lock; callers
 * always receive a {@link #copy()}.
 */
@Data
@NoArgsConstructor
public class BackgroundTask {

    private String id;
    private TaskKind kind;
    private TaskPriority priority;
    private TaskStatus status;
    private double progress;
    private String message;
    private Map<String, Object> metadata = new HashMap<>();
    private Instant createdAt;
    private Instant startedAt;
    private Instant completedAt;
    private String errorMessage;

    /**
     * Creates a freshly queued task.
     */
    public static BackgroundTask queued(String id, TaskKind kind, TaskPriority priority,
                                        Map<String, Object> metadata) {
        BackgroundTask task = new BackgroundTask();
        task.setId(id);
        task.setKind(kind);
        task.setPriority(priority);
        task.setStatus(TaskStatus.QUEUED);
        task.setProgress(0.0);
        task.setMessage("Task queued");
        task.setMetadata(metadata != null ? new HashMap<>(metadata) : new HashMap<>());
        task.setCreatedAt(Instant.now());
        return task;
    }

    public BackgroundTask copy() {
        BackgroundTask copy = new BackgroundTask();
        copy.setId(id);
        copy.setKind(kind);
        copy.setPriority(priority);
        copy.setStatus(status);
        copy.setProgress(progress);
        copy.setMessage(message);
        copy.setMetadata(new HashMap<>(metadata));
        copy.setCreatedAt(createdAt);
        copy.setStartedAt(startedAt);
        copy.setCompletedAt(completedAt);
        copy.setErrorMessage(errorMessage);
        return copy;
    }

    public boolean isTerminal() {
        return status != null && status.isTerminal();
    }
}

package org.background.task.engine.core.queue;

import org.background.task.engine.api.exception.InvalidTaskException;
import org.background.task.engine.api.exception.QueueCapacityException;
import org.background.task.engine.api.exception.ServiceShutdownException;
import org.background.task.engine.config.TaskEngineConfig;
import org.background.task.engine.core.model.TaskKind;
import org.background.task.engine.core.processor.TaskProcessorManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Checks a submission against the engine state and constraints before it is queued.
 *
 * <p>Validations run cheapest first:
 * <ol>
 *   <li>Service state</li>
 *   <li>Submission structure</li>
 *   <li>Queue capacity and processor-specific rules</li>
 * </ol>
 *
 * <p>The shutdown flag is volatile so that a shutdown started on another thread is seen by the
 * next submission.
 */
public class TaskValidator {

    private static final Logger logger = LoggerFactory.getLogger(TaskValidator.class);

    private final TaskEngineConfig config;
    private final TaskProcessorManager processorManager;

    private volatile boolean shuttingDown = false;

    public TaskValidator(TaskEngineConfig config, TaskProcessorManager processorManager) {
        this.config = config;
        this.processorManager = processorManager;
    }

    /**
     * @throws ServiceShutdownException if the engine is shutting down or has no processors
     */
    public void validateServiceState() {
        if (shuttingDown) {
            logger.warn("Task submission rejected - engine is shutting down");
            throw new ServiceShutdownException("Engine is shutting down");
        }
        if (!processorManager.hasProcessors()) {
            logger.error("Task submission rejected - no processors available");
            throw new ServiceShutdownException("No task processors are available");
        }
    }

    /**
     * @throws InvalidTaskException if the kind is missing or has no processor
     */
    public void validateSubmission(TaskKind kind, Map<String, Object> metadata) {
        if (kind == null) {
            logger.warn("Task submission rejected - missing task type");
            throw new InvalidTaskException("Task type is required");
        }
        if (!processorManager.hasProcessor(kind)) {
            logger.warn("Task submission rejected - no processor for type: {}", kind.getValue());
            throw new InvalidTaskException(String.format("No processor available for task type: %s. Available types: %s",
                    kind.getValue(), processorManager.getAvailableTaskKinds()));
        }
        try {
            processorManager.validateTask(kind, metadata);
        } catch (IllegalArgumentException e) {
            logger.warn("Task submission rejected - processor validation failed: {}", e.getMessage());
            throw new InvalidTaskException("Task validation failed: " + e.getMessage());
        }
    }

    /**
     * @throws QueueCapacityException if the queue already holds {@code maxQueueSize} tasks
     */
    public void validateCapacity(int currentQueueSize) {
        if (currentQueueSize >= config.getMaxQueueSize()) {
            logger.warn("Task submission rejected - queue capacity exceeded: {}", currentQueueSize);
            throw new QueueCapacityException(String.format("Queue capacity exceeded (%d tasks). Please try again later.",
                    currentQueueSize));
        }
    }

    public void setShuttingDown(boolean shuttingDown) {
        this.shuttingDown = shuttingDown;
        if (shuttingDown) {
            logger.info("TaskValidator - shutdown flag set, will reject new tasks");
        }
    }

    public boolean isShuttingDown() {
        return shuttingDown;
    }
}

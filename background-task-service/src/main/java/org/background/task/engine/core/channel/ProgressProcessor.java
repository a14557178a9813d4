package org.background.task.engine.core.channel;

import org.background.task.engine.core.model.TaskProgress;
import org.background.task.engine.core.registry.TaskRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.Consumer;

/**
 * Applies progress events to the registry. Events for unknown or finished tasks are dropped.
 */
public class ProgressProcessor implements Consumer<TaskProgress> {

    private static final Logger logger = LoggerFactory.getLogger(ProgressProcessor.class);

    private final TaskRegistry registry;

    public ProgressProcessor(TaskRegistry registry) {
        this.registry = registry;
    }

    @Override
    public void accept(TaskProgress event) {
        boolean applied = registry.updateIfNotTerminal(event.taskId(), task -> {
            task.setProgress(event.progress());
            if (event.message() != null) {
                task.setMessage(event.message());
            }
            task.getMetadata().putAll(event.metadata());
        });

        if (applied) {
            logger.debug("Task {} progress {}% - {}", event.taskId(), event.progress(), event.message());
        } else {
            logger.debug("Dropped progress for unknown or finished task {}", event.taskId());
        }
    }
}

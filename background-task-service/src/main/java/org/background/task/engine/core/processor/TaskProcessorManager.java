package org.background.task.engine.core.processor;

import org.background.task.engine.core.model.TaskKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Dispatch table binding each {@link TaskKind} to the {@link TaskProcessor} that executes it.
 * <p>
 * This class acts as a registry and dispatcher:
 * <ul>
 *   <li>Registers the supplied processors, one per kind; a later processor for the same kind wins</li>
 *   <li>Provides lookup by {@link TaskKind}</li>
 *   <li>Delegates metadata validation to processors implementing {@link ValidatableTaskProcessor}</li>
 * </ul>
 */
public class TaskProcessorManager {
    private static final Logger logger = LoggerFactory.getLogger(TaskProcessorManager.class);

    private final Map<TaskKind, TaskProcessor> taskProcessors = new EnumMap<>(TaskKind.class);

    /**
     * @param processors processors to register
     */
    public TaskProcessorManager(List<? extends TaskProcessor> processors) {
        registerTaskProcessors(processors);
    }

    /**
     * Registers the given processors and fills every kind they leave uncovered with a
     * {@link StagedTaskProcessor}.
     *
     * @param processors  explicitly provided processors, may be empty
     * @param delayScale  multiplier for the staged processors' step delay
     */
    public static TaskProcessorManager withDefaults(List<? extends TaskProcessor> processors, double delayScale) {
        List<TaskProcessor> all = new ArrayList<>();
        Set<TaskKind> covered = new TreeSet<>();
        for (TaskProcessor processor : processors) {
            covered.add(processor.getTaskKind());
        }
        for (TaskKind kind : TaskKind.values()) {
            if (!covered.contains(kind)) {
                all.add(StagedTaskProcessor.forKind(kind, delayScale));
            }
        }
        all.addAll(processors);
        return new TaskProcessorManager(all);
    }

    private void registerTaskProcessors(List<? extends TaskProcessor> processors) {
        if (processors == null || processors.isEmpty()) {
            logger.warn("No task processors found! Engine will reject all tasks.");
            return;
        }

        for (TaskProcessor processor : processors) {
            try {
                TaskKind kind = processor.getTaskKind();
                taskProcessors.put(kind, processor);
            } catch (Exception e) {
                logger.error("Failed to register processor: {}", processor.getClass().getSimpleName(), e);
            }
        }

        logger.info("Registered {} task processors", taskProcessors.size());
        taskProcessors.forEach((kind, processor) ->
                logger.debug("  {} -> {} {}", kind.getValue(), processor.getClass().getSimpleName(),
                        processor instanceof InterruptibleTaskProcessor ? "(Interruptible)" : ""));
    }

    public boolean hasProcessors() {
        return !taskProcessors.isEmpty();
    }

    public boolean hasProcessor(TaskKind kind) {
        return taskProcessors.containsKey(kind);
    }

    /**
     * @return the processor for {@code kind}, or {@code null} if none is registered
     */
    public TaskProcessor getProcessor(TaskKind kind) {
        return taskProcessors.get(kind);
    }

    /**
     * @return kinds that currently have a processor, in declaration order
     */
    public Set<TaskKind> getAvailableTaskKinds() {
        return Collections.unmodifiableSet(new TreeSet<>(taskProcessors.keySet()));
    }

    /**
     * Validates metadata if the kind's processor implements {@link ValidatableTaskProcessor}.
     *
     * @throws IllegalArgumentException if validation fails
     */
    public void validateTask(TaskKind kind, Map<String, Object> metadata) {
        TaskProcessor processor = taskProcessors.get(kind);
        if (processor instanceof ValidatableTaskProcessor validatable) {
            validatable.validateTask(metadata);
        }
    }
}

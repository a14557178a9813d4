package org.background.task.engine.core.channel;

import org.background.task.engine.core.model.TaskCommand;
import org.background.task.engine.core.model.TaskStatus;
import org.background.task.engine.core.monitor.ResourceMonitor;
import org.background.task.engine.core.processor.CancellationTokens;
import org.background.task.engine.core.queue.TaskPriorityQueue;
import org.background.task.engine.core.registry.TaskRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.util.function.Consumer;

/**
 * Applies control commands to the registry. Runs on the command channel's consumer thread, so
 * commands take effect one at a time in the order they were sent.
 */
public class CommandProcessor implements Consumer<TaskCommand> {

    private static final Logger logger = LoggerFactory.getLogger(CommandProcessor.class);

    private final TaskRegistry registry;
    private final TaskPriorityQueue queue;
    private final ResourceMonitor monitor;
    private final CancellationTokens tokens;

    public CommandProcessor(TaskRegistry registry, TaskPriorityQueue queue, ResourceMonitor monitor,
                            CancellationTokens tokens) {
        this.registry = registry;
        this.queue = queue;
        this.monitor = monitor;
        this.tokens = tokens;
    }

    @Override
    public void accept(TaskCommand command) {
        String taskId = command.taskId();
        try {
            MDC.put("taskId", taskId);
            switch (command.type()) {
                case CANCEL -> handleCancel(taskId);
                case PAUSE -> updateMessage(taskId, "Task paused");
                case RESUME -> updateMessage(taskId, "Task resumed");
                case GET_STATUS -> logger.info("Status requested: {}",
                        registry.statusOf(taskId).map(TaskStatus::name).orElse("NOT_FOUND"));
            }
        } finally {
            MDC.remove("taskId");
        }
    }

    private void handleCancel(String taskId) {
        boolean[] removedFromQueue = new boolean[1];
        boolean cancelled = queue.withLock(() -> {
            removedFromQueue[0] = queue.remove(taskId);
            return registry.transition(taskId, TaskStatus.CANCELLED, task -> task.setMessage("Task cancelled"));
        });

        if (!cancelled) {
            logger.info("Cancel ignored - task is {}", registry.statusOf(taskId).map(TaskStatus::name).orElse("unknown"));
            return;
        }

        monitor.cancelTask(taskId);
        if (removedFromQueue[0]) {
            tokens.release(taskId);
        }
        logger.info("Task CANCELLED{}", removedFromQueue[0] ? " before admission" : " while running");
    }

    private void updateMessage(String taskId, String message) {
        if (registry.updateIfNotTerminal(taskId, task -> task.setMessage(message))) {
            logger.info(message);
        } else {
            logger.debug("Ignoring '{}' for unknown or finished task", message);
        }
    }
}

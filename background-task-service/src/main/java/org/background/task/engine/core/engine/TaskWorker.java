package org.background.task.engine.core.engine;

import org.background.task.engine.api.exception.TaskCancelledException;
import org.background.task.engine.core.channel.TaskChannel;
import org.background.task.engine.core.model.TaskKind;
import org.background.task.engine.core.model.TaskProgress;
import org.background.task.engine.core.model.TaskStatus;
import org.background.task.engine.core.monitor.ResourceMonitor;
import org.background.task.engine.core.processor.CancellationToken;
import org.background.task.engine.core.processor.CancellationTokens;
import org.background.task.engine.core.processor.TaskExecutionContext;
import org.background.task.engine.core.processor.TaskProcessor;
import org.background.task.engine.core.registry.TaskRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * Runs one admitted task on a worker thread and writes its terminal state.
 *
 * <p>When the task's cancellation was requested, or the thread was interrupted, the worker leaves
 * the terminal write to whoever cancelled it. It never overwrites a terminal state. Whatever the
 * outcome, it releases the task's monitor slot, worker slot and token. An {@link Error} from the
 * processor fails the task like any exception and is then rethrown to the pool.
 */
public class TaskWorker implements Runnable {

    private static final Logger logger = LoggerFactory.getLogger(TaskWorker.class);

    private final String taskId;
    private final TaskKind kind;
    private final Map<String, Object> metadata;
    private final TaskProcessor processor;
    private final CancellationToken token;
    private final TaskRegistry registry;
    private final TaskChannel<TaskProgress> progressChannel;
    private final ResourceMonitor monitor;
    private final CancellationTokens tokens;
    private final AtomicInteger activeWorkers;
    private final Consumer<String> onFinished;

    private Thread runner;

    public TaskWorker(String taskId, TaskKind kind, Map<String, Object> metadata, TaskProcessor processor,
                      CancellationToken token, TaskRegistry registry, TaskChannel<TaskProgress> progressChannel,
                      ResourceMonitor monitor, CancellationTokens tokens, AtomicInteger activeWorkers,
                      Consumer<String> onFinished) {
        this.taskId = taskId;
        this.kind = kind;
        this.metadata = metadata;
        this.processor = processor;
        this.token = token;
        this.registry = registry;
        this.progressChannel = progressChannel;
        this.monitor = monitor;
        this.tokens = tokens;
        this.activeWorkers = activeWorkers;
        this.onFinished = onFinished;
    }

    @Override
    public void run() {
        synchronized (this) {
            runner = Thread.currentThread();
        }
        long startTime = System.currentTimeMillis();
        boolean success = false;

        try {
            MDC.put("taskId", taskId);

            if (token.isCancelled()) {
                logger.info("Task was cancelled before execution started");
                return;
            }

            progressChannel.send(new TaskProgress(taskId, 0.0, "Initializing task"));
            logger.info("STARTED task - Type: {}", kind.getValue());

            TaskExecutionContext context = new TaskExecutionContext(taskId, kind, metadata,
                    (progress, message, extra) -> progressChannel.send(new TaskProgress(taskId, progress, message, extra)),
                    token);
            processor.process(context);

            if (isCancellationObserved() || !token.finish()) {
                logger.info("Task cancellation detected after execution");
                return;
            }

            long duration = System.currentTimeMillis() - startTime;
            success = registry.transition(taskId, TaskStatus.COMPLETED, task -> {
                task.setProgress(100.0);
                task.setMessage("Task completed successfully");
            });
            if (success) {
                logger.info("COMPLETED task in {}ms", duration);
            } else {
                logger.info("Task finished after {}ms but was already {}", duration,
                        registry.statusOf(taskId).map(TaskStatus::name).orElse("removed"));
            }

        } catch (TaskCancelledException e) {
            logger.info("Task cancellation observed after {}ms: {}", System.currentTimeMillis() - startTime, e.getReason());

        } catch (InterruptedException e) {
            logger.info("Task interrupted after {}ms", System.currentTimeMillis() - startTime);
            Thread.currentThread().interrupt();

        } catch (Exception e) {
            recordFailure(e, startTime);

        } catch (Error e) {
            recordFailure(e, startTime);
            throw e;

        } finally {
            monitor.completeTask(taskId, success);
            activeWorkers.decrementAndGet();
            tokens.release(taskId);
            try {
                onFinished.accept(taskId);
            } finally {
                synchronized (this) {
                    runner = null;
                }
                MDC.remove("taskId");
            }
        }
    }

    /**
     * Cancels the token and interrupts the worker thread if the task is still running.
     */
    public void abort(String reason) {
        token.cancel(reason);
        synchronized (this) {
            if (runner != null) {
                runner.interrupt();
            }
        }
    }

    public String getTaskId() {
        return taskId;
    }

    public TaskKind getKind() {
        return kind;
    }

    private void recordFailure(Throwable e, long startTime) {
        long duration = System.currentTimeMillis() - startTime;
        if (isCancellationObserved() || !token.finish()) {
            logger.info("Task failed due to cancellation after {}ms", duration);
            return;
        }
        String errorMessage = e.getMessage() != null ? e.getMessage() : "Unknown error: " + e.getClass().getSimpleName();
        boolean failed = registry.transition(taskId, TaskStatus.FAILED, task -> {
            task.setMessage("Task failed");
            task.setErrorMessage(errorMessage);
        });
        if (failed) {
            logger.error("Task FAILED after {}ms - Error: {}", duration, errorMessage, e);
        } else {
            logger.warn("Task raised after reaching a terminal state: {}", errorMessage);
        }
    }

    private boolean isCancellationObserved() {
        return token.isCancelled() || Thread.currentThread().isInterrupted();
    }
}

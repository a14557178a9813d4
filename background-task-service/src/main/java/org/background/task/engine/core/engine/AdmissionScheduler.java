package org.background.task.engine.core.engine;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import org.background.task.engine.api.exception.AdmissionRejectedException;
import org.background.task.engine.config.TaskEngineConfig;
import org.background.task.engine.core.model.AdmissionRejectionPolicy;
import org.background.task.engine.core.model.TaskStatus;
import org.background.task.engine.core.monitor.ResourceMonitor;
import org.background.task.engine.core.processor.CancellationTokens;
import org.background.task.engine.core.queue.QueuedTask;
import org.background.task.engine.core.queue.TaskPriorityQueue;
import org.background.task.engine.core.registry.TaskRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * Fixed-delay loop that admits queued tasks for execution.
 *
 * <p>Each tick admits at most one task. The head of the queue is inspected, approved by the
 * {@link ResourceMonitor}, popped and marked RUNNING while the queue lock is held, so a task is
 * never visible as queued and running at the same time. Launching the worker happens after the
 * lock is released.
 */
public class AdmissionScheduler {

    private static final Logger logger = LoggerFactory.getLogger(AdmissionScheduler.class);

    private final TaskEngineConfig config;
    private final TaskRegistry registry;
    private final TaskPriorityQueue queue;
    private final ResourceMonitor monitor;
    private final CancellationTokens tokens;
    private final AtomicInteger activeWorkers;
    private final ShutdownCoordinator shutdownCoordinator;
    private final Consumer<QueuedTask> launcher;

    private volatile String lastDeferredTaskId;
    private ScheduledExecutorService executor;

    public AdmissionScheduler(TaskEngineConfig config, TaskRegistry registry, TaskPriorityQueue queue,
                              ResourceMonitor monitor, CancellationTokens tokens, AtomicInteger activeWorkers,
                              ShutdownCoordinator shutdownCoordinator, Consumer<QueuedTask> launcher) {
        this.config = config;
        this.registry = registry;
        this.queue = queue;
        this.monitor = monitor;
        this.tokens = tokens;
        this.activeWorkers = activeWorkers;
        this.shutdownCoordinator = shutdownCoordinator;
        this.launcher = launcher;
    }

    public synchronized void start() {
        if (executor != null) {
            return;
        }
        executor = Executors.newSingleThreadScheduledExecutor(new ThreadFactoryBuilder()
                .setNameFormat("AdmissionScheduler-%d")
                .setDaemon(true)
                .setUncaughtExceptionHandler((thread, e) ->
                        logger.error("Uncaught exception in thread {}: {}", thread.getName(), e.getMessage(), e))
                .build());
        long tick = config.getSchedulerTickMillis();
        executor.scheduleWithFixedDelay(this::tickSafely, tick, tick, TimeUnit.MILLISECONDS);
        logger.info("Admission scheduler started - tick {}ms, max workers {}, rejection policy {}",
                tick, config.getMaxWorkers(), config.getRejectionPolicy());
    }

    /**
     * Stops the loop. Running workers are not waited for.
     */
    public synchronized void stop() {
        if (executor == null) {
            return;
        }
        executor.shutdown();
        try {
            if (!executor.awaitTermination(config.getSchedulerTickMillis() * 2, TimeUnit.MILLISECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        executor = null;
        logger.info("Admission scheduler stopped");
    }

    /**
     * Runs one admission attempt.
     *
     * @return {@code true} if a task was admitted and launched
     */
    @VisibleForTesting
    boolean tick() {
        if (shutdownCoordinator.isShutdownRequested()) {
            return false;
        }
        if (activeWorkers.get() >= config.getMaxWorkers()) {
            logger.trace("All {} workers busy, skipping tick", config.getMaxWorkers());
            return false;
        }

        QueuedTask admitted = queue.withLock(this::admitHead);
        if (admitted == null) {
            return false;
        }

        launcher.accept(admitted);
        return true;
    }

    private void tickSafely() {
        try {
            tick();
        } catch (Exception e) {
            logger.error("Error in admission scheduler", e);
        }
    }

    /**
     * Must run under the queue lock.
     */
    private QueuedTask admitHead() {
        while (true) {
            Optional<QueuedTask> head = queue.peek();
            if (head.isEmpty()) {
                return null;
            }
            QueuedTask task = head.get();
            String taskId = task.taskId();

            if (task.isCancelled()) {
                queue.poll();
                registry.transition(taskId, TaskStatus.CANCELLED, t -> t.setMessage("Task cancelled"));
                tokens.release(taskId);
                logger.info("Dropped cancelled task {} from queue", taskId);
                continue;
            }

            if (registry.statusOf(taskId).filter(status -> status == TaskStatus.QUEUED).isEmpty()) {
                queue.poll();
                tokens.release(taskId);
                logger.info("Dropped task {} from queue - no longer queued (status: {})", taskId,
                        registry.statusOf(taskId).map(TaskStatus::name).orElse("removed"));
                continue;
            }

            try {
                monitor.startTask(taskId, task.kind());
            } catch (AdmissionRejectedException e) {
                handleRejection(task, e);
                return null;
            }

            queue.poll();
            if (!registry.transition(taskId, TaskStatus.RUNNING, null)) {
                // Finished while queued, e.g. cancelled by a command that had not removed it yet
                monitor.cancelTask(taskId);
                tokens.release(taskId);
                continue;
            }
            activeWorkers.incrementAndGet();
            lastDeferredTaskId = null;
            logWithTask(taskId, "Task admitted - Priority: {}, Active workers: {}, Queue size: {}",
                    task.priority(), activeWorkers.get(), queue.size());
            return task;
        }
    }

    private void handleRejection(QueuedTask task, AdmissionRejectedException e) {
        String taskId = task.taskId();
        if (config.getRejectionPolicy() == AdmissionRejectionPolicy.FAIL) {
            queue.poll();
            registry.transition(taskId, TaskStatus.FAILED, t -> {
                t.setMessage("Task failed");
                t.setErrorMessage(e.getMessage());
            });
            tokens.release(taskId);
            try {
                MDC.put("taskId", taskId);
                logger.warn("Task FAILED at admission ({}): {}", e.getLimit(), e.getMessage());
            } finally {
                MDC.remove("taskId");
            }
            return;
        }

        if (!taskId.equals(lastDeferredTaskId)) {
            lastDeferredTaskId = taskId;
            try {
                MDC.put("taskId", taskId);
                logger.warn("Task admission deferred ({}): {}", e.getLimit(), e.getMessage());
            } finally {
                MDC.remove("taskId");
            }
        } else {
            logger.debug("Task {} still deferred: {}", taskId, e.getMessage());
        }
    }

    private void logWithTask(String taskId, String format, Object... args) {
        try {
            MDC.put("taskId", taskId);
            logger.info(format, args);
        } finally {
            MDC.remove("taskId");
        }
    }
}

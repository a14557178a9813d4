package org.background.task.engine.core.engine;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.Getter;
import org.background.task.engine.api.exception.ServiceShutdownException;
import org.background.task.engine.api.exception.TaskNotFoundException;
import org.background.task.engine.config.TaskEngineConfig;
import org.background.task.engine.core.channel.CommandProcessor;
import org.background.task.engine.core.channel.ProgressProcessor;
import org.background.task.engine.core.channel.TaskChannel;
import org.background.task.engine.core.model.BackgroundTask;
import org.background.task.engine.core.model.CompletionEstimate;
import org.background.task.engine.core.model.ServiceState;
import org.background.task.engine.core.model.SystemStats;
import org.background.task.engine.core.model.TaskCommand;
import org.background.task.engine.core.model.TaskKind;
import org.background.task.engine.core.model.TaskPriority;
import org.background.task.engine.core.model.TaskProgress;
import org.background.task.engine.core.model.TaskStatus;
import org.background.task.engine.core.monitor.ResourceMonitor;
import org.background.task.engine.core.processor.CancellationToken;
import org.background.task.engine.core.processor.CancellationTokens;
import org.background.task.engine.core.processor.InterruptibleTaskProcessor;
import org.background.task.engine.core.processor.TaskProcessor;
import org.background.task.engine.core.processor.TaskProcessorManager;
import org.background.task.engine.core.queue.QueuedTask;
import org.background.task.engine.core.queue.TaskPriorityQueue;
import org.background.task.engine.core.queue.TaskValidator;
import org.background.task.engine.core.registry.TaskRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Background task engine: accepts work, queues it by priority, admits it under the worker ceiling
 * and the resource monitor's limits, and tracks it to a terminal state.
 *
 * <p>The engine wires together:
 * <ul>
 *   <li>a {@link TaskRegistry} holding the state of every known task</li>
 *   <li>a {@link TaskPriorityQueue} of tasks awaiting admission</li>
 *   <li>a command channel and a progress channel, each drained by one consumer thread</li>
 *   <li>an {@link AdmissionScheduler} launching {@link TaskWorker}s on a fixed-size pool</li>
 *   <li>a watchdog failing tasks that exceed the configured timeout</li>
 * </ul>
 *
 * <p>Cancellation is cooperative. {@link #cancel(String)} flips the task's token at once, so a
 * queued task is never admitted afterwards, and the registry write happens on the command channel.
 */
@Service
public class BackgroundTaskEngine {
    private static final Logger logger = LoggerFactory.getLogger(BackgroundTaskEngine.class);

    private static final long CHANNEL_DRAIN_SECONDS = 2;

    private final TaskEngineConfig config;
    private final TaskProcessorManager processorManager;
    private final ResourceMonitor monitor;

    private final TaskRegistry registry = new TaskRegistry();
    private final TaskPriorityQueue queue = new TaskPriorityQueue();
    private final CancellationTokens tokens = new CancellationTokens();
    private final AtomicInteger activeWorkers = new AtomicInteger(0);
    private final ShutdownCoordinator shutdownCoordinator = new ShutdownCoordinator();
    private final TaskValidator validator;

    private final TaskChannel<TaskCommand> commandChannel;
    private final TaskChannel<TaskProgress> progressChannel;
    private final AdmissionScheduler admissionScheduler;

    /** Fixed pool sized to the worker ceiling */
    private final ExecutorService workerPool;

    /** Fires timeouts of running tasks */
    private final ScheduledExecutorService timeoutWatchdog;

    private final Map<String, TaskWorker> runningWorkers = new ConcurrentHashMap<>();
    private final Map<String, ScheduledFuture<?>> timeouts = new ConcurrentHashMap<>();

    /**
     * -- GETTER --
     * Returns the current engine state.
     */
    @Getter
    private volatile ServiceState serviceState = ServiceState.STARTING;

    private volatile Instant startTime;

    public BackgroundTaskEngine(TaskEngineConfig config, TaskProcessorManager processorManager,
                                ResourceMonitor monitor) {
        this.config = config;
        this.processorManager = processorManager;
        this.monitor = monitor;
        this.validator = new TaskValidator(config, processorManager);

        this.commandChannel = new TaskChannel<>("TaskCommandChannel",
                new CommandProcessor(registry, queue, monitor, tokens));
        this.progressChannel = new TaskChannel<>("TaskProgressChannel", new ProgressProcessor(registry));
        this.admissionScheduler = new AdmissionScheduler(config, registry, queue, monitor, tokens,
                activeWorkers, shutdownCoordinator, this::launch);

        this.workerPool = Executors.newFixedThreadPool(config.getMaxWorkers(), new ThreadFactoryBuilder()
                .setNameFormat("TaskWorker-%d")
                .setDaemon(false)
                .setUncaughtExceptionHandler(this::handleUncaughtException)
                .build());
        this.timeoutWatchdog = Executors.newSingleThreadScheduledExecutor(new ThreadFactoryBuilder()
                .setNameFormat("TaskTimeoutWatchdog-%d")
                .setDaemon(true)
                .setUncaughtExceptionHandler(this::handleUncaughtException)
                .build());

        shutdownCoordinator.onShutdown(admissionScheduler::stop);
    }

    /**
     * Starts the channel consumers and the admission loop.
     */
    @PostConstruct
    public void initialize() {
        startTime = Instant.now();
        commandChannel.start();
        progressChannel.start();
        admissionScheduler.start();
        serviceState = ServiceState.RUNNING;
        logger.info("Config loaded {}", config);
        logger.info("BackgroundTaskEngine initialized - State: {}, Max workers: {}, Task kinds: {}",
                serviceState, config.getMaxWorkers(), processorManager.getAvailableTaskKinds().size());
    }

    /**
     * Registers a new task as QUEUED and places it in the priority queue.
     *
     * @param kind     kind of work, required
     * @param priority priority, {@link TaskPriority#NORMAL} when null
     * @param metadata free-form parameters handed to the processor, empty when null
     * @return the generated task id
     * @throws org.background.task.engine.api.exception.InvalidTaskException   if the kind is missing or rejected
     * @throws org.background.task.engine.api.exception.QueueCapacityException if the queue is full
     * @throws ServiceShutdownException                                        if the engine is not running
     */
    public String submit(TaskKind kind, TaskPriority priority, Map<String, Object> metadata) {
        validator.validateServiceState();
        if (serviceState != ServiceState.RUNNING) {
            logger.warn("Task submission rejected - engine state: {}", serviceState);
            throw new ServiceShutdownException("Engine is not accepting new tasks (state: " + serviceState + ")");
        }
        Map<String, Object> effectiveMetadata = metadata != null ? metadata : Map.of();
        validator.validateSubmission(kind, effectiveMetadata);
        TaskPriority effectivePriority = priority != null ? priority : TaskPriority.NORMAL;

        String taskId = UUID.randomUUID().toString();
        try {
            MDC.put("taskId", taskId);
            int queueSize = queue.withLock(() -> {
                validator.validateCapacity(queue.size());
                registry.register(BackgroundTask.queued(taskId, kind, effectivePriority, effectiveMetadata));
                CancellationToken token = tokens.create(taskId);
                queue.enqueue(taskId, kind, effectivePriority, token);
                return queue.size();
            });
            logger.info("Task submitted - Type: {}, Priority: {}, Queue size: {}",
                    kind.getValue(), effectivePriority, queueSize);
            return taskId;
        } finally {
            MDC.remove("taskId");
        }
    }

    /**
     * Requests cancellation of a queued or running task.
     *
     * @return {@code false} if the task already finished or the cancel command could not be delivered
     * @throws TaskNotFoundException if the task is unknown
     */
    public boolean cancel(String taskId) {
        BackgroundTask task = requireTask(taskId);
        try {
            MDC.put("taskId", taskId);
            if (task.isTerminal()) {
                logger.info("Cancel request for already finished task (status: {})", task.getStatus());
                return false;
            }

            logger.info("Processing cancel request");
            Optional<CancellationToken> token = tokens.get(taskId);
            boolean requested = token
                    .map(t -> t.cancel("Cancelled by user request") || t.isCancelled())
                    .orElse(false);
            if (!requested) {
                logger.info("Cancel request arrived after the task finished (status: {})",
                        registry.statusOf(taskId).map(TaskStatus::name).orElse("removed"));
                return false;
            }
            if (task.getStatus() == TaskStatus.RUNNING) {
                notifyProcessorOfCancellation(task.getKind(), taskId);
            }
            return commandChannel.send(TaskCommand.cancel(taskId));
        } finally {
            MDC.remove("taskId");
        }
    }

    /**
     * Marks a task as paused. Processors are not suspended.
     *
     * @throws TaskNotFoundException if the task is unknown
     */
    public boolean pause(String taskId) {
        requireTask(taskId);
        return commandChannel.send(TaskCommand.pause(taskId));
    }

    /**
     * @throws TaskNotFoundException if the task is unknown
     */
    public boolean resume(String taskId) {
        requireTask(taskId);
        return commandChannel.send(TaskCommand.resume(taskId));
    }

    /**
     * Logs the task's status on the command thread.
     *
     * @throws TaskNotFoundException if the task is unknown
     */
    public boolean requestStatus(String taskId) {
        requireTask(taskId);
        return commandChannel.send(TaskCommand.status(taskId));
    }

    /**
     * Posts a progress update. Updates for unknown or finished tasks are dropped when applied.
     */
    public boolean updateProgress(String taskId, double progress, String message) {
        return progressChannel.send(new TaskProgress(taskId, progress, message));
    }

    public Optional<BackgroundTask> getTaskStatus(String taskId) {
        return registry.get(taskId);
    }

    public List<BackgroundTask> getAllTasks() {
        return registry.findAll();
    }

    public List<BackgroundTask> getActiveTasks() {
        return registry.findByStatus(TaskStatus.RUNNING);
    }

    public List<BackgroundTask> getTasksByStatus(TaskStatus status) {
        return registry.findByStatus(status);
    }

    /**
     * @return admission position counting from 1, or -1 if the task is not queued
     */
    public int getQueuePosition(String taskId) {
        return queue.positionOf(taskId);
    }

    public int getQueueLength() {
        return queue.size();
    }

    public int getActiveWorkers() {
        return activeWorkers.get();
    }

    public int getMaxWorkers() {
        return config.getMaxWorkers();
    }

    public Set<TaskKind> getAvailableTaskKinds() {
        return processorManager.getAvailableTaskKinds();
    }

    public Duration getUptime() {
        return startTime != null ? Duration.between(startTime, Instant.now()) : Duration.ZERO;
    }

    public SystemStats getSystemStats() {
        Map<TaskStatus, Integer> breakdown = registry.statusBreakdown();
        int total = breakdown.values().stream().mapToInt(Integer::intValue).sum();
        int completed = breakdown.get(TaskStatus.COMPLETED);
        return new SystemStats(
                total,
                completed,
                breakdown.get(TaskStatus.FAILED),
                breakdown.get(TaskStatus.CANCELLED),
                breakdown.get(TaskStatus.RUNNING),
                breakdown.get(TaskStatus.QUEUED),
                activeWorkers.get(),
                config.getMaxWorkers(),
                SystemStats.successRate(completed, total));
    }

    /**
     * Requests cancellation of every running task that is not {@link TaskPriority#CRITICAL}.
     *
     * @return number of cancellations requested
     */
    public int cancelNonCriticalTasks() {
        int cancelled = 0;
        for (BackgroundTask task : registry.findByStatus(TaskStatus.RUNNING)) {
            if (task.getPriority() == TaskPriority.CRITICAL) {
                continue;
            }
            try {
                if (cancel(task.getId())) {
                    cancelled++;
                }
            } catch (TaskNotFoundException e) {
                logger.debug("Task {} disappeared before it could be cancelled", task.getId());
            }
        }
        logger.info("Requested cancellation of {} non-critical tasks", cancelled);
        return cancelled;
    }

    /**
     * Estimates how long a task of {@code kind} submitted now would take to finish.
     */
    public CompletionEstimate estimateCompletion(TaskKind kind) {
        int queueLength = queue.size();
        int active = activeWorkers.get();
        double multiplier = 1.0 + 0.1 * queueLength + 0.2 * active;
        return new CompletionEstimate(kind, kind.getBaseMinutes() * multiplier, queueLength + 1,
                queueLength, active, multiplier);
    }

    /**
     * Removes finished tasks that completed more than {@code olderThan} ago.
     *
     * @return number of tasks removed
     */
    public int cleanupFinishedTasks(Duration olderThan) {
        int removed = registry.removeFinishedBefore(Instant.now().minus(olderThan));
        if (removed > 0) {
            logger.info("Removed {} finished tasks older than {}", removed, olderThan);
        }
        return removed;
    }

    /**
     * Stops accepting work, cancels queued and running tasks and shuts the thread pools down.
     * Safe to call more than once.
     */
    @PreDestroy
    public void shutdown() {
        if (shutdownCoordinator.isShutdownRequested()) {
            return;
        }
        logger.info("Initiating BackgroundTaskEngine shutdown...");
        serviceState = ServiceState.SHUTTING_DOWN;
        validator.setShuttingDown(true);
        if (!shutdownCoordinator.signal()) {
            return;
        }

        if (config.isDrainQueueOnShutdown()) {
            drainQueueAndCancelTasks();
        }
        cancelRunningTasks();

        workerPool.shutdown();
        try {
            if (!workerPool.awaitTermination(config.getShutdownTimeoutSeconds(), TimeUnit.SECONDS)) {
                logger.warn("Worker pool did not terminate within {} seconds, forcing shutdown",
                        config.getShutdownTimeoutSeconds());
                workerPool.shutdownNow();
            }
        } catch (InterruptedException e) {
            logger.warn("Shutdown interrupted, forcing immediate shutdown");
            workerPool.shutdownNow();
            Thread.currentThread().interrupt();
        }

        commandChannel.closeAndAwait(CHANNEL_DRAIN_SECONDS, TimeUnit.SECONDS);
        progressChannel.closeAndAwait(CHANNEL_DRAIN_SECONDS, TimeUnit.SECONDS);
        timeoutWatchdog.shutdownNow();

        serviceState = ServiceState.SHUTDOWN;
        SystemStats stats = getSystemStats();
        logger.info("BackgroundTaskEngine shutdown completed. Final statistics: completed={}, failed={}, cancelled={}",
                stats.completedTasks(), stats.failedTasks(), stats.cancelledTasks());
    }

    @VisibleForTesting
    AdmissionScheduler getAdmissionScheduler() {
        return admissionScheduler;
    }

    /**
     * Hands an admitted task to the worker pool. Called by the admission loop once the task is
     * RUNNING and counted in {@code activeWorkers}.
     */
    private void launch(QueuedTask admitted) {
        String taskId = admitted.taskId();
        TaskProcessor processor = processorManager.getProcessor(admitted.kind());
        Map<String, Object> metadata = registry.get(taskId).map(BackgroundTask::getMetadata).orElse(Map.of());

        TaskWorker worker = new TaskWorker(taskId, admitted.kind(), metadata, processor, admitted.token(),
                registry, progressChannel, monitor, tokens, activeWorkers, this::onWorkerFinished);
        runningWorkers.put(taskId, worker);

        long timeoutSeconds = monitor.getLimits().taskTimeoutSeconds();
        try {
            timeouts.put(taskId, timeoutWatchdog.schedule(() -> onTimeout(worker, timeoutSeconds),
                    timeoutSeconds, TimeUnit.SECONDS));
            workerPool.execute(worker);
        } catch (RejectedExecutionException e) {
            logger.warn("Worker pool rejected task {} - engine is shutting down", taskId);
            registry.transition(taskId, TaskStatus.CANCELLED, task -> task.setMessage("Task cancelled: engine shutting down"));
            monitor.cancelTask(taskId);
            activeWorkers.decrementAndGet();
            tokens.release(taskId);
            onWorkerFinished(taskId);
        }
    }

    private void onWorkerFinished(String taskId) {
        runningWorkers.remove(taskId);
        ScheduledFuture<?> timeout = timeouts.remove(taskId);
        if (timeout != null) {
            timeout.cancel(false);
        }
    }

    private void onTimeout(TaskWorker worker, long timeoutSeconds) {
        String taskId = worker.getTaskId();
        try {
            MDC.put("taskId", taskId);
            String error = "Task timed out after " + timeoutSeconds + " seconds";
            boolean failed = registry.transition(taskId, TaskStatus.FAILED, task -> {
                task.setMessage("Task failed");
                task.setErrorMessage(error);
            });
            if (failed) {
                logger.error("Task TIMEOUT after {} seconds", timeoutSeconds);
                worker.abort(error);
            }
        } finally {
            MDC.remove("taskId");
        }
    }

    private void notifyProcessorOfCancellation(TaskKind kind, String taskId) {
        try {
            TaskProcessor processor = processorManager.getProcessor(kind);
            if (processor instanceof InterruptibleTaskProcessor interruptible) {
                interruptible.cancelTask(taskId);
            }
        } catch (Exception e) {
            logger.warn("Error notifying processor of cancellation: {}", e.getMessage());
        }
    }

    private BackgroundTask requireTask(String taskId) {
        if (taskId == null || taskId.isBlank()) {
            throw new TaskNotFoundException("Task ID is required");
        }
        return registry.get(taskId).orElseThrow(() -> new TaskNotFoundException("Task not found: " + taskId));
    }

    private void drainQueueAndCancelTasks() {
        List<QueuedTask> drained = queue.drain();
        for (QueuedTask queued : drained) {
            queued.token().cancel("Engine shutting down");
            registry.transition(queued.taskId(), TaskStatus.CANCELLED,
                    task -> task.setMessage("Task cancelled: engine shutting down"));
            tokens.release(queued.taskId());
        }
        logger.info("Drained {} queued tasks", drained.size());
    }

    private void cancelRunningTasks() {
        for (TaskWorker worker : runningWorkers.values()) {
            String taskId = worker.getTaskId();
            tokens.cancel(taskId, "Engine shutting down");
            notifyProcessorOfCancellation(worker.getKind(), taskId);
            boolean cancelled = registry.transition(taskId, TaskStatus.CANCELLED,
                    task -> task.setMessage("Task cancelled: engine shutting down"));
            if (cancelled) {
                monitor.cancelTask(taskId);
                logger.info("Cancelled running task {} for shutdown", taskId);
            }
        }
    }

    private void handleUncaughtException(Thread thread, Throwable exception) {
        logger.error("Uncaught exception in thread {}: {}", thread.getName(), exception.getMessage(), exception);
    }
}

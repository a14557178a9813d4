package org.background.task.engine.core.engine;

import org.background.task.engine.api.exception.InvalidTaskException;
import org.background.task.engine.api.exception.ServiceShutdownException;
import org.background.task.engine.api.exception.TaskNotFoundException;
import org.background.task.engine.config.ObjectMapperConfig;
import org.background.task.engine.config.TaskEngineConfig;
import org.background.task.engine.core.model.BackgroundTask;
import org.background.task.engine.core.model.CompletionEstimate;
import org.background.task.engine.core.model.ServiceState;
import org.background.task.engine.core.model.SystemStats;
import org.background.task.engine.core.model.TaskKind;
import org.background.task.engine.core.model.TaskPriority;
import org.background.task.engine.core.model.TaskStatus;
import org.background.task.engine.core.monitor.FakeSystemMetricsSampler;
import org.background.task.engine.core.monitor.ResourceMonitor;
import org.background.task.engine.core.processor.TaskExecutionContext;
import org.background.task.engine.core.processor.TaskProcessor;
import org.background.task.engine.core.processor.TaskProcessorManager;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.awaitility.Awaitility.await;

class BackgroundTaskEngineTest {

    private static final Duration WAIT = Duration.ofSeconds(5);

    private TaskEngineConfig config;
    private ResourceMonitor monitor;
    private GatedProcessor gated;
    private StubbornProcessor stubborn;
    private BackgroundTaskEngine engine;

    @BeforeEach
    void setUp() {
        config = new TaskEngineConfig();
        config.setMaxWorkers(2);
        config.setSchedulerTickMillis(20);
        config.setShutdownTimeoutSeconds(2);
        config.setStepDelayScale(0.0);
        config.getLimits().setMaxConcurrentTasks(10);
        gated = new GatedProcessor();
        stubborn = new StubbornProcessor();
    }

    @AfterEach
    void tearDown() {
        gated.open();
        stubborn.release();
        if (engine != null) {
            engine.shutdown();
        }
    }

    @Test
    void submittedTask_runsToCompletion() {
        start();

        String taskId = engine.submit(TaskKind.EXPORT, TaskPriority.NORMAL, Map.of("format", "csv"));

        await().atMost(WAIT).until(() -> status(taskId) == TaskStatus.COMPLETED);
        BackgroundTask task = engine.getTaskStatus(taskId).orElseThrow();
        assertThat(task.getProgress()).isEqualTo(100.0);
        assertThat(task.getMessage()).isEqualTo("Task completed successfully");
        assertThat(task.getStartedAt()).isNotNull();
        assertThat(task.getCompletedAt()).isAfterOrEqualTo(task.getStartedAt());
        assertThat(task.getMetadata()).containsEntry("format", "csv");
        await().atMost(WAIT).until(() -> engine.getActiveWorkers() == 0);
    }

    @Test
    void submit_defaultsPriorityAndRejectsMissingKind() {
        start();

        String taskId = engine.submit(TaskKind.EXPORT, null, null);

        assertThat(engine.getTaskStatus(taskId).orElseThrow().getPriority()).isEqualTo(TaskPriority.NORMAL);
        assertThatThrownBy(() -> engine.submit(null, TaskPriority.HIGH, Map.of()))
                .isInstanceOf(InvalidTaskException.class)
                .hasMessage("Task type is required");
    }

    @Test
    void runningTasks_neverExceedWorkerCeiling() {
        start();

        List<String> ids = List.of(
                engine.submit(TaskKind.BACKUP, TaskPriority.NORMAL, null),
                engine.submit(TaskKind.BACKUP, TaskPriority.NORMAL, null),
                engine.submit(TaskKind.BACKUP, TaskPriority.NORMAL, null),
                engine.submit(TaskKind.BACKUP, TaskPriority.NORMAL, null),
                engine.submit(TaskKind.BACKUP, TaskPriority.NORMAL, null));

        await().atMost(WAIT).until(() -> gated.running.get() == 2);
        await().during(Duration.ofMillis(200)).atMost(WAIT).until(() -> engine.getActiveTasks().size() == 2);
        assertThat(engine.getTasksByStatus(TaskStatus.QUEUED)).hasSize(3);
        assertThat(engine.getQueueLength()).isEqualTo(3);

        gated.open();

        await().atMost(WAIT).until(() -> ids.stream().allMatch(id -> status(id) == TaskStatus.COMPLETED));
        assertThat(gated.maxConcurrent.get()).isEqualTo(2);
    }

    @Test
    void queuePosition_followsPriority() {
        config.setMaxWorkers(1);
        start();
        String occupant = engine.submit(TaskKind.BACKUP, TaskPriority.NORMAL, null);
        await().atMost(WAIT).until(() -> status(occupant) == TaskStatus.RUNNING);

        String low = engine.submit(TaskKind.EXPORT, TaskPriority.LOW, null);
        String high = engine.submit(TaskKind.EXPORT, TaskPriority.HIGH, null);

        assertThat(engine.getQueuePosition(high)).isEqualTo(1);
        assertThat(engine.getQueuePosition(low)).isEqualTo(2);
        assertThat(engine.getQueuePosition(occupant)).isEqualTo(-1);
    }

    @Test
    void cancelledQueuedTask_neverRuns() {
        config.setMaxWorkers(1);
        start();
        String occupant = engine.submit(TaskKind.BACKUP, TaskPriority.NORMAL, null);
        await().atMost(WAIT).until(() -> status(occupant) == TaskStatus.RUNNING);
        String victim = engine.submit(TaskKind.EXPORT, TaskPriority.CRITICAL, null);

        assertThat(engine.cancel(victim)).isTrue();

        await().atMost(WAIT).until(() -> status(victim) == TaskStatus.CANCELLED);
        gated.open();
        await().atMost(WAIT).until(() -> status(occupant) == TaskStatus.COMPLETED);

        BackgroundTask task = engine.getTaskStatus(victim).orElseThrow();
        assertThat(task.getStartedAt()).isNull();
        assertThat(task.getCompletedAt()).isNotNull();
        assertThat(engine.getQueueLength()).isZero();
    }

    @Test
    void cancelledRunningTask_releasesItsSlots() {
        start();
        String taskId = engine.submit(TaskKind.BACKUP, TaskPriority.HIGH, null);
        await().atMost(WAIT).until(() -> status(taskId) == TaskStatus.RUNNING);

        assertThat(engine.cancel(taskId)).isTrue();

        await().atMost(WAIT).until(() -> status(taskId) == TaskStatus.CANCELLED);
        await().atMost(WAIT).until(() -> engine.getActiveWorkers() == 0 && monitor.getActiveTaskCount() == 0);
        assertThat(engine.getTaskStatus(taskId).orElseThrow().getMessage()).isEqualTo("Task cancelled");
    }

    @Test
    void runningTaskIgnoringCancellation_staysCancelledWhenItReturns() {
        start();
        String taskId = engine.submit(TaskKind.CLOUD_SYNC, TaskPriority.NORMAL, null);
        await().atMost(WAIT).until(() -> stubborn.started.get());

        assertThat(engine.cancel(taskId)).isTrue();
        await().atMost(WAIT).until(() -> status(taskId) == TaskStatus.CANCELLED);

        stubborn.release();
        await().atMost(WAIT).until(() -> stubborn.returned.get() && engine.getActiveWorkers() == 0);

        BackgroundTask task = engine.getTaskStatus(taskId).orElseThrow();
        assertThat(task.getStatus()).isEqualTo(TaskStatus.CANCELLED);
        assertThat(task.getMessage()).isEqualTo("Task cancelled");
        assertThat(task.getProgress()).isLessThan(100.0);
        assertThat(engine.cancel(taskId)).isFalse();
    }

    @Test
    void cancelRacingCompletion_returnsTrueOnlyWhenTaskEndsCancelled() {
        config.setMaxWorkers(4);
        start();
        Map<String, Boolean> cancelResults = new LinkedHashMap<>();

        for (int i = 0; i < 40; i++) {
            String taskId = engine.submit(TaskKind.EXPORT, TaskPriority.NORMAL, null);
            await().atMost(WAIT).pollInterval(Duration.ofMillis(1))
                    .until(() -> status(taskId) != TaskStatus.QUEUED);
            cancelResults.put(taskId, engine.cancel(taskId));
        }

        await().atMost(WAIT).until(() -> cancelResults.keySet().stream().allMatch(id -> status(id).isTerminal()));
        cancelResults.forEach((taskId, cancelled) -> assertThat(status(taskId))
                .as("task %s, cancel returned %s", taskId, cancelled)
                .isEqualTo(cancelled ? TaskStatus.CANCELLED : TaskStatus.COMPLETED));
    }

    @Test
    void cancel_finishedTaskReturnsFalseAndUnknownTaskThrows() {
        start();
        String taskId = engine.submit(TaskKind.EXPORT, TaskPriority.NORMAL, null);
        await().atMost(WAIT).until(() -> status(taskId) == TaskStatus.COMPLETED);

        assertThat(engine.cancel(taskId)).isFalse();
        assertThat(status(taskId)).isEqualTo(TaskStatus.COMPLETED);
        assertThatThrownBy(() -> engine.cancel("missing")).isInstanceOf(TaskNotFoundException.class);
        assertThatThrownBy(() -> engine.pause("missing")).isInstanceOf(TaskNotFoundException.class);
        assertThatThrownBy(() -> engine.resume("missing")).isInstanceOf(TaskNotFoundException.class);
    }

    @Test
    void failingProcessor_marksTaskFailed() {
        start();

        String taskId = engine.submit(TaskKind.QUALITY_ANALYSIS, TaskPriority.NORMAL, null);

        await().atMost(WAIT).until(() -> status(taskId) == TaskStatus.FAILED);
        BackgroundTask task = engine.getTaskStatus(taskId).orElseThrow();
        assertThat(task.getErrorMessage()).isEqualTo("disk full");
        assertThat(task.getMessage()).isEqualTo("Task failed");
        await().atMost(WAIT).until(() -> monitor.getCompletedTaskMetrics().stream()
                .anyMatch(m -> m.taskId().equals(taskId) && m.status() == TaskStatus.FAILED));
    }

    @Test
    void processorError_marksTaskFailedAndFreesItsWorker() {
        config.setMaxWorkers(1);
        config.getLimits().setTaskTimeoutSeconds(2);
        start();

        String crashed = engine.submit(TaskKind.TEXT_PROCESSING, TaskPriority.NORMAL, null);

        await().atMost(WAIT).until(() -> status(crashed) == TaskStatus.FAILED);
        assertThat(engine.getTaskStatus(crashed).orElseThrow().getErrorMessage()).isEqualTo("boom");
        await().atMost(WAIT).until(() -> engine.getActiveWorkers() == 0 && monitor.getActiveTaskCount() == 0);
        assertThat(engine.getSystemStats().runningTasks()).isZero();

        String next = engine.submit(TaskKind.EXPORT, TaskPriority.NORMAL, null);
        await().atMost(WAIT).until(() -> status(next) == TaskStatus.COMPLETED);
    }

    @Test
    void taskExceedingTimeout_isFailed() {
        config.getLimits().setTaskTimeoutSeconds(1);
        start();

        String taskId = engine.submit(TaskKind.BACKUP, TaskPriority.NORMAL, null);

        await().atMost(WAIT).until(() -> status(taskId) == TaskStatus.FAILED);
        assertThat(engine.getTaskStatus(taskId).orElseThrow().getErrorMessage())
                .isEqualTo("Task timed out after 1 seconds");
        await().atMost(WAIT).until(() -> engine.getActiveWorkers() == 0 && gated.running.get() == 0);
    }

    @Test
    void pauseAndResume_updateMessageOnly() {
        config.setMaxWorkers(1);
        start();
        String occupant = engine.submit(TaskKind.BACKUP, TaskPriority.NORMAL, null);
        await().atMost(WAIT).until(() -> status(occupant) == TaskStatus.RUNNING);
        String queued = engine.submit(TaskKind.EXPORT, TaskPriority.NORMAL, null);

        assertThat(engine.pause(queued)).isTrue();
        await().atMost(WAIT).until(() -> "Task paused".equals(engine.getTaskStatus(queued).orElseThrow().getMessage()));
        assertThat(status(queued)).isEqualTo(TaskStatus.QUEUED);

        assertThat(engine.resume(queued)).isTrue();
        await().atMost(WAIT).until(() -> "Task resumed".equals(engine.getTaskStatus(queued).orElseThrow().getMessage()));
        assertThat(engine.requestStatus(queued)).isTrue();
    }

    @Test
    void systemStats_onEmptyEngine_reportZeroSuccessRate() {
        start();

        SystemStats stats = engine.getSystemStats();

        assertThat(stats.totalTasks()).isZero();
        assertThat(stats.activeWorkers()).isZero();
        assertThat(stats.successRate()).isZero();
    }

    @Test
    void systemStats_countEveryStatus() {
        start();
        String ok = engine.submit(TaskKind.EXPORT, TaskPriority.NORMAL, null);
        String broken = engine.submit(TaskKind.QUALITY_ANALYSIS, TaskPriority.NORMAL, null);
        String dropped = engine.submit(TaskKind.BACKUP, TaskPriority.NORMAL, null);
        await().atMost(WAIT).until(() -> status(dropped) == TaskStatus.RUNNING);
        engine.cancel(dropped);

        await().atMost(WAIT).until(() -> status(ok) == TaskStatus.COMPLETED && status(broken) == TaskStatus.FAILED
                && status(dropped) == TaskStatus.CANCELLED);
        await().atMost(WAIT).until(() -> engine.getActiveWorkers() == 0);

        SystemStats stats = engine.getSystemStats();
        assertThat(stats.totalTasks()).isEqualTo(3);
        assertThat(stats.completedTasks()).isEqualTo(1);
        assertThat(stats.failedTasks()).isEqualTo(1);
        assertThat(stats.cancelledTasks()).isEqualTo(1);
        assertThat(stats.runningTasks()).isZero();
        assertThat(stats.queuedTasks()).isZero();
        assertThat(stats.maxWorkers()).isEqualTo(2);
        assertThat(stats.successRate()).isCloseTo(33.33, within(0.01));
    }

    @Test
    void cancelNonCriticalTasks_sparesCriticalWork() {
        start();
        String critical = engine.submit(TaskKind.BACKUP, TaskPriority.CRITICAL, null);
        String normal = engine.submit(TaskKind.BACKUP, TaskPriority.NORMAL, null);
        await().atMost(WAIT).until(() -> status(critical) == TaskStatus.RUNNING && status(normal) == TaskStatus.RUNNING);

        assertThat(engine.cancelNonCriticalTasks()).isEqualTo(1);

        await().atMost(WAIT).until(() -> status(normal) == TaskStatus.CANCELLED);
        assertThat(status(critical)).isEqualTo(TaskStatus.RUNNING);
    }

    @Test
    void estimateCompletion_scalesWithLoad() {
        start();

        CompletionEstimate idle = engine.estimateCompletion(TaskKind.EXPORT);

        assertThat(idle.loadMultiplier()).isEqualTo(1.0);
        assertThat(idle.estimatedMinutes()).isEqualTo(TaskKind.EXPORT.getBaseMinutes());
        assertThat(idle.queuePosition()).isEqualTo(1);
    }

    @Test
    void cleanupFinishedTasks_removesOnlyOldTerminalTasks() {
        start();
        String taskId = engine.submit(TaskKind.EXPORT, TaskPriority.NORMAL, null);
        await().atMost(WAIT).until(() -> status(taskId) == TaskStatus.COMPLETED);

        assertThat(engine.cleanupFinishedTasks(Duration.ofHours(1))).isZero();
        await().atMost(WAIT).until(() -> engine.cleanupFinishedTasks(Duration.ZERO) == 1);
        assertThat(engine.getTaskStatus(taskId)).isEmpty();
    }

    @Test
    void shutdown_cancelsQueuedAndRunningTasksAndRejectsSubmissions() {
        config.setMaxWorkers(1);
        start();
        String running = engine.submit(TaskKind.BACKUP, TaskPriority.NORMAL, null);
        await().atMost(WAIT).until(() -> status(running) == TaskStatus.RUNNING);
        String queued = engine.submit(TaskKind.EXPORT, TaskPriority.NORMAL, null);

        engine.shutdown();

        assertThat(engine.getServiceState()).isEqualTo(ServiceState.SHUTDOWN);
        assertThat(status(queued)).isEqualTo(TaskStatus.CANCELLED);
        assertThat(status(running)).isEqualTo(TaskStatus.CANCELLED);
        assertThat(engine.getTaskStatus(queued).orElseThrow().getMessage())
                .isEqualTo("Task cancelled: engine shutting down");
        assertThat(gated.running.get()).isZero();
        assertThatThrownBy(() -> engine.submit(TaskKind.EXPORT, TaskPriority.NORMAL, null))
                .isInstanceOf(ServiceShutdownException.class);

        engine.shutdown();
        assertThat(engine.getServiceState()).isEqualTo(ServiceState.SHUTDOWN);
    }

    @Test
    void shutdown_withoutDrain_leavesQueuedTasks() {
        config.setMaxWorkers(1);
        config.setDrainQueueOnShutdown(false);
        start();
        String running = engine.submit(TaskKind.BACKUP, TaskPriority.NORMAL, null);
        await().atMost(WAIT).until(() -> status(running) == TaskStatus.RUNNING);
        String queued = engine.submit(TaskKind.EXPORT, TaskPriority.NORMAL, null);

        engine.shutdown();

        assertThat(status(queued)).isEqualTo(TaskStatus.QUEUED);
        assertThat(engine.getQueueLength()).isEqualTo(1);
    }

    private void start() {
        monitor = new ResourceMonitor(config, new FakeSystemMetricsSampler(), ObjectMapperConfig.create());
        TaskProcessorManager manager = TaskProcessorManager.withDefaults(
                List.of(gated, stubborn, new FailingProcessor(), new CrashingProcessor()), config.getStepDelayScale());
        engine = new BackgroundTaskEngine(config, manager, monitor);
        engine.initialize();
    }

    private TaskStatus status(String taskId) {
        return engine.getTaskStatus(taskId).map(BackgroundTask::getStatus).orElse(null);
    }

    /** Blocks until opened, checking for cancellation while it waits. */
    private static class GatedProcessor implements TaskProcessor {
        private final CountDownLatch gate = new CountDownLatch(1);
        private final AtomicInteger running = new AtomicInteger();
        private final AtomicInteger maxConcurrent = new AtomicInteger();

        void open() {
            gate.countDown();
        }

        @Override
        public TaskKind getTaskKind() {
            return TaskKind.BACKUP;
        }

        @Override
        public void process(TaskExecutionContext context) throws Exception {
            maxConcurrent.accumulateAndGet(running.incrementAndGet(), Math::max);
            try {
                while (!gate.await(10, TimeUnit.MILLISECONDS)) {
                    context.checkCancelled();
                }
                context.reportProgress(50, "Gate opened");
            } finally {
                running.decrementAndGet();
            }
        }
    }

    /** Ignores its token: only {@link #release()} lets it return, and it then returns normally. */
    private static class StubbornProcessor implements TaskProcessor {
        private final CountDownLatch gate = new CountDownLatch(1);
        private final AtomicBoolean started = new AtomicBoolean();
        private final AtomicBoolean returned = new AtomicBoolean();

        void release() {
            gate.countDown();
        }

        @Override
        public TaskKind getTaskKind() {
            return TaskKind.CLOUD_SYNC;
        }

        @Override
        public void process(TaskExecutionContext context) throws Exception {
            started.set(true);
            gate.await();
            returned.set(true);
        }
    }

    private static class CrashingProcessor implements TaskProcessor {
        @Override
        public TaskKind getTaskKind() {
            return TaskKind.TEXT_PROCESSING;
        }

        @Override
        public void process(TaskExecutionContext context) {
            throw new AssertionError("boom");
        }
    }

    private static class FailingProcessor implements TaskProcessor {
        @Override
        public TaskKind getTaskKind() {
            return TaskKind.QUALITY_ANALYSIS;
        }

        @Override
        public void process(TaskExecutionContext context) {
            throw new IllegalStateException("disk full");
        }
    }
}

package org.background.task.engine.core.processor;

import com.google.common.annotations.VisibleForTesting;
import org.background.task.engine.api.exception.TaskCancelledException;
import org.background.task.engine.core.model.TaskKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Default processor for a task kind: walks through the kind's named sub-steps, waiting a fixed
 * delay before each one and reporting its progress once done.
 *
 * <p>Cancellation is checked before every step, both through the task's token and through the
 * direct notification received via {@link #cancelTask(String)}. Notifications for tasks that are
 * not currently inside {@link #process(TaskExecutionContext)} are ignored.
 */
public class StagedTaskProcessor implements InterruptibleTaskProcessor {

    private static final Logger logger = LoggerFactory.getLogger(StagedTaskProcessor.class);

    private final TaskKind kind;
    private final List<PayloadStep> steps;
    private final long stepDelayMillis;
    /** Cancel-requested flags of the tasks currently being processed */
    private final Map<String, AtomicBoolean> inProgress = new ConcurrentHashMap<>();

    public StagedTaskProcessor(TaskKind kind, List<PayloadStep> steps, Duration stepDelay) {
        this.kind = kind;
        this.steps = List.copyOf(steps);
        this.stepDelayMillis = Math.max(0, stepDelay.toMillis());
    }

    /**
     * Builds the processor for {@code kind} from the catalog, scaling the step delay.
     */
    public static StagedTaskProcessor forKind(TaskKind kind, double delayScale) {
        Duration base = PayloadStepCatalog.stepDelay(kind);
        long scaled = Math.round(base.toMillis() * Math.max(0.0, delayScale));
        return new StagedTaskProcessor(kind, PayloadStepCatalog.steps(kind), Duration.ofMillis(scaled));
    }

    @Override
    public TaskKind getTaskKind() {
        return kind;
    }

    @Override
    public void process(TaskExecutionContext context) throws Exception {
        String taskId = context.taskId();
        AtomicBoolean cancelRequested = new AtomicBoolean(false);
        inProgress.put(taskId, cancelRequested);
        try {
            for (PayloadStep step : steps) {
                checkCancelled(context, cancelRequested);
                if (stepDelayMillis > 0) {
                    Thread.sleep(stepDelayMillis);
                }
                checkCancelled(context, cancelRequested);
                context.reportProgress(step.progress(), step.message(), Map.of("step", step.message()));
                logger.debug("Task {} reached {}% - {}", taskId, step.progress(), step.message());
            }
        } finally {
            inProgress.remove(taskId, cancelRequested);
        }
    }

    @Override
    public void cancelTask(String taskId) {
        AtomicBoolean cancelRequested = inProgress.get(taskId);
        if (cancelRequested == null) {
            logger.debug("Ignoring cancellation of {} task {} - not running here", kind.getValue(), taskId);
            return;
        }
        cancelRequested.set(true);
        logger.debug("Cancellation noted for {} task {}", kind.getValue(), taskId);
    }

    @VisibleForTesting
    int inProgressCount() {
        return inProgress.size();
    }

    public List<PayloadStep> getSteps() {
        return steps;
    }

    public long getStepDelayMillis() {
        return stepDelayMillis;
    }

    private static void checkCancelled(TaskExecutionContext context, AtomicBoolean cancelRequested)
            throws TaskCancelledException {
        if (cancelRequested.get()) {
            throw new TaskCancelledException("cancel requested");
        }
        context.checkCancelled();
    }
}

package org.background.task.engine.core.processor;

import org.background.task.engine.api.exception.TaskCancelledException;
import org.background.task.engine.core.model.TaskKind;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class StagedTaskProcessorTest {

    @ParameterizedTest
    @EnumSource(TaskKind.class)
    void everyKind_hasStepsEndingAtOneHundred(TaskKind kind) {
        List<PayloadStep> steps = PayloadStepCatalog.steps(kind);

        assertThat(steps).isNotEmpty();
        assertThat(steps.get(steps.size() - 1).progress()).isEqualTo(100.0);
        assertThat(PayloadStepCatalog.stepDelay(kind).toMillis()).isPositive();
    }

    @Test
    void forKind_scalesStepDelay() {
        assertThat(StagedTaskProcessor.forKind(TaskKind.EXPORT, 1.0).getStepDelayMillis()).isEqualTo(250);
        assertThat(StagedTaskProcessor.forKind(TaskKind.EXPORT, 0.5).getStepDelayMillis()).isEqualTo(125);
        assertThat(StagedTaskProcessor.forKind(TaskKind.EXPORT, 0.0).getStepDelayMillis()).isZero();
    }

    @Test
    void process_reportsEveryStepInOrder() throws Exception {
        StagedTaskProcessor processor = StagedTaskProcessor.forKind(TaskKind.EXPORT, 0.0);
        List<Double> progress = new ArrayList<>();
        List<String> messages = new ArrayList<>();
        TaskExecutionContext context = context("t1", (value, message, metadata) -> {
            progress.add(value);
            messages.add(message);
            assertThat(metadata).containsEntry("step", message);
        }, new CancellationToken("t1"));

        processor.process(context);

        assertThat(progress).containsExactly(25.0, 50.0, 75.0, 100.0);
        assertThat(messages).containsExactly("Preparing export data", "Formatting output", "Writing files",
                "Export completed");
    }

    @Test
    void process_stopsWhenTokenIsCancelled() {
        StagedTaskProcessor processor = StagedTaskProcessor.forKind(TaskKind.BACKUP, 0.0);
        CancellationToken token = new CancellationToken("t2");
        List<Double> progress = new ArrayList<>();
        TaskExecutionContext context = context("t2", (value, message, metadata) -> {
            progress.add(value);
            if (value >= 40) {
                token.cancel("user request");
            }
        }, token);

        assertThatThrownBy(() -> processor.process(context))
                .isInstanceOf(TaskCancelledException.class)
                .hasMessageContaining("user request");
        assertThat(progress).containsExactly(20.0, 40.0);
    }

    @Test
    void cancelTask_stopsTheNextStep() {
        StagedTaskProcessor processor = StagedTaskProcessor.forKind(TaskKind.CLOUD_SYNC, 0.0);
        List<Double> progress = new ArrayList<>();
        TaskExecutionContext context = context("t3", (value, message, metadata) -> {
            progress.add(value);
            processor.cancelTask("t3");
        }, new CancellationToken("t3"));

        assertThatThrownBy(() -> processor.process(context)).isInstanceOf(TaskCancelledException.class);
        assertThat(progress).containsExactly(25.0);
    }

    @Test
    void cancelTask_forTaskNotBeingProcessed_isForgotten() throws Exception {
        StagedTaskProcessor processor = StagedTaskProcessor.forKind(TaskKind.EXPORT, 0.0);
        processor.cancelTask("finished-earlier");
        List<Double> progress = new ArrayList<>();

        processor.process(context("finished-earlier", (value, message, metadata) -> progress.add(value),
                new CancellationToken("finished-earlier")));

        assertThat(progress).containsExactly(25.0, 50.0, 75.0, 100.0);
        assertThat(processor.inProgressCount()).isZero();
    }

    @Test
    void process_clearsCancelFlagWhenItStops() {
        StagedTaskProcessor processor = StagedTaskProcessor.forKind(TaskKind.CLOUD_SYNC, 0.0);
        TaskExecutionContext context = context("t4", (value, message, metadata) -> processor.cancelTask("t4"),
                new CancellationToken("t4"));

        assertThatThrownBy(() -> processor.process(context)).isInstanceOf(TaskCancelledException.class);
        assertThat(processor.inProgressCount()).isZero();
    }

    private static TaskExecutionContext context(String taskId, ProgressReporter reporter, CancellationToken token) {
        return new TaskExecutionContext(taskId, TaskKind.EXPORT, Map.of(), reporter, token);
    }
}

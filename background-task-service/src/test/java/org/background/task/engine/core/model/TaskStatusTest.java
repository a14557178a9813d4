package org.background.task.engine.core.model;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import static org.assertj.core.api.Assertions.assertThat;

class TaskStatusTest {

    @Test
    void queued_canMoveToRunningCancelledOrFailed() {
        assertThat(TaskStatus.QUEUED.canTransitionTo(TaskStatus.RUNNING)).isTrue();
        assertThat(TaskStatus.QUEUED.canTransitionTo(TaskStatus.CANCELLED)).isTrue();
        assertThat(TaskStatus.QUEUED.canTransitionTo(TaskStatus.FAILED)).isTrue();
        assertThat(TaskStatus.QUEUED.canTransitionTo(TaskStatus.COMPLETED)).isFalse();
        assertThat(TaskStatus.QUEUED.canTransitionTo(TaskStatus.QUEUED)).isFalse();
    }

    @Test
    void running_canOnlyMoveToTerminalStates() {
        assertThat(TaskStatus.RUNNING.canTransitionTo(TaskStatus.COMPLETED)).isTrue();
        assertThat(TaskStatus.RUNNING.canTransitionTo(TaskStatus.FAILED)).isTrue();
        assertThat(TaskStatus.RUNNING.canTransitionTo(TaskStatus.CANCELLED)).isTrue();
        assertThat(TaskStatus.RUNNING.canTransitionTo(TaskStatus.QUEUED)).isFalse();
        assertThat(TaskStatus.RUNNING.canTransitionTo(TaskStatus.RUNNING)).isFalse();
    }

    @ParameterizedTest
    @EnumSource(value = TaskStatus.class, names = {"COMPLETED", "FAILED", "CANCELLED"})
    void terminalStates_neverTransition(TaskStatus terminal) {
        assertThat(terminal.isTerminal()).isTrue();
        for (TaskStatus target : TaskStatus.values()) {
            assertThat(terminal.canTransitionTo(target)).isFalse();
        }
    }

    @Test
    void nullTarget_isRejected() {
        assertThat(TaskStatus.QUEUED.canTransitionTo(null)).isFalse();
    }
}

package org.background.task.engine.core.processor;

import org.background.task.engine.api.exception.TaskCancelledException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CancellationTokenTest {

    @Test
    void cancel_winsOverLaterFinish() {
        CancellationToken token = new CancellationToken("t1");

        assertThat(token.cancel("user request")).isTrue();
        assertThat(token.cancel("again")).isFalse();
        assertThat(token.finish()).isFalse();

        assertThat(token.isCancelled()).isTrue();
        assertThat(token.getReason()).isEqualTo("user request");
        assertThatThrownBy(token::throwIfCancelled)
                .isInstanceOf(TaskCancelledException.class)
                .hasMessageContaining("user request");
    }

    @Test
    void finish_winsOverLaterCancel() throws Exception {
        CancellationToken token = new CancellationToken("t2");

        assertThat(token.finish()).isTrue();
        assertThat(token.finish()).isTrue();
        assertThat(token.cancel("too late")).isFalse();

        assertThat(token.isCancelled()).isFalse();
        assertThat(token.isFinished()).isTrue();
        assertThat(token.getReason()).isNull();
        token.throwIfCancelled();
    }

    @Test
    void tokens_cancelReportsMissingOrFinishedTokens() {
        CancellationTokens tokens = new CancellationTokens();
        tokens.create("live");
        tokens.create("done").finish();

        assertThat(tokens.cancel("live", "user")).isTrue();
        assertThat(tokens.cancel("done", "user")).isFalse();
        assertThat(tokens.cancel("missing", "user")).isFalse();
        assertThat(tokens.isCancelled("live")).isTrue();

        tokens.release("live");
        assertThat(tokens.get("live")).isEmpty();
        assertThat(tokens.size()).isEqualTo(1);
    }
}

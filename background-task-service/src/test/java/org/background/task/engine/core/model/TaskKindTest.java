package org.background.task.engine.core.model;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TaskKindTest {

    @Test
    void fromValue_acceptsWireAndConstantNames() {
        assertThat(TaskKind.fromValue("web_scraping")).isEqualTo(TaskKind.WEB_SCRAPING);
        assertThat(TaskKind.fromValue("BATCH_PROCESSING")).isEqualTo(TaskKind.BATCH_PROCESSING);
        assertThat(TaskKind.fromValue(" cloud_sync ")).isEqualTo(TaskKind.CLOUD_SYNC);
    }

    @Test
    void fromValue_rejectsUnknownAndBlank() {
        assertThatThrownBy(() -> TaskKind.fromValue("telepathy"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Unknown task type");
        assertThatThrownBy(() -> TaskKind.fromValue(" "))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("required");
    }

    @Test
    void baseMinutes_matchEstimateTable() {
        assertThat(TaskKind.WEB_SCRAPING.getBaseMinutes()).isEqualTo(3.0);
        assertThat(TaskKind.CHUNK_GENERATION.getBaseMinutes()).isEqualTo(1.5);
        assertThat(TaskKind.BACKUP.getBaseMinutes()).isEqualTo(5.0);
        assertThat(TaskKind.BATCH_PROCESSING.getBaseMinutes()).isEqualTo(8.0);
        assertThat(TaskKind.PYTHON_PACKAGE_INSTALL.getBaseMinutes()).isEqualTo(3.0);
    }
}

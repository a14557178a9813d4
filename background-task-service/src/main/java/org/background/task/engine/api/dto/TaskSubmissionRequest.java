package org.background.task.engine.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.HashMap;
import java.util.Map;

/**
 * Request body for submitting a background task.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class TaskSubmissionRequest {

    @NotBlank(message = "taskType is required")
    @Schema(description = "Wire name of the task kind", example = "web_scraping")
    private String taskType;

    @Schema(description = "LOW, NORMAL, HIGH or CRITICAL; NORMAL when omitted", example = "HIGH")
    private String priority;

    @Schema(description = "Free-form parameters handed to the processor")
    private Map<String, Object> metadata = new HashMap<>();
}

package org.background.task.engine.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Response to a task command such as submit, cancel or pause.
 *
 * <pre>{@code
 * new TaskResponseDto("3f2a...", "QUEUED", 3, "Task queued at position 3");
 * }</pre>
 */
@Data
@NoArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class TaskResponseDto {

    private String taskId;

    /** Task status after the command, e.g. QUEUED or CANCELLED. */
    private String status;

    /** Admission position, only set for queued tasks. */
    private Integer queuePosition;

    private String message;

    public TaskResponseDto(String taskId, String status, String message) {
        this.taskId = taskId;
        this.status = status;
        this.message = message;
    }

    public TaskResponseDto(String taskId, String status, Integer queuePosition, String message) {
        this.taskId = taskId;
        this.status = status;
        this.queuePosition = queuePosition;
        this.message = message;
    }
}

package org.background.task.engine.api.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.enums.ParameterIn;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import org.background.task.engine.api.dto.ErrorResponse;
import org.background.task.engine.api.dto.TaskResponseDto;
import org.background.task.engine.api.dto.TaskSubmissionRequest;
import org.background.task.engine.api.dto.TaskView;
import org.background.task.engine.api.mapper.TaskMapper;
import org.background.task.engine.core.engine.BackgroundTaskEngine;
import org.background.task.engine.core.model.BackgroundTask;
import org.background.task.engine.core.model.CompletionEstimate;
import org.background.task.engine.core.model.ServiceState;
import org.background.task.engine.core.model.SystemStats;
import org.background.task.engine.core.model.TaskKind;
import org.background.task.engine.core.model.TaskPriority;
import org.background.task.engine.core.model.TaskStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Duration;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/tasks")
@Validated
public class BackgroundTaskController {

    private static final Logger logger = LoggerFactory.getLogger(BackgroundTaskController.class);

    private final BackgroundTaskEngine engine;
    private final TaskMapper taskMapper;

    public BackgroundTaskController(BackgroundTaskEngine engine, TaskMapper taskMapper) {
        this.engine = engine;
        this.taskMapper = taskMapper;
    }

    // ===============================
    // TASK LIFECYCLE ENDPOINTS
    // ===============================

    @Operation(summary = "Submit a new task", description = "Queues a task of the given type and priority.")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "202", description = "Task queued"),
            @ApiResponse(responseCode = "400", description = "Task rejected", content = @Content(schema = @Schema(implementation = ErrorResponse.class))),
            @ApiResponse(responseCode = "503", description = "Engine shutting down", content = @Content(schema = @Schema(implementation = ErrorResponse.class)))
    })
    @PostMapping("/submit")
    public ResponseEntity<TaskResponseDto> submitTask(@Valid @RequestBody TaskSubmissionRequest request) {
        logger.info("Received task submission: {} ({})", request.getTaskType(), request.getPriority());
        TaskKind kind = taskMapper.toKind(request.getTaskType());
        TaskPriority priority = taskMapper.toPriority(request.getPriority());

        String taskId = engine.submit(kind, priority, request.getMetadata());
        int position = engine.getQueuePosition(taskId);
        TaskResponseDto response = position > 0
                ? new TaskResponseDto(taskId, TaskStatus.QUEUED.name(), position, String.format("Task queued at position %d", position))
                : new TaskResponseDto(taskId, TaskStatus.QUEUED.name(), "Task queued");
        return ResponseEntity.accepted().body(response);
    }

    @Operation(summary = "Cancel a task", description = "Requests cancellation of a queued or running task.")
    @Parameter(name = "taskId", description = "ID of the task to cancel", required = true, in = ParameterIn.PATH)
    @DeleteMapping("/{taskId}")
    public ResponseEntity<TaskResponseDto> cancelTask(@PathVariable("taskId") String taskId) {
        logger.info("Received cancel request for task: {}", taskId);
        if (engine.cancel(taskId)) {
            return ResponseEntity.ok(new TaskResponseDto(taskId, TaskStatus.CANCELLED.name(), "Task cancellation requested"));
        }
        String status = engine.getTaskStatus(taskId).map(task -> task.getStatus().name()).orElse("UNKNOWN");
        return ResponseEntity.status(HttpStatus.CONFLICT)
                .body(new TaskResponseDto(taskId, status, "Task could not be cancelled"));
    }

    @Operation(summary = "Pause a task", description = "Marks a task as paused.")
    @PostMapping("/{taskId}/pause")
    public ResponseEntity<TaskResponseDto> pauseTask(@PathVariable("taskId") String taskId) {
        return commandResponse(taskId, engine.pause(taskId), "Pause requested");
    }

    @Operation(summary = "Resume a task", description = "Marks a paused task as resumed.")
    @PostMapping("/{taskId}/resume")
    public ResponseEntity<TaskResponseDto> resumeTask(@PathVariable("taskId") String taskId) {
        return commandResponse(taskId, engine.resume(taskId), "Resume requested");
    }

    @Operation(summary = "Get a task", description = "Returns the current state of a task.")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Task found"),
            @ApiResponse(responseCode = "404", description = "Task not found")
    })
    @GetMapping("/{taskId}")
    public ResponseEntity<TaskView> getTask(@PathVariable("taskId") String taskId) {
        return engine.getTaskStatus(taskId)
                .map(taskMapper::toView)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    // ===============================
    // QUERY ENDPOINTS
    // ===============================

    @Operation(summary = "List all tasks", description = "Returns every known task, oldest first.")
    @GetMapping
    public ResponseEntity<List<TaskView>> getAllTasks() {
        return ResponseEntity.ok(taskMapper.toViews(engine.getAllTasks()));
    }

    @Operation(summary = "List running tasks")
    @GetMapping("/active")
    public ResponseEntity<List<TaskView>> getActiveTasks() {
        return ResponseEntity.ok(taskMapper.toViews(engine.getActiveTasks()));
    }

    @Operation(summary = "List tasks by status")
    @Parameter(name = "status", description = "Task status filter", required = true, example = "RUNNING", in = ParameterIn.PATH, schema = @Schema(implementation = TaskStatus.class))
    @GetMapping("/status/{status}")
    public ResponseEntity<List<TaskView>> getTasksByStatus(@PathVariable("status") TaskStatus status) {
        return ResponseEntity.ok(taskMapper.toViews(engine.getTasksByStatus(status)));
    }

    @Operation(summary = "Get queue length", description = "Returns the number of queued tasks and busy workers.")
    @GetMapping("/queue/length")
    public ResponseEntity<Map<String, Integer>> getQueueLength() {
        return ResponseEntity.ok(Map.of(
                "queueLength", engine.getQueueLength(),
                "activeWorkers", engine.getActiveWorkers(),
                "maxWorkers", engine.getMaxWorkers()));
    }

    @Operation(summary = "Get task statistics")
    @GetMapping("/stats")
    public ResponseEntity<SystemStats> getSystemStats() {
        return ResponseEntity.ok(engine.getSystemStats());
    }

    @Operation(summary = "Estimate completion", description = "Estimates how long a task of the given type would take if submitted now.")
    @Parameter(name = "taskType", description = "Wire name of the task kind", required = true, example = "backup", in = ParameterIn.PATH)
    @GetMapping("/estimate/{taskType}")
    public ResponseEntity<CompletionEstimate> estimateCompletion(@PathVariable("taskType") String taskType) {
        return ResponseEntity.ok(engine.estimateCompletion(taskMapper.toKind(taskType)));
    }

    @Operation(summary = "Get available task types")
    @GetMapping("/types")
    public ResponseEntity<List<String>> getAvailableTaskTypes() {
        return ResponseEntity.ok(engine.getAvailableTaskKinds().stream().map(TaskKind::getValue).toList());
    }

    @Operation(summary = "Remove finished tasks", description = "Removes finished tasks that completed longer ago than the given age.")
    @Parameter(name = "olderThanMinutes", description = "Minimum age in minutes", example = "60", in = ParameterIn.QUERY)
    @PostMapping("/cleanup")
    public ResponseEntity<Map<String, Integer>> cleanupFinishedTasks(
            @RequestParam(name = "olderThanMinutes", defaultValue = "60") @Min(0) long olderThanMinutes) {
        int removed = engine.cleanupFinishedTasks(Duration.ofMinutes(olderThanMinutes));
        return ResponseEntity.ok(Map.of("removed", removed));
    }

    // ===============================
    // MONITORING ENDPOINTS
    // ===============================

    @Operation(summary = "Health check", description = "Returns UP while the engine accepts tasks, DOWN otherwise.")
    @GetMapping("/health")
    public ResponseEntity<Map<String, String>> healthCheck() {
        ServiceState serviceState = engine.getServiceState();
        boolean isHealthy = serviceState == ServiceState.RUNNING;

        Map<String, String> health = Map.of(
                "status", isHealthy ? "UP" : "DOWN",
                "service", "BackgroundTaskEngine",
                "state", serviceState.name()
        );

        return isHealthy ? ResponseEntity.ok(health) :
                ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(health);
    }

    private ResponseEntity<TaskResponseDto> commandResponse(String taskId, boolean delivered, String message) {
        String status = engine.getTaskStatus(taskId).map(BackgroundTask::getStatus).map(Enum::name).orElse("UNKNOWN");
        if (!delivered) {
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                    .body(new TaskResponseDto(taskId, status, "Command could not be delivered"));
        }
        return ResponseEntity.accepted().body(new TaskResponseDto(taskId, status, message));
    }
}

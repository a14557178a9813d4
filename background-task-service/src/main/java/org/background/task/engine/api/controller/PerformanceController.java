package org.background.task.engine.api.controller;

import com.fasterxml.jackson.core.JsonProcessingException;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.enums.ParameterIn;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import org.background.task.engine.api.dto.OptimizationRequest;
import org.background.task.engine.api.exception.InvalidTaskException;
import org.background.task.engine.config.TaskEngineConfig;
import org.background.task.engine.core.health.EmergencyCleanupResult;
import org.background.task.engine.core.health.HealthSummary;
import org.background.task.engine.core.health.SystemHealthService;
import org.background.task.engine.core.monitor.OptimizationProfile;
import org.background.task.engine.core.monitor.ResourceLimits;
import org.background.task.engine.core.monitor.ResourceMonitor;
import org.background.task.engine.core.monitor.SystemSnapshot;
import org.background.task.engine.core.monitor.TaskMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/performance")
@Validated
public class PerformanceController {

    private static final Logger logger = LoggerFactory.getLogger(PerformanceController.class);

    private final ResourceMonitor monitor;
    private final SystemHealthService healthService;
    private final TaskEngineConfig config;

    public PerformanceController(ResourceMonitor monitor, SystemHealthService healthService, TaskEngineConfig config) {
        this.monitor = monitor;
        this.healthService = healthService;
        this.config = config;
    }

    @Operation(summary = "Get system metrics", description = "Returns the latest host sample and task accounting.")
    @GetMapping("/metrics")
    public ResponseEntity<SystemSnapshot> getSystemMetrics() {
        return ResponseEntity.ok(monitor.getSystemSnapshot());
    }

    @Operation(summary = "Get performance recommendation")
    @GetMapping("/recommendation")
    public ResponseEntity<Map<String, String>> getRecommendation() {
        return ResponseEntity.ok(Map.of("recommendation", monitor.getRecommendation()));
    }

    @Operation(summary = "Get resource limits")
    @GetMapping("/limits")
    public ResponseEntity<ResourceLimits> getLimits() {
        return ResponseEntity.ok(monitor.getLimits());
    }

    @Operation(summary = "Apply an optimization preset", description = "Replaces the resource limits with the low_memory, performance or balanced preset.")
    @PostMapping("/optimize")
    public ResponseEntity<ResourceLimits> optimize(@Valid @RequestBody OptimizationRequest request) {
        OptimizationProfile profile;
        try {
            profile = OptimizationProfile.fromValue(request.getOptimizationType());
        } catch (IllegalArgumentException e) {
            throw new InvalidTaskException(e.getMessage());
        }
        logger.info("Applying optimization preset: {}", profile.getValue());
        return ResponseEntity.ok(monitor.optimize(profile));
    }

    @Operation(summary = "Export metrics", description = "Returns snapshot, task metrics and limits as one JSON document.")
    @GetMapping(value = "/export", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<String> exportMetrics() throws JsonProcessingException {
        return ResponseEntity.ok(monitor.exportMetrics());
    }

    @Operation(summary = "Prune metrics history", description = "Keeps only the most recent finished task metrics.")
    @Parameter(name = "retain", description = "Number of entries to keep; defaults to the configured history cap", in = ParameterIn.QUERY)
    @PostMapping("/cleanup")
    public ResponseEntity<Map<String, Integer>> cleanupMetrics(
            @RequestParam(name = "retain", required = false) @Min(0) Integer retain) {
        int keep = retain != null ? retain : config.getCompletedHistoryCap();
        int removed = monitor.cleanupOldMetrics(keep);
        return ResponseEntity.ok(Map.of("removed", removed, "retained", monitor.getCompletedTaskMetrics().size()));
    }

    @Operation(summary = "Get health summary")
    @GetMapping("/health-summary")
    public ResponseEntity<HealthSummary> getHealthSummary() {
        return ResponseEntity.ok(healthService.healthSummary());
    }

    @Operation(summary = "Emergency cleanup", description = "Cancels running non-critical tasks and switches to the low-memory preset.")
    @PostMapping("/emergency-cleanup")
    public ResponseEntity<EmergencyCleanupResult> emergencyCleanup() {
        return ResponseEntity.ok(healthService.emergencyCleanup());
    }

    @Operation(summary = "List metrics of running tasks")
    @GetMapping("/active-tasks")
    public ResponseEntity<List<TaskMetrics>> getActiveTaskMetrics() {
        return ResponseEntity.ok(monitor.getActiveTaskMetrics());
    }
}

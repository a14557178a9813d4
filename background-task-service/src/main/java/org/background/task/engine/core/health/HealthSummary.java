package org.background.task.engine.core.health;

import org.background.task.engine.core.model.SystemStats;
import org.background.task.engine.core.monitor.HealthStatus;
import org.background.task.engine.core.monitor.ResourceLimits;
import org.background.task.engine.core.monitor.SystemSnapshot;

import java.time.Instant;

public record HealthSummary(
        HealthStatus status,
        SystemSnapshot performanceMetrics,
        SystemStats taskStatistics,
        ResourceLimits resourceLimits,
        String recommendation,
        Instant timestamp) {
}

package org.background.task.engine.core.health;

import org.background.task.engine.core.monitor.ResourceLimits;

/**
 * Outcome of an emergency cleanup.
 *
 * @param cancelledTasks number of running non-critical tasks asked to stop
 * @param metricsRemoved number of finished task metrics pruned
 */
public record EmergencyCleanupResult(int cancelledTasks, int metricsRemoved, ResourceLimits appliedLimits) {
}

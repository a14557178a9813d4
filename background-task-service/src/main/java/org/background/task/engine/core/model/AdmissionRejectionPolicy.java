package org.background.task.engine.core.model;

/**
 * What the admission loop does with the head task when the resource monitor refuses it.
 */
public enum AdmissionRejectionPolicy {
    /** Leave the task queued at its position and retry on the next tick. */
    DEFER,
    /** Remove the task from the queue and mark it failed with the rejection reason. */
    FAIL
}

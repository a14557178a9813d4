package org.background.task.engine.core.monitor;

/**
 * The limit that caused an admission to be refused.
 */
public enum AdmissionLimit {
    CONCURRENCY,
    MEMORY
}

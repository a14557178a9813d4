package org.background.task.engine.api.exception;

import org.background.task.engine.core.monitor.AdmissionLimit;

/**
 * Raised by the resource monitor when a task may not start under the current limits.
 */
public class AdmissionRejectedException extends ServiceException {
    private final AdmissionLimit limit;

    public AdmissionRejectedException(AdmissionLimit limit, String message) {
        super(message);
        this.limit = limit;
    }

    public AdmissionLimit getLimit() {
        return limit;
    }
}

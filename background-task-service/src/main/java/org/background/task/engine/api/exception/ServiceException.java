package org.background.task.engine.api.exception;

/**
 * Base type of every error the engine raises towards its callers.
 */
public abstract class ServiceException extends RuntimeException {
    public ServiceException(String message) {
        super(message);
    }
}

package org.background.task.engine.api.exception;

public class ServiceShutdownException extends ServiceException {
    public ServiceShutdownException(String message) {
        super(message);
    }
}

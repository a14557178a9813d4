package org.background.task.engine.api.exception;

public class QueueCapacityException extends ServiceException {
    public QueueCapacityException(String message) {
        super(message);
    }
}

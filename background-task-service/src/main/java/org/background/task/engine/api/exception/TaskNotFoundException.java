package org.background.task.engine.api.exception;

public class TaskNotFoundException extends ServiceException {
    public TaskNotFoundException(String message) {
        super(message);
    }
}

package org.background.task.engine.api.exception;

public class InvalidTaskException extends ServiceException {
    public InvalidTaskException(String message) {
        super(message);
    }
}

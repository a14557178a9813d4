package org.background.task.engine.core.model;

/**
 * Control instruction delivered through the command channel.
 */
public record TaskCommand(CommandType type, String taskId) {

    public enum CommandType {
        CANCEL,
        PAUSE,
        RESUME,
        GET_STATUS
    }

    public static TaskCommand cancel(String taskId) {
        return new TaskCommand(CommandType.CANCEL, taskId);
    }

    public static TaskCommand pause(String taskId) {
        return new TaskCommand(CommandType.PAUSE, taskId);
    }

    public static TaskCommand resume(String taskId) {
        return new TaskCommand(CommandType.RESUME, taskId);
    }

    public static TaskCommand status(String taskId) {
        return new TaskCommand(CommandType.GET_STATUS, taskId);
    }
}

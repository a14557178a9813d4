package org.background.task.engine.core.model;

public enum ServiceState {
    STARTING,
    RUNNING,
    SHUTTING_DOWN,
    SHUTDOWN
}

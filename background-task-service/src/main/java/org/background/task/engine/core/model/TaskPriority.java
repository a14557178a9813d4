package org.background.task.engine.core.model;

import java.util.Locale;

/**
 * Scheduling priority of a background task. Higher levels are admitted first.
 */
public enum TaskPriority {
    LOW(1),
    NORMAL(2),
    HIGH(3),
    CRITICAL(4);

    private final int level;

    TaskPriority(int level) {
        this.level = level;
    }

    public int getLevel() {
        return level;
    }

    /**
     * Resolves a priority by name, case-insensitively, falling back to {@link #NORMAL}
     * when the value is blank.
     *
     * @param value priority name such as {@code "high"}
     * @return the matching priority
     * @throws IllegalArgumentException if the value names no priority
     */
    public static TaskPriority fromValueOrDefault(String value) {
        if (value == null || value.isBlank()) {
            return NORMAL;
        }
        try {
            return TaskPriority.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown task priority: " + value, e);
        }
    }
}

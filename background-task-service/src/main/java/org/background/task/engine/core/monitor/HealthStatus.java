package org.background.task.engine.core.monitor;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum HealthStatus {
    HEALTHY,
    WARNING,
    CRITICAL;

    @JsonValue
    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}

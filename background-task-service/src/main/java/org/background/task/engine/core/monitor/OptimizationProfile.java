package org.background.task.engine.core.monitor;

import java.util.Arrays;
import java.util.Locale;

/**
 * Named presets that replace the active {@link ResourceLimits}.
 */
public enum OptimizationProfile {
    LOW_MEMORY("low_memory"),
    PERFORMANCE("performance"),
    BALANCED("balanced");

    private final String value;

    OptimizationProfile(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static OptimizationProfile fromValue(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Optimization type is required");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(profile -> profile.value.equals(normalized))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown optimization type: " + value));
    }
}

package org.background.task.engine.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Locale;

/**
 * Closed set of background work the engine knows how to run. Each kind carries its wire name
 * and the base duration, in minutes, used for completion estimates.
 */
public enum TaskKind {
    WEB_SCRAPING("web_scraping", 3.0),
    TEXT_PROCESSING("text_processing", 2.0),
    CHUNK_GENERATION("chunk_generation", 1.5),
    EXPORT("export", 1.0),
    METADATA_ENRICHMENT("metadata_enrichment", 4.0),
    VISUAL_ASSET_DOWNLOAD("visual_asset_download", 2.5),
    CLOUD_SYNC("cloud_sync", 3.5),
    BACKUP("backup", 5.0),
    QUALITY_ANALYSIS("quality_analysis", 2.0),
    BATCH_PROCESSING("batch_processing", 8.0),
    ADVANCED_CHUNKING("advanced_chunking", 3.0),
    QUALITY_ASSESSMENT("quality_assessment", 3.0),
    RELATIONSHIP_EXTRACTION("relationship_extraction", 3.0),
    PYTHON_PACKAGE_INSTALL("python_package_install", 3.0);

    private final String value;
    private final double baseMinutes;

    TaskKind(String value, double baseMinutes) {
        this.value = value;
        this.baseMinutes = baseMinutes;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public double getBaseMinutes() {
        return baseMinutes;
    }

    /**
     * Resolves a kind from its wire name ({@code web_scraping}) or its constant name
     * ({@code WEB_SCRAPING}).
     *
     * @param value the kind name
     * @return the matching kind
     * @throws IllegalArgumentException if the value is blank or unknown
     */
    @JsonCreator
    public static TaskKind fromValue(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Task type is required");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(kind -> kind.value.equals(normalized))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown task type: " + value));
    }
}

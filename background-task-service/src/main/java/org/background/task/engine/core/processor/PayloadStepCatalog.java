package org.background.task.engine.core.processor;

import org.background.task.engine.core.model.TaskKind;

import java.time.Duration;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Sub-steps and per-step delay of every task kind, as reported by the built-in processors.
 */
public final class PayloadStepCatalog {

    private record Plan(Duration stepDelay, List<PayloadStep> steps) {
    }

    private static final Map<TaskKind, Plan> PLANS = new EnumMap<>(TaskKind.class);

    static {
        PLANS.put(TaskKind.WEB_SCRAPING, plan(500,
                step(10, "Connecting to source"),
                step(25, "Downloading content"),
                step(50, "Parsing HTML structure"),
                step(75, "Extracting text content"),
                step(100, "Scraping completed")));
        PLANS.put(TaskKind.TEXT_PROCESSING, plan(400,
                step(15, "Analyzing text structure"),
                step(35, "Cleaning text content"),
                step(60, "Normalizing formatting"),
                step(85, "Validating quality"),
                step(100, "Text processing completed")));
        PLANS.put(TaskKind.CHUNK_GENERATION, plan(300,
                step(20, "Analyzing content boundaries"),
                step(40, "Applying chunking strategy"),
                step(70, "Generating chunks"),
                step(90, "Validating chunk quality"),
                step(100, "Chunking completed")));
        PLANS.put(TaskKind.EXPORT, plan(250,
                step(25, "Preparing export data"),
                step(50, "Formatting output"),
                step(75, "Writing files"),
                step(100, "Export completed")));
        PLANS.put(TaskKind.METADATA_ENRICHMENT, plan(600,
                step(20, "Querying external APIs"),
                step(45, "Processing metadata"),
                step(70, "Enriching book information"),
                step(90, "Validating enrichments"),
                step(100, "Metadata enrichment completed")));
        PLANS.put(TaskKind.VISUAL_ASSET_DOWNLOAD, plan(400,
                step(30, "Downloading cover images"),
                step(60, "Processing images"),
                step(85, "Caching assets"),
                step(100, "Visual assets ready")));
        PLANS.put(TaskKind.CLOUD_SYNC, plan(800,
                step(25, "Connecting to cloud storage"),
                step(50, "Uploading changes"),
                step(75, "Syncing metadata"),
                step(100, "Sync completed")));
        PLANS.put(TaskKind.BACKUP, plan(500,
                step(20, "Preparing backup"),
                step(40, "Compressing data"),
                step(70, "Creating archive"),
                step(90, "Verifying backup"),
                step(100, "Backup completed")));
        PLANS.put(TaskKind.QUALITY_ANALYSIS, plan(350,
                step(30, "Analyzing content quality"),
                step(60, "Checking completeness"),
                step(85, "Generating quality report"),
                step(100, "Quality analysis completed")));
        PLANS.put(TaskKind.BATCH_PROCESSING, plan(700,
                step(10, "Initializing batch"),
                step(25, "Processing items 1-10"),
                step(45, "Processing items 11-20"),
                step(65, "Processing items 21-30"),
                step(85, "Finalizing batch"),
                step(100, "Batch processing completed")));
        PLANS.put(TaskKind.ADVANCED_CHUNKING, plan(600,
                step(15, "Initializing advanced chunking"),
                step(30, "Analyzing text structure"),
                step(50, "Applying chunking strategies"),
                step(75, "Optimizing chunk boundaries"),
                step(90, "Validating chunks"),
                step(100, "Advanced chunking completed")));
        PLANS.put(TaskKind.QUALITY_ASSESSMENT, plan(800,
                step(20, "Loading ML models"),
                step(40, "Analyzing text quality"),
                step(60, "Computing readability scores"),
                step(80, "Assessing coherence"),
                step(95, "Generating quality report"),
                step(100, "Quality assessment completed")));
        PLANS.put(TaskKind.RELATIONSHIP_EXTRACTION, plan(700,
                step(10, "Initializing relationship extraction"),
                step(25, "Computing semantic embeddings"),
                step(45, "Analyzing chunk similarities"),
                step(65, "Extracting relationships"),
                step(85, "Building relationship graph"),
                step(100, "Relationship extraction completed")));
        PLANS.put(TaskKind.PYTHON_PACKAGE_INSTALL, plan(1200,
                step(10, "Checking Python environment"),
                step(25, "Downloading packages"),
                step(50, "Installing dependencies"),
                step(75, "Compiling native extensions"),
                step(90, "Verifying installation"),
                step(100, "Package installation completed")));
    }

    private PayloadStepCatalog() {
    }

    public static List<PayloadStep> steps(TaskKind kind) {
        return PLANS.get(kind).steps();
    }

    public static Duration stepDelay(TaskKind kind) {
        return PLANS.get(kind).stepDelay();
    }

    private static Plan plan(long delayMillis, PayloadStep... steps) {
        return new Plan(Duration.ofMillis(delayMillis), Collections.unmodifiableList(List.of(steps)));
    }

    private static PayloadStep step(double progress, String message) {
        return new PayloadStep(progress, message);
    }
}

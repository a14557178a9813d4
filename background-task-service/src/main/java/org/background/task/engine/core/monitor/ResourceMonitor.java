package org.background.task.engine.core.monitor;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.EvictingQueue;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.background.task.engine.api.exception.AdmissionRejectedException;
import org.background.task.engine.config.TaskEngineConfig;
import org.background.task.engine.core.model.TaskKind;
import org.background.task.engine.core.model.TaskStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Samples host resources and decides whether a task may start.
 *
 * <p>The monitor keeps its own accounting of running tasks, independent of the engine's worker
 * counter: a task enters the active set on {@link #startTask} and leaves it on
 * {@link #completeTask} or {@link #cancelTask}, moving into a bounded history of finished
 * metrics. Host figures are refreshed by a background sampler on a fixed interval.
 *
 * <p>Limits are swapped atomically; presets replace them wholesale.
 */
@Service
public class ResourceMonitor {

    private static final Logger logger = LoggerFactory.getLogger(ResourceMonitor.class);

    static final String HIGH_CPU_RECOMMENDATION =
            "High CPU usage detected. Consider reducing concurrent tasks or enabling background processing.";
    static final String HIGH_MEMORY_RECOMMENDATION =
            "High memory usage detected. Consider processing smaller batches or closing other applications.";
    static final String NEAR_LIMIT_RECOMMENDATION =
            "Near maximum concurrent task limit. New tasks may be queued.";
    static final String NORMAL_RECOMMENDATION =
            "System resources are operating within normal limits.";

    private static final double HIGH_MEMORY_RATIO = 0.85;

    private final SystemMetricsSampler sampler;
    private final ObjectMapper objectMapper;
    private final ResourceLimits configuredLimits;
    private final int monitorIntervalSeconds;
    private final AtomicReference<ResourceLimits> limits;

    private final ReentrantLock metricsLock = new ReentrantLock();
    private final Map<String, TaskMetrics> activeTasks = new LinkedHashMap<>();
    private final EvictingQueue<TaskMetrics> completedTasks;
    private double averageTaskDuration = 0.0;

    private final Instant startedAt = Instant.now();
    private volatile SystemSnapshot lastSample;
    private ScheduledExecutorService samplerExecutor;

    public ResourceMonitor(TaskEngineConfig config, SystemMetricsSampler sampler, ObjectMapper objectMapper) {
        this.sampler = sampler;
        this.objectMapper = objectMapper;
        this.configuredLimits = config.getLimits().toResourceLimits();
        this.monitorIntervalSeconds = config.getMonitorIntervalSeconds();
        this.limits = new AtomicReference<>(configuredLimits);
        this.completedTasks = EvictingQueue.create(config.getCompletedHistoryCap());
    }

    /**
     * Starts the background sampler. Calling it twice has no effect.
     */
    @PostConstruct
    public synchronized void startMonitoring() {
        if (samplerExecutor != null) {
            return;
        }
        samplerExecutor = Executors.newSingleThreadScheduledExecutor(new ThreadFactoryBuilder()
                .setNameFormat("ResourceSampler-%d")
                .setDaemon(true)
                .build());
        samplerExecutor.scheduleWithFixedDelay(this::sampleSafely, 0, monitorIntervalSeconds, TimeUnit.SECONDS);
        logger.info("Resource monitoring started - interval {}s, limits {}", monitorIntervalSeconds, limits.get());
    }

    @PreDestroy
    public synchronized void stopMonitoring() {
        if (samplerExecutor == null) {
            return;
        }
        samplerExecutor.shutdownNow();
        samplerExecutor = null;
        logger.info("Resource monitoring stopped");
    }

    /**
     * Records the start of a task if the current limits allow it.
     *
     * @throws AdmissionRejectedException if the concurrency ceiling is reached or the process uses
     *                                    more memory than allowed
     */
    public void startTask(String taskId, TaskKind kind) {
        ResourceLimits current = limits.get();
        metricsLock.lock();
        try {
            if (activeTasks.size() >= current.maxConcurrentTasks()) {
                throw new AdmissionRejectedException(AdmissionLimit.CONCURRENCY, String.format(
                        "Cannot start task: maximum concurrent tasks (%d) reached", current.maxConcurrentTasks()));
            }
            long memoryUsed = sampler.processMemoryUsedBytes();
            if (memoryUsed > current.maxMemoryBytes()) {
                throw new AdmissionRejectedException(AdmissionLimit.MEMORY, "Cannot start task: memory limit exceeded");
            }
            SystemSnapshot sample = lastSample;
            double cpu = sample != null ? sample.cpuUsagePercent() : sampler.cpuUsagePercent();
            activeTasks.put(taskId, TaskMetrics.started(taskId, kind, memoryUsed, cpu));
            logger.debug("Task {} admitted by resource monitor ({} active)", taskId, activeTasks.size());
        } finally {
            metricsLock.unlock();
        }
    }

    /**
     * Moves a task from the active set to the history as COMPLETED or FAILED.
     *
     * @return {@code false} if the task was not active
     */
    public boolean completeTask(String taskId, boolean success) {
        return finish(taskId, success ? TaskStatus.COMPLETED : TaskStatus.FAILED);
    }

    /**
     * Moves a task from the active set to the history as CANCELLED.
     *
     * @return {@code false} if the task was not active
     */
    public boolean cancelTask(String taskId) {
        return finish(taskId, TaskStatus.CANCELLED);
    }

    public ResourceLimits getLimits() {
        return limits.get();
    }

    public ResourceLimits getConfiguredLimits() {
        return configuredLimits;
    }

    public void updateLimits(ResourceLimits newLimits) {
        ResourceLimits previous = limits.getAndSet(newLimits);
        logger.info("Resource limits updated: {} -> {}", previous, newLimits);
    }

    public ResourceLimits optimizeForLowMemory() {
        ResourceLimits preset = configuredLimits.lowMemory();
        updateLimits(preset);
        return preset;
    }

    public ResourceLimits optimizeForPerformance() {
        ResourceLimits preset = configuredLimits.performance(sampler.systemMemoryTotalBytes(), sampler.availableProcessors());
        updateLimits(preset);
        return preset;
    }

    public ResourceLimits optimizeBalanced() {
        updateLimits(configuredLimits);
        return configuredLimits;
    }

    public ResourceLimits optimize(OptimizationProfile profile) {
        return switch (profile) {
            case LOW_MEMORY -> optimizeForLowMemory();
            case PERFORMANCE -> optimizeForPerformance();
            case BALANCED -> optimizeBalanced();
        };
    }

    /**
     * Latest host sample combined with the live task accounting.
     */
    public SystemSnapshot getSystemSnapshot() {
        SystemSnapshot sample = lastSample;
        if (sample == null) {
            sample = refreshSnapshot();
        }
        metricsLock.lock();
        try {
            return new SystemSnapshot(sample.cpuUsagePercent(), sample.memoryUsedBytes(), sample.memoryTotalBytes(),
                    sample.diskUsedBytes(), sample.diskTotalBytes(), activeTasks.size(), completedTasks.size(),
                    averageTaskDuration, Duration.between(startedAt, Instant.now()), sample.sampledAt());
        } finally {
            metricsLock.unlock();
        }
    }

    public String getRecommendation() {
        return recommend(getSystemSnapshot(), limits.get());
    }

    public HealthStatus getHealthStatus() {
        return evaluateHealth(getSystemSnapshot());
    }

    public List<TaskMetrics> getActiveTaskMetrics() {
        metricsLock.lock();
        try {
            return new ArrayList<>(activeTasks.values());
        } finally {
            metricsLock.unlock();
        }
    }

    public List<TaskMetrics> getCompletedTaskMetrics() {
        metricsLock.lock();
        try {
            return new ArrayList<>(completedTasks);
        } finally {
            metricsLock.unlock();
        }
    }

    public int getActiveTaskCount() {
        metricsLock.lock();
        try {
            return activeTasks.size();
        } finally {
            metricsLock.unlock();
        }
    }

    /**
     * Drops the oldest finished metrics so that at most {@code retain} remain.
     *
     * @return number of entries removed
     */
    public int cleanupOldMetrics(int retain) {
        metricsLock.lock();
        try {
            int removed = 0;
            while (completedTasks.size() > Math.max(0, retain)) {
                completedTasks.poll();
                removed++;
            }
            recomputeAverage();
            if (removed > 0) {
                logger.info("Removed {} old task metrics, {} retained", removed, completedTasks.size());
            }
            return removed;
        } finally {
            metricsLock.unlock();
        }
    }

    /**
     * Serializes the snapshot, active and finished metrics and current limits as indented JSON.
     */
    public String exportMetrics() throws JsonProcessingException {
        Map<String, Object> export = new LinkedHashMap<>();
        export.put("systemMetrics", getSystemSnapshot());
        export.put("activeTasks", getActiveTaskMetrics());
        export.put("completedTasks", getCompletedTaskMetrics());
        export.put("resourceLimits", limits.get());
        export.put("timestamp", Instant.now());
        return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(export);
    }

    /**
     * Text advice derived from a snapshot. CPU is checked first, then memory, then concurrency.
     */
    public static String recommend(SystemSnapshot snapshot, ResourceLimits limits) {
        if (snapshot.cpuUsagePercent() > limits.maxCpuPercent()) {
            return HIGH_CPU_RECOMMENDATION;
        }
        if (snapshot.memoryUsageRatio() > HIGH_MEMORY_RATIO) {
            return HIGH_MEMORY_RECOMMENDATION;
        }
        if (snapshot.activeTasks() > limits.maxConcurrentTasks() - 1) {
            return NEAR_LIMIT_RECOMMENDATION;
        }
        return NORMAL_RECOMMENDATION;
    }

    public static HealthStatus evaluateHealth(SystemSnapshot snapshot) {
        double cpu = snapshot.cpuUsagePercent();
        double memoryRatio = snapshot.memoryUsageRatio();
        if (cpu > 90.0 || memoryRatio > 0.9) {
            return HealthStatus.CRITICAL;
        }
        if (cpu > 70.0 || memoryRatio > 0.75) {
            return HealthStatus.WARNING;
        }
        return HealthStatus.HEALTHY;
    }

    /**
     * Takes a host sample immediately.
     */
    @VisibleForTesting
    public SystemSnapshot refreshSnapshot() {
        double cpu = sampler.cpuUsagePercent();
        long memoryUsed = sampler.systemMemoryUsedBytes();
        long memoryTotal = sampler.systemMemoryTotalBytes();
        long diskUsed = sampler.diskUsedBytes();
        long diskTotal = sampler.diskTotalBytes();
        Instant now = Instant.now();

        SystemSnapshot sample;
        metricsLock.lock();
        try {
            sample = new SystemSnapshot(cpu, memoryUsed, memoryTotal, diskUsed, diskTotal, activeTasks.size(),
                    completedTasks.size(), averageTaskDuration, Duration.between(startedAt, now), now);
        } finally {
            metricsLock.unlock();
        }
        lastSample = sample;
        return sample;
    }

    private void sampleSafely() {
        try {
            SystemSnapshot sample = refreshSnapshot();
            logger.debug("Sampled resources - CPU: {}%, Memory: {}/{} MB, Active tasks: {}",
                    String.format("%.1f", sample.cpuUsagePercent()),
                    sample.memoryUsedBytes() / (1024 * 1024), sample.memoryTotalBytes() / (1024 * 1024),
                    sample.activeTasks());
        } catch (Exception e) {
            logger.warn("Resource sampling failed: {}", e.getMessage());
        }
    }

    private boolean finish(String taskId, TaskStatus status) {
        metricsLock.lock();
        try {
            TaskMetrics metrics = activeTasks.remove(taskId);
            if (metrics == null) {
                logger.debug("Task {} was not tracked as active by the resource monitor", taskId);
                return false;
            }
            completedTasks.add(metrics.finish(status));
            recomputeAverage();
            return true;
        } finally {
            metricsLock.unlock();
        }
    }

    private void recomputeAverage() {
        averageTaskDuration = completedTasks.stream()
                .filter(metrics -> metrics.durationMs() != null)
                .mapToLong(TaskMetrics::durationMs)
                .average()
                .orElse(0.0);
    }
}

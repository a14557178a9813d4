package org.background.task.engine.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Data;
import org.background.task.engine.core.model.AdmissionRejectionPolicy;
import org.background.task.engine.core.monitor.ResourceLimits;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the background task engine.
 * <p>
 * Bound to properties with the prefix {@code task.engine}. Controls the worker pool, the
 * admission loop, the resource monitor and shutdown behaviour.
 * </p>
 *
 * <p>Example configuration in {@code application.yml}:</p>
 * <pre>{@code
 * task:
 *   engine:
 *     max-workers: 4
 *     max-queue-size: 10000
 *     scheduler-tick-millis: 1000
 *     rejection-policy: DEFER
 *     limits:
 *       max-memory-mb: 2048
 *       max-concurrent-tasks: 4
 *       task-timeout-seconds: 1800
 * }</pre>
 */
@Data
@Validated
@Component
@ConfigurationProperties(prefix = "task.engine")
public class TaskEngineConfig {

    /**
     * Size of the worker pool and ceiling on concurrently running tasks.
     * <p>Default: {@code 4}</p>
     */
    @Min(1)
    @Max(64)
    private int maxWorkers = 4;

    /**
     * Maximum number of tasks waiting for admission.
     * <p>Default: {@code 10000}</p>
     */
    @Positive
    private int maxQueueSize = 10000;

    /**
     * Delay between two admission attempts, in milliseconds.
     * <p>Default: {@code 1000}</p>
     */
    @Positive
    private long schedulerTickMillis = 1000;

    /**
     * Time to wait for worker threads to finish before forcing shutdown.
     * <p>Default: {@code 10}</p>
     */
    @Positive
    private int shutdownTimeoutSeconds = 10;

    /**
     * Whether queued tasks are cancelled when the engine shuts down.
     * <p>Default: {@code true}</p>
     */
    private boolean drainQueueOnShutdown = true;

    /**
     * What happens to a task the resource monitor refuses to admit.
     * <p>Default: {@code DEFER}</p>
     */
    @NotNull
    private AdmissionRejectionPolicy rejectionPolicy = AdmissionRejectionPolicy.DEFER;

    /**
     * Interval between two host resource samples, in seconds.
     * <p>Default: {@code 5}</p>
     */
    @Positive
    private int monitorIntervalSeconds = 5;

    /**
     * Number of finished task metrics the resource monitor retains.
     * <p>Default: {@code 1000}</p>
     */
    @Positive
    private int completedHistoryCap = 1000;

    /**
     * Multiplier applied to every built-in processor's sub-step delay. {@code 0} runs steps
     * back to back.
     * <p>Default: {@code 1.0}</p>
     */
    @PositiveOrZero
    private double stepDelayScale = 1.0;

    /** Admission ceilings handed to the resource monitor on startup. */
    @Valid
    private Limits limits = new Limits();

    @Data
    public static class Limits {

        @Positive
        private long maxMemoryMb = ResourceLimits.DEFAULT_MAX_MEMORY_MB;

        @DecimalMin("1.0")
        @DecimalMax("100.0")
        private double maxCpuPercent = ResourceLimits.DEFAULT_MAX_CPU_PERCENT;

        @Positive
        private int maxConcurrentTasks = ResourceLimits.DEFAULT_MAX_CONCURRENT_TASKS;

        @Positive
        private long taskTimeoutSeconds = ResourceLimits.DEFAULT_TASK_TIMEOUT_SECONDS;

        public ResourceLimits toResourceLimits() {
            return new ResourceLimits(maxMemoryMb, maxCpuPercent, maxConcurrentTasks, taskTimeoutSeconds);
        }
    }
}

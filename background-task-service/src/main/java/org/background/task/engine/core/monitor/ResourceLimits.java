package org.background.task.engine.core.monitor;

/**
 * Ceilings enforced on task admission. Replaced wholesale, never mutated.
 *
 * @param maxMemoryMb        memory ceiling in megabytes
 * @param maxCpuPercent      CPU level above which the monitor recommends backing off
 * @param maxConcurrentTasks number of tasks the monitor admits at once
 * @param taskTimeoutSeconds wall-clock budget of a running task
 */
public record ResourceLimits(long maxMemoryMb, double maxCpuPercent, int maxConcurrentTasks, long taskTimeoutSeconds) {

    public static final long DEFAULT_MAX_MEMORY_MB = 2048;
    public static final double DEFAULT_MAX_CPU_PERCENT = 80.0;
    public static final int DEFAULT_MAX_CONCURRENT_TASKS = 4;
    public static final long DEFAULT_TASK_TIMEOUT_SECONDS = 1800;

    public ResourceLimits {
        if (maxMemoryMb <= 0) {
            throw new IllegalArgumentException("maxMemoryMb must be positive");
        }
        if (maxConcurrentTasks <= 0) {
            throw new IllegalArgumentException("maxConcurrentTasks must be positive");
        }
        if (taskTimeoutSeconds <= 0) {
            throw new IllegalArgumentException("taskTimeoutSeconds must be positive");
        }
    }

    public static ResourceLimits defaults() {
        return new ResourceLimits(DEFAULT_MAX_MEMORY_MB, DEFAULT_MAX_CPU_PERCENT,
                DEFAULT_MAX_CONCURRENT_TASKS, DEFAULT_TASK_TIMEOUT_SECONDS);
    }

    /** 1024 MB and two concurrent tasks; CPU and timeout are carried over. */
    public ResourceLimits lowMemory() {
        return new ResourceLimits(1024, maxCpuPercent, 2, taskTimeoutSeconds);
    }

    /**
     * Half a gigabyte per gigabyte of installed memory (at least 2048 MB) and one task per core.
     */
    public ResourceLimits performance(long totalMemoryBytes, int cores) {
        long totalGb = totalMemoryBytes / (1024L * 1024L * 1024L);
        long memoryMb = Math.max(totalGb * 512, 2048);
        return new ResourceLimits(memoryMb, maxCpuPercent, Math.max(1, cores), taskTimeoutSeconds);
    }

    public long maxMemoryBytes() {
        return maxMemoryMb * 1024L * 1024L;
    }
}

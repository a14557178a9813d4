package org.background.task.engine.core.registry;

import org.background.task.engine.core.model.BackgroundTask;
import org.background.task.engine.core.model.TaskStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Consumer;

/**
 * Authoritative map of task id to task state.
 *
 * <p>Reads share the read lock and always hand out copies; every mutation runs under the write
 * lock. Status changes go through {@link #transition} so that the lifecycle only ever moves
 * forward and nothing leaves a terminal state.
 */
public class TaskRegistry {

    private static final Logger logger = LoggerFactory.getLogger(TaskRegistry.class);

    private final Map<String, BackgroundTask> tasks = new HashMap<>();
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    /**
     * Adds a new task.
     *
     * @throws IllegalStateException if a task with the same id is already registered
     */
    public void register(BackgroundTask task) {
        lock.writeLock().lock();
        try {
            if (tasks.containsKey(task.getId())) {
                throw new IllegalStateException("Task already registered: " + task.getId());
            }
            tasks.put(task.getId(), task.copy());
        } finally {
            lock.writeLock().unlock();
        }
    }

    public Optional<BackgroundTask> get(String taskId) {
        lock.readLock().lock();
        try {
            BackgroundTask task = tasks.get(taskId);
            return task != null ? Optional.of(task.copy()) : Optional.empty();
        } finally {
            lock.readLock().unlock();
        }
    }

    public Optional<TaskStatus> statusOf(String taskId) {
        lock.readLock().lock();
        try {
            BackgroundTask task = tasks.get(taskId);
            return task != null ? Optional.of(task.getStatus()) : Optional.empty();
        } finally {
            lock.readLock().unlock();
        }
    }

    public boolean contains(String taskId) {
        lock.readLock().lock();
        try {
            return tasks.containsKey(taskId);
        } finally {
            lock.readLock().unlock();
        }
    }

    /** All tasks, oldest first. */
    public List<BackgroundTask> findAll() {
        lock.readLock().lock();
        try {
            return snapshot(null);
        } finally {
            lock.readLock().unlock();
        }
    }

    public List<BackgroundTask> findByStatus(TaskStatus status) {
        lock.readLock().lock();
        try {
            return snapshot(status);
        } finally {
            lock.readLock().unlock();
        }
    }

    public Map<TaskStatus, Integer> statusBreakdown() {
        lock.readLock().lock();
        try {
            Map<TaskStatus, Integer> breakdown = new EnumMap<>(TaskStatus.class);
            for (TaskStatus status : TaskStatus.values()) {
                breakdown.put(status, 0);
            }
            tasks.values().forEach(task -> breakdown.merge(task.getStatus(), 1, Integer::sum));
            return breakdown;
        } finally {
            lock.readLock().unlock();
        }
    }

    public int size() {
        lock.readLock().lock();
        try {
            return tasks.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Applies a mutation to a task that has not reached a terminal state. The mutation must not
     * change the status; use {@link #transition} for that.
     *
     * @return {@code false} if the task is unknown or already terminal
     */
    public boolean updateIfNotTerminal(String taskId, Consumer<BackgroundTask> mutation) {
        lock.writeLock().lock();
        try {
            BackgroundTask task = tasks.get(taskId);
            if (task == null || task.isTerminal()) {
                return false;
            }
            TaskStatus before = task.getStatus();
            mutation.accept(task);
            task.setStatus(before);
            return true;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Moves a task to {@code target} if the lifecycle allows it, then applies {@code mutation}.
     * Entering a terminal state stamps {@code completedAt}; entering RUNNING stamps
     * {@code startedAt}.
     *
     * @return {@code true} if the transition happened
     */
    public boolean transition(String taskId, TaskStatus target, Consumer<BackgroundTask> mutation) {
        lock.writeLock().lock();
        try {
            BackgroundTask task = tasks.get(taskId);
            if (task == null) {
                logger.debug("Ignoring transition to {} for unknown task {}", target, taskId);
                return false;
            }
            if (!task.getStatus().canTransitionTo(target)) {
                logger.debug("Ignoring transition {} -> {} for task {}", task.getStatus(), target, taskId);
                return false;
            }
            task.setStatus(target);
            Instant now = Instant.now();
            if (target == TaskStatus.RUNNING) {
                task.setStartedAt(now);
            } else if (target.isTerminal()) {
                task.setCompletedAt(now);
            }
            if (mutation != null) {
                mutation.accept(task);
                task.setStatus(target);
            }
            return true;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Removes terminal tasks that completed before the given instant.
     *
     * @return number of tasks removed
     */
    public int removeFinishedBefore(Instant cutoff) {
        lock.writeLock().lock();
        try {
            int removed = 0;
            Iterator<BackgroundTask> iterator = tasks.values().iterator();
            while (iterator.hasNext()) {
                BackgroundTask task = iterator.next();
                if (task.isTerminal() && task.getCompletedAt() != null && task.getCompletedAt().isBefore(cutoff)) {
                    iterator.remove();
                    removed++;
                }
            }
            return removed;
        } finally {
            lock.writeLock().unlock();
        }
    }

    private List<BackgroundTask> snapshot(TaskStatus status) {
        List<BackgroundTask> result = new ArrayList<>();
        for (BackgroundTask task : tasks.values()) {
            if (status == null || task.getStatus() == status) {
                result.add(task.copy());
            }
        }
        result.sort(Comparator.comparing(BackgroundTask::getCreatedAt));
        return result;
    }
}

package org.background.task.engine.core.queue;

import org.background.task.engine.core.model.TaskKind;
import org.background.task.engine.core.model.TaskPriority;
import org.background.task.engine.core.processor.CancellationToken;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.PriorityQueue;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Tasks waiting for admission, ordered by priority with arrival order as tie-break.
 *
 * <p>All operations take the queue lock. {@link #withLock(Supplier)} lets the admission loop
 * inspect and pop the head and update the registry as one critical section; the lock is
 * reentrant, so the other methods may be called inside it.
 */
public class TaskPriorityQueue {

    private final PriorityQueue<QueuedTask> heap = new PriorityQueue<>(QueuedTask.ADMISSION_ORDER);
    private final AtomicLong sequence = new AtomicLong();
    private final ReentrantLock lock = new ReentrantLock();

    public QueuedTask enqueue(String taskId, TaskKind kind, TaskPriority priority, CancellationToken token) {
        QueuedTask entry = new QueuedTask(taskId, kind, priority, sequence.getAndIncrement(), Instant.now(), token);
        lock.lock();
        try {
            heap.add(entry);
            return entry;
        } finally {
            lock.unlock();
        }
    }

    public Optional<QueuedTask> peek() {
        lock.lock();
        try {
            return Optional.ofNullable(heap.peek());
        } finally {
            lock.unlock();
        }
    }

    public Optional<QueuedTask> poll() {
        lock.lock();
        try {
            return Optional.ofNullable(heap.poll());
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return {@code true} if the task was queued and has been removed
     */
    public boolean remove(String taskId) {
        lock.lock();
        try {
            return heap.removeIf(entry -> entry.taskId().equals(taskId));
        } finally {
            lock.unlock();
        }
    }

    public boolean contains(String taskId) {
        lock.lock();
        try {
            return heap.stream().anyMatch(entry -> entry.taskId().equals(taskId));
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return heap.size();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Position the task would be admitted at, counting from 1.
     *
     * @return the position, or -1 if the task is not queued
     */
    public int positionOf(String taskId) {
        lock.lock();
        try {
            List<QueuedTask> ordered = new ArrayList<>(heap);
            ordered.sort(QueuedTask.ADMISSION_ORDER);
            for (int i = 0; i < ordered.size(); i++) {
                if (ordered.get(i).taskId().equals(taskId)) {
                    return i + 1;
                }
            }
            return -1;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Removes every entry, returned in admission order.
     */
    public List<QueuedTask> drain() {
        lock.lock();
        try {
            List<QueuedTask> drained = new ArrayList<>(heap.size());
            while (!heap.isEmpty()) {
                drained.add(heap.poll());
            }
            return drained;
        } finally {
            lock.unlock();
        }
    }

    public <T> T withLock(Supplier<T> action) {
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }
}

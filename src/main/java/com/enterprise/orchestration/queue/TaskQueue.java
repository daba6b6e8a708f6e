package com.enterprise.orchestration.queue;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Comparator;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.PriorityQueue;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.BooleanSupplier;

/**
 * Priority queue of task ids (lower number = more urgent, FIFO within a priority).
 * Tasks popped before their dependencies are resolved are parked outside the
 * ordering and put back by {@link #unpark(String)}.
 */
public class TaskQueue {

    private static final Logger logger = LoggerFactory.getLogger(TaskQueue.class);

    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final AtomicLong sequence = new AtomicLong(0);
    private final PriorityQueue<QueueEntry> priorityQueue = new PriorityQueue<>(
        Comparator.comparingInt(QueueEntry::getPriority).thenComparingLong(QueueEntry::getSequence)
    );
    private final Map<String, QueueEntry> parked = new HashMap<>();

    /**
     * Add a task to the queue
     */
    public void enqueue(String taskId, int priority) {
        lock.writeLock().lock();
        try {
            priorityQueue.offer(new QueueEntry(taskId, priority, sequence.getAndIncrement()));
            logger.debug("Task {} enqueued with priority {}", taskId, priority);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Remove and return the most urgent entry
     */
    public Optional<QueueEntry> poll() {
        lock.writeLock().lock();
        try {
            return Optional.ofNullable(priorityQueue.poll());
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Put a previously polled entry back at its original position
     */
    public void requeue(QueueEntry entry) {
        lock.writeLock().lock();
        try {
            priorityQueue.offer(entry);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Park the entry unless the task became ready. The readiness check and the
     * park are atomic with respect to {@link #unpark(String)}.
     *
     * @return true if the entry was parked
     */
    public boolean parkIfNotReady(QueueEntry entry, BooleanSupplier ready) {
        lock.writeLock().lock();
        try {
            if (ready.getAsBoolean()) {
                return false;
            }
            parked.put(entry.getTaskId(), entry);
            logger.debug("Task {} parked until its dependencies resolve", entry.getTaskId());
            return true;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Return a parked task to the ready ordering
     *
     * @return true if the task was parked
     */
    public boolean unpark(String taskId) {
        lock.writeLock().lock();
        try {
            QueueEntry entry = parked.remove(taskId);
            if (entry == null) {
                return false;
            }
            priorityQueue.offer(entry);
            logger.debug("Task {} unparked", taskId);
            return true;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Number of entries in the ready ordering
     */
    public int size() {
        lock.readLock().lock();
        try {
            return priorityQueue.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    public int parkedCount() {
        lock.readLock().lock();
        try {
            return parked.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    public boolean isParked(String taskId) {
        lock.readLock().lock();
        try {
            return parked.containsKey(taskId);
        } finally {
            lock.readLock().unlock();
        }
    }

    public boolean isEmpty() {
        return size() == 0;
    }

    /**
     * A queued task id with its ordering keys
     */
    public static class QueueEntry {
        private final String taskId;
        private final int priority;
        private final long sequence;

        QueueEntry(String taskId, int priority, long sequence) {
            this.taskId = taskId;
            this.priority = priority;
            this.sequence = sequence;
        }

        public String getTaskId() { return taskId; }
        public int getPriority() { return priority; }
        public long getSequence() { return sequence; }

        @Override
        public String toString() {
            return "QueueEntry{" + taskId + ", priority=" + priority + '}';
        }
    }
}

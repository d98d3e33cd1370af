package agenthub.orchestrator.scheduler;

import agenthub.orchestrator.error.QueueFullException;
import agenthub.orchestrator.model.Task;

import java.util.Comparator;
import java.util.HashMap;
import java.util.Map;
import java.util.PriorityQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Bounded priority queue of task ids ready to run.
 * Ordered by priority (highest first), then by enqueue order.
 * <p>
 * {@link #take()} blocks on a condition while the queue is empty; it never spins.
 */
public class ReadyQueue {

    record Entry(String taskId, int priority, long sequence) {
    }

    private static final Comparator<Entry> ORDER = Comparator
            .comparingInt(Entry::priority).reversed()
            .thenComparingLong(Entry::sequence);

    private final int capacity;
    private final PriorityQueue<Entry> queue = new PriorityQueue<>(ORDER);
    private final Map<String, Entry> byTaskId = new HashMap<>();
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition notEmpty = lock.newCondition();
    private long nextSequence;

    public ReadyQueue(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive");
        }
        this.capacity = capacity;
    }

    /**
     * Enqueue a task. A task already in the queue is not added twice.
     *
     * @return true if the task was added, false if it was already queued
     * @throws QueueFullException if the queue is at capacity
     */
    public boolean offer(Task task) {
        return offer(task.id(), task.priority());
    }

    public boolean offer(String taskId, int priority) {
        lock.lock();
        try {
            if (byTaskId.containsKey(taskId)) {
                return false;
            }
            if (queue.size() >= capacity) {
                throw new QueueFullException(capacity);
            }
            Entry entry = new Entry(taskId, priority, nextSequence++);
            queue.add(entry);
            byTaskId.put(taskId, entry);
            notEmpty.signal();
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Remove and return the highest-priority task id, waiting until one is available.
     */
    public String take() throws InterruptedException {
        lock.lockInterruptibly();
        try {
            while (queue.isEmpty()) {
                notEmpty.await();
            }
            return pollLocked();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Remove and return the highest-priority task id, waiting up to the timeout.
     *
     * @return the task id, or null if the timeout elapsed
     */
    public String poll(long timeout, TimeUnit unit) throws InterruptedException {
        long nanos = unit.toNanos(timeout);
        lock.lockInterruptibly();
        try {
            while (queue.isEmpty()) {
                if (nanos <= 0) {
                    return null;
                }
                nanos = notEmpty.awaitNanos(nanos);
            }
            return pollLocked();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Remove a specific task (pending cancellation).
     *
     * @return true if the task was queued
     */
    public boolean remove(String taskId) {
        lock.lock();
        try {
            Entry entry = byTaskId.remove(taskId);
            return entry != null && queue.remove(entry);
        } finally {
            lock.unlock();
        }
    }

    public boolean contains(String taskId) {
        lock.lock();
        try {
            return byTaskId.containsKey(taskId);
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return queue.size();
        } finally {
            lock.unlock();
        }
    }

    public int remainingCapacity() {
        lock.lock();
        try {
            return capacity - queue.size();
        } finally {
            lock.unlock();
        }
    }

    public int capacity() {
        return capacity;
    }

    private String pollLocked() {
        Entry entry = queue.poll();
        byTaskId.remove(entry.taskId());
        return entry.taskId();
    }
}

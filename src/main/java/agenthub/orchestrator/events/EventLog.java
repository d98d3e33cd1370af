package agenthub.orchestrator.events;

import agenthub.orchestrator.model.EventKind;
import agenthub.orchestrator.model.TaskEvent;
import com.fasterxml.jackson.databind.JsonNode;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Append-only event log of one task.
 * Sequence numbers are assigned under the lock, start at 1 and have no gaps.
 * Once a COMPLETE event is appended the log is sealed and further appends are dropped.
 */
public class EventLog {

    private final String taskId;
    private final List<TaskEvent> events = new ArrayList<>();
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition completed = lock.newCondition();
    private final CompletableFuture<Void> sealedFuture = new CompletableFuture<>();
    private boolean sealed;

    EventLog(String taskId) {
        this.taskId = taskId;
    }

    /**
     * @return the appended event, or null if the log is already sealed
     */
    TaskEvent append(EventKind kind, Integer percent, String message, JsonNode data) {
        TaskEvent event;
        lock.lock();
        try {
            if (sealed) {
                return null;
            }
            event = new TaskEvent(taskId, events.size() + 1L, Instant.now(), kind, percent, message, data);
            events.add(event);
            if (kind == EventKind.COMPLETE) {
                sealed = true;
                completed.signalAll();
            }
        } finally {
            lock.unlock();
        }
        // completed outside the lock: dependent stages may run on this thread
        if (kind == EventKind.COMPLETE) {
            sealedFuture.complete(null);
        }
        return event;
    }

    /** Oldest first, at most {@code limit} events */
    List<TaskEvent> snapshot(int limit) {
        lock.lock();
        try {
            return List.copyOf(events.subList(0, Math.min(limit, events.size())));
        } finally {
            lock.unlock();
        }
    }

    /** Events with a sequence greater than {@code afterSequence} */
    List<TaskEvent> since(long afterSequence) {
        lock.lock();
        try {
            int from = (int) Math.min(Math.max(afterSequence, 0), events.size());
            return List.copyOf(events.subList(from, events.size()));
        } finally {
            lock.unlock();
        }
    }

    boolean isSealed() {
        lock.lock();
        try {
            return sealed;
        } finally {
            lock.unlock();
        }
    }

    int size() {
        lock.lock();
        try {
            return events.size();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Wait until a COMPLETE event is appended.
     *
     * @return true if the log is sealed, false on timeout
     */
    boolean awaitSealed(Duration timeout) throws InterruptedException {
        long nanos = timeout.toNanos();
        lock.lockInterruptibly();
        try {
            while (!sealed) {
                if (nanos <= 0) {
                    return false;
                }
                nanos = completed.awaitNanos(nanos);
            }
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Completes when a COMPLETE event is appended or the log is purged. Each caller
     * gets its own copy, so completing or timing out the returned future has no
     * effect on other waiters.
     */
    CompletableFuture<Void> onSealed() {
        return sealedFuture.copy();
    }

    /** Wake every waiter without sealing (log purged) */
    void wakeAll() {
        lock.lock();
        try {
            completed.signalAll();
        } finally {
            lock.unlock();
        }
        sealedFuture.complete(null);
    }
}

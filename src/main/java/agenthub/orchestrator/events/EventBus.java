package agenthub.orchestrator.events;

import agenthub.orchestrator.model.EventKind;
import agenthub.orchestrator.model.TaskEvent;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory registry of per-task event logs.
 * Appends for different tasks never contend; appends for one task are ordered by its log's lock.
 */
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    private final Map<String, EventLog> logs = new ConcurrentHashMap<>();

    /**
     * Append an event to the task's log.
     *
     * @return the stored event, or null if the task already has a COMPLETE event
     */
    public TaskEvent append(String taskId, EventKind kind, Integer percent, String message, JsonNode data) {
        TaskEvent event = logFor(taskId).append(kind, percent, message, data);
        if (event == null) {
            log.debug("Dropped {} event for task {}: log already complete", kind.wireName(), taskId);
        }
        return event;
    }

    public TaskEvent progress(String taskId, int percent, String message, JsonNode data) {
        return append(taskId, EventKind.PROGRESS, percent, message, data);
    }

    public TaskEvent error(String taskId, String message, JsonNode data) {
        return append(taskId, EventKind.ERROR, null, message, data);
    }

    public TaskEvent complete(String taskId, String message, JsonNode data) {
        return append(taskId, EventKind.COMPLETE, null, message, data);
    }

    /**
     * Ordered snapshot of a task's events, oldest first.
     */
    public List<TaskEvent> snapshot(String taskId, int limit) {
        EventLog eventLog = logs.get(taskId);
        return eventLog == null ? List.of() : eventLog.snapshot(limit);
    }

    /**
     * Events appended after the given sequence number.
     */
    public List<TaskEvent> since(String taskId, long afterSequence) {
        EventLog eventLog = logs.get(taskId);
        return eventLog == null ? List.of() : eventLog.since(afterSequence);
    }

    public boolean hasLog(String taskId) {
        EventLog eventLog = logs.get(taskId);
        return eventLog != null && eventLog.size() > 0;
    }

    public boolean isComplete(String taskId) {
        EventLog eventLog = logs.get(taskId);
        return eventLog != null && eventLog.isSealed();
    }

    /**
     * Block until the task's COMPLETE event is appended or the timeout elapses.
     *
     * @return true if the task completed in time
     */
    public boolean awaitCompletion(String taskId, Duration timeout) throws InterruptedException {
        return logFor(taskId).awaitSealed(timeout);
    }

    /**
     * Future completed once the task's COMPLETE event is appended, without blocking
     * the caller. Also completes if the log is purged.
     */
    public CompletableFuture<Void> onCompletion(String taskId) {
        return logFor(taskId).onSealed();
    }

    /**
     * Drop a task's log (task deleted).
     */
    public void purge(String taskId) {
        EventLog removed = logs.remove(taskId);
        if (removed != null) {
            removed.wakeAll();
        }
    }

    public int taskCount() {
        return logs.size();
    }

    private EventLog logFor(String taskId) {
        return logs.computeIfAbsent(taskId, EventLog::new);
    }
}

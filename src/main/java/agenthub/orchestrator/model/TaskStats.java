package agenthub.orchestrator.model;

import java.util.Map;

/**
 * Task counts by status, computed from the store.
 */
public record TaskStats(
        int pending,
        int running,
        int retrying,
        int completed,
        int failed,
        int cancelled) {

    public static TaskStats from(Map<TaskStatus, Integer> counts) {
        return new TaskStats(
                counts.getOrDefault(TaskStatus.PENDING, 0),
                counts.getOrDefault(TaskStatus.RUNNING, 0),
                counts.getOrDefault(TaskStatus.RETRYING, 0),
                counts.getOrDefault(TaskStatus.COMPLETED, 0),
                counts.getOrDefault(TaskStatus.FAILED, 0),
                counts.getOrDefault(TaskStatus.CANCELLED, 0));
    }

    public int total() {
        return pending + running + retrying + completed + failed + cancelled;
    }
}

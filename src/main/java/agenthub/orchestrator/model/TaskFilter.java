package agenthub.orchestrator.model;

/**
 * Filters for listing tasks. Null fields match everything.
 *
 * @param activeOnly only non-terminal tasks, ordered by priority desc then created_at asc
 */
public record TaskFilter(String agentType, TaskStatus status, String userId, boolean activeOnly) {

    public static TaskFilter all() {
        return new TaskFilter(null, null, null, false);
    }

    public static TaskFilter active() {
        return new TaskFilter(null, null, null, true);
    }
}

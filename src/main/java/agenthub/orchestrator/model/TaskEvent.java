package agenthub.orchestrator.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;

/**
 * Append-only event owned by a task. Sequence numbers start at 1 and have no gaps.
 */
public record TaskEvent(
        String taskId,
        long sequence,
        Instant timestamp,
        EventKind kind,
        Integer percent,
        String message,
        JsonNode data) {
}

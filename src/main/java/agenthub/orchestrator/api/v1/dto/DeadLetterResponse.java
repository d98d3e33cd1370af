package agenthub.orchestrator.api.v1.dto;

import agenthub.orchestrator.core.Json;
import agenthub.orchestrator.model.DeadLetterEntry;
import agenthub.orchestrator.model.TaskCost;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.util.List;

/**
 * Response DTO for a dead letter entry.
 * GET /api/v1/dead-letter/{taskId}
 */
public record DeadLetterResponse(
        @JsonProperty("task_id") String taskId,
        @JsonProperty("agent_type") String agentType,
        @JsonProperty("payload") JsonNode payload,
        @JsonProperty("priority") int priority,
        @JsonProperty("attempts") TaskResponse.Attempts attempts,
        @JsonProperty("error") TaskResponse.Error error,
        @JsonProperty("user_id") String userId,
        @JsonProperty("webhook_url") String webhookUrl,
        @JsonProperty("cost") TaskResponse.Cost cost,
        @JsonProperty("requeue_count") int requeueCount,
        @JsonProperty("created_at") Instant createdAt,
        @JsonProperty("failed_at") Instant failedAt,
        @JsonProperty("moved_at") Instant movedAt,
        @JsonProperty("links") Links links) {

    public static final String BASE_PATH = "/api/v1/dead-letter/";

    public record Links(
            @JsonProperty("self") String self,
            @JsonProperty("requeue") String requeue,
            @JsonProperty("task") String task) {
    }

    public static DeadLetterResponse from(DeadLetterEntry entry) {
        TaskCost cost = entry.cost() != null ? entry.cost() : TaskCost.ZERO;
        String self = BASE_PATH + entry.taskId();
        return new DeadLetterResponse(
                entry.taskId(),
                entry.agentType(),
                Json.parse(entry.payload()),
                entry.priority(),
                new TaskResponse.Attempts(entry.attempts(), entry.maxAttempts()),
                TaskResponse.Error.from(entry.error()),
                entry.userId(),
                entry.webhookUrl(),
                TaskResponse.Cost.from(cost),
                entry.requeueCount(),
                entry.createdAt(),
                entry.failedAt(),
                entry.movedAt(),
                new Links(self, self + "/requeue", TaskResponse.BASE_PATH + entry.taskId()));
    }

    /**
     * GET /api/v1/dead-letter
     */
    public record Page(
            @JsonProperty("entries") List<DeadLetterResponse> entries,
            @JsonProperty("count") int count,
            @JsonProperty("total") int total) {

        public static Page from(List<DeadLetterEntry> entries, int total) {
            return new Page(entries.stream().map(DeadLetterResponse::from).toList(), entries.size(), total);
        }
    }
}

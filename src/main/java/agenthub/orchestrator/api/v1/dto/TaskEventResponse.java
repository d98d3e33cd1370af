package agenthub.orchestrator.api.v1.dto;

import agenthub.orchestrator.model.TaskEvent;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.util.List;

/**
 * One entry of a task's event trail.
 */
public record TaskEventResponse(
        @JsonProperty("sequence") long sequence,
        @JsonProperty("event") String event,
        @JsonProperty("timestamp") Instant timestamp,
        @JsonProperty("percent") Integer percent,
        @JsonProperty("message") String message,
        @JsonProperty("data") JsonNode data) {

    public static TaskEventResponse from(TaskEvent event) {
        return new TaskEventResponse(
                event.sequence(),
                event.kind().wireName(),
                event.timestamp(),
                event.percent(),
                event.message(),
                event.data());
    }

    /**
     * GET /api/v1/tasks/{taskId}/events
     */
    public record Page(
            @JsonProperty("task_id") String taskId,
            @JsonProperty("events") List<TaskEventResponse> events,
            @JsonProperty("count") int count) {

        public static Page from(String taskId, List<TaskEvent> events) {
            return new Page(taskId, events.stream().map(TaskEventResponse::from).toList(), events.size());
        }
    }
}

package agenthub.orchestrator.api.v1.dto;

import agenthub.orchestrator.model.TaskPage;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Response DTO for a page of tasks.
 * GET /api/v1/tasks
 */
public record TaskListResponse(
        @JsonProperty("tasks") List<TaskResponse> tasks,
        @JsonProperty("total") int total,
        @JsonProperty("limit") int limit,
        @JsonProperty("offset") int offset) {

    public static TaskListResponse from(TaskPage page, int limit, int offset) {
        return new TaskListResponse(
                page.tasks().stream().map(TaskResponse::from).toList(),
                page.total(),
                limit,
                offset);
    }
}

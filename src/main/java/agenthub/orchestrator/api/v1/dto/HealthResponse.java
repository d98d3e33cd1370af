package agenthub.orchestrator.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Response DTO for health check.
 * GET /api/v1/health
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record HealthResponse(
        @JsonProperty("status") String status,
        @JsonProperty("database") String database,
        @JsonProperty("uptime") String uptime,
        @JsonProperty("version") String version,
        @JsonProperty("pending_tasks") Integer pendingTasks,
        @JsonProperty("running_tasks") Integer runningTasks) {
    public static HealthResponse healthy(String uptime, String version, int pendingTasks, int runningTasks) {
        return new HealthResponse("healthy", "ok", uptime, version, pendingTasks, runningTasks);
    }

    public static HealthResponse unhealthy(String database) {
        return new HealthResponse("unhealthy", database, null, null, null, null);
    }
}

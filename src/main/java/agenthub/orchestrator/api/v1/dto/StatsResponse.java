package agenthub.orchestrator.api.v1.dto;

import agenthub.orchestrator.model.TaskStats;
import agenthub.orchestrator.service.StatsService;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Response DTO for task statistics.
 * GET /api/v1/stats
 */
public record StatsResponse(
        @JsonProperty("pending") int pending,
        @JsonProperty("running") int running,
        @JsonProperty("retrying") int retrying,
        @JsonProperty("completed") int completed,
        @JsonProperty("failed") int failed,
        @JsonProperty("cancelled") int cancelled,
        @JsonProperty("total") int total,
        @JsonProperty("dead_letter") int deadLetter,
        @JsonProperty("queue_depth") int queueDepth,
        @JsonProperty("workers") Workers workers) {

    public record Workers(
            @JsonProperty("size") int size,
            @JsonProperty("busy") int busy) {
    }

    public static StatsResponse from(StatsService.Snapshot snapshot) {
        TaskStats t = snapshot.tasks();
        return new StatsResponse(
                t.pending(), t.running(), t.retrying(), t.completed(), t.failed(), t.cancelled(), t.total(),
                snapshot.deadLetter(),
                snapshot.queueDepth(),
                new Workers(snapshot.workers(), snapshot.busyWorkers()));
    }
}

package agenthub.orchestrator.api.v1.dto;

import agenthub.orchestrator.core.Json;
import agenthub.orchestrator.model.Task;
import agenthub.orchestrator.model.TaskCost;
import agenthub.orchestrator.model.TaskError;
import agenthub.orchestrator.model.TaskProgress;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;

/**
 * Response DTO for task details.
 * GET /api/v1/tasks/{taskId}
 */
public record TaskResponse(
        @JsonProperty("task_id") String taskId,
        @JsonProperty("agent_type") String agentType,
        @JsonProperty("status") String status,
        @JsonProperty("priority") int priority,
        @JsonProperty("idempotency_key") String idempotencyKey,
        @JsonProperty("user_id") String userId,
        @JsonProperty("progress") Progress progress,
        @JsonProperty("result") JsonNode result,
        @JsonProperty("error") Error error,
        @JsonProperty("cost") Cost cost,
        @JsonProperty("attempts") Attempts attempts,
        @JsonProperty("timestamps") Timestamps timestamps,
        @JsonProperty("links") Links links) {

    public static final String BASE_PATH = "/api/v1/tasks/";

    public record Progress(
            @JsonProperty("percent") int percent,
            @JsonProperty("message") String message,
            @JsonProperty("current_step") String currentStep,
            @JsonProperty("total_steps") Integer totalSteps,
            @JsonProperty("current_step_num") Integer currentStepNum) {

        static Progress from(TaskProgress p) {
            return new Progress(p.percent(), p.message(), p.currentStep(), p.totalSteps(), p.currentStepNum());
        }
    }

    public record Error(
            @JsonProperty("code") String code,
            @JsonProperty("message") String message,
            @JsonProperty("retryable") boolean retryable) {

        static Error from(TaskError e) {
            return e == null ? null : new Error(e.code(), e.message(), e.retryable());
        }
    }

    public record Cost(
            @JsonProperty("tokens_input") long tokensInput,
            @JsonProperty("tokens_output") long tokensOutput,
            @JsonProperty("estimated_cost_cents") long estimatedCostCents) {

        static Cost from(TaskCost c) {
            return new Cost(c.tokensInput(), c.tokensOutput(), c.estimatedCostCents());
        }
    }

    public record Attempts(
            @JsonProperty("count") int count,
            @JsonProperty("max") int max) {
    }

    public record Timestamps(
            @JsonProperty("created_at") Instant createdAt,
            @JsonProperty("started_at") Instant startedAt,
            @JsonProperty("updated_at") Instant updatedAt,
            @JsonProperty("completed_at") Instant completedAt,
            @JsonProperty("next_retry_at") Instant nextRetryAt) {
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Links(
            @JsonProperty("self") String self,
            @JsonProperty("events") String events,
            @JsonProperty("cancel") String cancel,
            @JsonProperty("retry") String retry,
            @JsonProperty("stream") String stream) {

        static Links from(Task task) {
            String self = BASE_PATH + task.id();
            return new Links(
                    self,
                    self + "/events",
                    task.isCancellable() ? self + "/cancel" : null,
                    task.isRetryableFailure() ? self + "/retry" : null,
                    task.isTerminal() ? null : self + "/stream");
        }
    }

    /** Create response from domain model */
    public static TaskResponse from(Task task) {
        return new TaskResponse(
                task.id(),
                task.agentType(),
                task.status().wireName(),
                task.priority(),
                task.idempotencyKey(),
                task.userId(),
                Progress.from(task.progress()),
                task.result() != null ? Json.parse(task.result()) : null,
                Error.from(task.error()),
                Cost.from(task.cost()),
                new Attempts(task.attempts(), task.maxAttempts()),
                new Timestamps(task.createdAt(), task.startedAt(), task.updatedAt(), task.completedAt(),
                        task.nextRetryAt()),
                Links.from(task));
    }
}

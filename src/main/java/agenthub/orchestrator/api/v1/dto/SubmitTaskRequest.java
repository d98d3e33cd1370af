package agenthub.orchestrator.api.v1.dto;

import agenthub.orchestrator.core.Json;
import agenthub.orchestrator.error.ValidationException;
import agenthub.orchestrator.error.ValidationException.FieldError;
import agenthub.orchestrator.model.TaskSubmission;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Request DTO for submitting a task.
 * POST /api/v1/tasks
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SubmitTaskRequest(
        @JsonProperty("agent_type") String agentType,
        @JsonProperty("payload") JsonNode payload,
        @JsonProperty("priority") Integer priority,
        @JsonProperty("max_attempts") Integer maxAttempts,
        @JsonProperty("idempotency_key") String idempotencyKey,
        @JsonProperty("webhook_url") String webhookUrl,
        @JsonProperty("user_id") String userId,
        @JsonProperty("sync") Boolean sync,
        @JsonProperty("sync_timeout") Double syncTimeout) {

    public static final int MIN_PRIORITY = 0;
    public static final int MAX_PRIORITY = 10;
    public static final int MIN_ATTEMPTS = 1;
    public static final int MAX_ATTEMPTS = 10;
    public static final int MAX_IDEMPOTENCY_KEY_LENGTH = 64;
    public static final int MAX_WEBHOOK_URL_LENGTH = 2000;
    public static final int MAX_USER_ID_LENGTH = 128;
    public static final double MIN_SYNC_TIMEOUT = 1;
    public static final double MAX_SYNC_TIMEOUT = 300;

    /** Validate the request, reporting every invalid field at once */
    public void validate() {
        List<FieldError> errors = new ArrayList<>();

        if (agentType == null || agentType.isBlank()) {
            errors.add(new FieldError("agent_type", "is required"));
        } else if (agentType.length() > 100) {
            errors.add(new FieldError("agent_type", "must be at most 100 characters"));
        }
        if (payload != null && !payload.isNull() && !payload.isObject()) {
            errors.add(new FieldError("payload", "must be a JSON object"));
        }
        if (priority != null && (priority < MIN_PRIORITY || priority > MAX_PRIORITY)) {
            errors.add(new FieldError("priority", "must be between " + MIN_PRIORITY + " and " + MAX_PRIORITY));
        }
        if (maxAttempts != null && (maxAttempts < MIN_ATTEMPTS || maxAttempts > MAX_ATTEMPTS)) {
            errors.add(new FieldError("max_attempts", "must be between " + MIN_ATTEMPTS + " and " + MAX_ATTEMPTS));
        }
        if (idempotencyKey != null) {
            validateIdempotencyKey("idempotency_key", idempotencyKey, errors);
        }
        if (webhookUrl != null) {
            if (webhookUrl.length() > MAX_WEBHOOK_URL_LENGTH) {
                errors.add(new FieldError("webhook_url", "must be at most " + MAX_WEBHOOK_URL_LENGTH + " characters"));
            } else if (!webhookUrl.startsWith("http://") && !webhookUrl.startsWith("https://")) {
                errors.add(new FieldError("webhook_url", "must start with http:// or https://"));
            }
        }
        if (userId != null && userId.length() > MAX_USER_ID_LENGTH) {
            errors.add(new FieldError("user_id", "must be at most " + MAX_USER_ID_LENGTH + " characters"));
        }
        if (syncTimeout != null && (syncTimeout < MIN_SYNC_TIMEOUT || syncTimeout > MAX_SYNC_TIMEOUT)) {
            errors.add(new FieldError("sync_timeout",
                    "must be between " + (int) MIN_SYNC_TIMEOUT + " and " + (int) MAX_SYNC_TIMEOUT + " seconds"));
        }

        if (!errors.isEmpty()) {
            throw new ValidationException(errors);
        }
    }

    /**
     * Validate an idempotency key given in the header.
     */
    public static void validateHeaderKey(String key) {
        List<FieldError> errors = new ArrayList<>();
        validateIdempotencyKey("X-Idempotency-Key", key, errors);
        if (!errors.isEmpty()) {
            throw new ValidationException(errors);
        }
    }

    private static void validateIdempotencyKey(String field, String key, List<FieldError> errors) {
        if (key.isBlank()) {
            errors.add(new FieldError(field, "must not be blank"));
        } else if (key.trim().length() > MAX_IDEMPOTENCY_KEY_LENGTH) {
            errors.add(new FieldError(field, "must be at most " + MAX_IDEMPOTENCY_KEY_LENGTH + " characters"));
        }
    }

    /**
     * Build the submission. A header idempotency key wins over the body field;
     * either is trimmed.
     *
     * @param headerKey value of X-Idempotency-Key, may be null
     */
    public TaskSubmission toSubmission(String headerKey) {
        String key = headerKey != null && !headerKey.isBlank() ? headerKey : idempotencyKey;
        key = key != null ? key.trim() : null;
        String payloadJson = payload == null || payload.isNull() ? "{}" : Json.write(payload);
        return new TaskSubmission(
                agentType.trim(),
                payloadJson,
                priority != null ? priority : 0,
                maxAttempts != null ? maxAttempts : 0,
                key,
                webhookUrl,
                userId);
    }

    public boolean isSync() {
        return Boolean.TRUE.equals(sync);
    }

    public Duration syncTimeoutOr(Duration fallback) {
        return syncTimeout != null ? Duration.ofMillis(Math.round(syncTimeout * 1000)) : fallback;
    }
}

package agenthub.orchestrator.api.v1.dto;

import agenthub.orchestrator.error.ValidationException;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Optional body of POST /api/v1/tasks/{taskId}/cancel.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record CancelRequest(
        @JsonProperty("force") Boolean force,
        @JsonProperty("reason") String reason) {

    public static final CancelRequest EMPTY = new CancelRequest(false, null);
    public static final int MAX_REASON_LENGTH = 500;

    public void validate() {
        if (reason != null && reason.length() > MAX_REASON_LENGTH) {
            throw new ValidationException("reason", "must be at most " + MAX_REASON_LENGTH + " characters");
        }
    }

    public boolean isForce() {
        return Boolean.TRUE.equals(force);
    }
}

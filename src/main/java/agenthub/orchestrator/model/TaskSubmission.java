package agenthub.orchestrator.model;

/**
 * A validated request to run a task.
 *
 * @param payload JSON object passed to the work function untouched
 */
public record TaskSubmission(
        String agentType,
        String payload,
        int priority,
        int maxAttempts,
        String idempotencyKey,
        String webhookUrl,
        String userId) {

    public boolean hasIdempotencyKey() {
        return idempotencyKey != null && !idempotencyKey.isBlank();
    }
}

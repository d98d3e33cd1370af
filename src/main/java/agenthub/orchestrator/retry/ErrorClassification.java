package agenthub.orchestrator.retry;

/**
 * Outcome of classifying a failed attempt.
 *
 * @param code              error code stored on the task
 * @param backoffMultiplier scales the retry delay (resource errors back off longer)
 */
public record ErrorClassification(
        ErrorCategory category,
        boolean retryable,
        String code,
        String message,
        double backoffMultiplier) {

    /** Message prefixed with the category, e.g. {@code [transient] Connection refused} */
    public String normalizedMessage() {
        return "[" + category.label() + "] " + message;
    }
}

package agenthub.orchestrator.error;

/**
 * Retry requested for a task that is not FAILED with a retryable error.
 */
public class NotRetryableException extends InvalidStateException {

    public NotRetryableException(String message) {
        super(message);
    }

    @Override
    public String code() {
        return "NOT_RETRYABLE";
    }
}

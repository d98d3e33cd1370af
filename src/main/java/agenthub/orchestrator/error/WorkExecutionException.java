package agenthub.orchestrator.error;

/**
 * Raised by a work function. The explicit {@code retryable} flag drives the retry policy.
 */
public class WorkExecutionException extends OrchestratorException {

    private final String errorCode;
    private final boolean retryable;

    public WorkExecutionException(String errorCode, String message, boolean retryable) {
        super(message);
        this.errorCode = errorCode;
        this.retryable = retryable;
    }

    public WorkExecutionException(String errorCode, String message, boolean retryable, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.retryable = retryable;
    }

    public static WorkExecutionException retryable(String errorCode, String message) {
        return new WorkExecutionException(errorCode, message, true);
    }

    public static WorkExecutionException permanent(String errorCode, String message) {
        return new WorkExecutionException(errorCode, message, false);
    }

    @Override
    public String code() {
        return errorCode != null ? errorCode : "WORK_FAILED";
    }

    public boolean retryable() {
        return retryable;
    }
}

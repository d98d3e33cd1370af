package agenthub.orchestrator.model;

/**
 * Error recorded on a task that failed, is waiting for a retry, or was cancelled.
 */
public record TaskError(String code, String message, boolean retryable) {

    public static final String CANCELLED = "CANCELLED";
    public static final String SERVER_RESTART = "SERVER_RESTART";
    public static final String UNKNOWN_AGENT_TYPE = "UNKNOWN_AGENT_TYPE";

    public static final int MAX_MESSAGE_LENGTH = 2000;
    public static final int MAX_CODE_LENGTH = 64;

    public TaskError {
        if (message != null && message.length() > MAX_MESSAGE_LENGTH) {
            message = message.substring(0, MAX_MESSAGE_LENGTH);
        }
        if (code != null && code.length() > MAX_CODE_LENGTH) {
            code = code.substring(0, MAX_CODE_LENGTH);
        }
    }

    public static TaskError cancelled(String reason) {
        String message = reason == null || reason.isBlank() ? "Task cancelled" : "Task cancelled: " + reason;
        return new TaskError(CANCELLED, message, false);
    }
}

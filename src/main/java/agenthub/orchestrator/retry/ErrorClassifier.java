package agenthub.orchestrator.retry;

import agenthub.orchestrator.error.WorkExecutionException;

import java.util.List;
import java.util.Locale;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * Classifies work failures by message pattern.
 * Permanent patterns win over retryable ones; unknown messages are retryable.
 */
public class ErrorClassifier {

    static final double RESOURCE_BACKOFF_MULTIPLIER = 2.0;

    private static final List<String> PERMANENT_PATTERNS = List.of(
            "not found", "does not exist", "missing", "permission denied", "unauthorized",
            "forbidden", "access denied", "authentication failed", "401", "403", "invalid",
            "validation", "malformed", "configuration error");

    private static final List<String> TIMEOUT_PATTERNS = List.of(
            "timeout", "timed out");

    private static final List<String> RESOURCE_PATTERNS = List.of(
            "rate limit", "429", "too many requests", "throttl", "quota", "no space left",
            "out of memory");

    private static final List<String> TRANSIENT_PATTERNS = List.of(
            "connection", "temporar", "unavailable", "502", "503", "504", "bad gateway",
            "locked", "deadlock", "closed", "terminated", "crashed");

    /**
     * Classify a failure. A {@link WorkExecutionException} keeps its explicit code and
     * retryable flag; anything else is judged by its message.
     */
    public ErrorClassification classify(Throwable error) {
        Throwable root = unwrap(error);
        String message = describe(root);

        if (root instanceof WorkExecutionException work) {
            ErrorCategory category = categorize(message);
            if (!work.retryable()) {
                category = ErrorCategory.PERMANENT;
            } else if (category == ErrorCategory.PERMANENT) {
                category = ErrorCategory.UNKNOWN;
            }
            return new ErrorClassification(category, work.retryable(), work.code(), message,
                    multiplierFor(category));
        }

        return classify(message);
    }

    /**
     * Classify a bare message. Null and empty messages are retryable.
     */
    public ErrorClassification classify(String message) {
        String text = message == null ? "" : message;
        ErrorCategory category = categorize(text);
        return new ErrorClassification(category, category.retryable(), category.name(), text,
                multiplierFor(category));
    }

    public boolean isRetryable(String message) {
        return classify(message).retryable();
    }

    private static ErrorCategory categorize(String message) {
        String lower = message.toLowerCase(Locale.ROOT);
        if (lower.isBlank()) {
            return ErrorCategory.UNKNOWN;
        }
        if (matchesAny(lower, PERMANENT_PATTERNS)) {
            return ErrorCategory.PERMANENT;
        }
        if (matchesAny(lower, TIMEOUT_PATTERNS)) {
            return ErrorCategory.TIMEOUT;
        }
        if (matchesAny(lower, RESOURCE_PATTERNS)) {
            return ErrorCategory.RESOURCE;
        }
        if (matchesAny(lower, TRANSIENT_PATTERNS)) {
            return ErrorCategory.TRANSIENT;
        }
        return ErrorCategory.UNKNOWN;
    }

    private static boolean matchesAny(String text, List<String> patterns) {
        for (String pattern : patterns) {
            if (text.contains(pattern)) {
                return true;
            }
        }
        return false;
    }

    private static double multiplierFor(ErrorCategory category) {
        return category == ErrorCategory.RESOURCE ? RESOURCE_BACKOFF_MULTIPLIER : 1.0;
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof ExecutionException || current instanceof CompletionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private static String describe(Throwable error) {
        if (error == null) {
            return "";
        }
        String message = error.getMessage();
        if (message == null || message.isBlank()) {
            return error.getClass().getSimpleName();
        }
        return message;
    }
}

package agenthub.orchestrator.retry;

import java.util.Locale;

/**
 * Broad cause of a failed attempt.
 */
public enum ErrorCategory {
    /** Network blips, unavailable dependencies, lock contention */
    TRANSIENT(true),
    /** The attempt or a dependency timed out */
    TIMEOUT(true),
    /** Rate limits, quotas, exhausted disk or memory */
    RESOURCE(true),
    /** Bad input, missing objects, auth failures: retrying cannot help */
    PERMANENT(false),
    /** Nothing matched; retried optimistically */
    UNKNOWN(true);

    private final boolean retryable;

    ErrorCategory(boolean retryable) {
        this.retryable = retryable;
    }

    public boolean retryable() {
        return retryable;
    }

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}

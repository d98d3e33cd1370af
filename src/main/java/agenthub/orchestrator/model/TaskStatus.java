package agenthub.orchestrator.model;

import java.util.Locale;

/**
 * Task lifecycle status.
 */
public enum TaskStatus {
    /** Task created, waiting in the ready queue */
    PENDING,
    /** Task claimed by a worker and being executed */
    RUNNING,
    /** Attempt failed with a retryable error, waiting for its backoff to elapse */
    RETRYING,
    /** Task completed successfully */
    COMPLETED,
    /** Task failed permanently (moved to the dead letter queue) */
    FAILED,
    /** Task cancelled by user */
    CANCELLED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }

    /**
     * Forward-only state machine. Staying in the same status is always allowed
     * (progress and bookkeeping updates).
     */
    public boolean canTransitionTo(TaskStatus next) {
        if (next == this) {
            return true;
        }
        return switch (this) {
            case PENDING -> next == RUNNING || next == CANCELLED;
            case RUNNING -> next == COMPLETED || next == FAILED || next == RETRYING || next == CANCELLED;
            case RETRYING -> next == PENDING || next == CANCELLED;
            case COMPLETED, FAILED, CANCELLED -> false;
        };
    }

    /** Lowercase name used on the wire */
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Parse a status from its wire or enum name.
     *
     * @throws IllegalArgumentException if the value is not a known status
     */
    public static TaskStatus parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("status is required");
        }
        return TaskStatus.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}

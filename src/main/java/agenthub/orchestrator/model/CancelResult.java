package agenthub.orchestrator.model;

/**
 * Result of a cancel request.
 */
public enum CancelResult {
    /** Task was pending/retrying (or force-cancelled) and is now CANCELLED */
    CANCELLED,

    /** Task is running; the cooperative cancellation flag is set */
    CANCEL_REQUESTED,

    /** Task was already terminal - no-op */
    ALREADY_TERMINAL
}

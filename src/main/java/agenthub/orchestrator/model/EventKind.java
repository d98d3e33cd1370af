package agenthub.orchestrator.model;

import java.util.Locale;

/**
 * Kind of a task event.
 */
public enum EventKind {
    /** Progress reported by the work function */
    PROGRESS,
    /** Attempt failed, a retry is scheduled */
    ERROR,
    /** Terminal outcome; always the last event of a task */
    COMPLETE;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}

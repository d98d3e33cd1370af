package agenthub.orchestrator.events;

/**
 * Handle of an active progress stream.
 */
public interface Subscription {

    String taskId();

    /** Stop polling and close the sink. Safe to call more than once. */
    void cancel();

    boolean isClosed();
}

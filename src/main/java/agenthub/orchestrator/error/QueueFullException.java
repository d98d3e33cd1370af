package agenthub.orchestrator.error;

/**
 * The ready queue is at capacity; the submission was not accepted.
 */
public class QueueFullException extends OrchestratorException {

    public QueueFullException(int capacity) {
        super("ready queue is full (capacity " + capacity + ")");
    }

    @Override
    public String code() {
        return "QUEUE_FULL";
    }
}

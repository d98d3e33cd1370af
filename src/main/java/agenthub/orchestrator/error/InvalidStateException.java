package agenthub.orchestrator.error;

/**
 * Operation not allowed in the task's current status.
 */
public class InvalidStateException extends OrchestratorException {

    public InvalidStateException(String message) {
        super(message);
    }

    @Override
    public String code() {
        return "INVALID_STATE";
    }
}

package agenthub.orchestrator.error;

/**
 * Base class of all errors raised by the orchestration engine.
 * Each subtype carries a stable machine-readable code.
 */
public abstract class OrchestratorException extends RuntimeException {

    protected OrchestratorException(String message) {
        super(message);
    }

    protected OrchestratorException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract String code();
}

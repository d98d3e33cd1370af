package agenthub.orchestrator.model;

/**
 * Cancel result together with the task state after the request.
 */
public record CancelOutcome(CancelResult result, Task task) {
}

package agenthub.orchestrator.model;

/**
 * Outcome of a submission.
 *
 * @param created false when an idempotency key matched an existing task
 */
public record SubmitResult(Task task, boolean created) {
}

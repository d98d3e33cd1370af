package agenthub.orchestrator.error;

/**
 * Thrown at a cancellation checkpoint once the task's cancel flag is set.
 */
public class TaskCancelledException extends OrchestratorException {

    public TaskCancelledException(String taskId) {
        super("task cancelled: " + taskId);
    }

    @Override
    public String code() {
        return "CANCELLED";
    }
}

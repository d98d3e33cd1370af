package agenthub.orchestrator.error;

/**
 * Optimistic-concurrency clash: the task changed between read and write.
 */
public class ConflictException extends OrchestratorException {

    private final String taskId;

    public ConflictException(String taskId, String message) {
        super(message);
        this.taskId = taskId;
    }

    public String taskId() {
        return taskId;
    }

    @Override
    public String code() {
        return "CONFLICT";
    }
}

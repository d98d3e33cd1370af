package agenthub.orchestrator.model;

/**
 * Latest progress reported by the work function.
 */
public record TaskProgress(
        int percent,
        String message,
        String currentStep,
        Integer totalSteps,
        Integer currentStepNum) {

    public static final int MAX_MESSAGE_LENGTH = 500;
    public static final int MAX_STEP_LENGTH = 100;

    public static final TaskProgress NONE = new TaskProgress(0, null, null, null, null);

    public TaskProgress {
        percent = Math.max(0, Math.min(100, percent));
        message = truncate(message, MAX_MESSAGE_LENGTH);
        currentStep = truncate(currentStep, MAX_STEP_LENGTH);
    }

    /**
     * Merge an update into this progress. Percent never moves backwards;
     * null fields keep their previous value.
     */
    public TaskProgress merge(Integer newPercent, String newMessage, String newStep,
            Integer newStepNum, Integer newTotalSteps) {
        int merged = newPercent == null ? percent : Math.max(percent, newPercent);
        return new TaskProgress(
                merged,
                newMessage != null ? newMessage : message,
                newStep != null ? newStep : currentStep,
                newTotalSteps != null ? newTotalSteps : totalSteps,
                newStepNum != null ? newStepNum : currentStepNum);
    }

    private static String truncate(String value, int max) {
        if (value == null || value.length() <= max) {
            return value;
        }
        return value.substring(0, max);
    }
}

package agenthub.orchestrator.worker;

import agenthub.orchestrator.error.TaskCancelledException;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * What a work function sees of its task while it runs.
 */
public interface WorkContext {

    String taskId();

    String agentType();

    /** The submitted payload, as given by the client */
    JsonNode payload();

    /** 1 for the first attempt */
    int attempt();

    boolean isCancelled();

    /**
     * Cancellation checkpoint.
     *
     * @throws TaskCancelledException if cancellation was requested
     */
    void checkCancelled();

    /**
     * Report progress. Percent is clamped to 0..100 and never moves backwards.
     */
    void reportProgress(int percent, String message);

    void reportStep(String stepName, int stepNum, int totalSteps);

    /**
     * Add usage charges for this attempt. Charges are kept even if the attempt fails.
     */
    void addCost(long tokensInput, long tokensOutput, long estimatedCostCents);
}

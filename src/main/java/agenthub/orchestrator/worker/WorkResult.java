package agenthub.orchestrator.worker;

import agenthub.orchestrator.model.TaskCost;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Successful outcome of a work function.
 *
 * @param cost charges not already reported through {@link WorkContext#addCost}
 */
public record WorkResult(JsonNode result, TaskCost cost) {

    public WorkResult {
        cost = cost != null ? cost : TaskCost.ZERO;
    }

    public static WorkResult of(JsonNode result) {
        return new WorkResult(result, TaskCost.ZERO);
    }

    public static WorkResult of(JsonNode result, TaskCost cost) {
        return new WorkResult(result, cost);
    }
}

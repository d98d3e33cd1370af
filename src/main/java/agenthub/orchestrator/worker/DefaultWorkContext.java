package agenthub.orchestrator.worker;

import agenthub.orchestrator.core.Json;
import agenthub.orchestrator.error.InvalidStateException;
import agenthub.orchestrator.error.TaskCancelledException;
import agenthub.orchestrator.model.Task;
import agenthub.orchestrator.model.TaskCost;
import agenthub.orchestrator.service.TaskExecutionService;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicReference;

/**
 * Work context backed by the task execution service.
 */
class DefaultWorkContext implements WorkContext {

    private static final Logger log = LoggerFactory.getLogger(DefaultWorkContext.class);

    private final Task task;
    private final WorkerPool.Execution execution;
    private final TaskExecutionService executionService;
    private final JsonNode payload;
    private final AtomicReference<TaskCost> cost = new AtomicReference<>(TaskCost.ZERO);

    DefaultWorkContext(Task task, WorkerPool.Execution execution, TaskExecutionService executionService) {
        this.task = task;
        this.execution = execution;
        this.executionService = executionService;
        this.payload = Json.parse(task.payload());
    }

    @Override
    public String taskId() {
        return task.id();
    }

    @Override
    public String agentType() {
        return task.agentType();
    }

    @Override
    public JsonNode payload() {
        return payload;
    }

    @Override
    public int attempt() {
        return task.attempts();
    }

    @Override
    public boolean isCancelled() {
        return execution.isCancelled();
    }

    @Override
    public void checkCancelled() {
        if (execution.isCancelled()) {
            throw new TaskCancelledException(task.id());
        }
    }

    @Override
    public void reportProgress(int percent, String message) {
        report(percent, message, null, null, null);
    }

    @Override
    public void reportStep(String stepName, int stepNum, int totalSteps) {
        report(null, null, stepName, stepNum, totalSteps);
    }

    @Override
    public void addCost(long tokensInput, long tokensOutput, long estimatedCostCents) {
        TaskCost charge = new TaskCost(tokensInput, tokensOutput, estimatedCostCents);
        cost.accumulateAndGet(charge, TaskCost::plus);
    }

    /** Charges reported so far in this attempt */
    TaskCost accumulatedCost() {
        return cost.get();
    }

    private void report(Integer percent, String message, String step, Integer stepNum, Integer totalSteps) {
        try {
            executionService.reportProgress(task.id(), percent, message, step, stepNum, totalSteps);
        } catch (InvalidStateException e) {
            // Task left RUNNING under us (force cancel or reaper)
            log.debug("Progress for task {} ignored: {}", task.id(), e.getMessage());
        }
    }
}

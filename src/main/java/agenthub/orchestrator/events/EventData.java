package agenthub.orchestrator.events;

import agenthub.orchestrator.core.Json;
import agenthub.orchestrator.model.Task;
import agenthub.orchestrator.model.TaskError;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.time.Duration;

/**
 * Builds the JSON {@code data} carried by task events and stream messages.
 */
public final class EventData {

    private EventData() {
    }

    public static ObjectNode progress(Task task) {
        ObjectNode data = base(task);
        ObjectNode progress = data.putObject("progress");
        progress.put("percent", task.progress().percent());
        progress.put("message", task.progress().message());
        progress.put("current_step", task.progress().currentStep());
        if (task.progress().totalSteps() != null) {
            progress.put("total_steps", task.progress().totalSteps());
        }
        if (task.progress().currentStepNum() != null) {
            progress.put("current_step_num", task.progress().currentStepNum());
        }
        return data;
    }

    public static ObjectNode retrying(Task task, Duration delay) {
        ObjectNode data = base(task);
        putError(data, task.error());
        data.put("retryable", true);
        data.put("retry_in_ms", delay.toMillis());
        return data;
    }

    /**
     * Data of the final COMPLETE event: result for completed tasks, error otherwise.
     */
    public static ObjectNode terminal(Task task) {
        ObjectNode data = base(task);
        if (task.result() != null) {
            data.set("result", Json.parse(task.result()));
        }
        putError(data, task.error());
        if (task.error() != null) {
            data.put("retryable", task.error().retryable());
        }
        return data;
    }

    private static ObjectNode base(Task task) {
        ObjectNode data = Json.object();
        data.put("task_id", task.id());
        data.put("status", task.status().wireName());
        data.put("attempt", task.attempts());
        data.put("max_attempts", task.maxAttempts());
        return data;
    }

    private static void putError(ObjectNode data, TaskError error) {
        if (error == null) {
            return;
        }
        ObjectNode node = data.putObject("error");
        node.put("code", error.code());
        node.put("message", error.message());
        node.put("retryable", error.retryable());
    }
}

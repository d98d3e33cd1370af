package agenthub.orchestrator.worker;

import agenthub.orchestrator.core.Json;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Built-in work function: walks through {@code steps} steps (default 3), sleeping
 * {@code delay_ms} per step, and returns the payload.
 */
public class EchoWorkFunction implements WorkFunction {

    public static final String AGENT_TYPE = "echo";

    @Override
    public WorkResult execute(WorkContext ctx) throws Exception {
        JsonNode payload = ctx.payload();
        int steps = Math.max(1, payload.path("steps").asInt(3));
        long delayMs = Math.max(0, payload.path("delay_ms").asLong(0));

        for (int step = 1; step <= steps; step++) {
            ctx.checkCancelled();
            ctx.reportStep("step " + step, step, steps);
            if (delayMs > 0) {
                Thread.sleep(delayMs);
            }
            ctx.reportProgress(step * 100 / steps, "Completed step " + step + " of " + steps);
        }

        ObjectNode result = Json.object();
        result.set("echo", payload);
        result.put("steps", steps);
        result.put("attempt", ctx.attempt());
        return WorkResult.of(result);
    }
}

package agenthub.orchestrator.events;

import agenthub.orchestrator.core.Json;
import agenthub.orchestrator.model.TaskEvent;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.time.Instant;

/**
 * One message of a progress stream.
 *
 * @param event    wire kind: progress, error, complete or heartbeat
 * @param sequence event sequence number, null for messages not backed by a stored event
 */
public record StreamMessage(String event, Long sequence, JsonNode data) {

    public static final String HEARTBEAT = "heartbeat";
    public static final String ERROR = "error";
    public static final String COMPLETE = "complete";

    public static StreamMessage of(TaskEvent event) {
        ObjectNode data = Json.object();
        data.put("task_id", event.taskId());
        data.put("sequence", event.sequence());
        data.put("timestamp", event.timestamp().toString());
        if (event.percent() != null) {
            data.put("percent", event.percent());
        }
        if (event.message() != null) {
            data.put("message", event.message());
        }
        if (event.data() instanceof ObjectNode extra) {
            extra.fields().forEachRemaining(field -> {
                if (!data.has(field.getKey())) {
                    data.set(field.getKey(), field.getValue());
                }
            });
        }
        return new StreamMessage(event.kind().wireName(), event.sequence(), data);
    }

    public static StreamMessage heartbeat(Instant now) {
        ObjectNode data = Json.object();
        data.put("timestamp", now.toString());
        return new StreamMessage(HEARTBEAT, null, data);
    }

    public static StreamMessage error(String code, String message) {
        ObjectNode data = Json.object();
        data.put("code", code);
        data.put("message", message);
        return new StreamMessage(ERROR, null, data);
    }

    public static StreamMessage complete(JsonNode data) {
        return new StreamMessage(COMPLETE, null, data);
    }

    public boolean isTerminal() {
        return COMPLETE.equals(event);
    }

    /** The JSON line carried by the frame: {@code {"event": ..., "data": ...}} */
    public String toJson() {
        ObjectNode node = Json.object();
        node.put("event", event);
        node.set("data", data);
        return Json.write(node);
    }

    /** Server-sent-events frame, terminated by a blank line */
    public String toSseFrame() {
        StringBuilder frame = new StringBuilder();
        if (sequence != null) {
            frame.append("id: ").append(sequence).append('\n');
        }
        frame.append("event: ").append(event).append('\n');
        frame.append("data: ").append(toJson()).append("\n\n");
        return frame.toString();
    }
}

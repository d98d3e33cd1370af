package agenthub.orchestrator.api.v1.dto;

import agenthub.orchestrator.core.Json;
import agenthub.orchestrator.error.ValidationException;
import agenthub.orchestrator.model.TaskSubmission;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class SubmitTaskRequestTest {

    private static SubmitTaskRequest read(String json) throws Exception {
        return Json.mapper().readValue(json, SubmitTaskRequest.class);
    }

    @Test
    void minimalRequestGetsDefaults() throws Exception {
        SubmitTaskRequest request = read("{\"agent_type\":\"echo\",\"unknown_field\":1}");
        request.validate();

        TaskSubmission submission = request.toSubmission(null);
        assertEquals("echo", submission.agentType());
        assertEquals("{}", submission.payload());
        assertEquals(0, submission.priority());
        assertEquals(0, submission.maxAttempts());
        assertFalse(submission.hasIdempotencyKey());
        assertFalse(request.isSync());
        assertEquals(Duration.ofSeconds(60), request.syncTimeoutOr(Duration.ofSeconds(60)));
    }

    @Test
    void reportsEveryInvalidField() throws Exception {
        SubmitTaskRequest request = read("""
                {"payload": [1, 2], "priority": 11, "max_attempts": 0,
                 "idempotency_key": "  ", "webhook_url": "ftp://x", "sync_timeout": 0.5}
                """);

        ValidationException e = assertThrows(ValidationException.class, request::validate);

        Set<String> fields = e.fieldErrors().stream()
                .map(ValidationException.FieldError::field)
                .collect(Collectors.toSet());
        assertEquals(Set.of("agent_type", "payload", "priority", "max_attempts", "idempotency_key",
                "webhook_url", "sync_timeout"), fields);
    }

    @Test
    void headerKeyWinsOverBody() throws Exception {
        SubmitTaskRequest request = read(
                "{\"agent_type\":\"echo\",\"idempotency_key\":\"body-key\",\"payload\":{\"a\":1}}");

        assertEquals("header-key", request.toSubmission(" header-key ").idempotencyKey());
        assertEquals("body-key", request.toSubmission(null).idempotencyKey());
        assertEquals("{\"a\":1}", request.toSubmission(null).payload());
    }

    @Test
    void bodyKeyIsTrimmedLikeTheHeader() throws Exception {
        SubmitTaskRequest padded = read("{\"agent_type\":\"echo\",\"idempotency_key\":\" k \"}");
        padded.validate();

        assertEquals("k", padded.toSubmission(null).idempotencyKey());
        assertEquals(read("{\"agent_type\":\"echo\"}").toSubmission(" k").idempotencyKey(),
                padded.toSubmission(null).idempotencyKey());
    }

    @Test
    void headerKeyIsValidated() {
        assertThrows(ValidationException.class, () -> SubmitTaskRequest.validateHeaderKey("k".repeat(65)));
        assertDoesNotThrow(() -> SubmitTaskRequest.validateHeaderKey("k".repeat(64)));
    }

    @Test
    void syncTimeoutInSeconds() throws Exception {
        SubmitTaskRequest request = read("{\"agent_type\":\"echo\",\"sync\":true,\"sync_timeout\":2.5}");
        request.validate();

        assertTrue(request.isSync());
        assertEquals(Duration.ofMillis(2500), request.syncTimeoutOr(Duration.ofSeconds(60)));
    }
}

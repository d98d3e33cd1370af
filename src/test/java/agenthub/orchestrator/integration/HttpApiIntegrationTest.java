package agenthub.orchestrator.integration;

import agenthub.orchestrator.config.Dependencies;
import agenthub.orchestrator.config.OrchestratorConfig;
import agenthub.orchestrator.core.Json;
import agenthub.orchestrator.error.WorkExecutionException;
import agenthub.orchestrator.worker.WorkRegistry;
import agenthub.orchestrator.worker.WorkResult;
import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.*;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Integration test that hits the HTTP endpoints through the Netty server.
 */
class HttpApiIntegrationTest {

    private Dependencies deps;
    private HttpClient httpClient;
    private String baseUrl;

    @BeforeEach
    void setUp() {
        start(null);
    }

    @AfterEach
    void tearDown() {
        deps.close();
    }

    private void start(String apiKey) {
        start(apiKey, 16);
    }

    private void start(String apiKey, int handlerThreads) {
        OrchestratorConfig config = OrchestratorConfig.defaults()
                .withDatabaseUrl("jdbc:h2:mem:test-http-" + UUID.randomUUID()
                        + ";DB_CLOSE_DELAY=-1;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE")
                .withServerPort(0)
                .withWorkerCount(2)
                .withHandlerThreads(handlerThreads)
                .withRetryDelays(Duration.ofMillis(20), Duration.ofMillis(100), 0)
                .withApiKey(apiKey);

        WorkRegistry registry = WorkRegistry.withDefaults()
                .register("fail", ctx -> {
                    throw WorkExecutionException.retryable("FLAKY", "upstream unavailable");
                })
                .register("wait", ctx -> {
                    for (int i = 0; i < 500; i++) {
                        ctx.checkCancelled();
                        Thread.sleep(20);
                    }
                    return WorkResult.of(null);
                });

        deps = Dependencies.create(config, registry);
        deps.start();
        int port = deps.startServer().port();
        baseUrl = "http://localhost:" + port;
        httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(5))
                .build();
    }

    private HttpResponse<String> send(String method, String path, String body, String... headers)
            throws Exception {
        return httpClient.send(request(method, path, body, headers), HttpResponse.BodyHandlers.ofString());
    }

    private HttpRequest request(String method, String path, String body, String... headers) {
        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + path))
                .timeout(Duration.ofSeconds(20))
                .header("Content-Type", "application/json")
                .method(method, body == null
                        ? HttpRequest.BodyPublishers.noBody()
                        : HttpRequest.BodyPublishers.ofString(body));
        for (int i = 0; i + 1 < headers.length; i += 2) {
            builder.header(headers[i], headers[i + 1]);
        }
        return builder.build();
    }

    private JsonNode json(HttpResponse<String> response) {
        return Json.parse(response.body());
    }

    private JsonNode waitForStatus(String taskId, String status) throws Exception {
        JsonNode task = null;
        for (int i = 0; i < 250; i++) {
            task = json(send("GET", "/api/v1/tasks/" + taskId, null));
            if (status.equals(task.get("status").asText())) {
                return task;
            }
            Thread.sleep(20);
        }
        fail("task " + taskId + " stuck in " + (task != null ? task.get("status") : null));
        return task;
    }

    @Test
    @DisplayName("Submit, poll until completed, read events")
    void submitAndComplete() throws Exception {
        HttpResponse<String> created = send("POST", "/api/v1/tasks",
                "{\"agent_type\":\"echo\",\"payload\":{\"steps\":2,\"delay_ms\":10},\"priority\":3}");

        assertEquals(202, created.statusCode(), created.body());
        JsonNode task = json(created);
        String taskId = task.get("task_id").asText();
        assertTrue(taskId.startsWith("task_"));
        assertEquals("pending", task.get("status").asText());
        assertEquals("/api/v1/tasks/" + taskId, task.get("links").get("self").asText());

        JsonNode done = waitForStatus(taskId, "completed");
        assertEquals(100, done.get("progress").get("percent").asInt());
        assertEquals(2, done.get("result").get("echo").get("steps").asInt());
        assertEquals(1, done.get("attempts").get("count").asInt());

        JsonNode events = json(send("GET", "/api/v1/tasks/" + taskId + "/events", null));
        assertEquals(taskId, events.get("task_id").asText());
        JsonNode list = events.get("events");
        assertEquals("complete", list.get(list.size() - 1).get("event").asText());
        assertEquals(1, list.get(0).get("sequence").asInt());
    }

    @Test
    void syncSubmitWaitsForTheResult() throws Exception {
        HttpResponse<String> response = send("POST", "/api/v1/tasks",
                "{\"agent_type\":\"echo\",\"payload\":{\"steps\":1},\"sync\":true,\"sync_timeout\":10}");

        assertEquals(200, response.statusCode(), response.body());
        assertEquals("completed", json(response).get("status").asText());
    }

    @Test
    void syncSubmitTimesOutWith202() throws Exception {
        HttpResponse<String> response = send("POST", "/api/v1/tasks",
                "{\"agent_type\":\"wait\",\"sync\":true,\"sync_timeout\":1}");

        assertEquals(202, response.statusCode(), response.body());
        JsonNode task = json(response);
        assertNotEquals("completed", task.get("status").asText());

        send("POST", "/api/v1/tasks/" + task.get("task_id").asText() + "/cancel", "{\"force\":true}");
    }

    @Test
    @DisplayName("A waiting sync submit does not hold up other requests")
    void syncWaitDoesNotBlockOtherRequests() throws Exception {
        deps.close();
        start(null, 1);

        CompletableFuture<HttpResponse<String>> sync = httpClient.sendAsync(
                request("POST", "/api/v1/tasks", "{\"agent_type\":\"wait\",\"sync\":true,\"sync_timeout\":5}"),
                HttpResponse.BodyHandlers.ofString());

        String taskId = null;
        for (int i = 0; i < 250 && taskId == null; i++) {
            JsonNode tasks = json(send("GET", "/api/v1/tasks?agent_type=wait&status=running", null)).get("tasks");
            if (tasks.size() > 0) {
                taskId = tasks.get(0).get("task_id").asText();
            } else {
                Thread.sleep(20);
            }
        }
        assertNotNull(taskId, "sync task never started");

        // Fresh clients open new connections, all served by the single handler thread
        for (int i = 0; i < 5; i++) {
            HttpClient fresh = HttpClient.newHttpClient();
            long started = System.nanoTime();
            HttpResponse<String> health = fresh.send(request("GET", "/api/v1/health", null),
                    HttpResponse.BodyHandlers.ofString());
            long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);

            assertEquals(200, health.statusCode());
            assertTrue(elapsedMs < 1000, "health call took " + elapsedMs + " ms");
        }
        assertFalse(sync.isDone());

        HttpResponse<String> response = sync.get(10, TimeUnit.SECONDS);
        assertEquals(202, response.statusCode(), response.body());
        assertEquals(taskId, json(response).get("task_id").asText());

        send("POST", "/api/v1/tasks/" + taskId + "/cancel", "{\"force\":true}");
    }

    @Test
    void nullBodiesAreHandled() throws Exception {
        HttpResponse<String> submit = send("POST", "/api/v1/tasks", "null");
        assertEquals(422, submit.statusCode(), submit.body());
        assertEquals("body", json(submit).get("error").get("fields").get(0).get("field").asText());

        String taskId = json(send("POST", "/api/v1/tasks", "{\"agent_type\":\"echo\"}")).get("task_id").asText();
        waitForStatus(taskId, "completed");

        HttpResponse<String> cancel = send("POST", "/api/v1/tasks/" + taskId + "/cancel", "null");
        assertEquals(200, cancel.statusCode(), cancel.body());
        assertEquals("completed", json(cancel).get("status").asText());
    }

    @Test
    void idempotentReplayReturns200() throws Exception {
        String body = "{\"agent_type\":\"echo\"}";
        HttpResponse<String> first = send("POST", "/api/v1/tasks", body, "X-Idempotency-Key", "abc-123");
        HttpResponse<String> second = send("POST", "/api/v1/tasks", body, "X-Idempotency-Key", "abc-123");

        assertEquals(202, first.statusCode());
        assertEquals(200, second.statusCode());
        assertEquals(json(first).get("task_id").asText(), json(second).get("task_id").asText());
    }

    @Test
    void validationErrorsListFields() throws Exception {
        HttpResponse<String> response = send("POST", "/api/v1/tasks", "{\"priority\":99}");

        assertEquals(422, response.statusCode());
        JsonNode error = json(response).get("error");
        assertEquals("VALIDATION_ERROR", error.get("code").asText());
        assertTrue(error.get("fields").size() >= 2);

        HttpResponse<String> unknown = send("POST", "/api/v1/tasks", "{\"agent_type\":\"nope\"}");
        assertEquals(422, unknown.statusCode());

        HttpResponse<String> badJson = send("POST", "/api/v1/tasks", "{not json");
        assertEquals(400, badJson.statusCode());
        assertEquals("INVALID_JSON", json(badJson).get("error").get("code").asText());

        HttpResponse<String> mistyped = send("POST", "/api/v1/tasks", "{\"agent_type\":\"echo\",\"priority\":\"high\"}");
        assertEquals(422, mistyped.statusCode(), mistyped.body());
        JsonNode mistypedError = json(mistyped).get("error");
        assertEquals("VALIDATION_ERROR", mistypedError.get("code").asText());
        assertEquals("priority", mistypedError.get("fields").get(0).get("field").asText());

        HttpResponse<String> badCancel = send("POST", "/api/v1/tasks/task_missing/cancel", "{\"force\":\"maybe\"}");
        assertEquals(422, badCancel.statusCode(), badCancel.body());
        assertEquals("force", json(badCancel).get("error").get("fields").get(0).get("field").asText());

        HttpResponse<String> badLimit = send("GET", "/api/v1/tasks?limit=1000", null);
        assertEquals(422, badLimit.statusCode());
    }

    @Test
    void unknownTaskAndRouteAre404() throws Exception {
        HttpResponse<String> missing = send("GET", "/api/v1/tasks/task_missing", null);
        assertEquals(404, missing.statusCode());
        assertEquals("NOT_FOUND", json(missing).get("error").get("code").asText());

        assertEquals(404, send("GET", "/api/v1/nothing-here", null).statusCode());
        assertEquals(404, send("GET", "/api/v1/tasks/task_missing/stream", null).statusCode());
    }

    @Test
    void cancelRunningTaskThenDeleteIt() throws Exception {
        String taskId = json(send("POST", "/api/v1/tasks", "{\"agent_type\":\"wait\"}")).get("task_id").asText();
        waitForStatus(taskId, "running");

        assertEquals(409, send("DELETE", "/api/v1/tasks/" + taskId, null).statusCode());

        HttpResponse<String> cancel = send("POST", "/api/v1/tasks/" + taskId + "/cancel", "{\"reason\":\"user\"}");
        assertEquals(202, cancel.statusCode(), cancel.body());

        JsonNode cancelled = waitForStatus(taskId, "cancelled");
        assertEquals("Task cancelled: user", cancelled.get("error").get("message").asText());

        HttpResponse<String> again = send("POST", "/api/v1/tasks/" + taskId + "/cancel", null);
        assertEquals(200, again.statusCode());

        assertEquals(204, send("DELETE", "/api/v1/tasks/" + taskId, null).statusCode());
        assertEquals(404, send("GET", "/api/v1/tasks/" + taskId, null).statusCode());
    }

    @Test
    void failedTaskLandsInDeadLetterAndCanBeRetried() throws Exception {
        String taskId = json(send("POST", "/api/v1/tasks", "{\"agent_type\":\"fail\",\"max_attempts\":2}"))
                .get("task_id").asText();
        JsonNode failed = waitForStatus(taskId, "failed");
        assertEquals("FLAKY", failed.get("error").get("code").asText());
        assertTrue(failed.get("links").has("retry"));

        JsonNode dlq = json(send("GET", "/api/v1/dead-letter", null));
        assertEquals(1, dlq.get("total").asInt());
        assertEquals(taskId, dlq.get("entries").get(0).get("task_id").asText());

        HttpResponse<String> retried = send("POST", "/api/v1/tasks/" + taskId + "/retry", null);
        assertEquals(202, retried.statusCode(), retried.body());
        assertNotEquals(taskId, json(retried).get("task_id").asText());

        HttpResponse<String> twice = send("POST", "/api/v1/tasks/" + taskId + "/retry", null);
        assertEquals(400, twice.statusCode());
        assertEquals(404, send("POST", "/api/v1/dead-letter/" + taskId + "/requeue", null).statusCode());
    }

    @Test
    void streamDeliversEventsUntilComplete() throws Exception {
        String taskId = json(send("POST", "/api/v1/tasks",
                "{\"agent_type\":\"echo\",\"payload\":{\"steps\":3,\"delay_ms\":50}}")).get("task_id").asText();

        HttpResponse<String> stream = send("GET",
                "/api/v1/tasks/" + taskId + "/stream?pollInterval=0.1&timeout=30", null);

        assertEquals(200, stream.statusCode());
        assertTrue(stream.headers().firstValue("content-type").orElse("").startsWith("text/event-stream"));
        String body = stream.body();
        assertTrue(body.contains("event: progress\n"), body);
        assertTrue(body.contains("event: complete\n"), body);
        assertTrue(body.trim().endsWith("}"), body);
    }

    @Test
    void listStatsAndHealth() throws Exception {
        String taskId = json(send("POST", "/api/v1/tasks", "{\"agent_type\":\"echo\",\"user_id\":\"u1\"}"))
                .get("task_id").asText();
        waitForStatus(taskId, "completed");

        JsonNode list = json(send("GET", "/api/v1/tasks?user_id=u1&status=completed", null));
        assertEquals(1, list.get("total").asInt());
        assertEquals(50, list.get("limit").asInt());

        JsonNode stats = json(send("GET", "/api/v1/stats", null));
        assertEquals(1, stats.get("completed").asInt());
        assertEquals(2, stats.get("workers").get("size").asInt());

        HttpResponse<String> health = send("GET", "/api/v1/health", null);
        assertEquals(200, health.statusCode());
        assertEquals("healthy", json(health).get("status").asText());
    }

    @Test
    void apiKeyIsEnforced() throws Exception {
        deps.close();
        start("test-key");

        assertEquals(401, send("GET", "/api/v1/tasks", null).statusCode());
        assertEquals(401, send("GET", "/api/v1/tasks", null, "X-Api-Key", "wrong").statusCode());
        assertEquals(200, send("GET", "/api/v1/tasks", null, "X-Api-Key", "test-key").statusCode());
        assertEquals(200, send("GET", "/api/v1/health", null).statusCode());
    }
}

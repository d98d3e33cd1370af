package agenthub.orchestrator.webhook;

import agenthub.orchestrator.config.OrchestratorConfig;
import agenthub.orchestrator.core.Json;
import agenthub.orchestrator.model.Task;
import agenthub.orchestrator.model.TaskStatus;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.time.Instant;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Fire-and-forget webhook delivery for completed and failed tasks.
 * <p>
 * Deliveries run on a small executor with a fixed number of attempts and exponential
 * backoff. 5xx responses and I/O errors are retried; 4xx is final. Failures are only logged.
 */
public class WebhookNotifier implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(WebhookNotifier.class);

    public static final String EVENT_HEADER = "X-AgentHub-Event";
    public static final String DELIVERY_HEADER = "X-AgentHub-Delivery";
    public static final String SIGNATURE_HEADER = "X-AgentHub-Signature";

    private final HttpClient httpClient;
    private final Duration timeout;
    private final int maxAttempts;
    private final Duration initialBackoff;
    private final WebhookSigner signer;
    private final ExecutorService executor;

    public WebhookNotifier(OrchestratorConfig config) {
        this.timeout = config.webhookTimeout();
        this.maxAttempts = Math.max(1, config.webhookMaxAttempts());
        this.initialBackoff = config.webhookInitialBackoff();
        this.signer = config.webhookSecret() != null && !config.webhookSecret().isEmpty()
                ? new WebhookSigner(config.webhookSecret())
                : null;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(timeout)
                .followRedirects(HttpClient.Redirect.NEVER)
                .build();
        AtomicInteger counter = new AtomicInteger();
        this.executor = Executors.newFixedThreadPool(2, r -> {
            Thread t = new Thread(r, "agenthub-webhook-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Schedule delivery for a task that reached COMPLETED or FAILED. Other tasks and
     * tasks without a webhook URL are ignored.
     */
    public void notify(Task task) {
        if (task.webhookUrl() == null || task.webhookUrl().isBlank()) {
            return;
        }
        if (task.status() != TaskStatus.COMPLETED && task.status() != TaskStatus.FAILED) {
            return;
        }

        String event = eventName(task.status());
        String body = Json.write(payload(task, event));
        try {
            executor.execute(() -> deliver(task.webhookUrl(), event, body));
        } catch (RejectedExecutionException e) {
            log.warn("Webhook for task {} not sent: notifier is shut down", task.id());
        }
    }

    /**
     * Deliver synchronously with retries.
     *
     * @return true if an attempt got a 2xx response
     */
    boolean deliver(String url, String event, String body) {
        String deliveryId = UUID.randomUUID().toString();
        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(URI.create(url))
                .timeout(timeout)
                .header("Content-Type", "application/json")
                .header(EVENT_HEADER, event)
                .header(DELIVERY_HEADER, deliveryId)
                .POST(HttpRequest.BodyPublishers.ofString(body));
        if (signer != null) {
            builder.header(SIGNATURE_HEADER, signer.sign(body));
        }
        HttpRequest request = builder.build();

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
                int status = response.statusCode();
                if (status >= 200 && status < 300) {
                    log.debug("Webhook {} delivered to {} (attempt {})", deliveryId, url, attempt);
                    return true;
                }
                if (status < 500) {
                    log.warn("Webhook {} to {} rejected with HTTP {}, not retrying", deliveryId, url, status);
                    return false;
                }
                log.warn("Webhook {} to {} got HTTP {} (attempt {}/{})", deliveryId, url, status, attempt, maxAttempts);
            } catch (IOException e) {
                log.warn("Webhook {} to {} failed (attempt {}/{}): {}", deliveryId, url, attempt, maxAttempts,
                        e.toString());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Webhook {} to {} interrupted", deliveryId, url);
                return false;
            }

            if (attempt < maxAttempts && !sleep(initialBackoff.multipliedBy(1L << (attempt - 1)))) {
                return false;
            }
        }

        log.warn("Webhook {} to {} gave up after {} attempts", deliveryId, url, maxAttempts);
        return false;
    }

    static String eventName(TaskStatus status) {
        return status == TaskStatus.COMPLETED ? "task.completed" : "task.failed";
    }

    static ObjectNode payload(Task task, String event) {
        ObjectNode payload = Json.object();
        payload.put("event", event);
        payload.put("task_id", task.id());
        payload.put("agent_type", task.agentType());
        payload.put("status", task.status().wireName());
        if (task.result() != null) {
            payload.set("result", Json.parse(task.result()));
        } else {
            payload.putNull("result");
        }
        if (task.error() != null) {
            ObjectNode error = payload.putObject("error");
            error.put("code", task.error().code());
            error.put("message", task.error().message());
            error.put("retryable", task.error().retryable());
        } else {
            payload.putNull("error");
        }
        payload.put("timestamp", Instant.now().toString());
        return payload;
    }

    private static boolean sleep(Duration delay) {
        try {
            Thread.sleep(delay.toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(2, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}

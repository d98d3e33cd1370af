package agenthub.orchestrator.config;

import org.ini4j.Ini;
import org.ini4j.Profile;

import java.io.File;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Duration;

/**
 * Configuration holder for orchestrator settings.
 * All settings have sensible defaults; override from the environment,
 * an INI file, or the fluent setters (tests).
 */
public final class OrchestratorConfig {

    // Database settings
    private String databaseUrl = "jdbc:h2:file:./data/agenthub;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE";
    private int databasePoolSize = 10;

    // Server settings
    private int serverPort = 8080;
    private String serverHost = "0.0.0.0";
    private int handlerThreads = 16;
    private String apiKey = null; // If set, /api requests must carry X-Api-Key

    // Execution settings
    private int workerCount = 4;
    private int queueCapacity = 10_000;
    private int defaultMaxAttempts = 3;
    private int conflictRetries = 3;
    private Duration defaultSyncTimeout = Duration.ofSeconds(60);

    // Retry settings
    private Duration retryBaseDelay = Duration.ofSeconds(5);
    private Duration retryMaxDelay = Duration.ofSeconds(300);
    private double retryJitter = 0.25;

    // Idempotency
    private Duration idempotencyTtl = Duration.ofHours(24);

    // Streaming
    private Duration streamHeartbeat = Duration.ofSeconds(15);
    private int streamThreads = 2;

    // Webhooks
    private Duration webhookTimeout = Duration.ofSeconds(10);
    private int webhookMaxAttempts = 3;
    private Duration webhookInitialBackoff = Duration.ofSeconds(1);
    private String webhookSecret = null;
    private boolean webhookAllowPrivateHosts = false;

    // Maintenance
    private Duration staleThreshold = Duration.ofSeconds(600);
    private Duration staleRetryDelay = Duration.ofSeconds(30);
    private Duration retention = Duration.ofDays(7);
    private int cleanupBatchSize = 100;
    private Duration maintenanceInterval = Duration.ofSeconds(30);
    private Duration orphanThreshold = Duration.ofSeconds(30);

    private OrchestratorConfig() {
    }

    public static OrchestratorConfig defaults() {
        return new OrchestratorConfig();
    }

    public static OrchestratorConfig fromEnv() {
        OrchestratorConfig config;

        String iniPath = System.getenv("AGENTHUB_CONFIG");
        if (iniPath != null && !iniPath.isBlank()) {
            config = fromIni(new File(iniPath));
        } else {
            config = new OrchestratorConfig();
        }

        // Environment variables override the file
        String dbUrl = System.getenv("AGENTHUB_DB_URL");
        if (dbUrl != null && !dbUrl.isBlank()) {
            config.databaseUrl = dbUrl;
        }

        String port = System.getenv("AGENTHUB_PORT");
        if (port != null && !port.isBlank()) {
            config.serverPort = Integer.parseInt(port);
        }

        String workers = System.getenv("AGENTHUB_WORKERS");
        if (workers != null && !workers.isBlank()) {
            config.workerCount = Integer.parseInt(workers);
        }

        String maxAttempts = System.getenv("AGENTHUB_MAX_ATTEMPTS");
        if (maxAttempts != null && !maxAttempts.isBlank()) {
            config.defaultMaxAttempts = Integer.parseInt(maxAttempts);
        }

        String apiKey = System.getenv("AGENTHUB_API_KEY");
        if (apiKey != null && !apiKey.isBlank()) {
            config.apiKey = apiKey;
        }

        String secret = System.getenv("AGENTHUB_WEBHOOK_SECRET");
        if (secret != null && !secret.isBlank()) {
            config.webhookSecret = secret;
        }

        return config;
    }

    /**
     * Load settings from an INI file. Sections: [server], [database], [workers],
     * [retry], [stream], [webhook], [maintenance]. Durations are in seconds.
     */
    public static OrchestratorConfig fromIni(File file) {
        Ini ini;
        try {
            ini = new Ini(file);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read config file: " + file, e);
        }

        OrchestratorConfig config = new OrchestratorConfig();

        Profile.Section server = ini.get("server");
        if (server != null) {
            config.serverHost = opt(server, "host", config.serverHost);
            config.serverPort = optInt(server, "port", config.serverPort);
            config.handlerThreads = optInt(server, "handler_threads", config.handlerThreads);
            config.apiKey = opt(server, "api_key", config.apiKey);
        }

        Profile.Section database = ini.get("database");
        if (database != null) {
            config.databaseUrl = opt(database, "url", config.databaseUrl);
            config.databasePoolSize = optInt(database, "pool_size", config.databasePoolSize);
        }

        Profile.Section workers = ini.get("workers");
        if (workers != null) {
            config.workerCount = optInt(workers, "count", config.workerCount);
            config.queueCapacity = optInt(workers, "queue_capacity", config.queueCapacity);
            config.defaultSyncTimeout = optSeconds(workers, "sync_timeout", config.defaultSyncTimeout);
        }

        Profile.Section retry = ini.get("retry");
        if (retry != null) {
            config.defaultMaxAttempts = optInt(retry, "max_attempts", config.defaultMaxAttempts);
            config.retryBaseDelay = optSeconds(retry, "base_delay", config.retryBaseDelay);
            config.retryMaxDelay = optSeconds(retry, "max_delay", config.retryMaxDelay);
            config.retryJitter = optDouble(retry, "jitter", config.retryJitter);
            config.idempotencyTtl = optSeconds(retry, "idempotency_ttl", config.idempotencyTtl);
        }

        Profile.Section stream = ini.get("stream");
        if (stream != null) {
            config.streamHeartbeat = optSeconds(stream, "heartbeat", config.streamHeartbeat);
            config.streamThreads = optInt(stream, "threads", config.streamThreads);
        }

        Profile.Section webhook = ini.get("webhook");
        if (webhook != null) {
            config.webhookTimeout = optSeconds(webhook, "timeout", config.webhookTimeout);
            config.webhookMaxAttempts = optInt(webhook, "max_attempts", config.webhookMaxAttempts);
            config.webhookInitialBackoff = optSeconds(webhook, "initial_backoff", config.webhookInitialBackoff);
            config.webhookSecret = opt(webhook, "secret", config.webhookSecret);
            config.webhookAllowPrivateHosts = Boolean.parseBoolean(
                    opt(webhook, "allow_private_hosts", String.valueOf(config.webhookAllowPrivateHosts)));
        }

        Profile.Section maintenance = ini.get("maintenance");
        if (maintenance != null) {
            config.staleThreshold = optSeconds(maintenance, "stale_threshold", config.staleThreshold);
            config.staleRetryDelay = optSeconds(maintenance, "stale_retry_delay", config.staleRetryDelay);
            config.retention = optSeconds(maintenance, "retention", config.retention);
            config.cleanupBatchSize = optInt(maintenance, "cleanup_batch_size", config.cleanupBatchSize);
            config.maintenanceInterval = optSeconds(maintenance, "interval", config.maintenanceInterval);
            config.orphanThreshold = optSeconds(maintenance, "orphan_threshold", config.orphanThreshold);
        }

        return config;
    }

    private static String opt(Profile.Section section, String key, String fallback) {
        String value = section.get(key);
        return value == null || value.isBlank() ? fallback : value.trim();
    }

    private static int optInt(Profile.Section section, String key, int fallback) {
        String value = section.get(key);
        return value == null || value.isBlank() ? fallback : Integer.parseInt(value.trim());
    }

    private static double optDouble(Profile.Section section, String key, double fallback) {
        String value = section.get(key);
        return value == null || value.isBlank() ? fallback : Double.parseDouble(value.trim());
    }

    private static Duration optSeconds(Profile.Section section, String key, Duration fallback) {
        String value = section.get(key);
        if (value == null || value.isBlank()) {
            return fallback;
        }
        return Duration.ofMillis(Math.round(Double.parseDouble(value.trim()) * 1000));
    }

    // Getters
    public String databaseUrl() {
        return databaseUrl;
    }

    public int databasePoolSize() {
        return databasePoolSize;
    }

    public int serverPort() {
        return serverPort;
    }

    public String serverHost() {
        return serverHost;
    }

    public int handlerThreads() {
        return handlerThreads;
    }

    public String apiKey() {
        return apiKey;
    }

    public boolean hasApiKey() {
        return apiKey != null && !apiKey.isBlank();
    }

    public int workerCount() {
        return workerCount;
    }

    public int queueCapacity() {
        return queueCapacity;
    }

    public int defaultMaxAttempts() {
        return defaultMaxAttempts;
    }

    public int conflictRetries() {
        return conflictRetries;
    }

    public Duration defaultSyncTimeout() {
        return defaultSyncTimeout;
    }

    public Duration retryBaseDelay() {
        return retryBaseDelay;
    }

    public Duration retryMaxDelay() {
        return retryMaxDelay;
    }

    public double retryJitter() {
        return retryJitter;
    }

    public Duration idempotencyTtl() {
        return idempotencyTtl;
    }

    public Duration streamHeartbeat() {
        return streamHeartbeat;
    }

    public int streamThreads() {
        return streamThreads;
    }

    public Duration webhookTimeout() {
        return webhookTimeout;
    }

    public int webhookMaxAttempts() {
        return webhookMaxAttempts;
    }

    public Duration webhookInitialBackoff() {
        return webhookInitialBackoff;
    }

    public String webhookSecret() {
        return webhookSecret;
    }

    public boolean webhookAllowPrivateHosts() {
        return webhookAllowPrivateHosts;
    }

    public Duration staleThreshold() {
        return staleThreshold;
    }

    public Duration staleRetryDelay() {
        return staleRetryDelay;
    }

    public Duration retention() {
        return retention;
    }

    public int cleanupBatchSize() {
        return cleanupBatchSize;
    }

    public Duration maintenanceInterval() {
        return maintenanceInterval;
    }

    public Duration orphanThreshold() {
        return orphanThreshold;
    }

    // Fluent setters for testing/customization
    public OrchestratorConfig withDatabaseUrl(String url) {
        this.databaseUrl = url;
        return this;
    }

    public OrchestratorConfig withServerPort(int port) {
        this.serverPort = port;
        return this;
    }

    public OrchestratorConfig withHandlerThreads(int threads) {
        this.handlerThreads = threads;
        return this;
    }

    public OrchestratorConfig withApiKey(String key) {
        this.apiKey = key;
        return this;
    }

    public OrchestratorConfig withWorkerCount(int count) {
        this.workerCount = count;
        return this;
    }

    public OrchestratorConfig withQueueCapacity(int capacity) {
        this.queueCapacity = capacity;
        return this;
    }

    public OrchestratorConfig withMaxAttempts(int attempts) {
        this.defaultMaxAttempts = attempts;
        return this;
    }

    public OrchestratorConfig withRetryDelays(Duration base, Duration max, double jitter) {
        this.retryBaseDelay = base;
        this.retryMaxDelay = max;
        this.retryJitter = jitter;
        return this;
    }

    public OrchestratorConfig withIdempotencyTtl(Duration ttl) {
        this.idempotencyTtl = ttl;
        return this;
    }

    public OrchestratorConfig withStreamHeartbeat(Duration heartbeat) {
        this.streamHeartbeat = heartbeat;
        return this;
    }

    public OrchestratorConfig withWebhook(Duration timeout, int maxAttempts, Duration initialBackoff) {
        this.webhookTimeout = timeout;
        this.webhookMaxAttempts = maxAttempts;
        this.webhookInitialBackoff = initialBackoff;
        return this;
    }

    public OrchestratorConfig withWebhookSecret(String secret) {
        this.webhookSecret = secret;
        return this;
    }

    public OrchestratorConfig withWebhookAllowPrivateHosts(boolean allow) {
        this.webhookAllowPrivateHosts = allow;
        return this;
    }

    public OrchestratorConfig withStaleThreshold(Duration threshold) {
        this.staleThreshold = threshold;
        return this;
    }

    public OrchestratorConfig withStaleRetryDelay(Duration delay) {
        this.staleRetryDelay = delay;
        return this;
    }

    public OrchestratorConfig withRetention(Duration retention) {
        this.retention = retention;
        return this;
    }

    public OrchestratorConfig withOrphanThreshold(Duration threshold) {
        this.orphanThreshold = threshold;
        return this;
    }

    @Override
    public String toString() {
        return "OrchestratorConfig{" +
                "databaseUrl='" + databaseUrl + '\'' +
                ", serverPort=" + serverPort +
                ", workers=" + workerCount +
                ", queueCapacity=" + queueCapacity +
                ", maxAttempts=" + defaultMaxAttempts +
                ", apiKeySet=" + hasApiKey() +
                '}';
    }
}

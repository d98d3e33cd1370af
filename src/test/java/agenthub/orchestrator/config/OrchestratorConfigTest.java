package agenthub.orchestrator.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class OrchestratorConfigTest {

    @Test
    void defaults() {
        OrchestratorConfig config = OrchestratorConfig.defaults();

        assertEquals(8080, config.serverPort());
        assertEquals(4, config.workerCount());
        assertEquals(3, config.defaultMaxAttempts());
        assertEquals(Duration.ofSeconds(5), config.retryBaseDelay());
        assertEquals(Duration.ofSeconds(300), config.retryMaxDelay());
        assertEquals(Duration.ofHours(24), config.idempotencyTtl());
        assertEquals(Duration.ofDays(7), config.retention());
        assertFalse(config.hasApiKey());
        assertFalse(config.webhookAllowPrivateHosts());
    }

    @Test
    void loadsIniSections(@TempDir Path dir) throws Exception {
        Path ini = dir.resolve("agenthub.ini");
        Files.writeString(ini, String.join("\n",
                "[server]",
                "port = 9090",
                "api_key = secret-key",
                "",
                "[database]",
                "url = jdbc:h2:mem:from-ini",
                "",
                "[workers]",
                "count = 8",
                "queue_capacity = 50",
                "sync_timeout = 2.5",
                "",
                "[retry]",
                "max_attempts = 5",
                "base_delay = 0.5",
                "jitter = 0",
                "",
                "[webhook]",
                "secret = hook-secret",
                "allow_private_hosts = true",
                "",
                "[maintenance]",
                "retention = 3600",
                "orphan_threshold = 10",
                ""));

        OrchestratorConfig config = OrchestratorConfig.fromIni(ini.toFile());

        assertEquals(9090, config.serverPort());
        assertEquals("secret-key", config.apiKey());
        assertTrue(config.hasApiKey());
        assertEquals("jdbc:h2:mem:from-ini", config.databaseUrl());
        assertEquals(8, config.workerCount());
        assertEquals(50, config.queueCapacity());
        assertEquals(Duration.ofMillis(2500), config.defaultSyncTimeout());
        assertEquals(5, config.defaultMaxAttempts());
        assertEquals(Duration.ofMillis(500), config.retryBaseDelay());
        assertEquals(0.0, config.retryJitter());
        assertEquals("hook-secret", config.webhookSecret());
        assertTrue(config.webhookAllowPrivateHosts());
        assertEquals(Duration.ofHours(1), config.retention());
        assertEquals(Duration.ofSeconds(10), config.orphanThreshold());
        // untouched sections keep defaults
        assertEquals(Duration.ofSeconds(15), config.streamHeartbeat());
    }

    @Test
    void missingFileFails() {
        assertThrows(UncheckedIOException.class,
                () -> OrchestratorConfig.fromIni(new File("/nonexistent/agenthub.ini")));
    }

    @Test
    void withersOverride() {
        OrchestratorConfig config = OrchestratorConfig.defaults()
                .withServerPort(0)
                .withRetryDelays(Duration.ofMillis(10), Duration.ofMillis(50), 0.1)
                .withApiKey("k");

        assertEquals(0, config.serverPort());
        assertEquals(Duration.ofMillis(10), config.retryBaseDelay());
        assertEquals(Duration.ofMillis(50), config.retryMaxDelay());
        assertEquals(0.1, config.retryJitter());
        assertEquals("k", config.apiKey());
    }
}

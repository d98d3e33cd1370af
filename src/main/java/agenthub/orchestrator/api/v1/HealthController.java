package agenthub.orchestrator.api.v1;

import agenthub.orchestrator.api.Controller;
import agenthub.orchestrator.api.v1.dto.HealthResponse;
import agenthub.orchestrator.model.TaskStats;
import agenthub.orchestrator.service.StatsService;
import agenthub.orchestrator.store.Database;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.management.ManagementFactory;
import java.time.Duration;

/**
 * Health check controller.
 * GET /api/v1/health
 */
public class HealthController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(HealthController.class);
    public static final String VERSION = "1.0.0";
    public static final String PATH = "/api/v1/health";

    private final Database database;
    private final StatsService statsService;

    public HealthController(Database database, StatsService statsService) {
        this.database = database;
        this.statsService = statsService;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return method.equals(HttpMethod.GET) && PATH.equals(path);
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        if (!database.isHealthy()) {
            return ControllerResponse.json(HttpResponseStatus.SERVICE_UNAVAILABLE,
                    HealthResponse.unhealthy("connection failed"));
        }

        try {
            TaskStats stats = statsService.taskStats();
            return ControllerResponse.json(
                    HealthResponse.healthy(formatUptime(), VERSION, stats.pending(), stats.running()));
        } catch (RuntimeException e) {
            log.error("Health check failed", e);
            return ControllerResponse.json(HttpResponseStatus.SERVICE_UNAVAILABLE,
                    HealthResponse.unhealthy(e.getMessage()));
        }
    }

    private String formatUptime() {
        long uptimeMs = ManagementFactory.getRuntimeMXBean().getUptime();
        Duration duration = Duration.ofMillis(uptimeMs);
        long hours = duration.toHours();
        long minutes = duration.toMinutesPart();
        return hours + "h " + minutes + "m";
    }
}

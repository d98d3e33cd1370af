package agenthub.orchestrator.api.v1;

import agenthub.orchestrator.api.Controller;
import agenthub.orchestrator.api.v1.dto.StatsResponse;
import agenthub.orchestrator.service.StatsService;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;

/**
 * Task counts, queue depth and worker usage.
 * GET /api/v1/stats
 */
public class StatsController implements Controller {

    private final StatsService statsService;

    public StatsController(StatsService statsService) {
        this.statsService = statsService;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return method.equals(HttpMethod.GET) && "/api/v1/stats".equals(path);
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        return ControllerResponse.json(StatsResponse.from(statsService.snapshot()));
    }
}

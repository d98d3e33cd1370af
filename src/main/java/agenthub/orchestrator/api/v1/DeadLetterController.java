package agenthub.orchestrator.api.v1;

import agenthub.orchestrator.api.Controller;
import agenthub.orchestrator.api.QueryParams;
import agenthub.orchestrator.api.v1.dto.DeadLetterResponse;
import agenthub.orchestrator.api.v1.dto.TaskResponse;
import agenthub.orchestrator.service.DeadLetterService;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Dead letter queue inspection and requeue.
 *
 * GET    /api/v1/dead-letter?limit=            - List entries
 * GET    /api/v1/dead-letter/{taskId}          - Get entry
 * DELETE /api/v1/dead-letter/{taskId}          - Discard entry
 * POST   /api/v1/dead-letter/{taskId}/requeue  - Requeue as a new task
 */
public class DeadLetterController implements Controller {

    private static final Pattern LIST_PATTERN = Pattern.compile("^/api/v1/dead-letter/?$");
    private static final Pattern ENTRY_PATTERN = Pattern.compile("^/api/v1/dead-letter/([^/]+)$");
    private static final Pattern REQUEUE_PATTERN = Pattern.compile("^/api/v1/dead-letter/([^/]+)/requeue$");

    private final DeadLetterService deadLetterService;

    public DeadLetterController(DeadLetterService deadLetterService) {
        this.deadLetterService = deadLetterService;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        if (method.equals(HttpMethod.GET)) {
            return LIST_PATTERN.matcher(path).matches() || ENTRY_PATTERN.matcher(path).matches();
        }
        if (method.equals(HttpMethod.DELETE)) {
            return ENTRY_PATTERN.matcher(path).matches();
        }
        return method.equals(HttpMethod.POST) && REQUEUE_PATTERN.matcher(path).matches();
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        if (LIST_PATTERN.matcher(path).matches()) {
            int limit = QueryParams.of(req.uri()).intValue("limit", 100, 1, 500);
            return ControllerResponse.json(
                    DeadLetterResponse.Page.from(deadLetterService.list(limit), deadLetterService.count()));
        }

        Matcher matcher = REQUEUE_PATTERN.matcher(path);
        if (matcher.matches()) {
            return ControllerResponse.json(HttpResponseStatus.ACCEPTED,
                    TaskResponse.from(deadLetterService.requeue(matcher.group(1))));
        }

        matcher = ENTRY_PATTERN.matcher(path);
        if (matcher.matches()) {
            String taskId = matcher.group(1);
            if (req.method().equals(HttpMethod.DELETE)) {
                deadLetterService.delete(taskId);
                return ControllerResponse.noContent();
            }
            return ControllerResponse.json(DeadLetterResponse.from(deadLetterService.get(taskId)));
        }

        throw new IllegalStateException("unmatched dead letter route: " + path);
    }
}

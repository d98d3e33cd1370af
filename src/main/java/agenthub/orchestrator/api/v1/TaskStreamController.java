package agenthub.orchestrator.api.v1;

import agenthub.orchestrator.api.Controller;
import agenthub.orchestrator.api.QueryParams;
import agenthub.orchestrator.events.ProgressStreamer;
import agenthub.orchestrator.events.StreamMessage;
import agenthub.orchestrator.events.StreamSink;
import agenthub.orchestrator.events.Subscription;
import agenthub.orchestrator.service.TaskService;
import io.netty.buffer.Unpooled;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.DefaultHttpContent;
import io.netty.handler.codec.http.DefaultHttpResponse;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpHeaderValues;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponse;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.LastHttpContent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static io.netty.handler.codec.http.HttpVersion.HTTP_1_1;

/**
 * Server-sent event stream of a task's progress.
 * GET /api/v1/tasks/{taskId}/stream?pollInterval=&timeout=
 */
public class TaskStreamController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(TaskStreamController.class);

    private static final Pattern STREAM_PATTERN = Pattern.compile("^/api/v1/tasks/([^/]+)/stream$");

    private final TaskService taskService;
    private final ProgressStreamer streamer;

    public TaskStreamController(TaskService taskService, ProgressStreamer streamer) {
        this.taskService = taskService;
        this.streamer = streamer;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return method.equals(HttpMethod.GET) && STREAM_PATTERN.matcher(path).matches();
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        Matcher matcher = STREAM_PATTERN.matcher(path);
        if (!matcher.matches()) {
            throw new IllegalStateException("unmatched stream route: " + path);
        }
        String taskId = matcher.group(1);

        QueryParams params = QueryParams.of(req.uri());
        Duration pollInterval = seconds(params.doubleValue("pollInterval", 0.5, 0.1, 5.0));
        Duration timeout = seconds(params.doubleValue("timeout", 300, 10, 600));

        // 404 while a normal response is still possible
        taskService.get(taskId);

        Channel channel = ctx.channel();
        HttpResponse response = new DefaultHttpResponse(HTTP_1_1, HttpResponseStatus.OK);
        response.headers().set(HttpHeaderNames.CONTENT_TYPE, "text/event-stream; charset=utf-8");
        response.headers().set(HttpHeaderNames.CACHE_CONTROL, HttpHeaderValues.NO_CACHE);
        response.headers().set(HttpHeaderNames.TRANSFER_ENCODING, HttpHeaderValues.CHUNKED);
        channel.writeAndFlush(response);

        Subscription subscription = streamer.subscribe(taskId, pollInterval, timeout, new ChannelSink(channel));
        channel.closeFuture().addListener(f -> subscription.cancel());
        log.debug("Streaming task {} to {}", taskId, channel.remoteAddress());
        return ControllerResponse.detachedResponse();
    }

    private static Duration seconds(double value) {
        return Duration.ofMillis(Math.round(value * 1000));
    }

    /**
     * Writes SSE frames as HTTP chunks; ends the response and closes the channel.
     */
    static final class ChannelSink implements StreamSink {

        private final Channel channel;

        ChannelSink(Channel channel) {
            this.channel = channel;
        }

        @Override
        public boolean send(StreamMessage message) {
            if (!channel.isActive()) {
                return false;
            }
            channel.writeAndFlush(new DefaultHttpContent(
                    Unpooled.copiedBuffer(message.toSseFrame(), StandardCharsets.UTF_8)));
            return true;
        }

        @Override
        public void close() {
            if (channel.isActive()) {
                channel.writeAndFlush(LastHttpContent.EMPTY_LAST_CONTENT).addListener(ChannelFutureListener.CLOSE);
            }
        }
    }
}

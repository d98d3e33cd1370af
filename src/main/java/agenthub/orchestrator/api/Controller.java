package agenthub.orchestrator.api;

import agenthub.orchestrator.core.Json;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;

import java.util.concurrent.CompletionStage;

/**
 * Base interface for HTTP controllers.
 * Controllers handle specific URL patterns and HTTP methods.
 * <p>
 * Handlers throw domain exceptions; the router maps them to error responses.
 */
public interface Controller {

    /**
     * Check if this controller can handle the given request.
     *
     * @param method HTTP method
     * @param path   Request path (without query string)
     * @return true if this controller handles this request
     */
    boolean matches(HttpMethod method, String path);

    /**
     * Handle the request.
     *
     * @param ctx  Netty channel context
     * @param req  Full HTTP request
     * @param path Request path (without query string)
     * @return Response to send back
     */
    ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) throws Exception;

    /**
     * Response from a controller. A detached response means the controller has
     * taken over the channel (streaming) and the router writes nothing. A deferred
     * response is written by the router once {@code pending} completes; a failed
     * stage is mapped to an error response like a thrown exception.
     */
    record ControllerResponse(
            HttpResponseStatus status,
            String contentType,
            String body,
            boolean detached,
            CompletionStage<ControllerResponse> pending) {

        public ControllerResponse(HttpResponseStatus status, String contentType, String body) {
            this(status, contentType, body, false, null);
        }

        public boolean isDeferred() {
            return pending != null;
        }

        public static ControllerResponse json(Object value) {
            return json(HttpResponseStatus.OK, value);
        }

        public static ControllerResponse json(HttpResponseStatus status, Object value) {
            return new ControllerResponse(status, "application/json", Json.write(value));
        }

        public static ControllerResponse text(String body) {
            return new ControllerResponse(HttpResponseStatus.OK, "text/plain", body);
        }

        public static ControllerResponse noContent() {
            return new ControllerResponse(HttpResponseStatus.NO_CONTENT, "application/json", "");
        }

        public static ControllerResponse detachedResponse() {
            return new ControllerResponse(HttpResponseStatus.OK, "text/event-stream", null, true, null);
        }

        public static ControllerResponse deferred(CompletionStage<ControllerResponse> pending) {
            return new ControllerResponse(null, null, null, false, pending);
        }
    }
}

package agenthub.orchestrator.server;

import agenthub.orchestrator.api.Controller;
import agenthub.orchestrator.api.Controller.ControllerResponse;
import agenthub.orchestrator.api.v1.HealthController;
import agenthub.orchestrator.api.v1.dto.ErrorResponse;
import agenthub.orchestrator.core.Json;
import agenthub.orchestrator.error.ConflictException;
import agenthub.orchestrator.error.InvalidStateException;
import agenthub.orchestrator.error.NotFoundException;
import agenthub.orchestrator.error.OrchestratorException;
import agenthub.orchestrator.error.QueueFullException;
import agenthub.orchestrator.error.ValidationException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.exc.MismatchedInputException;
import io.netty.buffer.Unpooled;
import io.netty.channel.ChannelHandler.Sharable;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.http.DefaultFullHttpResponse;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.List;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;

import static io.netty.handler.codec.http.HttpHeaderNames.CONTENT_TYPE;
import static io.netty.handler.codec.http.HttpResponseStatus.BAD_REQUEST;
import static io.netty.handler.codec.http.HttpResponseStatus.CONFLICT;
import static io.netty.handler.codec.http.HttpResponseStatus.INTERNAL_SERVER_ERROR;
import static io.netty.handler.codec.http.HttpResponseStatus.NOT_FOUND;
import static io.netty.handler.codec.http.HttpResponseStatus.SERVICE_UNAVAILABLE;
import static io.netty.handler.codec.http.HttpResponseStatus.UNAUTHORIZED;
import static io.netty.handler.codec.http.HttpResponseStatus.UNPROCESSABLE_ENTITY;
import static io.netty.handler.codec.http.HttpVersion.HTTP_1_1;

/**
 * Central router that dispatches HTTP requests to registered controllers.
 * <p>
 * Controllers throw domain exceptions; this handler maps them to status codes and
 * the JSON error body in one place. When an API key is configured every
 * {@code /api/} request except the health check must carry it in {@code X-Api-Key}.
 * <p>
 * This handler is @Sharable because it has no per-channel state.
 */
@Sharable
public class RouterHandler extends SimpleChannelInboundHandler<FullHttpRequest> {

    private static final Logger log = LoggerFactory.getLogger(RouterHandler.class);

    public static final String API_KEY_HEADER = "X-Api-Key";

    private final List<Controller> controllers = new CopyOnWriteArrayList<>();
    private final String apiKey;

    /**
     * @param apiKey required key, or null to disable the check
     */
    public RouterHandler(String apiKey) {
        this.apiKey = apiKey == null || apiKey.isBlank() ? null : apiKey;
    }

    /**
     * Register a controller to handle requests.
     * Controllers are checked in order of registration.
     */
    public RouterHandler registerController(Controller controller) {
        controllers.add(controller);
        log.debug("Registered controller: {}", controller.getClass().getSimpleName());
        return this;
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, FullHttpRequest req) {
        String uri = req.uri();
        HttpMethod method = req.method();
        String path = uri.contains("?") ? uri.substring(0, uri.indexOf('?')) : uri;

        try {
            if (!checkAuth(req, path)) {
                log.warn("Auth failed for {} {}", method, path);
                writeError(ctx, UNAUTHORIZED, ErrorResponse.of("UNAUTHORIZED", "missing or invalid API key"));
                return;
            }

            for (Controller controller : controllers) {
                if (controller.matches(method, path)) {
                    ControllerResponse response = controller.handle(ctx, req, path);
                    if (response.isDeferred()) {
                        response.pending().whenComplete((done, error) -> {
                            if (error != null) {
                                writeFailure(ctx, method, path, unwrap(error));
                            } else {
                                writeResponse(ctx, done);
                            }
                        });
                    } else {
                        writeResponse(ctx, response);
                    }
                    return;
                }
            }

            log.debug("No handler for: {} {}", method, path);
            writeError(ctx, NOT_FOUND, ErrorResponse.of("NOT_FOUND", "no route for " + method + " " + path));

        } catch (Exception e) {
            writeFailure(ctx, method, path, e);
        }
    }

    private void writeResponse(ChannelHandlerContext ctx, ControllerResponse response) {
        if (!response.detached()) {
            writeSafe(ctx, response.status(), response.contentType(), response.body());
        }
    }

    /**
     * Map a controller failure to its status code and error body.
     */
    private void writeFailure(ChannelHandlerContext ctx, HttpMethod method, String path, Throwable failure) {
        Throwable e = failure instanceof MismatchedInputException mismatch ? toValidation(mismatch) : failure;

        if (e instanceof ValidationException validation) {
            log.debug("Validation error on {} {}: {}", method, path, validation.getMessage());
            writeError(ctx, UNPROCESSABLE_ENTITY, ErrorResponse.of(validation));
        } else if (e instanceof OrchestratorException orchestratorError) {
            HttpResponseStatus status = statusOf(orchestratorError);
            log.debug("{} {} -> {} {}", method, path, status.code(), orchestratorError.getMessage());
            writeError(ctx, status, ErrorResponse.of(orchestratorError.code(), orchestratorError.getMessage()));
        } else if (e instanceof JsonProcessingException json) {
            log.debug("Malformed JSON on {} {}: {}", method, path, json.getOriginalMessage());
            writeError(ctx, BAD_REQUEST, ErrorResponse.of("INVALID_JSON", "malformed JSON: " + json.getOriginalMessage()));
        } else if (e instanceof InterruptedException) {
            Thread.currentThread().interrupt();
            writeError(ctx, SERVICE_UNAVAILABLE, ErrorResponse.of("INTERRUPTED", "server is shutting down"));
        } else {
            log.error("Handler error: {} {}", method, path, e);
            writeError(ctx, INTERNAL_SERVER_ERROR, ErrorResponse.of("INTERNAL_ERROR", "internal error"));
        }
    }

    /**
     * Well-formed JSON whose values do not fit the request type is a validation
     * error on the offending field.
     */
    static ValidationException toValidation(MismatchedInputException e) {
        StringBuilder field = new StringBuilder();
        for (JsonMappingException.Reference ref : e.getPath()) {
            if (ref.getFieldName() != null) {
                if (field.length() > 0) {
                    field.append('.');
                }
                field.append(ref.getFieldName());
            } else if (ref.getIndex() >= 0) {
                field.append('[').append(ref.getIndex()).append(']');
            }
        }
        String message = e.getTargetType() != null
                ? "cannot be read as " + e.getTargetType().getSimpleName()
                : "has an invalid value";
        return new ValidationException(field.length() > 0 ? field.toString() : "body", message);
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    static HttpResponseStatus statusOf(OrchestratorException e) {
        if (e instanceof ValidationException) {
            return UNPROCESSABLE_ENTITY;
        }
        if (e instanceof NotFoundException) {
            return NOT_FOUND;
        }
        if (e instanceof ConflictException) {
            return CONFLICT;
        }
        if (e instanceof InvalidStateException) {
            return BAD_REQUEST;
        }
        if (e instanceof QueueFullException) {
            return SERVICE_UNAVAILABLE;
        }
        return INTERNAL_SERVER_ERROR;
    }

    private boolean checkAuth(FullHttpRequest req, String path) {
        if (apiKey == null) {
            return true;
        }
        if (!path.startsWith("/api/") || HealthController.PATH.equals(path)) {
            return true;
        }
        String providedKey = req.headers().get(API_KEY_HEADER);
        return providedKey != null && MessageDigest.isEqual(
                apiKey.getBytes(StandardCharsets.UTF_8), providedKey.getBytes(StandardCharsets.UTF_8));
    }

    private void writeError(ChannelHandlerContext ctx, HttpResponseStatus status, ErrorResponse error) {
        writeSafe(ctx, status, "application/json", Json.write(error));
    }

    /**
     * Safe write that catches any exceptions during response writing.
     */
    private void writeSafe(ChannelHandlerContext ctx, HttpResponseStatus status, String contentType, String body) {
        try {
            byte[] bytes = (body == null ? "" : body).getBytes(StandardCharsets.UTF_8);
            FullHttpResponse response = new DefaultFullHttpResponse(HTTP_1_1, status, Unpooled.wrappedBuffer(bytes));
            response.headers().set(CONTENT_TYPE, contentType + "; charset=utf-8");
            response.headers().setInt(HttpHeaderNames.CONTENT_LENGTH, bytes.length);
            ctx.writeAndFlush(response);
        } catch (RuntimeException e) {
            log.error("Failed to write response: {}", e.getMessage(), e);
            ctx.close();
        }
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        log.error("Unhandled exception in channel: {}", cause.getMessage(), cause);
        ctx.close();
    }
}

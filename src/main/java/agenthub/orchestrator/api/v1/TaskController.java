package agenthub.orchestrator.api.v1;

import agenthub.orchestrator.api.Controller;
import agenthub.orchestrator.api.QueryParams;
import agenthub.orchestrator.api.v1.dto.CancelRequest;
import agenthub.orchestrator.api.v1.dto.SubmitTaskRequest;
import agenthub.orchestrator.api.v1.dto.TaskEventResponse;
import agenthub.orchestrator.api.v1.dto.TaskListResponse;
import agenthub.orchestrator.api.v1.dto.TaskResponse;
import agenthub.orchestrator.core.Json;
import agenthub.orchestrator.error.ValidationException;
import agenthub.orchestrator.model.CancelOutcome;
import agenthub.orchestrator.model.CancelResult;
import agenthub.orchestrator.model.SubmitResult;
import agenthub.orchestrator.model.Task;
import agenthub.orchestrator.model.TaskFilter;
import agenthub.orchestrator.model.TaskStatus;
import agenthub.orchestrator.service.TaskService;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Controller for task management (public API).
 *
 * POST   /api/v1/tasks                  - Submit a task (optionally waiting for it)
 * GET    /api/v1/tasks                  - List tasks
 * GET    /api/v1/tasks/{taskId}         - Get task status
 * DELETE /api/v1/tasks/{taskId}         - Delete a terminal task
 * GET    /api/v1/tasks/{taskId}/events  - Event trail
 * POST   /api/v1/tasks/{taskId}/cancel  - Cancel a task
 * POST   /api/v1/tasks/{taskId}/retry   - Retry a failed task
 */
public class TaskController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(TaskController.class);

    public static final String IDEMPOTENCY_HEADER = "X-Idempotency-Key";

    private static final Pattern TASKS_PATTERN = Pattern.compile("^/api/v1/tasks/?$");
    private static final Pattern TASK_BY_ID_PATTERN = Pattern.compile("^/api/v1/tasks/([^/]+)$");
    private static final Pattern TASK_EVENTS_PATTERN = Pattern.compile("^/api/v1/tasks/([^/]+)/events$");
    private static final Pattern TASK_CANCEL_PATTERN = Pattern.compile("^/api/v1/tasks/([^/]+)/cancel$");
    private static final Pattern TASK_RETRY_PATTERN = Pattern.compile("^/api/v1/tasks/([^/]+)/retry$");

    private final TaskService taskService;
    private final Duration defaultSyncTimeout;

    public TaskController(TaskService taskService, Duration defaultSyncTimeout) {
        this.taskService = taskService;
        this.defaultSyncTimeout = defaultSyncTimeout;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        if (method.equals(HttpMethod.POST)) {
            return TASKS_PATTERN.matcher(path).matches()
                    || TASK_CANCEL_PATTERN.matcher(path).matches()
                    || TASK_RETRY_PATTERN.matcher(path).matches();
        }
        if (method.equals(HttpMethod.GET)) {
            return TASKS_PATTERN.matcher(path).matches()
                    || TASK_BY_ID_PATTERN.matcher(path).matches()
                    || TASK_EVENTS_PATTERN.matcher(path).matches();
        }
        if (method.equals(HttpMethod.DELETE)) {
            return TASK_BY_ID_PATTERN.matcher(path).matches();
        }
        return false;
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) throws Exception {
        HttpMethod method = req.method();

        if (TASKS_PATTERN.matcher(path).matches()) {
            return method.equals(HttpMethod.POST) ? handleSubmit(ctx, req) : handleList(req);
        }

        Matcher matcher = TASK_EVENTS_PATTERN.matcher(path);
        if (matcher.matches()) {
            return handleEvents(req, matcher.group(1));
        }

        matcher = TASK_CANCEL_PATTERN.matcher(path);
        if (matcher.matches()) {
            return handleCancel(req, matcher.group(1));
        }

        matcher = TASK_RETRY_PATTERN.matcher(path);
        if (matcher.matches()) {
            return handleRetry(matcher.group(1));
        }

        matcher = TASK_BY_ID_PATTERN.matcher(path);
        if (matcher.matches()) {
            String taskId = matcher.group(1);
            if (method.equals(HttpMethod.DELETE)) {
                taskService.delete(taskId);
                return ControllerResponse.noContent();
            }
            return ControllerResponse.json(TaskResponse.from(taskService.get(taskId)));
        }

        throw new IllegalStateException("unmatched task route: " + method + " " + path);
    }

    /**
     * POST /api/v1/tasks
     * <p>
     * A sync submission never blocks the handler thread: the response is written
     * when the task's completion signal fires or the sync timeout elapses.
     */
    private ControllerResponse handleSubmit(ChannelHandlerContext ctx, FullHttpRequest req) throws Exception {
        String body = req.content().toString(StandardCharsets.UTF_8);
        SubmitTaskRequest request = body.isBlank()
                ? null
                : Json.mapper().readValue(body, SubmitTaskRequest.class);
        if (request == null) {
            throw new ValidationException("body", "request body is required");
        }
        request.validate();

        String headerKey = req.headers().get(IDEMPOTENCY_HEADER);
        if (headerKey != null) {
            SubmitTaskRequest.validateHeaderKey(headerKey);
        }

        SubmitResult submitted = taskService.submit(request.toSubmission(headerKey));
        Task task = submitted.task();

        if (!request.isSync()) {
            HttpResponseStatus status = submitted.created() ? HttpResponseStatus.ACCEPTED : HttpResponseStatus.OK;
            return ControllerResponse.json(status, TaskResponse.from(task));
        }

        Duration timeout = request.syncTimeoutOr(defaultSyncTimeout);
        return ControllerResponse.deferred(taskService.whenTerminal(task.id(), timeout, ctx.executor())
                .thenApply(latest -> {
                    if (!latest.isTerminal()) {
                        log.debug("Sync wait for task {} timed out after {}s", task.id(), timeout.toSeconds());
                    }
                    HttpResponseStatus status = latest.isTerminal()
                            ? HttpResponseStatus.OK
                            : HttpResponseStatus.ACCEPTED;
                    return ControllerResponse.json(status, TaskResponse.from(latest));
                }));
    }

    /**
     * GET /api/v1/tasks?status=&agent_type=&user_id=&active_only=&limit=&offset=
     */
    private ControllerResponse handleList(FullHttpRequest req) {
        QueryParams params = QueryParams.of(req.uri());
        int limit = params.intValue("limit", 50, 1, 100);
        int offset = params.intValue("offset", 0, 0, Integer.MAX_VALUE);

        TaskStatus status = null;
        String rawStatus = params.string("status");
        if (rawStatus != null) {
            try {
                status = TaskStatus.parse(rawStatus);
            } catch (IllegalArgumentException e) {
                throw new ValidationException("status", "unknown status: " + rawStatus);
            }
        }

        TaskFilter filter = new TaskFilter(
                params.string("agent_type"),
                status,
                params.string("user_id"),
                params.bool("active_only"));

        return ControllerResponse.json(TaskListResponse.from(taskService.list(filter, limit, offset), limit, offset));
    }

    /**
     * GET /api/v1/tasks/{taskId}/events?limit=
     */
    private ControllerResponse handleEvents(FullHttpRequest req, String taskId) {
        int limit = QueryParams.of(req.uri()).intValue("limit", 100, 1, 500);
        return ControllerResponse.json(TaskEventResponse.Page.from(taskId, taskService.events(taskId, limit)));
    }

    /**
     * POST /api/v1/tasks/{taskId}/cancel
     */
    private ControllerResponse handleCancel(FullHttpRequest req, String taskId) throws Exception {
        String body = req.content().toString(StandardCharsets.UTF_8);
        CancelRequest request = body.isBlank()
                ? null
                : Json.mapper().readValue(body, CancelRequest.class);
        if (request == null) {
            request = CancelRequest.EMPTY;
        }
        request.validate();

        CancelOutcome outcome = taskService.cancel(taskId, request.isForce(), request.reason());
        HttpResponseStatus status = outcome.result() == CancelResult.CANCEL_REQUESTED
                ? HttpResponseStatus.ACCEPTED
                : HttpResponseStatus.OK;
        return ControllerResponse.json(status, TaskResponse.from(outcome.task()));
    }

    /**
     * POST /api/v1/tasks/{taskId}/retry
     */
    private ControllerResponse handleRetry(String taskId) {
        Task retried = taskService.retry(taskId);
        return ControllerResponse.json(HttpResponseStatus.ACCEPTED, TaskResponse.from(retried));
    }
}

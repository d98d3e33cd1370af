package agenthub.orchestrator.service;

import agenthub.orchestrator.config.OrchestratorConfig;
import agenthub.orchestrator.error.ConflictException;
import agenthub.orchestrator.error.NotFoundException;
import agenthub.orchestrator.error.NotRetryableException;
import agenthub.orchestrator.error.QueueFullException;
import agenthub.orchestrator.error.ValidationException;
import agenthub.orchestrator.events.EventBus;
import agenthub.orchestrator.idempotency.IdempotencyIndex;
import agenthub.orchestrator.model.CancelOutcome;
import agenthub.orchestrator.model.CancelResult;
import agenthub.orchestrator.model.DeadLetterEntry;
import agenthub.orchestrator.model.SubmitResult;
import agenthub.orchestrator.model.Task;
import agenthub.orchestrator.model.TaskEvent;
import agenthub.orchestrator.model.TaskFilter;
import agenthub.orchestrator.model.TaskIds;
import agenthub.orchestrator.model.TaskPage;
import agenthub.orchestrator.model.TaskStatus;
import agenthub.orchestrator.model.TaskSubmission;
import agenthub.orchestrator.repository.DeadLetterRepository;
import agenthub.orchestrator.repository.TaskRepository;
import agenthub.orchestrator.scheduler.ReadyQueue;
import agenthub.orchestrator.scheduler.RetryScheduler;
import agenthub.orchestrator.webhook.WebhookUrlValidator;
import agenthub.orchestrator.worker.WorkRegistry;
import agenthub.orchestrator.worker.WorkerPool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Service layer for client task operations: submission, lookup, cancellation,
 * retry and deletion.
 */
public class TaskService {

    private static final Logger log = LoggerFactory.getLogger(TaskService.class);

    private final TaskRepository taskRepository;
    private final DeadLetterRepository deadLetterRepository;
    private final IdempotencyIndex idempotencyIndex;
    private final ReadyQueue readyQueue;
    private final WorkRegistry workRegistry;
    private final WorkerPool workerPool;
    private final TaskExecutionService executionService;
    private final RetryScheduler retryScheduler;
    private final EventBus eventBus;
    private final WebhookUrlValidator webhookUrlValidator;
    private final ConflictRetry conflictRetry;
    private final OrchestratorConfig config;

    public TaskService(TaskRepository taskRepository,
            DeadLetterRepository deadLetterRepository,
            IdempotencyIndex idempotencyIndex,
            ReadyQueue readyQueue,
            WorkRegistry workRegistry,
            WorkerPool workerPool,
            TaskExecutionService executionService,
            RetryScheduler retryScheduler,
            EventBus eventBus,
            WebhookUrlValidator webhookUrlValidator,
            ConflictRetry conflictRetry,
            OrchestratorConfig config) {
        this.taskRepository = taskRepository;
        this.deadLetterRepository = deadLetterRepository;
        this.idempotencyIndex = idempotencyIndex;
        this.readyQueue = readyQueue;
        this.workRegistry = workRegistry;
        this.workerPool = workerPool;
        this.executionService = executionService;
        this.retryScheduler = retryScheduler;
        this.eventBus = eventBus;
        this.webhookUrlValidator = webhookUrlValidator;
        this.conflictRetry = conflictRetry;
        this.config = config;
    }

    /**
     * Create a task and put it on the ready queue. With an idempotency key, a live
     * key returns the existing task instead ({@code created=false}).
     *
     * @throws ValidationException if the agent type is unknown or the webhook URL is not allowed
     * @throws QueueFullException  if the ready queue is at capacity
     */
    public SubmitResult submit(TaskSubmission submission) {
        if (!workRegistry.contains(submission.agentType())) {
            throw new ValidationException("agent_type", "unknown agent type: " + submission.agentType());
        }
        webhookUrlValidator.validate(submission.webhookUrl());

        if (!submission.hasIdempotencyKey()) {
            return new SubmitResult(createAndEnqueue(submission), true);
        }

        AtomicReference<Task> created = new AtomicReference<>();
        IdempotencyIndex.Reservation reservation = idempotencyIndex.reserve(
                submission.agentType(), submission.idempotencyKey(), () -> {
                    Task task = createAndEnqueue(submission);
                    created.set(task);
                    return task.id();
                });

        if (reservation.isNew()) {
            return new SubmitResult(created.get(), true);
        }

        log.info("Idempotent replay of key '{}' returns task {}", submission.idempotencyKey(), reservation.taskId());
        return new SubmitResult(get(reservation.taskId()), false);
    }

    private Task createAndEnqueue(TaskSubmission submission) {
        int maxAttempts = submission.maxAttempts() > 0 ? submission.maxAttempts() : config.defaultMaxAttempts();
        Task task = Task.builder()
                .id(TaskIds.newId())
                .agentType(submission.agentType())
                .status(TaskStatus.PENDING)
                .priority(submission.priority())
                .payload(submission.payload() != null ? submission.payload() : "{}")
                .idempotencyKey(submission.hasIdempotencyKey() ? submission.idempotencyKey() : null)
                .userId(submission.userId())
                .maxAttempts(maxAttempts)
                .webhookUrl(submission.webhookUrl())
                .createdAt(Instant.now())
                .build();
        return store(task);
    }

    private Task store(Task task) {
        Task stored = taskRepository.create(task);
        try {
            readyQueue.offer(stored);
        } catch (QueueFullException e) {
            taskRepository.delete(stored.id());
            log.warn("Rejected task {}: {}", stored.id(), e.getMessage());
            throw e;
        }
        log.info("Task {} submitted (agent {}, priority {}, max attempts {})",
                stored.id(), stored.agentType(), stored.priority(), stored.maxAttempts());
        return stored;
    }

    /**
     * @throws NotFoundException if the task does not exist
     */
    public Task get(String taskId) {
        return taskRepository.findById(taskId).orElseThrow(() -> new NotFoundException("task", taskId));
    }

    public TaskPage list(TaskFilter filter, int limit, int offset) {
        return taskRepository.list(filter, limit, offset);
    }

    /**
     * Event audit trail of a task, oldest first.
     */
    public List<TaskEvent> events(String taskId, int limit) {
        get(taskId);
        return eventBus.snapshot(taskId, limit);
    }

    /**
     * Non-blocking variant of {@link #awaitTerminal}: the returned future completes
     * with the task's latest state once it is terminal or the timeout elapses.
     * The final read runs on {@code executor}.
     */
    public CompletableFuture<Task> whenTerminal(String taskId, Duration timeout, Executor executor) {
        Task task = get(taskId);
        if (task.isTerminal()) {
            return CompletableFuture.completedFuture(task);
        }
        return eventBus.onCompletion(taskId)
                .completeOnTimeout(null, timeout.toMillis(), TimeUnit.MILLISECONDS)
                .thenApplyAsync(ignored -> get(taskId), executor);
    }

    /**
     * Wait until the task is terminal or the timeout elapses.
     *
     * @return the task's latest state
     */
    public Task awaitTerminal(String taskId, Duration timeout) throws InterruptedException {
        Instant deadline = Instant.now().plus(timeout);
        while (true) {
            Task task = get(taskId);
            if (task.isTerminal()) {
                return task;
            }
            Duration remaining = Duration.between(Instant.now(), deadline);
            if (remaining.isNegative() || remaining.isZero()) {
                return task;
            }
            if (eventBus.awaitCompletion(taskId, remaining)) {
                return get(taskId);
            }
        }
    }

    /**
     * Cancel a task. Pending and retrying tasks are cancelled immediately. A running
     * task gets its cancel flag set and is cancelled once the work function notices;
     * {@code force} interrupts the worker and cancels right away. Terminal tasks are
     * left unchanged.
     */
    public CancelOutcome cancel(String taskId, boolean force, String reason) {
        return conflictRetry.run(taskId, () -> {
            Task current = get(taskId);
            switch (current.status()) {
                case COMPLETED, FAILED, CANCELLED -> {
                    log.debug("Cancel of task {} ignored: already {}", taskId, current.status().wireName());
                    return new CancelOutcome(CancelResult.ALREADY_TERMINAL, current);
                }
                case PENDING -> {
                    readyQueue.remove(taskId);
                    return new CancelOutcome(CancelResult.CANCELLED, executionService.cancelNow(current, reason));
                }
                case RETRYING -> {
                    retryScheduler.cancel(taskId);
                    return new CancelOutcome(CancelResult.CANCELLED, executionService.cancelNow(current, reason));
                }
                default -> {
                    boolean live = workerPool.requestCancel(taskId, reason);
                    if (!live || force) {
                        Task cancelled = executionService.cancelNow(current, reason);
                        if (live) {
                            workerPool.interrupt(taskId);
                        }
                        return new CancelOutcome(CancelResult.CANCELLED, cancelled);
                    }
                    Task flagged = current.cancelRequested()
                            ? current
                            : taskRepository.compareAndSet(current, current.toBuilder().cancelRequested(true).build());
                    return new CancelOutcome(CancelResult.CANCEL_REQUESTED, flagged);
                }
            }
        });
    }

    /**
     * Run a failed task again. Only FAILED tasks with a retryable error qualify; the
     * dead letter entry is consumed and a new task is created from it.
     *
     * @throws NotRetryableException if the task does not qualify or was already requeued
     */
    public Task retry(String taskId) {
        Task task = get(taskId);
        if (!task.isRetryableFailure()) {
            String reason = task.status() != TaskStatus.FAILED
                    ? "status is " + task.status().wireName()
                    : "error is not retryable";
            throw new NotRetryableException("Task " + taskId + " cannot be retried: " + reason);
        }

        DeadLetterEntry entry = deadLetterRepository.take(taskId)
                .orElseThrow(() -> new NotRetryableException(
                        "Task " + taskId + " was already requeued or removed from the dead letter queue"));
        return requeue(entry);
    }

    /**
     * Create a fresh task from a dead letter entry the caller already removed.
     * On a full queue the entry is put back.
     */
    public Task requeue(DeadLetterEntry entry) {
        Task task = Task.builder()
                .id(TaskIds.newId())
                .agentType(entry.agentType())
                .status(TaskStatus.PENDING)
                .priority(entry.priority())
                .payload(entry.payload())
                .userId(entry.userId())
                .maxAttempts(entry.maxAttempts())
                .webhookUrl(entry.webhookUrl())
                .requeueCount(entry.requeueCount() + 1)
                .createdAt(Instant.now())
                .build();

        Task stored;
        try {
            stored = store(task);
        } catch (QueueFullException e) {
            deadLetterRepository.add(entry);
            throw e;
        }
        log.info("Dead letter entry {} requeued as task {}", entry.taskId(), stored.id());
        return stored;
    }

    /**
     * Delete a terminal task with its events, idempotency key and dead letter entry.
     *
     * @throws ConflictException if the task is still active
     */
    public void delete(String taskId) {
        Task task = get(taskId);
        if (!task.isTerminal()) {
            throw new ConflictException(taskId,
                    "Task " + taskId + " is still " + task.status().wireName() + "; cancel it first");
        }
        if (!taskRepository.delete(taskId)) {
            throw new NotFoundException("task", taskId);
        }
        eventBus.purge(taskId);
        idempotencyIndex.invalidate(taskId);
        deadLetterRepository.delete(taskId);
        log.info("Task {} deleted", taskId);
    }
}

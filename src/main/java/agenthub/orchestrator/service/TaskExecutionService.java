package agenthub.orchestrator.service;

import agenthub.orchestrator.core.Json;
import agenthub.orchestrator.error.ConflictException;
import agenthub.orchestrator.error.InvalidStateException;
import agenthub.orchestrator.error.NotFoundException;
import agenthub.orchestrator.events.EventBus;
import agenthub.orchestrator.events.EventData;
import agenthub.orchestrator.model.DeadLetterEntry;
import agenthub.orchestrator.model.Task;
import agenthub.orchestrator.model.TaskCost;
import agenthub.orchestrator.model.TaskError;
import agenthub.orchestrator.model.TaskProgress;
import agenthub.orchestrator.model.TaskStatus;
import agenthub.orchestrator.repository.DeadLetterRepository;
import agenthub.orchestrator.repository.TaskRepository;
import agenthub.orchestrator.retry.ErrorClassification;
import agenthub.orchestrator.retry.ErrorClassifier;
import agenthub.orchestrator.retry.RetryPolicy;
import agenthub.orchestrator.scheduler.RetryScheduler;
import agenthub.orchestrator.webhook.WebhookNotifier;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.UnaryOperator;

/**
 * Task lifecycle writes made on behalf of workers: claiming, progress, and the
 * outcome of an attempt. Every transition is a compare-and-set on the store, followed
 * by the matching event append.
 * <p>
 * An outcome for a task that is no longer RUNNING (force-cancelled, reaped) is
 * discarded with a warning.
 */
public class TaskExecutionService {

    private static final Logger log = LoggerFactory.getLogger(TaskExecutionService.class);

    private final TaskRepository taskRepository;
    private final DeadLetterRepository deadLetterRepository;
    private final EventBus eventBus;
    private final RetryPolicy retryPolicy;
    private final ErrorClassifier errorClassifier;
    private final RetryScheduler retryScheduler;
    private final WebhookNotifier webhookNotifier;
    private final ConflictRetry conflictRetry;

    public TaskExecutionService(TaskRepository taskRepository,
            DeadLetterRepository deadLetterRepository,
            EventBus eventBus,
            RetryPolicy retryPolicy,
            ErrorClassifier errorClassifier,
            RetryScheduler retryScheduler,
            WebhookNotifier webhookNotifier,
            ConflictRetry conflictRetry) {
        this.taskRepository = taskRepository;
        this.deadLetterRepository = deadLetterRepository;
        this.eventBus = eventBus;
        this.retryPolicy = retryPolicy;
        this.errorClassifier = errorClassifier;
        this.retryScheduler = retryScheduler;
        this.webhookNotifier = webhookNotifier;
        this.conflictRetry = conflictRetry;
    }

    /**
     * Atomically move a PENDING task to RUNNING, counting the attempt.
     *
     * @return the running task, or empty if the task is gone or no longer PENDING
     */
    public Optional<Task> claim(String taskId) {
        Optional<Task> claimed;
        try {
            claimed = conflictRetry.run(taskId, () -> {
                Task current = taskRepository.findById(taskId).orElse(null);
                if (current == null || current.status() != TaskStatus.PENDING) {
                    return Optional.<Task>empty();
                }
                return Optional.of(taskRepository.compareAndSet(current, current.toBuilder()
                        .status(TaskStatus.RUNNING)
                        .attempts(current.attempts() + 1)
                        .startedAt(Instant.now())
                        .progress(TaskProgress.NONE)
                        .nextRetryAt(null)
                        .build()));
            });
        } catch (ConflictException e) {
            log.warn("Could not claim task {}: {}", taskId, e.getMessage());
            return Optional.empty();
        }

        if (claimed.isEmpty()) {
            log.debug("Task {} not claimable, skipped", taskId);
            return claimed;
        }

        Task task = claimed.get();
        log.info("Task {} started (attempt {}/{})", taskId, task.attempts(), task.maxAttempts());
        eventBus.progress(taskId, 0, "Attempt " + task.attempts() + " of " + task.maxAttempts() + " started",
                EventData.progress(task));
        return claimed;
    }

    /**
     * Record progress of a running task. Null arguments keep their previous values.
     *
     * @throws InvalidStateException if the task is not RUNNING
     */
    public Task reportProgress(String taskId, Integer percent, String message, String step,
            Integer stepNum, Integer totalSteps) {
        Task updated = conflictRetry.run(taskId, () -> {
            Task current = taskRepository.findById(taskId)
                    .orElseThrow(() -> new NotFoundException("task", taskId));
            if (current.status() != TaskStatus.RUNNING) {
                throw new InvalidStateException(
                        "Task " + taskId + " is not running (status " + current.status().wireName() + ")");
            }
            TaskProgress merged = current.progress().merge(percent, message, step, stepNum, totalSteps);
            return taskRepository.compareAndSet(current, current.toBuilder().progress(merged).build());
        });

        TaskProgress progress = updated.progress();
        String eventMessage = message != null ? message : progress.currentStep();
        eventBus.progress(taskId, progress.percent(), eventMessage, EventData.progress(updated));
        return updated;
    }

    /**
     * RUNNING -> COMPLETED with the result and the attempt's cost.
     */
    public Optional<Task> recordSuccess(String taskId, JsonNode result, TaskCost cost) {
        String resultJson = Json.write(result != null ? result : Json.mapper().nullNode());

        Optional<Task> completed = finishAttempt(taskId, "success", current -> current.toBuilder()
                .status(TaskStatus.COMPLETED)
                .result(resultJson)
                .error(null)
                .progress(current.progress().merge(100, null, null, null, null))
                .cost(current.cost().plus(cost))
                .completedAt(Instant.now())
                .nextRetryAt(null)
                .build());

        completed.ifPresent(task -> {
            log.info("Task {} completed (attempt {}/{})", taskId, task.attempts(), task.maxAttempts());
            eventBus.complete(taskId, "Task completed", EventData.terminal(task));
            webhookNotifier.notify(task);
        });
        return completed;
    }

    /**
     * Classify a failed attempt and move the task to RETRYING (with a scheduled
     * release) or to FAILED (with a dead letter entry).
     */
    public Optional<Task> recordFailure(String taskId, Throwable error, TaskCost cost) {
        ErrorClassification classification = errorClassifier.classify(error);
        AtomicReference<Duration> delay = new AtomicReference<>();

        Optional<Task> outcome = finishAttempt(taskId, "failure", current -> {
            Task.Builder next = current.toBuilder().cost(current.cost().plus(cost));
            if (retryPolicy.shouldRetry(current.attempts(), current.maxAttempts(), classification)) {
                Duration backoff = retryPolicy.backoff(current.attempts(), classification);
                delay.set(backoff);
                return next.status(TaskStatus.RETRYING)
                        .error(new TaskError(classification.code(), classification.normalizedMessage(), true))
                        .nextRetryAt(Instant.now().plus(backoff))
                        .build();
            }
            delay.set(null);
            return next.status(TaskStatus.FAILED)
                    .error(new TaskError(classification.code(), classification.normalizedMessage(),
                            classification.retryable()))
                    .completedAt(Instant.now())
                    .nextRetryAt(null)
                    .build();
        });

        outcome.ifPresent(task -> {
            if (task.status() == TaskStatus.RETRYING) {
                scheduleRetry(task, delay.get());
            } else {
                failPermanently(task);
            }
        });
        return outcome;
    }

    /**
     * RUNNING -> CANCELLED after the work function observed its cancel flag.
     */
    public Optional<Task> recordCancelled(String taskId, String reason, TaskCost cost) {
        Optional<Task> cancelled = finishAttempt(taskId, "cancellation", current -> current.toBuilder()
                .status(TaskStatus.CANCELLED)
                .error(TaskError.cancelled(reason))
                .cancelRequested(true)
                .cost(current.cost().plus(cost))
                .completedAt(Instant.now())
                .nextRetryAt(null)
                .build());

        cancelled.ifPresent(task -> {
            log.info("Task {} cancelled while running", taskId);
            eventBus.complete(taskId, "Task cancelled", EventData.terminal(task));
        });
        return cancelled;
    }

    /**
     * Cancel a task right away (pending, waiting for a retry, force-cancelled or
     * running without a live worker). Conflicts propagate so the caller can re-read.
     */
    public Task cancelNow(Task current, String reason) {
        Task cancelled = taskRepository.compareAndSet(current, current.toBuilder()
                .status(TaskStatus.CANCELLED)
                .error(TaskError.cancelled(reason))
                .cancelRequested(true)
                .completedAt(Instant.now())
                .nextRetryAt(null)
                .build());
        log.info("Task {} cancelled (was {})", cancelled.id(), current.status().wireName());
        eventBus.complete(cancelled.id(), "Task cancelled", EventData.terminal(cancelled));
        return cancelled;
    }

    /**
     * Recover a RUNNING task whose worker is gone: retry after {@code retryDelay} if
     * the attempt budget allows, otherwise fail it with SERVER_RESTART.
     *
     * @return the recovered task, or empty if it was no longer RUNNING
     */
    public Optional<Task> recoverStale(Task stale, Duration retryDelay) {
        String taskId = stale.id();
        Optional<Task> outcome = conflictRetry.run(taskId, () -> {
            Task current = taskRepository.findById(taskId).orElse(null);
            if (current == null || current.status() != TaskStatus.RUNNING) {
                return Optional.<Task>empty();
            }
            Instant now = Instant.now();
            if (current.canRetry()) {
                return Optional.of(taskRepository.compareAndSet(current, current.toBuilder()
                        .status(TaskStatus.RETRYING)
                        .error(new TaskError(TaskError.SERVER_RESTART,
                                "Worker lost while running attempt " + current.attempts(), true))
                        .nextRetryAt(now.plus(retryDelay))
                        .build()));
            }
            return Optional.of(taskRepository.compareAndSet(current, current.toBuilder()
                    .status(TaskStatus.FAILED)
                    .error(new TaskError(TaskError.SERVER_RESTART,
                            "Worker lost and max attempts exceeded (" + current.attempts() + "/"
                                    + current.maxAttempts() + ")",
                            true))
                    .completedAt(now)
                    .nextRetryAt(null)
                    .build()));
        });

        outcome.ifPresent(task -> {
            if (task.status() == TaskStatus.RETRYING) {
                scheduleRetry(task, retryDelay);
            } else {
                failPermanently(task);
            }
        });
        return outcome;
    }

    private Optional<Task> finishAttempt(String taskId, String outcome, UnaryOperator<Task> mutation) {
        return conflictRetry.run(taskId, () -> {
            Task current = taskRepository.findById(taskId).orElse(null);
            if (current == null) {
                log.warn("Discarding {} of task {}: task no longer exists", outcome, taskId);
                return Optional.<Task>empty();
            }
            if (current.status() != TaskStatus.RUNNING) {
                log.warn("Discarding {} of task {}: status is already {}", outcome, taskId,
                        current.status().wireName());
                return Optional.<Task>empty();
            }
            return Optional.of(taskRepository.compareAndSet(current, mutation.apply(current)));
        });
    }

    private void scheduleRetry(Task task, Duration delay) {
        log.info("Task {} attempt {}/{} failed, retrying in {}ms: {}", task.id(), task.attempts(),
                task.maxAttempts(), delay.toMillis(), task.error().message());
        eventBus.error(task.id(), task.error().message(), EventData.retrying(task, delay));
        retryScheduler.schedule(task.id(), delay);
    }

    private void failPermanently(Task task) {
        log.warn("Task {} failed after {}/{} attempts: {}", task.id(), task.attempts(), task.maxAttempts(),
                task.error().message());
        if (deadLetterRepository.add(DeadLetterEntry.of(task, Instant.now()))) {
            log.info("Task {} moved to dead letter queue", task.id());
        }
        eventBus.complete(task.id(), task.error().message(), EventData.terminal(task));
        webhookNotifier.notify(task);
    }
}

package agenthub.orchestrator.scheduler;

import agenthub.orchestrator.error.NotFoundException;
import agenthub.orchestrator.error.QueueFullException;
import agenthub.orchestrator.model.Task;
import agenthub.orchestrator.model.TaskStatus;
import agenthub.orchestrator.repository.TaskRepository;
import agenthub.orchestrator.service.ConflictRetry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Moves RETRYING tasks back to PENDING once their backoff elapses and puts them
 * on the ready queue.
 */
public class RetryScheduler implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(RetryScheduler.class);

    static final Duration QUEUE_FULL_DELAY = Duration.ofSeconds(1);

    private final TaskRepository taskRepository;
    private final ReadyQueue readyQueue;
    private final ConflictRetry conflictRetry;
    private final ScheduledExecutorService executor;
    private final Map<String, ScheduledFuture<?>> pending = new ConcurrentHashMap<>();

    public RetryScheduler(TaskRepository taskRepository, ReadyQueue readyQueue, ConflictRetry conflictRetry) {
        this.taskRepository = taskRepository;
        this.readyQueue = readyQueue;
        this.conflictRetry = conflictRetry;
        this.executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "agenthub-retry");
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Release the task after the delay.
     */
    public void schedule(String taskId, Duration delay) {
        long delayMs = Math.max(0, delay.toMillis());
        ScheduledFuture<?> future = executor.schedule(() -> release(taskId), delayMs, TimeUnit.MILLISECONDS);
        ScheduledFuture<?> previous = pending.put(taskId, future);
        if (previous != null) {
            previous.cancel(false);
        }
        log.debug("Task {} scheduled for retry in {}ms", taskId, delayMs);
    }

    /**
     * Re-arm a RETRYING task loaded from the store with its remaining backoff.
     */
    public void rearm(Task task) {
        Instant at = task.nextRetryAt() != null ? task.nextRetryAt() : Instant.now();
        Duration remaining = Duration.between(Instant.now(), at);
        schedule(task.id(), remaining.isNegative() ? Duration.ZERO : remaining);
    }

    /**
     * Drop a scheduled release (task cancelled).
     *
     * @return true if a release was pending
     */
    public boolean cancel(String taskId) {
        ScheduledFuture<?> future = pending.remove(taskId);
        return future != null && future.cancel(false);
    }

    public int pendingCount() {
        return pending.size();
    }

    void release(String taskId) {
        pending.remove(taskId);
        try {
            Optional<Task> released = conflictRetry.run(taskId, () -> {
                Task current = taskRepository.findById(taskId).orElse(null);
                if (current == null || current.status() != TaskStatus.RETRYING) {
                    return Optional.<Task>empty();
                }
                return Optional.of(taskRepository.compareAndSet(current, current.toBuilder()
                        .status(TaskStatus.PENDING)
                        .nextRetryAt(null)
                        .build()));
            });

            if (released.isEmpty()) {
                log.debug("Task {} no longer waiting for retry, release skipped", taskId);
                return;
            }

            readyQueue.offer(released.get());
            log.info("Task {} re-queued for attempt {} of {}",
                    taskId, released.get().attempts() + 1, released.get().maxAttempts());
        } catch (QueueFullException e) {
            // Task stays PENDING; the orphan sweep also picks it up
            log.warn("Ready queue full, task {} will be offered again in {}ms", taskId, QUEUE_FULL_DELAY.toMillis());
            executor.schedule(() -> offerAgain(taskId), QUEUE_FULL_DELAY.toMillis(), TimeUnit.MILLISECONDS);
        } catch (NotFoundException e) {
            log.debug("Task {} deleted before its retry", taskId);
        } catch (Exception e) {
            log.error("Failed to release task {} for retry", taskId, e);
        }
    }

    private void offerAgain(String taskId) {
        try {
            taskRepository.findById(taskId)
                    .filter(t -> t.status() == TaskStatus.PENDING)
                    .ifPresent(readyQueue::offer);
        } catch (QueueFullException e) {
            log.warn("Ready queue still full, task {} left to the orphan sweep", taskId);
        } catch (Exception e) {
            log.error("Failed to re-offer task {}", taskId, e);
        }
    }

    @Override
    public void close() {
        executor.shutdownNow();
        pending.clear();
    }
}

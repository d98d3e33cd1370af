package agenthub.orchestrator.scheduler;

import agenthub.orchestrator.config.OrchestratorConfig;
import agenthub.orchestrator.error.QueueFullException;
import agenthub.orchestrator.model.Task;
import agenthub.orchestrator.model.TaskStatus;
import agenthub.orchestrator.repository.TaskRepository;
import agenthub.orchestrator.service.TaskExecutionService;
import agenthub.orchestrator.worker.WorkerPool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Background task that recovers tasks the scheduler lost track of.
 * <p>
 * Tasks can get stuck if:
 * - A worker hangs past the stale threshold
 * - The process restarted while tasks were RUNNING
 * - A PENDING task never made it onto the ready queue (queue full, crash)
 * <p>
 * Stuck RUNNING tasks without a live worker go back to RETRYING if attempts remain,
 * otherwise they fail with SERVER_RESTART and move to the dead letter queue.
 */
public class TaskReaper implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(TaskReaper.class);

    private final TaskRepository taskRepository;
    private final TaskExecutionService executionService;
    private final WorkerPool workerPool;
    private final ReadyQueue readyQueue;
    private final RetryScheduler retryScheduler;
    private final OrchestratorConfig config;

    public TaskReaper(TaskRepository taskRepository,
            TaskExecutionService executionService,
            WorkerPool workerPool,
            ReadyQueue readyQueue,
            RetryScheduler retryScheduler,
            OrchestratorConfig config) {
        this.taskRepository = taskRepository;
        this.executionService = executionService;
        this.workerPool = workerPool;
        this.readyQueue = readyQueue;
        this.retryScheduler = retryScheduler;
        this.config = config;
    }

    @Override
    public void run() {
        reapStuckTasks();
        sweepOrphans();
    }

    /**
     * Find and recover RUNNING tasks older than the stale threshold whose worker is gone.
     *
     * @return number of tasks recovered
     */
    public int reapStuckTasks() {
        Instant cutoff = Instant.now().minus(config.staleThreshold());
        List<Task> stuck = taskRepository.findStuckRunning(cutoff);

        if (stuck.isEmpty()) {
            log.debug("No stuck tasks found");
            return 0;
        }

        int recovered = 0;
        for (Task task : stuck) {
            if (workerPool.isExecuting(task.id())) {
                log.debug("Task {} running long but its worker is alive", task.id());
                continue;
            }
            if (recover(task)) {
                recovered++;
            }
        }

        if (recovered > 0) {
            log.info("Task reaper: {} of {} stuck tasks recovered", recovered, stuck.size());
        }
        return recovered;
    }

    /**
     * Put PENDING tasks that are not queued back on the ready queue.
     *
     * @return number of tasks re-offered
     */
    public int sweepOrphans() {
        Instant cutoff = Instant.now().minus(config.orphanThreshold());
        List<Task> pending = taskRepository.findByStatus(TaskStatus.PENDING, readyQueue.capacity());

        int offered = 0;
        for (Task task : pending) {
            Instant since = task.updatedAt() != null ? task.updatedAt() : task.createdAt();
            if (since == null || since.isAfter(cutoff)
                    || readyQueue.contains(task.id()) || workerPool.isExecuting(task.id())) {
                continue;
            }
            try {
                if (readyQueue.offer(task)) {
                    offered++;
                }
            } catch (QueueFullException e) {
                log.warn("Ready queue full, orphan sweep stopped after {} tasks", offered);
                break;
            }
        }

        if (offered > 0) {
            log.info("Orphan sweep re-queued {} pending tasks", offered);
        }
        return offered;
    }

    /**
     * Start-up recovery: queue PENDING tasks, re-arm RETRYING tasks and recover
     * RUNNING tasks left by the previous process.
     *
     * @return number of tasks touched
     */
    public int recoverOnStartup() {
        int queued = 0;
        for (Task task : taskRepository.findByStatus(TaskStatus.PENDING, readyQueue.capacity())) {
            try {
                if (readyQueue.offer(task)) {
                    queued++;
                }
            } catch (QueueFullException e) {
                log.warn("Ready queue full during recovery; remaining tasks left to the orphan sweep");
                break;
            }
        }

        List<Task> retrying = taskRepository.findByStatus(TaskStatus.RETRYING, Integer.MAX_VALUE);
        retrying.forEach(retryScheduler::rearm);

        int recovered = 0;
        for (Task task : taskRepository.findByStatus(TaskStatus.RUNNING, Integer.MAX_VALUE)) {
            if (recover(task)) {
                recovered++;
            }
        }

        log.info("Start-up recovery: {} pending queued, {} retries re-armed, {} interrupted tasks recovered",
                queued, retrying.size(), recovered);
        return queued + retrying.size() + recovered;
    }

    private boolean recover(Task task) {
        try {
            Optional<Task> outcome = executionService.recoverStale(task, config.staleRetryDelay());
            outcome.ifPresent(t -> {
                if (t.status() == TaskStatus.RETRYING) {
                    log.info("Reaped task {} for retry (attempt {} of {})", t.id(), t.attempts(), t.maxAttempts());
                } else {
                    log.warn("Task {} permanently failed after {} attempts (worker lost)", t.id(), t.attempts());
                }
            });
            return outcome.isPresent();
        } catch (Exception e) {
            log.error("Failed to reap task {}", task.id(), e);
            return false;
        }
    }
}

package agenthub.orchestrator.scheduler;

import agenthub.orchestrator.config.OrchestratorConfig;
import agenthub.orchestrator.idempotency.IdempotencyIndex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Coordinates background maintenance:
 * - TaskReaper: recovers stuck RUNNING and orphaned PENDING tasks
 * - RetentionSweeper: deletes expired terminal tasks
 * - idempotency key purge
 * <p>
 * Uses a single-threaded executor to avoid concurrency issues.
 */
public class Scheduler implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Scheduler.class);

    private final ScheduledExecutorService executor;
    private final TaskReaper taskReaper;
    private final RetentionSweeper retentionSweeper;
    private final IdempotencyIndex idempotencyIndex;
    private final OrchestratorConfig config;

    private volatile boolean running = false;

    public Scheduler(TaskReaper taskReaper, RetentionSweeper retentionSweeper,
            IdempotencyIndex idempotencyIndex, OrchestratorConfig config) {
        this.executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "agenthub-maintenance");
            t.setDaemon(true);
            return t;
        });
        this.taskReaper = taskReaper;
        this.retentionSweeper = retentionSweeper;
        this.idempotencyIndex = idempotencyIndex;
        this.config = config;
    }

    /**
     * Start the scheduler.
     */
    public void start() {
        if (running) {
            log.warn("Scheduler already running");
            return;
        }

        running = true;

        long intervalMs = config.maintenanceInterval().toMillis();
        executor.scheduleAtFixedRate(
                wrapRunnable("task-reaper", taskReaper), intervalMs, intervalMs, TimeUnit.MILLISECONDS);
        executor.scheduleAtFixedRate(
                wrapRunnable("retention-sweeper", retentionSweeper), intervalMs, intervalMs, TimeUnit.MILLISECONDS);
        executor.scheduleAtFixedRate(
                wrapRunnable("idempotency-purge", idempotencyIndex::purgeExpired),
                intervalMs, intervalMs, TimeUnit.MILLISECONDS);

        log.info("Scheduler started, maintenance every {}ms", intervalMs);
    }

    /**
     * Stop the scheduler gracefully.
     */
    public void stop() {
        if (!running) {
            return;
        }

        running = false;
        executor.shutdown();

        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
                log.warn("Scheduler forcefully stopped");
            } else {
                log.info("Scheduler stopped gracefully");
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public void close() {
        stop();
    }

    public boolean isRunning() {
        return running;
    }

    public TaskReaper taskReaper() {
        return taskReaper;
    }

    public RetentionSweeper retentionSweeper() {
        return retentionSweeper;
    }

    /**
     * Wrap a runnable with error handling so one failure never cancels the schedule.
     */
    private Runnable wrapRunnable(String name, Runnable task) {
        return () -> {
            try {
                task.run();
            } catch (Exception e) {
                log.error("{} error", name, e);
            }
        };
    }
}

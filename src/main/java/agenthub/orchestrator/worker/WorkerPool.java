package agenthub.orchestrator.worker;

import agenthub.orchestrator.error.TaskCancelledException;
import agenthub.orchestrator.error.WorkExecutionException;
import agenthub.orchestrator.model.Task;
import agenthub.orchestrator.model.TaskCost;
import agenthub.orchestrator.model.TaskError;
import agenthub.orchestrator.service.TaskExecutionService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Fixed pool of N execution slots.
 * <p>
 * The dispatcher acquires a slot, pops the ready queue, then calls {@link #dispatch}.
 * Each execution is registered before the task is claimed, so a RUNNING task with no
 * registered execution is known to have lost its worker.
 */
public class WorkerPool implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(WorkerPool.class);

    /** Live execution of one task */
    static final class Execution {
        private final String taskId;
        private final AtomicBoolean cancelled = new AtomicBoolean();
        private volatile String cancelReason;
        private volatile Thread thread;

        Execution(String taskId) {
            this.taskId = taskId;
        }

        boolean isCancelled() {
            return cancelled.get();
        }

        void cancel(String reason) {
            if (cancelled.compareAndSet(false, true)) {
                cancelReason = reason;
            }
        }

        void interrupt() {
            Thread t = thread;
            if (t != null) {
                t.interrupt();
            }
        }
    }

    private final WorkRegistry registry;
    private final TaskExecutionService executionService;
    private final int size;
    private final Semaphore slots;
    private final ExecutorService executor;
    private final Map<String, Execution> executions = new ConcurrentHashMap<>();

    public WorkerPool(WorkRegistry registry, TaskExecutionService executionService, int size) {
        if (size <= 0) {
            throw new IllegalArgumentException("worker count must be positive");
        }
        this.registry = registry;
        this.executionService = executionService;
        this.size = size;
        this.slots = new Semaphore(size);
        AtomicInteger counter = new AtomicInteger();
        this.executor = Executors.newFixedThreadPool(size, r -> {
            Thread t = new Thread(r, "agenthub-worker-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Block until a slot is free.
     */
    public void acquireSlot() throws InterruptedException {
        slots.acquire();
    }

    /**
     * Give back a slot acquired with {@link #acquireSlot()} that was not used.
     */
    public void releaseSlot() {
        slots.release();
    }

    /**
     * Run a task on a slot already acquired by the caller. The slot is released when
     * the execution ends.
     */
    public void dispatch(String taskId) {
        Execution execution = new Execution(taskId);
        if (executions.putIfAbsent(taskId, execution) != null) {
            log.warn("Task {} is already executing, dispatch ignored", taskId);
            slots.release();
            return;
        }

        try {
            executor.execute(() -> {
                execution.thread = Thread.currentThread();
                try {
                    run(execution);
                } catch (Exception e) {
                    log.error("Worker failed on task {}", taskId, e);
                } finally {
                    execution.thread = null;
                    executions.remove(taskId, execution);
                    Thread.interrupted(); // clear a late force-cancel interrupt
                    slots.release();
                }
            });
        } catch (RuntimeException e) {
            executions.remove(taskId, execution);
            slots.release();
            throw e;
        }
    }

    private void run(Execution execution) {
        String taskId = execution.taskId;
        Optional<Task> claimed = executionService.claim(taskId);
        if (claimed.isEmpty()) {
            return;
        }
        Task task = claimed.get();

        Optional<WorkFunction> function = registry.find(task.agentType());
        if (function.isEmpty()) {
            executionService.recordFailure(taskId, WorkExecutionException.permanent(
                    TaskError.UNKNOWN_AGENT_TYPE, "No work function for agent type: " + task.agentType()),
                    TaskCost.ZERO);
            return;
        }

        DefaultWorkContext ctx = new DefaultWorkContext(task, execution, executionService);
        WorkResult result = null;
        Exception failure = null;
        try {
            result = function.get().execute(ctx);
        } catch (Exception e) {
            failure = e;
        }
        // A force-cancel interrupt must not leak into the store calls below
        Thread.interrupted();

        TaskCost cost = ctx.accumulatedCost();
        if (failure == null && !execution.isCancelled()) {
            if (result == null) {
                result = WorkResult.of(null);
            }
            executionService.recordSuccess(taskId, result.result(), cost.plus(result.cost()));
        } else if (failure instanceof TaskCancelledException || execution.isCancelled()) {
            log.debug("Task {} stopped after cancellation: {}", taskId,
                    failure != null ? failure.toString() : "returned normally");
            executionService.recordCancelled(taskId, execution.cancelReason, cost);
        } else {
            executionService.recordFailure(taskId, failure, cost);
        }
    }

    /**
     * Ask a running execution to stop by setting its cancel flag. Once the flag is
     * set, whatever the work function returns is recorded as a cancellation.
     *
     * @return true if the task has a live execution
     */
    public boolean requestCancel(String taskId, String reason) {
        Execution execution = executions.get(taskId);
        if (execution == null) {
            return false;
        }
        execution.cancel(reason);
        log.info("Cancellation requested for running task {}", taskId);
        return true;
    }

    /**
     * Interrupt the worker thread of a force-cancelled task. Called after the task
     * is stored as CANCELLED, so the worker's own outcome write is discarded.
     */
    public void interrupt(String taskId) {
        Execution execution = executions.get(taskId);
        if (execution != null) {
            execution.interrupt();
            log.info("Interrupted worker of force-cancelled task {}", taskId);
        }
    }

    public boolean isExecuting(String taskId) {
        return executions.containsKey(taskId);
    }

    public int size() {
        return size;
    }

    /** Slots running a task right now */
    public int busy() {
        return executions.size();
    }

    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
                log.warn("Worker pool forcefully stopped");
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}

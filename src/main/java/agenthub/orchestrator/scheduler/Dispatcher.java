package agenthub.orchestrator.scheduler;

import agenthub.orchestrator.worker.WorkerPool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Hands ready tasks to the worker pool, highest priority first.
 * <p>
 * The loop first waits for a free slot, then for a ready task; it blocks in both
 * places and never polls.
 */
public class Dispatcher implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Dispatcher.class);

    private final ReadyQueue readyQueue;
    private final WorkerPool workerPool;
    private final Thread thread;
    private volatile boolean running;

    public Dispatcher(ReadyQueue readyQueue, WorkerPool workerPool) {
        this.readyQueue = readyQueue;
        this.workerPool = workerPool;
        this.thread = new Thread(this::loop, "agenthub-dispatcher");
        this.thread.setDaemon(true);
    }

    public synchronized void start() {
        if (running) {
            log.warn("Dispatcher already running");
            return;
        }
        running = true;
        thread.start();
        log.info("Dispatcher started ({} workers)", workerPool.size());
    }

    private void loop() {
        while (running) {
            try {
                workerPool.acquireSlot();
                String taskId;
                try {
                    taskId = readyQueue.take();
                } catch (InterruptedException e) {
                    workerPool.releaseSlot();
                    throw e;
                }
                workerPool.dispatch(taskId);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            } catch (Exception e) {
                log.error("Dispatch error", e);
            }
        }
        log.info("Dispatcher stopped");
    }

    public boolean isRunning() {
        return running;
    }

    @Override
    public synchronized void close() {
        if (!running) {
            return;
        }
        running = false;
        thread.interrupt();
        try {
            thread.join(5000);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}

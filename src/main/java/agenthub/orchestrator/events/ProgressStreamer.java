package agenthub.orchestrator.events;

import agenthub.orchestrator.model.EventKind;
import agenthub.orchestrator.model.Task;
import agenthub.orchestrator.model.TaskEvent;
import agenthub.orchestrator.repository.TaskRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Streams a task's events to a sink by polling the store and the event log.
 * <p>
 * Each subscription is a fixed-delay job. A tick reads the task from the store first,
 * then new events from the log, so a COMPLETE event is never missed. The stream ends
 * after the COMPLETE event, on timeout (error STREAM_TIMEOUT), or when the task
 * disappears (error TASK_NOT_FOUND). Idle streams get a heartbeat.
 */
public class ProgressStreamer implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ProgressStreamer.class);

    private final TaskRepository taskRepository;
    private final EventBus eventBus;
    private final Duration heartbeatInterval;
    private final ScheduledExecutorService executor;
    private final Set<StreamJob> active = ConcurrentHashMap.newKeySet();

    public ProgressStreamer(TaskRepository taskRepository, EventBus eventBus, Duration heartbeatInterval, int threads) {
        this.taskRepository = taskRepository;
        this.eventBus = eventBus;
        this.heartbeatInterval = heartbeatInterval;
        AtomicInteger counter = new AtomicInteger();
        this.executor = Executors.newScheduledThreadPool(threads, r -> {
            Thread t = new Thread(r, "agenthub-stream-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Start streaming a task.
     *
     * @param pollInterval delay between ticks
     * @param timeout      wall-clock limit of the whole stream
     */
    public Subscription subscribe(String taskId, Duration pollInterval, Duration timeout, StreamSink sink) {
        StreamJob job = new StreamJob(taskId, sink, Instant.now().plus(timeout));
        active.add(job);
        ScheduledFuture<?> future = executor.scheduleWithFixedDelay(
                job, 0, pollInterval.toMillis(), TimeUnit.MILLISECONDS);
        job.attach(future);
        log.debug("Stream opened for task {} (poll {}ms, timeout {}s)",
                taskId, pollInterval.toMillis(), timeout.toSeconds());
        return job;
    }

    public int activeCount() {
        return active.size();
    }

    @Override
    public void close() {
        for (StreamJob job : List.copyOf(active)) {
            job.cancel();
        }
        executor.shutdownNow();
    }

    private final class StreamJob implements Runnable, Subscription {
        private final String taskId;
        private final StreamSink sink;
        private final Instant deadline;
        private final AtomicBoolean closed = new AtomicBoolean();
        private volatile ScheduledFuture<?> future;

        private long lastSequence;
        private Instant lastSent = Instant.now();
        private boolean graceUsed;

        StreamJob(String taskId, StreamSink sink, Instant deadline) {
            this.taskId = taskId;
            this.sink = sink;
            this.deadline = deadline;
        }

        void attach(ScheduledFuture<?> future) {
            this.future = future;
            if (closed.get()) {
                future.cancel(false);
            }
        }

        @Override
        public void run() {
            if (closed.get()) {
                return;
            }
            try {
                tick();
            } catch (Exception e) {
                log.error("Stream for task {} failed", taskId, e);
                finish();
            }
        }

        private void tick() {
            Instant now = Instant.now();
            if (!now.isBefore(deadline)) {
                emit(StreamMessage.error("STREAM_TIMEOUT", "stream timeout"));
                log.debug("Stream for task {} timed out", taskId);
                finish();
                return;
            }

            Optional<Task> task;
            try {
                task = taskRepository.findById(taskId);
            } catch (RuntimeException e) {
                log.warn("Store error while streaming task {}: {}", taskId, e.getMessage());
                emit(StreamMessage.error("DB_ERROR", "Temporary database error, retrying..."));
                return;
            }

            if (task.isEmpty()) {
                emit(StreamMessage.error("TASK_NOT_FOUND", "Task " + taskId + " not found"));
                finish();
                return;
            }

            boolean sent = false;
            for (TaskEvent event : eventBus.since(taskId, lastSequence)) {
                if (!emit(StreamMessage.of(event))) {
                    return;
                }
                lastSequence = event.sequence();
                sent = true;
                if (event.kind() == EventKind.COMPLETE) {
                    finish();
                    return;
                }
            }

            if (task.get().isTerminal()) {
                // The log may lag the store by one write; give it one tick before synthesising
                if (graceUsed || !eventBus.hasLog(taskId)) {
                    emit(StreamMessage.complete(EventData.terminal(task.get())));
                    finish();
                    return;
                }
                graceUsed = true;
            }

            if (sent) {
                lastSent = now;
            } else if (Duration.between(lastSent, now).compareTo(heartbeatInterval) >= 0) {
                emit(StreamMessage.heartbeat(now));
                lastSent = now;
            }
        }

        private boolean emit(StreamMessage message) {
            if (closed.get()) {
                return false;
            }
            if (!sink.send(message)) {
                log.debug("Stream client for task {} went away", taskId);
                finish();
                return false;
            }
            return true;
        }

        private void finish() {
            if (!closed.compareAndSet(false, true)) {
                return;
            }
            active.remove(this);
            ScheduledFuture<?> f = future;
            if (f != null) {
                f.cancel(false);
            }
            sink.close();
        }

        @Override
        public String taskId() {
            return taskId;
        }

        @Override
        public void cancel() {
            finish();
        }

        @Override
        public boolean isClosed() {
            return closed.get();
        }
    }
}

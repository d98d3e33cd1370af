package agenthub.orchestrator.events;

import agenthub.orchestrator.core.Json;
import agenthub.orchestrator.model.Task;
import agenthub.orchestrator.model.TaskStatus;
import agenthub.orchestrator.store.Database;
import agenthub.orchestrator.store.JdbcTaskRepository;
import org.junit.jupiter.api.*;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class ProgressStreamerTest {

    private static Database db;
    private static JdbcTaskRepository repo;

    private EventBus bus;
    private ProgressStreamer streamer;

    /** Collects messages in memory */
    static class CollectingSink implements StreamSink {
        final List<StreamMessage> messages = new CopyOnWriteArrayList<>();
        final CountDownLatch closed = new CountDownLatch(1);
        volatile boolean accept = true;

        @Override
        public boolean send(StreamMessage message) {
            if (!accept) {
                return false;
            }
            messages.add(message);
            return true;
        }

        @Override
        public void close() {
            closed.countDown();
        }

        List<String> kinds() {
            return messages.stream().map(StreamMessage::event).toList();
        }

        boolean awaitClosed() throws InterruptedException {
            return closed.await(5, TimeUnit.SECONDS);
        }
    }

    @BeforeAll
    static void setupDb() {
        db = new Database("jdbc:h2:mem:test-streamer;DB_CLOSE_DELAY=-1;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE", 4);
        repo = new JdbcTaskRepository(db);
    }

    @AfterAll
    static void teardownDb() {
        if (db != null)
            db.close();
    }

    @BeforeEach
    void setup() throws Exception {
        try (var conn = db.getConnection();
                var st = conn.createStatement()) {
            st.execute("DELETE FROM tasks");
            conn.commit();
        }
        bus = new EventBus();
        streamer = new ProgressStreamer(repo, bus, Duration.ofMillis(100), 2);
    }

    @AfterEach
    void teardown() {
        streamer.close();
    }

    private Task createRunning(String id) {
        Task created = repo.create(Task.builder().id(id).agentType("echo").build());
        return repo.compareAndSet(created, created.toBuilder()
                .status(TaskStatus.RUNNING).attempts(1).startedAt(Instant.now()).build());
    }

    @Test
    void replaysEventsAndEndsWithComplete() throws Exception {
        Task running = createRunning("task-stream");
        bus.progress(running.id(), 0, "Attempt 1 of 3 started", null);
        bus.progress(running.id(), 50, "halfway", null);

        CollectingSink sink = new CollectingSink();
        streamer.subscribe(running.id(), Duration.ofMillis(20), Duration.ofSeconds(10), sink);

        Thread.sleep(100);
        Task done = repo.compareAndSet(running, running.toBuilder()
                .status(TaskStatus.COMPLETED).result("{\"ok\":true}").completedAt(Instant.now()).build());
        bus.complete(done.id(), "Task completed", EventData.terminal(done));

        assertTrue(sink.awaitClosed());
        List<String> kinds = sink.kinds().stream().filter(k -> !k.equals(StreamMessage.HEARTBEAT)).toList();
        assertEquals(List.of("progress", "progress", "complete"), kinds);
        assertEquals(Long.valueOf(3), sink.messages.get(sink.messages.size() - 1).sequence());
        assertEquals(0, streamer.activeCount());
    }

    @Test
    void missingTaskEndsWithNotFound() throws Exception {
        CollectingSink sink = new CollectingSink();
        streamer.subscribe("task-missing", Duration.ofMillis(20), Duration.ofSeconds(10), sink);

        assertTrue(sink.awaitClosed());
        StreamMessage last = sink.messages.get(sink.messages.size() - 1);
        assertEquals(StreamMessage.ERROR, last.event());
        assertEquals("TASK_NOT_FOUND", last.data().get("code").asText());
    }

    @Test
    void timesOutWithError() throws Exception {
        createRunning("task-slow");
        CollectingSink sink = new CollectingSink();
        streamer.subscribe("task-slow", Duration.ofMillis(20), Duration.ofMillis(150), sink);

        assertTrue(sink.awaitClosed());
        StreamMessage last = sink.messages.get(sink.messages.size() - 1);
        assertEquals("STREAM_TIMEOUT", last.data().get("code").asText());
    }

    @Test
    void idleStreamGetsHeartbeats() throws Exception {
        createRunning("task-idle");
        CollectingSink sink = new CollectingSink();
        Subscription subscription = streamer.subscribe("task-idle", Duration.ofMillis(20), Duration.ofSeconds(10), sink);

        Thread.sleep(400);
        subscription.cancel();

        assertTrue(sink.awaitClosed());
        assertTrue(sink.kinds().contains(StreamMessage.HEARTBEAT), sink.kinds().toString());
        assertTrue(subscription.isClosed());
    }

    @Test
    void terminalTaskWithoutEventsGetsSynthesizedComplete() throws Exception {
        Task running = createRunning("task-no-log");
        repo.compareAndSet(running, running.toBuilder()
                .status(TaskStatus.COMPLETED).result("{\"n\":1}").completedAt(Instant.now()).build());

        CollectingSink sink = new CollectingSink();
        streamer.subscribe("task-no-log", Duration.ofMillis(20), Duration.ofSeconds(10), sink);

        assertTrue(sink.awaitClosed());
        StreamMessage last = sink.messages.get(sink.messages.size() - 1);
        assertTrue(last.isTerminal());
        assertNull(last.sequence());
        assertEquals(Json.parse("{\"n\":1}"), last.data().get("result"));
    }

    @Test
    void goneClientStopsTheStream() throws Exception {
        createRunning("task-gone-client");
        CollectingSink sink = new CollectingSink();
        sink.accept = false;
        bus.progress("task-gone-client", 10, "hello", null);

        streamer.subscribe("task-gone-client", Duration.ofMillis(20), Duration.ofSeconds(10), sink);

        assertTrue(sink.awaitClosed());
        assertTrue(sink.messages.isEmpty());
    }
}

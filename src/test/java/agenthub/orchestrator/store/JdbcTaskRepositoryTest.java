package agenthub.orchestrator.store;

import agenthub.orchestrator.config.OrchestratorConfig;
import agenthub.orchestrator.error.ConflictException;
import agenthub.orchestrator.error.InvalidStateException;
import agenthub.orchestrator.error.NotFoundException;
import agenthub.orchestrator.model.Task;
import agenthub.orchestrator.model.TaskCost;
import agenthub.orchestrator.model.TaskError;
import agenthub.orchestrator.model.TaskFilter;
import agenthub.orchestrator.model.TaskPage;
import agenthub.orchestrator.model.TaskProgress;
import agenthub.orchestrator.model.TaskStatus;
import org.junit.jupiter.api.*;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class JdbcTaskRepositoryTest {

    private static Database db;
    private static JdbcTaskRepository repo;

    @BeforeAll
    static void setup() {
        OrchestratorConfig config = OrchestratorConfig.defaults()
                .withDatabaseUrl("jdbc:h2:mem:test-tasks;DB_CLOSE_DELAY=-1;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE");
        db = new Database(config);
        repo = new JdbcTaskRepository(db);
    }

    @AfterAll
    static void teardown() {
        if (db != null)
            db.close();
    }

    @BeforeEach
    void cleanTasks() throws Exception {
        try (var conn = db.getConnection();
                var st = conn.createStatement()) {
            st.execute("DELETE FROM tasks");
            conn.commit();
        }
    }

    private static Task.Builder task(String id) {
        return Task.builder().id(id).agentType("echo").payload("{\"n\":1}");
    }

    @Test
    void createAndFindById() {
        repo.create(task("task-1")
                .priority(5)
                .idempotencyKey("key-1")
                .userId("user-1")
                .maxAttempts(4)
                .webhookUrl("https://example.com/hook")
                .build());

        Optional<Task> found = repo.findById("task-1");
        assertTrue(found.isPresent());
        Task task = found.get();
        assertEquals("echo", task.agentType());
        assertEquals(TaskStatus.PENDING, task.status());
        assertEquals(5, task.priority());
        assertEquals("{\"n\":1}", task.payload());
        assertEquals("key-1", task.idempotencyKey());
        assertEquals("user-1", task.userId());
        assertEquals(4, task.maxAttempts());
        assertEquals("https://example.com/hook", task.webhookUrl());
        assertEquals(0, task.version());
        assertNotNull(task.createdAt());
        assertNull(task.error());
    }

    @Test
    void findMissingTask() {
        assertTrue(repo.findById("nope").isEmpty());
    }

    @Test
    void compareAndSetBumpsVersionAndStoresAllFields() {
        Task created = repo.create(task("task-cas").build());

        Task running = repo.compareAndSet(created, created.toBuilder()
                .status(TaskStatus.RUNNING)
                .attempts(1)
                .startedAt(Instant.now())
                .progress(new TaskProgress(30, "working", "fetch", 3, 1))
                .cost(new TaskCost(100, 50, 2))
                .build());
        assertEquals(1, running.version());

        Task stored = repo.findById("task-cas").orElseThrow();
        assertEquals(TaskStatus.RUNNING, stored.status());
        assertEquals(1, stored.attempts());
        assertEquals(1, stored.version());
        assertEquals(30, stored.progress().percent());
        assertEquals("working", stored.progress().message());
        assertEquals("fetch", stored.progress().currentStep());
        assertEquals(3, stored.progress().totalSteps());
        assertEquals(1, stored.progress().currentStepNum());
        assertEquals(new TaskCost(100, 50, 2), stored.cost());

        Task failed = repo.compareAndSet(stored, stored.toBuilder()
                .status(TaskStatus.FAILED)
                .error(new TaskError("PERMANENT", "[permanent] invalid input", false))
                .completedAt(Instant.now())
                .build());
        assertEquals(2, failed.version());

        Task reloaded = repo.findById("task-cas").orElseThrow();
        assertEquals("PERMANENT", reloaded.error().code());
        assertFalse(reloaded.error().retryable());
        assertNotNull(reloaded.completedAt());
    }

    @Test
    void staleWriteIsAConflict() {
        Task created = repo.create(task("task-stale").build());
        repo.compareAndSet(created, created.toBuilder().priority(3).build());

        // Second writer still holds version 0
        assertThrows(ConflictException.class,
                () -> repo.compareAndSet(created, created.toBuilder().status(TaskStatus.RUNNING).build()));
    }

    @Test
    void illegalTransitionIsRejected() {
        Task created = repo.create(task("task-illegal").build());

        assertThrows(InvalidStateException.class,
                () -> repo.compareAndSet(created, created.toBuilder().status(TaskStatus.COMPLETED).build()));
        assertEquals(TaskStatus.PENDING, repo.findById("task-illegal").orElseThrow().status());
    }

    @Test
    void updateOfDeletedTaskIsNotFound() {
        Task created = repo.create(task("task-gone").build());
        assertTrue(repo.delete("task-gone"));
        assertFalse(repo.delete("task-gone"));

        assertThrows(NotFoundException.class,
                () -> repo.compareAndSet(created, created.toBuilder().status(TaskStatus.RUNNING).build()));
        assertThrows(NotFoundException.class, () -> repo.update("task-gone", t -> t));
    }

    @Test
    void listFiltersAndPages() {
        Instant base = Instant.now().minusSeconds(60);
        for (int i = 0; i < 5; i++) {
            repo.create(task("task-a" + i).userId("alice").createdAt(base.plusSeconds(i)).build());
        }
        repo.create(task("task-b0").agentType("summarize").userId("bob").createdAt(base.plusSeconds(10)).build());

        TaskPage all = repo.list(TaskFilter.all(), 3, 0);
        assertEquals(6, all.total());
        assertEquals(3, all.tasks().size());
        assertEquals("task-b0", all.tasks().get(0).id(), "newest first");

        TaskPage alice = repo.list(new TaskFilter(null, null, "alice", false), 10, 2);
        assertEquals(5, alice.total());
        assertEquals(3, alice.tasks().size());

        TaskPage summarize = repo.list(new TaskFilter("summarize", null, null, false), 10, 0);
        assertEquals(1, summarize.total());
        assertEquals("bob", summarize.tasks().get(0).userId());

        TaskPage pending = repo.list(new TaskFilter(null, TaskStatus.PENDING, null, false), 10, 0);
        assertEquals(6, pending.total());
        TaskPage completed = repo.list(new TaskFilter(null, TaskStatus.COMPLETED, null, false), 10, 0);
        assertEquals(0, completed.total());
    }

    @Test
    void activeOnlyOrdersByPriorityThenAge() {
        Instant base = Instant.now().minusSeconds(60);
        repo.create(task("low-old").priority(1).createdAt(base).build());
        repo.create(task("high-new").priority(9).createdAt(base.plusSeconds(2)).build());
        repo.create(task("high-old").priority(9).createdAt(base.plusSeconds(1)).build());
        Task done = repo.create(task("done").priority(10).createdAt(base).build());
        Task running = repo.compareAndSet(done, done.toBuilder().status(TaskStatus.RUNNING).build());
        repo.compareAndSet(running, running.toBuilder().status(TaskStatus.COMPLETED).completedAt(Instant.now()).build());

        List<Task> active = repo.list(TaskFilter.active(), 10, 0).tasks();

        assertEquals(List.of("high-old", "high-new", "low-old"), active.stream().map(Task::id).toList());
    }

    @Test
    void countByStatus() {
        repo.create(task("p1").build());
        repo.create(task("p2").build());
        Task r = repo.create(task("r1").build());
        repo.compareAndSet(r, r.toBuilder().status(TaskStatus.RUNNING).build());

        Map<TaskStatus, Integer> counts = repo.countByStatus();
        assertEquals(2, counts.get(TaskStatus.PENDING));
        assertEquals(1, counts.get(TaskStatus.RUNNING));
        assertNull(counts.get(TaskStatus.FAILED));
    }

    @Test
    void findStuckRunning() {
        Task old = repo.create(task("old-run").build());
        repo.compareAndSet(old, old.toBuilder()
                .status(TaskStatus.RUNNING)
                .startedAt(Instant.now().minus(Duration.ofMinutes(20)))
                .build());
        Task fresh = repo.create(task("fresh-run").build());
        repo.compareAndSet(fresh, fresh.toBuilder().status(TaskStatus.RUNNING).startedAt(Instant.now()).build());

        List<Task> stuck = repo.findStuckRunning(Instant.now().minus(Duration.ofMinutes(10)));

        assertEquals(1, stuck.size());
        assertEquals("old-run", stuck.get(0).id());
    }

    @Test
    void findExpiredOnlyReturnsOldTerminalTasks() {
        Task a = repo.create(task("expired").build());
        repo.compareAndSet(a, a.toBuilder()
                .status(TaskStatus.CANCELLED)
                .error(TaskError.cancelled(null))
                .completedAt(Instant.now().minus(Duration.ofDays(8)))
                .build());
        Task b = repo.create(task("recent").build());
        repo.compareAndSet(b, b.toBuilder()
                .status(TaskStatus.CANCELLED)
                .completedAt(Instant.now())
                .build());
        repo.create(task("active").build());

        List<Task> expired = repo.findExpired(Instant.now().minus(Duration.ofDays(7)), 10);

        assertEquals(List.of("expired"), expired.stream().map(Task::id).toList());
    }

    @Test
    void findWithIdempotencyKeySince() {
        repo.create(task("keyed-new").idempotencyKey("k1").createdAt(Instant.now()).build());
        repo.create(task("keyed-old").idempotencyKey("k2").createdAt(Instant.now().minus(Duration.ofDays(2))).build());
        repo.create(task("unkeyed").build());

        List<Task> keyed = repo.findWithIdempotencyKeySince(Instant.now().minus(Duration.ofDays(1)));

        assertEquals(List.of("keyed-new"), keyed.stream().map(Task::id).toList());
    }
}

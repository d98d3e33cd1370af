package agenthub.orchestrator.scheduler;

import agenthub.orchestrator.config.OrchestratorConfig;
import agenthub.orchestrator.events.EventBus;
import agenthub.orchestrator.idempotency.IdempotencyIndex;
import agenthub.orchestrator.model.Task;
import agenthub.orchestrator.model.TaskStatus;
import agenthub.orchestrator.store.Database;
import agenthub.orchestrator.store.JdbcTaskRepository;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class RetentionSweeperTest {

    private Database db;
    private JdbcTaskRepository repo;
    private EventBus bus;
    private IdempotencyIndex index;
    private RetentionSweeper sweeper;

    @BeforeEach
    void setup() {
        OrchestratorConfig config = OrchestratorConfig.defaults()
                .withDatabaseUrl("jdbc:h2:mem:retention-" + UUID.randomUUID()
                        + ";DB_CLOSE_DELAY=-1;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE")
                .withRetention(Duration.ofDays(7));
        db = new Database(config);
        repo = new JdbcTaskRepository(db);
        bus = new EventBus();
        index = new IdempotencyIndex(Duration.ofDays(30));
        sweeper = new RetentionSweeper(repo, bus, index, config);
    }

    @AfterEach
    void teardown() {
        db.close();
    }

    private void finished(String id, Instant completedAt, String key) {
        Task created = repo.create(Task.builder().id(id).agentType("echo").idempotencyKey(key).build());
        index.reserve("echo", key, () -> id);
        bus.complete(id, "done", null);
        repo.compareAndSet(created, created.toBuilder().status(TaskStatus.CANCELLED).completedAt(completedAt).build());
    }

    @Test
    void deletesOnlyExpiredTerminalTasks() {
        finished("old-1", Instant.now().minus(Duration.ofDays(10)), "k1");
        finished("old-2", Instant.now().minus(Duration.ofDays(8)), "k2");
        finished("recent", Instant.now().minus(Duration.ofDays(1)), "k3");
        repo.create(Task.builder().id("active").agentType("echo").build());

        assertEquals(2, sweeper.sweep());

        assertTrue(repo.findById("old-1").isEmpty());
        assertTrue(repo.findById("old-2").isEmpty());
        assertTrue(repo.findById("recent").isPresent());
        assertTrue(repo.findById("active").isPresent());
        assertFalse(bus.hasLog("old-1"));
        assertTrue(index.lookup("echo", "k1").isEmpty());
        assertEquals("recent", index.lookup("echo", "k3").orElseThrow());

        assertEquals(0, sweeper.sweep());
    }
}

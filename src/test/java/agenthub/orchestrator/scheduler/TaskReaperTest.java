package agenthub.orchestrator.scheduler;

import agenthub.orchestrator.config.Dependencies;
import agenthub.orchestrator.config.OrchestratorConfig;
import agenthub.orchestrator.model.Task;
import agenthub.orchestrator.model.TaskError;
import agenthub.orchestrator.model.TaskStatus;
import agenthub.orchestrator.repository.TaskRepository;
import agenthub.orchestrator.worker.WorkRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Recovery paths, exercised without the dispatcher so queued tasks stay put.
 */
class TaskReaperTest {

    private Dependencies deps;
    private TaskRepository repo;
    private TaskReaper reaper;

    @BeforeEach
    void setup() {
        OrchestratorConfig config = OrchestratorConfig.defaults()
                .withDatabaseUrl("jdbc:h2:mem:reaper-" + UUID.randomUUID()
                        + ";DB_CLOSE_DELAY=-1;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE")
                .withStaleThreshold(Duration.ofMinutes(10))
                .withStaleRetryDelay(Duration.ofMillis(10))
                .withOrphanThreshold(Duration.ofSeconds(30));
        deps = Dependencies.create(config, WorkRegistry.withDefaults());
        repo = deps.taskRepository();
        reaper = deps.taskReaper();
    }

    @AfterEach
    void teardown() {
        deps.close();
    }

    private Task running(String id, int attempts, int maxAttempts, Instant startedAt) {
        Task created = repo.create(Task.builder().id(id).agentType("echo").maxAttempts(maxAttempts).build());
        return repo.compareAndSet(created, created.toBuilder()
                .status(TaskStatus.RUNNING).attempts(attempts).startedAt(startedAt).build());
    }

    private void waitForQueued(String taskId) throws InterruptedException {
        for (int i = 0; i < 200 && !deps.readyQueue().contains(taskId); i++) {
            Thread.sleep(10);
        }
        assertTrue(deps.readyQueue().contains(taskId), "task " + taskId + " not queued");
    }

    @Test
    void stuckTaskWithAttemptsLeftIsRetried() throws Exception {
        running("stuck", 1, 3, Instant.now().minus(Duration.ofMinutes(30)));
        running("fresh", 1, 3, Instant.now());

        assertEquals(1, reaper.reapStuckTasks());

        Task stuck = repo.findById("stuck").orElseThrow();
        assertEquals(TaskError.SERVER_RESTART, stuck.error().code());
        waitForQueued("stuck");
        assertEquals(TaskStatus.PENDING, repo.findById("stuck").orElseThrow().status());
        assertEquals(TaskStatus.RUNNING, repo.findById("fresh").orElseThrow().status());
    }

    @Test
    void stuckTaskOutOfAttemptsFails() {
        running("spent", 3, 3, Instant.now().minus(Duration.ofHours(1)));

        reaper.reapStuckTasks();

        Task failed = repo.findById("spent").orElseThrow();
        assertEquals(TaskStatus.FAILED, failed.status());
        assertEquals(TaskError.SERVER_RESTART, failed.error().code());
        assertTrue(deps.deadLetterRepository().findById("spent").isPresent());
        assertTrue(deps.eventBus().isComplete("spent"));
    }

    @Test
    void startupRecoveryRequeuesAndRecovers() throws Exception {
        repo.create(Task.builder().id("waiting").agentType("echo").build());
        running("interrupted", 1, 3, Instant.now());
        Task retrying = running("backing-off", 1, 3, Instant.now());
        repo.compareAndSet(retrying, retrying.toBuilder()
                .status(TaskStatus.RETRYING)
                .nextRetryAt(Instant.now().plusMillis(20))
                .build());

        assertEquals(3, reaper.recoverOnStartup());

        assertTrue(deps.readyQueue().contains("waiting"));
        waitForQueued("interrupted");
        waitForQueued("backing-off");
        assertEquals(TaskStatus.PENDING, repo.findById("backing-off").orElseThrow().status());
    }

    @Test
    void orphanSweepOffersOldUnqueuedPendingTasks() {
        Instant old = Instant.now().minus(Duration.ofMinutes(5));
        repo.create(Task.builder().id("orphan").agentType("echo").createdAt(old).updatedAt(old).build());
        repo.create(Task.builder().id("new").agentType("echo").build());

        assertEquals(1, reaper.sweepOrphans());
        assertTrue(deps.readyQueue().contains("orphan"));
        assertFalse(deps.readyQueue().contains("new"));

        assertEquals(0, reaper.sweepOrphans());
    }
}

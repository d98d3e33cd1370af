package agenthub.orchestrator.scheduler;

import agenthub.orchestrator.config.OrchestratorConfig;
import agenthub.orchestrator.events.EventBus;
import agenthub.orchestrator.idempotency.IdempotencyIndex;
import agenthub.orchestrator.model.Task;
import agenthub.orchestrator.repository.TaskRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.List;

/**
 * Deletes terminal tasks older than the retention period, in batches.
 * Dead letter entries are kept.
 */
public class RetentionSweeper implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(RetentionSweeper.class);

    private final TaskRepository taskRepository;
    private final EventBus eventBus;
    private final IdempotencyIndex idempotencyIndex;
    private final OrchestratorConfig config;

    public RetentionSweeper(TaskRepository taskRepository, EventBus eventBus,
            IdempotencyIndex idempotencyIndex, OrchestratorConfig config) {
        this.taskRepository = taskRepository;
        this.eventBus = eventBus;
        this.idempotencyIndex = idempotencyIndex;
        this.config = config;
    }

    @Override
    public void run() {
        sweep();
    }

    /**
     * @return number of tasks deleted
     */
    public int sweep() {
        Instant cutoff = Instant.now().minus(config.retention());
        int batchSize = config.cleanupBatchSize();
        int deleted = 0;

        while (true) {
            List<Task> expired = taskRepository.findExpired(cutoff, batchSize);
            int deletedInBatch = 0;
            for (Task task : expired) {
                if (taskRepository.delete(task.id())) {
                    eventBus.purge(task.id());
                    idempotencyIndex.invalidate(task.id());
                    deletedInBatch++;
                }
            }
            deleted += deletedInBatch;
            if (expired.size() < batchSize || deletedInBatch == 0) {
                break;
            }
        }

        if (deleted > 0) {
            log.info("Retention sweep deleted {} tasks completed before {}", deleted, cutoff);
        }
        return deleted;
    }
}

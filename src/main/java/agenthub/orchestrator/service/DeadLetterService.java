package agenthub.orchestrator.service;

import agenthub.orchestrator.error.NotFoundException;
import agenthub.orchestrator.model.DeadLetterEntry;
import agenthub.orchestrator.model.Task;
import agenthub.orchestrator.repository.DeadLetterRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Dead letter queue operations.
 */
public class DeadLetterService {

    private static final Logger log = LoggerFactory.getLogger(DeadLetterService.class);

    static final String RESOURCE = "dead letter entry";

    private final DeadLetterRepository deadLetterRepository;
    private final TaskService taskService;

    public DeadLetterService(DeadLetterRepository deadLetterRepository, TaskService taskService) {
        this.deadLetterRepository = deadLetterRepository;
        this.taskService = taskService;
    }

    public List<DeadLetterEntry> list(int limit) {
        return deadLetterRepository.list(limit);
    }

    public DeadLetterEntry get(String taskId) {
        return deadLetterRepository.findById(taskId).orElseThrow(() -> new NotFoundException(RESOURCE, taskId));
    }

    /**
     * Remove an entry permanently.
     */
    public void delete(String taskId) {
        if (!deadLetterRepository.delete(taskId)) {
            throw new NotFoundException(RESOURCE, taskId);
        }
        log.info("Dead letter entry {} deleted", taskId);
    }

    /**
     * Consume an entry and create a new task from it. Requeuing the same entry
     * twice fails the second time with {@link NotFoundException}.
     */
    public Task requeue(String taskId) {
        DeadLetterEntry entry = deadLetterRepository.take(taskId)
                .orElseThrow(() -> new NotFoundException(RESOURCE, taskId));
        return taskService.requeue(entry);
    }

    public int count() {
        return deadLetterRepository.count();
    }
}

package agenthub.orchestrator.service;

import agenthub.orchestrator.model.TaskStats;
import agenthub.orchestrator.repository.DeadLetterRepository;
import agenthub.orchestrator.repository.TaskRepository;
import agenthub.orchestrator.scheduler.ReadyQueue;
import agenthub.orchestrator.worker.WorkerPool;

/**
 * Task counts straight from the store plus live queue and pool figures.
 */
public class StatsService {

    /** Point-in-time statistics */
    public record Snapshot(TaskStats tasks, int deadLetter, int queueDepth, int workers, int busyWorkers) {
    }

    private final TaskRepository taskRepository;
    private final DeadLetterRepository deadLetterRepository;
    private final ReadyQueue readyQueue;
    private final WorkerPool workerPool;

    public StatsService(TaskRepository taskRepository, DeadLetterRepository deadLetterRepository,
            ReadyQueue readyQueue, WorkerPool workerPool) {
        this.taskRepository = taskRepository;
        this.deadLetterRepository = deadLetterRepository;
        this.readyQueue = readyQueue;
        this.workerPool = workerPool;
    }

    public TaskStats taskStats() {
        return TaskStats.from(taskRepository.countByStatus());
    }

    public Snapshot snapshot() {
        return new Snapshot(
                taskStats(),
                deadLetterRepository.count(),
                readyQueue.size(),
                workerPool.size(),
                workerPool.busy());
    }
}

package agenthub.orchestrator.repository;

import agenthub.orchestrator.error.ConflictException;
import agenthub.orchestrator.error.NotFoundException;
import agenthub.orchestrator.model.Task;
import agenthub.orchestrator.model.TaskFilter;
import agenthub.orchestrator.model.TaskPage;
import agenthub.orchestrator.model.TaskStatus;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Task Store: the single source of truth for task records.
 * All mutations are optimistic-concurrency checked.
 */
public interface TaskRepository {

    /**
     * Insert a new task.
     *
     * @param task the task to save (version is ignored and stored as 0)
     * @return the stored task
     */
    Task create(Task task);

    /**
     * Find a task by ID.
     *
     * @param taskId the task ID
     * @return the task if found
     */
    Optional<Task> findById(String taskId);

    /**
     * Atomically replace {@code current} with {@code updated} if the stored row still
     * has the status and version of {@code current}. The status change must be a legal
     * forward transition.
     *
     * @return the stored task with its new version and updated_at
     * @throws ConflictException  if the row changed since {@code current} was read
     * @throws NotFoundException  if the row no longer exists
     * @throws agenthub.orchestrator.error.InvalidStateException if the transition is not allowed
     */
    Task compareAndSet(Task current, Task updated);

    /**
     * Read-modify-write in one step. The mutation may throw to abort.
     *
     * @throws ConflictException if another writer got in between; callers retry
     */
    default Task update(String taskId, UnaryOperator<Task> mutation) {
        Task current = findById(taskId).orElseThrow(() -> new NotFoundException("task", taskId));
        return compareAndSet(current, mutation.apply(current));
    }

    /**
     * List tasks matching the filter. Ordered by created_at desc, or by priority desc
     * then created_at asc when {@link TaskFilter#activeOnly()} is set.
     */
    TaskPage list(TaskFilter filter, int limit, int offset);

    /**
     * Delete a task.
     *
     * @return true if a row was deleted
     */
    boolean delete(String taskId);

    /**
     * Count tasks grouped by status.
     */
    Map<TaskStatus, Integer> countByStatus();

    /**
     * Find tasks by status, highest priority first.
     */
    List<Task> findByStatus(TaskStatus status, int limit);

    /**
     * Find tasks that have been RUNNING since before the given instant.
     */
    List<Task> findStuckRunning(Instant startedBefore);

    /**
     * Find terminal tasks completed before the given instant, oldest first.
     */
    List<Task> findExpired(Instant completedBefore, int limit);

    /**
     * Find tasks carrying an idempotency key created at or after the given instant.
     */
    List<Task> findWithIdempotencyKeySince(Instant createdAfter);
}

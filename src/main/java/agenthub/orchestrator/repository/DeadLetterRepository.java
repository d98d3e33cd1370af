package agenthub.orchestrator.repository;

import agenthub.orchestrator.model.DeadLetterEntry;

import java.util.List;
import java.util.Optional;

/**
 * Storage for dead letter entries.
 */
public interface DeadLetterRepository {

    /**
     * Add an entry.
     *
     * @return false if an entry for the same task already exists
     */
    boolean add(DeadLetterEntry entry);

    Optional<DeadLetterEntry> findById(String taskId);

    /** Most recently moved first */
    List<DeadLetterEntry> list(int limit);

    boolean delete(String taskId);

    /**
     * Atomically remove and return an entry. Of two concurrent callers only one
     * receives the entry.
     */
    Optional<DeadLetterEntry> take(String taskId);

    int count();
}

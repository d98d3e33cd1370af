package agenthub.orchestrator.idempotency;

import agenthub.orchestrator.model.Task;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Maps client idempotency keys to task ids, scoped per agent type.
 * <p>
 * Holds only a back-reference to the task: entries expire after the TTL and are
 * invalidated when the task is deleted. The task for a new key is created while the
 * key's slot is held, so concurrent submissions with one key never create two tasks.
 */
public class IdempotencyIndex {

    private static final Logger log = LoggerFactory.getLogger(IdempotencyIndex.class);

    /** Key scoped to a namespace (the agent type) */
    record Key(String namespace, String key) {
    }

    record Entry(String taskId, Instant expiresAt) {
        boolean isExpired(Instant now) {
            return !now.isBefore(expiresAt);
        }
    }

    /**
     * Result of a reservation.
     *
     * @param isNew true if the task was created by this call
     */
    public record Reservation(String taskId, boolean isNew) {
    }

    private final Map<Key, Entry> entries = new ConcurrentHashMap<>();
    private final Map<String, Key> keysByTask = new ConcurrentHashMap<>();
    private final Duration ttl;

    public IdempotencyIndex(Duration ttl) {
        if (ttl == null || ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("ttl must be positive");
        }
        this.ttl = ttl;
    }

    /**
     * Reserve a key. If a live entry exists its task id is returned with
     * {@code isNew=false}; otherwise {@code taskCreator} runs and the id it returns
     * is stored. If the creator throws, nothing is stored.
     */
    public Reservation reserve(String namespace, String key, Supplier<String> taskCreator) {
        Objects.requireNonNull(namespace, "namespace");
        Objects.requireNonNull(key, "key");

        Key scoped = new Key(namespace, key);
        boolean[] created = new boolean[1];

        Entry entry = entries.compute(scoped, (k, existing) -> {
            Instant now = Instant.now();
            if (existing != null && !existing.isExpired(now)) {
                return existing;
            }
            String taskId = taskCreator.get();
            created[0] = true;
            return new Entry(taskId, now.plus(ttl));
        });

        if (created[0]) {
            keysByTask.put(entry.taskId(), scoped);
            log.debug("Idempotency key {}/{} reserved for task {}", namespace, key, entry.taskId());
        }
        return new Reservation(entry.taskId(), created[0]);
    }

    /**
     * Look up a live entry without reserving.
     */
    public Optional<String> lookup(String namespace, String key) {
        Entry entry = entries.get(new Key(namespace, key));
        if (entry == null || entry.isExpired(Instant.now())) {
            return Optional.empty();
        }
        return Optional.of(entry.taskId());
    }

    /**
     * Drop the entry pointing at a task (task deleted).
     *
     * @return true if an entry was removed
     */
    public boolean invalidate(String taskId) {
        Key key = keysByTask.remove(taskId);
        if (key == null) {
            return false;
        }
        Entry current = entries.get(key);
        boolean removed = current != null && current.taskId().equals(taskId) && entries.remove(key, current);
        if (removed) {
            log.debug("Idempotency key {}/{} invalidated (task {})", key.namespace(), key.key(), taskId);
        }
        return removed;
    }

    /**
     * Remove expired entries.
     *
     * @return number of entries removed
     */
    public int purgeExpired() {
        Instant now = Instant.now();
        int removed = 0;
        for (Map.Entry<Key, Entry> e : entries.entrySet()) {
            if (e.getValue().isExpired(now) && entries.remove(e.getKey(), e.getValue())) {
                keysByTask.remove(e.getValue().taskId(), e.getKey());
                removed++;
            }
        }
        if (removed > 0) {
            log.debug("Purged {} expired idempotency keys", removed);
        }
        return removed;
    }

    /**
     * Re-register keys of stored tasks (start-up). Entries expire relative to the
     * task's creation time.
     *
     * @return number of keys restored
     */
    public int restore(List<Task> tasks) {
        Instant now = Instant.now();
        int restored = 0;
        for (Task task : tasks) {
            if (task.idempotencyKey() == null || task.createdAt() == null) {
                continue;
            }
            Instant expiresAt = task.createdAt().plus(ttl);
            if (!now.isBefore(expiresAt)) {
                continue;
            }
            Key key = new Key(task.agentType(), task.idempotencyKey());
            if (entries.putIfAbsent(key, new Entry(task.id(), expiresAt)) == null) {
                keysByTask.put(task.id(), key);
                restored++;
            }
        }
        if (restored > 0) {
            log.info("Restored {} idempotency keys", restored);
        }
        return restored;
    }

    public int size() {
        return entries.size();
    }

    public Duration ttl() {
        return ttl;
    }
}

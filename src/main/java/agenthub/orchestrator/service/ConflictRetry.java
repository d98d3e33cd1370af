package agenthub.orchestrator.service;

import agenthub.orchestrator.error.ConflictException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.Supplier;

/**
 * Re-runs a read-modify-write when the store reports a concurrent change.
 * The action must re-read the task itself on each run.
 */
public final class ConflictRetry {

    private static final Logger log = LoggerFactory.getLogger(ConflictRetry.class);

    private final int maxAttempts;

    public ConflictRetry(int maxAttempts) {
        if (maxAttempts <= 0) {
            throw new IllegalArgumentException("maxAttempts must be positive");
        }
        this.maxAttempts = maxAttempts;
    }

    /**
     * @throws ConflictException if every attempt conflicted
     */
    public <T> T run(String taskId, Supplier<T> action) {
        for (int attempt = 1; ; attempt++) {
            try {
                return action.get();
            } catch (ConflictException e) {
                if (attempt >= maxAttempts) {
                    log.warn("Task {} still conflicting after {} attempts", taskId, attempt);
                    throw e;
                }
                log.debug("Conflict on task {} (attempt {}/{}), retrying", taskId, attempt, maxAttempts);
            }
        }
    }
}

package agenthub.orchestrator.retry;

import java.time.Duration;

/**
 * Decides whether a failed attempt is retried and how long to wait first.
 */
public interface RetryPolicy {

    /**
     * @param attempts    attempts made so far, including the one that just failed
     * @param maxAttempts the task's attempt ceiling
     * @return true if another attempt should be scheduled
     */
    boolean shouldRetry(int attempts, int maxAttempts, ErrorClassification classification);

    /**
     * Delay before the next attempt.
     *
     * @param attempts attempts made so far (1 after the first failure)
     */
    Duration backoff(int attempts, ErrorClassification classification);
}

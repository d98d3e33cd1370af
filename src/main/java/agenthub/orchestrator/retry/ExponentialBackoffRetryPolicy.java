package agenthub.orchestrator.retry;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Exponential backoff: {@code base * 2^(attempts-1) * multiplier}, capped at a maximum,
 * with optional +/- jitter.
 */
public class ExponentialBackoffRetryPolicy implements RetryPolicy {

    public static final Duration DEFAULT_BASE_DELAY = Duration.ofSeconds(5);
    public static final Duration DEFAULT_MAX_DELAY = Duration.ofSeconds(300);
    public static final double DEFAULT_JITTER = 0.25;

    private final Duration baseDelay;
    private final Duration maxDelay;
    private final double jitter;

    public ExponentialBackoffRetryPolicy() {
        this(DEFAULT_BASE_DELAY, DEFAULT_MAX_DELAY, DEFAULT_JITTER);
    }

    /**
     * @param baseDelay delay after the first failed attempt
     * @param maxDelay  cap on any single delay
     * @param jitter    fraction in [0, 1) of random variation applied to the delay
     */
    public ExponentialBackoffRetryPolicy(Duration baseDelay, Duration maxDelay, double jitter) {
        if (baseDelay == null || baseDelay.isNegative() || baseDelay.isZero())
            throw new IllegalArgumentException("baseDelay must be positive");
        if (maxDelay == null || maxDelay.compareTo(baseDelay) < 0)
            throw new IllegalArgumentException("maxDelay must be at least baseDelay");
        if (jitter < 0 || jitter >= 1)
            throw new IllegalArgumentException("jitter must be in [0, 1)");

        this.baseDelay = baseDelay;
        this.maxDelay = maxDelay;
        this.jitter = jitter;
    }

    @Override
    public boolean shouldRetry(int attempts, int maxAttempts, ErrorClassification classification) {
        return classification.retryable() && attempts < maxAttempts;
    }

    @Override
    public Duration backoff(int attempts, ErrorClassification classification) {
        int exponent = Math.max(0, attempts - 1);
        double multiplier = classification != null ? Math.max(1.0, classification.backoffMultiplier()) : 1.0;

        // 2^exponent overflows quickly; the cap makes anything past 2^30 irrelevant
        double delayMillis = baseDelay.toMillis() * Math.pow(2, Math.min(exponent, 30)) * multiplier;
        delayMillis = Math.min(delayMillis, maxDelay.toMillis());

        if (jitter > 0) {
            double factor = 1 + jitter * (ThreadLocalRandom.current().nextDouble() * 2 - 1);
            delayMillis = delayMillis * factor;
        }

        return Duration.ofMillis(Math.max(1, Math.round(delayMillis)));
    }

    public Duration baseDelay() {
        return baseDelay;
    }

    public Duration maxDelay() {
        return maxDelay;
    }

    public double jitter() {
        return jitter;
    }
}

package agenthub.orchestrator.model;

import java.security.SecureRandom;
import java.time.Instant;

/**
 * Generates time-sortable task identifiers: {@code task_<8 hex seconds><8 hex random>}.
 */
public final class TaskIds {

    private static final SecureRandom RANDOM = new SecureRandom();

    private TaskIds() {
    }

    public static String newId() {
        return newId(Instant.now());
    }

    static String newId(Instant at) {
        long seconds = at.getEpochSecond() & 0xFFFFFFFFL;
        int random = RANDOM.nextInt();
        return String.format("task_%08x%08x", seconds, random);
    }
}

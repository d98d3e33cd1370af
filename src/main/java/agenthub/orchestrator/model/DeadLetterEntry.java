package agenthub.orchestrator.model;

import java.time.Instant;

/**
 * Snapshot of a permanently failed task held in the dead letter queue.
 * Shares no identity with the tasks created from it by a requeue.
 */
public record DeadLetterEntry(
        String taskId,
        String agentType,
        String payload,
        int priority,
        int attempts,
        int maxAttempts,
        TaskError error,
        String userId,
        String webhookUrl,
        TaskCost cost,
        int requeueCount,
        Instant createdAt,
        Instant failedAt,
        Instant movedAt) {

    public static DeadLetterEntry of(Task task, Instant movedAt) {
        return new DeadLetterEntry(
                task.id(),
                task.agentType(),
                task.payload(),
                task.priority(),
                task.attempts(),
                task.maxAttempts(),
                task.error(),
                task.userId(),
                task.webhookUrl(),
                task.cost(),
                task.requeueCount(),
                task.createdAt(),
                task.completedAt(),
                movedAt);
    }
}

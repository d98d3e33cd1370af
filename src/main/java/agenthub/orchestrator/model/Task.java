package agenthub.orchestrator.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Immutable domain model of an asynchronous task.
 * Updates go through {@link #toBuilder()} and the repository's compare-and-set.
 */
public final class Task {
    private final String id;
    private final String agentType;
    private final TaskStatus status;
    private final int priority;
    private final String payload; // opaque JSON passed to the work function
    private final String idempotencyKey;
    private final String userId;
    private final int attempts;
    private final int maxAttempts;
    private final TaskProgress progress;
    private final String result; // JSON, only when COMPLETED
    private final TaskError error;
    private final TaskCost cost;
    private final String webhookUrl;
    private final boolean cancelRequested;
    private final int requeueCount;
    private final Instant createdAt;
    private final Instant startedAt;
    private final Instant updatedAt;
    private final Instant completedAt;
    private final Instant nextRetryAt;
    private final long version;

    private Task(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id is required");
        this.agentType = Objects.requireNonNull(builder.agentType, "agentType is required");
        this.status = Objects.requireNonNull(builder.status, "status is required");
        this.priority = builder.priority;
        this.payload = Objects.requireNonNull(builder.payload, "payload is required");
        this.idempotencyKey = builder.idempotencyKey;
        this.userId = builder.userId;
        this.attempts = builder.attempts;
        this.maxAttempts = builder.maxAttempts;
        this.progress = builder.progress != null ? builder.progress : TaskProgress.NONE;
        this.result = builder.result;
        this.error = builder.error;
        this.cost = builder.cost != null ? builder.cost : TaskCost.ZERO;
        this.webhookUrl = builder.webhookUrl;
        this.cancelRequested = builder.cancelRequested;
        this.requeueCount = builder.requeueCount;
        this.createdAt = builder.createdAt;
        this.startedAt = builder.startedAt;
        this.updatedAt = builder.updatedAt;
        this.completedAt = builder.completedAt;
        this.nextRetryAt = builder.nextRetryAt;
        this.version = builder.version;
    }

    public String id() {
        return id;
    }

    public String agentType() {
        return agentType;
    }

    public TaskStatus status() {
        return status;
    }

    public int priority() {
        return priority;
    }

    public String payload() {
        return payload;
    }

    public String idempotencyKey() {
        return idempotencyKey;
    }

    public String userId() {
        return userId;
    }

    public int attempts() {
        return attempts;
    }

    public int maxAttempts() {
        return maxAttempts;
    }

    public TaskProgress progress() {
        return progress;
    }

    public String result() {
        return result;
    }

    public TaskError error() {
        return error;
    }

    public TaskCost cost() {
        return cost;
    }

    public String webhookUrl() {
        return webhookUrl;
    }

    public boolean cancelRequested() {
        return cancelRequested;
    }

    public int requeueCount() {
        return requeueCount;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public Instant startedAt() {
        return startedAt;
    }

    public Instant updatedAt() {
        return updatedAt;
    }

    public Instant completedAt() {
        return completedAt;
    }

    public Instant nextRetryAt() {
        return nextRetryAt;
    }

    public long version() {
        return version;
    }

    /** Check if another attempt is allowed by the attempt budget */
    public boolean canRetry() {
        return attempts < maxAttempts;
    }

    /** Check if task is in terminal state */
    public boolean isTerminal() {
        return status.isTerminal();
    }

    /** Pending, running and retrying tasks can be cancelled */
    public boolean isCancellable() {
        return !status.isTerminal();
    }

    /** Failed with an error the client may retry */
    public boolean isRetryableFailure() {
        return status == TaskStatus.FAILED && error != null && error.retryable();
    }

    /** Create a builder from this task (for updates) */
    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .agentType(agentType)
                .status(status)
                .priority(priority)
                .payload(payload)
                .idempotencyKey(idempotencyKey)
                .userId(userId)
                .attempts(attempts)
                .maxAttempts(maxAttempts)
                .progress(progress)
                .result(result)
                .error(error)
                .cost(cost)
                .webhookUrl(webhookUrl)
                .cancelRequested(cancelRequested)
                .requeueCount(requeueCount)
                .createdAt(createdAt)
                .startedAt(startedAt)
                .updatedAt(updatedAt)
                .completedAt(completedAt)
                .nextRetryAt(nextRetryAt)
                .version(version);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String id;
        private String agentType;
        private TaskStatus status = TaskStatus.PENDING;
        private int priority = 0;
        private String payload = "{}";
        private String idempotencyKey;
        private String userId;
        private int attempts = 0;
        private int maxAttempts = 3;
        private TaskProgress progress;
        private String result;
        private TaskError error;
        private TaskCost cost;
        private String webhookUrl;
        private boolean cancelRequested;
        private int requeueCount;
        private Instant createdAt;
        private Instant startedAt;
        private Instant updatedAt;
        private Instant completedAt;
        private Instant nextRetryAt;
        private long version;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder agentType(String agentType) {
            this.agentType = agentType;
            return this;
        }

        public Builder status(TaskStatus status) {
            this.status = status;
            return this;
        }

        public Builder priority(int priority) {
            this.priority = priority;
            return this;
        }

        public Builder payload(String payload) {
            this.payload = payload;
            return this;
        }

        public Builder idempotencyKey(String idempotencyKey) {
            this.idempotencyKey = idempotencyKey;
            return this;
        }

        public Builder userId(String userId) {
            this.userId = userId;
            return this;
        }

        public Builder attempts(int attempts) {
            this.attempts = attempts;
            return this;
        }

        public Builder maxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
            return this;
        }

        public Builder progress(TaskProgress progress) {
            this.progress = progress;
            return this;
        }

        public Builder result(String result) {
            this.result = result;
            return this;
        }

        public Builder error(TaskError error) {
            this.error = error;
            return this;
        }

        public Builder cost(TaskCost cost) {
            this.cost = cost;
            return this;
        }

        public Builder webhookUrl(String webhookUrl) {
            this.webhookUrl = webhookUrl;
            return this;
        }

        public Builder cancelRequested(boolean cancelRequested) {
            this.cancelRequested = cancelRequested;
            return this;
        }

        public Builder requeueCount(int requeueCount) {
            this.requeueCount = requeueCount;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder startedAt(Instant startedAt) {
            this.startedAt = startedAt;
            return this;
        }

        public Builder updatedAt(Instant updatedAt) {
            this.updatedAt = updatedAt;
            return this;
        }

        public Builder completedAt(Instant completedAt) {
            this.completedAt = completedAt;
            return this;
        }

        public Builder nextRetryAt(Instant nextRetryAt) {
            this.nextRetryAt = nextRetryAt;
            return this;
        }

        public Builder version(long version) {
            this.version = version;
            return this;
        }

        public Task build() {
            return new Task(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Task task))
            return false;
        return Objects.equals(id, task.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "Task{id='" + id + "', agentType='" + agentType + "', status=" + status
                + ", attempts=" + attempts + "/" + maxAttempts + "}";
    }
}

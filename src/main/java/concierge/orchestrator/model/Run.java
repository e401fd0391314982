package concierge.orchestrator.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Immutable snapshot of a run.
 *
 * Identity fields (id, correlation id, idempotency key, tenant, thread, task,
 * createdAt) never change. Status, result and error are the cached projection of
 * the run's event log and are rewritten only in the transaction that appends
 * the events they derive from.
 */
public final class Run {
    private final String id;
    private final String correlationId;
    private final String idempotencyKey;
    private final String tenantId;
    private final String threadId;
    private final String task;
    private final RunStatus status;
    private final String result;
    private final String error;
    private final Instant createdAt;
    private final Instant updatedAt;
    private final Instant waitingSince;

    private Run(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id is required");
        this.correlationId = Objects.requireNonNull(builder.correlationId, "correlationId is required");
        this.idempotencyKey = builder.idempotencyKey;
        this.tenantId = builder.tenantId;
        this.threadId = builder.threadId;
        this.task = builder.task;
        this.status = Objects.requireNonNull(builder.status, "status is required");
        this.result = builder.result;
        this.error = builder.error;
        this.createdAt = builder.createdAt;
        this.updatedAt = builder.updatedAt;
        this.waitingSince = builder.waitingSince;
    }

    public String id() {
        return id;
    }

    public String correlationId() {
        return correlationId;
    }

    public String idempotencyKey() {
        return idempotencyKey;
    }

    public String tenantId() {
        return tenantId;
    }

    public String threadId() {
        return threadId;
    }

    public String task() {
        return task;
    }

    public RunStatus status() {
        return status;
    }

    public String result() {
        return result;
    }

    public String error() {
        return error;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public Instant updatedAt() {
        return updatedAt;
    }

    /** Time the current barrier started waiting, null unless WAITING */
    public Instant waitingSince() {
        return waitingSince;
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }

    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .correlationId(correlationId)
                .idempotencyKey(idempotencyKey)
                .tenantId(tenantId)
                .threadId(threadId)
                .task(task)
                .status(status)
                .result(result)
                .error(error)
                .createdAt(createdAt)
                .updatedAt(updatedAt)
                .waitingSince(waitingSince);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String id;
        private String correlationId;
        private String idempotencyKey;
        private String tenantId;
        private String threadId;
        private String task;
        private RunStatus status = RunStatus.PENDING;
        private String result;
        private String error;
        private Instant createdAt;
        private Instant updatedAt;
        private Instant waitingSince;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder correlationId(String correlationId) {
            this.correlationId = correlationId;
            return this;
        }

        public Builder idempotencyKey(String idempotencyKey) {
            this.idempotencyKey = idempotencyKey;
            return this;
        }

        public Builder tenantId(String tenantId) {
            this.tenantId = tenantId;
            return this;
        }

        public Builder threadId(String threadId) {
            this.threadId = threadId;
            return this;
        }

        public Builder task(String task) {
            this.task = task;
            return this;
        }

        public Builder status(RunStatus status) {
            this.status = status;
            return this;
        }

        public Builder result(String result) {
            this.result = result;
            return this;
        }

        public Builder error(String error) {
            this.error = error;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder updatedAt(Instant updatedAt) {
            this.updatedAt = updatedAt;
            return this;
        }

        public Builder waitingSince(Instant waitingSince) {
            this.waitingSince = waitingSince;
            return this;
        }

        public Run build() {
            return new Run(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Run run))
            return false;
        return Objects.equals(id, run.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "Run{id='" + id + "', status=" + status + ", correlationId='" + correlationId + "'}";
    }
}

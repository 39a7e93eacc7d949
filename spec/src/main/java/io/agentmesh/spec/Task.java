package io.agentmesh.spec;

import java.time.OffsetDateTime;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.agentmesh.util.Assert;
import org.jspecify.annotations.Nullable;

/**
 * Snapshot of a unit of work tracked through the {@link TaskState} machine.
 * <p>
 * Tasks are immutable values; the task lifecycle manager produces a new snapshot for every
 * applied transition. The id never changes and {@code updated_at} never moves backwards.
 *
 * @param id unique task identifier
 * @param status current lifecycle state
 * @param createdAt creation timestamp
 * @param updatedAt last transition timestamp
 * @param agent the agent owning execution, if routed
 * @param result the result message, set when completed
 * @param error the failure detail, set when failed
 * @param cancelRequested whether cancellation has been requested
 * @param workerId the worker currently (or last) holding the lease, for worker-bound tasks
 * @param attempts number of times a worker lease on this task expired
 * @param metadata arbitrary metadata, e.g. {@code codebase_id} for worker-bound tasks
 */
@JsonInclude(JsonInclude.Include.NON_ABSENT)
@JsonIgnoreProperties(ignoreUnknown = true)
public record Task(@JsonProperty("id") String id,
                   @JsonProperty("status") TaskState status,
                   @JsonProperty("created_at") OffsetDateTime createdAt,
                   @JsonProperty("updated_at") OffsetDateTime updatedAt,
                   @JsonProperty("agent") @Nullable String agent,
                   @JsonProperty("result") @Nullable Message result,
                   @JsonProperty("error") @Nullable TaskErrorDetail error,
                   @JsonProperty("cancel_requested") boolean cancelRequested,
                   @JsonProperty("worker_id") @Nullable String workerId,
                   @JsonProperty("attempts") int attempts,
                   @JsonProperty("metadata") Map<String, Object> metadata) {

    public static final String CODEBASE_ID = "codebase_id";

    @JsonCreator
    public Task {
        Assert.checkNotNullParam("id", id);
        Assert.checkNotNullParam("status", status);
        Assert.checkNotNullParam("createdAt", createdAt);
        Assert.checkNotNullParam("updatedAt", updatedAt);
        metadata = (metadata != null) ? Map.copyOf(metadata) : Map.of();
    }

    /**
     * Returns the codebase this task is scoped to, if it is a worker-bound task.
     */
    public @Nullable String codebaseId() {
        Object value = metadata.get(CODEBASE_ID);
        return value != null ? value.toString() : null;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static Builder builder(Task task) {
        return new Builder(task);
    }

    /**
     * Builder for constructing {@link Task} snapshots.
     */
    public static class Builder {
        private @Nullable String id;
        private TaskState status = TaskState.PENDING;
        private @Nullable OffsetDateTime createdAt;
        private @Nullable OffsetDateTime updatedAt;
        private @Nullable String agent;
        private @Nullable Message result;
        private @Nullable TaskErrorDetail error;
        private boolean cancelRequested;
        private @Nullable String workerId;
        private int attempts;
        private @Nullable Map<String, Object> metadata;

        private Builder() {
        }

        private Builder(Task task) {
            id = task.id;
            status = task.status;
            createdAt = task.createdAt;
            updatedAt = task.updatedAt;
            agent = task.agent;
            result = task.result;
            error = task.error;
            cancelRequested = task.cancelRequested;
            workerId = task.workerId;
            attempts = task.attempts;
            metadata = task.metadata;
        }

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder status(TaskState status) {
            this.status = status;
            return this;
        }

        public Builder createdAt(OffsetDateTime createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder updatedAt(OffsetDateTime updatedAt) {
            this.updatedAt = updatedAt;
            return this;
        }

        public Builder agent(@Nullable String agent) {
            this.agent = agent;
            return this;
        }

        public Builder result(@Nullable Message result) {
            this.result = result;
            return this;
        }

        public Builder error(@Nullable TaskErrorDetail error) {
            this.error = error;
            return this;
        }

        public Builder cancelRequested(boolean cancelRequested) {
            this.cancelRequested = cancelRequested;
            return this;
        }

        public Builder workerId(@Nullable String workerId) {
            this.workerId = workerId;
            return this;
        }

        public Builder attempts(int attempts) {
            this.attempts = attempts;
            return this;
        }

        public Builder metadata(@Nullable Map<String, Object> metadata) {
            this.metadata = metadata;
            return this;
        }

        public Task build() {
            return new Task(
                    Assert.checkNotNullParam("id", id),
                    status,
                    Assert.checkNotNullParam("createdAt", createdAt),
                    updatedAt != null ? updatedAt : createdAt,
                    agent,
                    result,
                    error,
                    cancelRequested,
                    workerId,
                    attempts,
                    metadata);
        }
    }
}

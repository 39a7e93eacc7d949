package io.agentmesh.server.workers;

import static io.agentmesh.util.Assert.checkNotNullParam;

import java.time.Duration;
import java.time.Instant;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.jspecify.annotations.Nullable;

/**
 * Time-bounded claim of a worker on a running task, renewed by heartbeats and output submissions.
 *
 * @param taskId the leased task
 * @param workerId the owning worker
 * @param codebaseId the codebase the task is scoped to, if any
 * @param token identifies this particular claim; a reclaimed task gets a new one
 * @param lastSeen last renewal
 */
@JsonInclude(JsonInclude.Include.NON_ABSENT)
public record WorkerLease(@JsonProperty("task_id") String taskId,
                          @JsonProperty("worker_id") String workerId,
                          @JsonProperty("codebase_id") @Nullable String codebaseId,
                          @JsonProperty("token") String token,
                          @JsonProperty("last_seen") Instant lastSeen) {

    public WorkerLease {
        checkNotNullParam("taskId", taskId);
        checkNotNullParam("workerId", workerId);
        checkNotNullParam("token", token);
        checkNotNullParam("lastSeen", lastSeen);
    }

    public boolean isExpired(Instant now, Duration timeout) {
        return lastSeen.plus(timeout).isBefore(now);
    }

    public WorkerLease renew(Instant now) {
        return new WorkerLease(taskId, workerId, codebaseId, token, now);
    }
}

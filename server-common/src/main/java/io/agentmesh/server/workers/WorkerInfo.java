package io.agentmesh.server.workers;

import static io.agentmesh.util.Assert.checkNotBlankParam;
import static io.agentmesh.util.Assert.checkNotNullParam;

import java.time.Instant;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.jspecify.annotations.Nullable;

/**
 * A registered out-of-process worker.
 */
@JsonInclude(JsonInclude.Include.NON_ABSENT)
public record WorkerInfo(@JsonProperty("worker_id") String workerId,
                         @JsonProperty("name") String name,
                         @JsonProperty("capabilities") List<String> capabilities,
                         @JsonProperty("hostname") @Nullable String hostname,
                         @JsonProperty("registered_at") Instant registeredAt,
                         @JsonProperty("last_seen") Instant lastSeen) {

    public WorkerInfo {
        checkNotBlankParam("workerId", workerId);
        name = name == null || name.isBlank() ? workerId : name;
        capabilities = capabilities == null ? List.of() : List.copyOf(capabilities);
        checkNotNullParam("registeredAt", registeredAt);
        checkNotNullParam("lastSeen", lastSeen);
    }

    public WorkerInfo seenAt(Instant instant) {
        return new WorkerInfo(workerId, name, capabilities, hostname, registeredAt, instant);
    }
}

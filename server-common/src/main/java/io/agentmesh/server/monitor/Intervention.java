package io.agentmesh.server.monitor;

import static io.agentmesh.util.Assert.checkNotNullParam;

import java.time.OffsetDateTime;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A message a human operator injected into an agent's mailbox.
 */
public record Intervention(@JsonProperty("agent_id") String agentId,
                           @JsonProperty("message") String message,
                           @JsonProperty("timestamp") OffsetDateTime timestamp) {

    public Intervention {
        checkNotNullParam("agentId", agentId);
        checkNotNullParam("message", message);
        checkNotNullParam("timestamp", timestamp);
    }
}

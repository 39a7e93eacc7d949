package io.agentmesh.spec;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Optional features supported by the server, advertised in the {@link AgentCard}.
 *
 * @param streaming whether {@code message/stream} and {@code tasks/resubscribe} are available
 * @param workerProtocol whether out-of-process workers can poll for tasks
 * @param toolBridge whether agents can reach an MCP tool server
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AgentCapabilities(@JsonProperty("streaming") boolean streaming,
                                @JsonProperty("worker_protocol") boolean workerProtocol,
                                @JsonProperty("tool_bridge") boolean toolBridge) {
}

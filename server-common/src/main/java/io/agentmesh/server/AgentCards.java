package io.agentmesh.server;

import static io.agentmesh.util.Assert.checkNotNullParam;

import java.util.ArrayList;
import java.util.List;

import io.agentmesh.server.agents.AgentIdentity;
import io.agentmesh.server.agents.AgentRegistry;
import io.agentmesh.server.config.ServerConfig;
import io.agentmesh.spec.AgentCapabilities;
import io.agentmesh.spec.AgentCard;
import io.agentmesh.spec.AgentSkill;
import io.agentmesh.util.Utils;

/**
 * Builds the discovery document served at {@code /.well-known/agent-card.json}.
 */
public final class AgentCards {

    public static final String WELL_KNOWN_PATH = "/.well-known/agent-card.json";
    public static final String STREAMING_PATH = "/v1/tasks/{task_id}/events";
    public static final String WORKERS_PATH = "/v1/workers";

    private AgentCards() {
    }

    /**
     * Lists one skill entry per registered agent, in registration order.
     *
     * @param workersEnabled whether the worker protocol is served
     */
    public static AgentCard create(ServerConfig config, AgentRegistry registry, boolean workersEnabled) {
        checkNotNullParam("config", config);
        checkNotNullParam("registry", registry);
        String baseUrl = stripTrailingSlash(config.publicUrl());

        List<AgentSkill> skills = new ArrayList<>();
        for (AgentIdentity agent : registry.list()) {
            skills.add(new AgentSkill(agent.name(), agent.name(), agent.description()));
        }

        AgentCard.Builder builder = AgentCard.builder()
                .name(config.agentName())
                .description(config.agentDescription())
                .version(config.agentVersion())
                .url(baseUrl + "/")
                .protocolVersion(Utils.PROTOCOL_VERSION)
                .capabilities(new AgentCapabilities(true, workersEnabled, registry.toolBridge() != null))
                .skills(skills)
                .endpoint(AgentCard.JSONRPC_ENDPOINT, baseUrl + "/")
                .endpoint(AgentCard.STREAMING_ENDPOINT, baseUrl + STREAMING_PATH);
        if (registry.toolBridge() != null) {
            builder.endpoint(AgentCard.TOOL_BRIDGE_ENDPOINT, config.mcpUrl());
        }
        if (workersEnabled) {
            builder.endpoint(AgentCard.WORKERS_ENDPOINT, baseUrl + WORKERS_PATH);
        }
        return builder.build();
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}

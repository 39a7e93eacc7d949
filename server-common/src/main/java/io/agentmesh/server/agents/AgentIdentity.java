package io.agentmesh.server.agents;

import static io.agentmesh.util.Assert.checkNotBlankParam;
import static io.agentmesh.util.Assert.checkNotNullParam;

import java.util.List;

import io.agentmesh.spec.AgentSkill;

/**
 * A registered agent: unique name, advertised skills and its handler.
 */
public record AgentIdentity(String name, String description, List<AgentSkill> skills, AgentHandler handler) {

    public AgentIdentity {
        checkNotBlankParam("name", name);
        checkNotNullParam("handler", handler);
        description = description == null ? "" : description;
        skills = skills == null ? List.of() : List.copyOf(skills);
    }
}

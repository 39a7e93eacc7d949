package io.agentmesh.server.agents;

import java.util.List;

import io.agentmesh.spec.AgentSkill;
import io.agentmesh.spec.Message;

/**
 * Fallback agent: replies with the message text prefixed by {@code Echo: }.
 */
public class EchoAgent implements AgentHandler {

    public static final String NAME = "echo";

    public static AgentIdentity identity() {
        return new AgentIdentity(NAME, "Echoes back received messages for testing and fallback",
                List.of(new AgentSkill("echo", "Echo Messages",
                        "Echoes back received messages for testing and fallback")),
                new EchoAgent());
    }

    @Override
    public Message handle(Message message, AgentContext context) {
        return Message.text("Echo: " + message.joinedText());
    }
}

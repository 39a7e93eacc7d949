package io.agentmesh.server.agents;

import io.agentmesh.spec.Message;

/**
 * Message handler of an agent. Returns the reply; a thrown exception fails the task.
 */
@FunctionalInterface
public interface AgentHandler {

    Message handle(Message message, AgentContext context) throws Exception;
}

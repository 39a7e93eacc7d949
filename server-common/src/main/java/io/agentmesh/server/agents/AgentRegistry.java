package io.agentmesh.server.agents;

import static io.agentmesh.util.Assert.checkNotNullParam;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.BooleanSupplier;

import io.agentmesh.client.mcp.ToolBridge;
import io.agentmesh.server.events.MessageBroker;
import io.agentmesh.spec.AgentNotFoundError;
import io.agentmesh.spec.Event;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Named agents known to this server.
 * <p>
 * Copy-on-write: registration swaps in a new immutable map, so routing reads a consistent snapshot
 * without locking. Registering an agent opens its broker mailbox and announces
 * {@code agent.registered}; unregistering reverses both.
 */
public class AgentRegistry {

    private static final Logger LOGGER = LoggerFactory.getLogger(AgentRegistry.class);

    private final MessageBroker broker;
    private final @Nullable ToolBridge toolBridge;
    private volatile Map<String, AgentIdentity> agents = Map.of();

    public AgentRegistry(MessageBroker broker, @Nullable ToolBridge toolBridge) {
        this.broker = checkNotNullParam("broker", broker);
        this.toolBridge = toolBridge;
    }

    public MessageBroker broker() {
        return broker;
    }

    public @Nullable ToolBridge toolBridge() {
        return toolBridge;
    }

    /**
     * @throws IllegalStateException if an agent with the same name is registered
     */
    public void register(AgentIdentity agent) {
        checkNotNullParam("agent", agent);
        synchronized (this) {
            if (agents.containsKey(agent.name())) {
                throw new IllegalStateException("Agent already registered: " + agent.name());
            }
            Map<String, AgentIdentity> updated = new LinkedHashMap<>(agents);
            updated.put(agent.name(), agent);
            agents = Collections.unmodifiableMap(updated);
            broker.openMailbox(agent.name(), (sender, message) ->
                    agent.handler().handle(message, contextFor(agent.name(), message.taskId(), sender)));
        }
        LOGGER.info("Registered agent {}", agent.name());
        broker.publish(Event.AGENT_REGISTERED, describe(agent), agent.name());
    }

    /**
     * @return {@code true} if the agent was registered
     */
    public boolean unregister(String name) {
        AgentIdentity removed;
        synchronized (this) {
            removed = agents.get(name);
            if (removed == null) {
                return false;
            }
            Map<String, AgentIdentity> updated = new LinkedHashMap<>(agents);
            updated.remove(name);
            agents = Collections.unmodifiableMap(updated);
            broker.closeMailbox(name);
        }
        LOGGER.info("Unregistered agent {}", name);
        broker.publish(Event.AGENT_UNREGISTERED, describe(removed), name);
        return true;
    }

    public @Nullable AgentIdentity get(String name) {
        return agents.get(name);
    }

    /**
     * @throws AgentNotFoundError if no agent has this name
     */
    public AgentIdentity require(String name) {
        AgentIdentity agent = agents.get(name);
        if (agent == null) {
            throw AgentNotFoundError.forAgent(name);
        }
        return agent;
    }

    public boolean contains(String name) {
        return agents.containsKey(name);
    }

    /**
     * Agents in registration order.
     */
    public List<AgentIdentity> list() {
        return List.copyOf(agents.values());
    }

    public AgentContext contextFor(String agentName, @Nullable String taskId, @Nullable String sender) {
        return new AgentContext(agentName, taskId, sender, broker, toolBridge);
    }

    public AgentContext contextFor(String agentName, @Nullable String taskId, @Nullable String sender,
                                   BooleanSupplier cancellation) {
        return new AgentContext(agentName, taskId, sender, broker, toolBridge, cancellation);
    }

    private static Map<String, Object> describe(AgentIdentity agent) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("name", agent.name());
        payload.put("description", agent.description());
        payload.put("skills", agent.skills());
        return payload;
    }
}

package io.agentmesh.server.agents;

import static io.agentmesh.util.Assert.checkNotBlankParam;
import static io.agentmesh.util.Assert.checkNotNullParam;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Predicate;

import io.agentmesh.spec.AgentNotFoundError;
import io.agentmesh.spec.Message;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Picks the agent for an inbound message.
 * <p>
 * Routes are evaluated in the order they were added; the first whose predicate matches and whose
 * agent is registered wins. When nothing matches, the fallback agent handles the message. A
 * predicate that throws is logged and counts as no match.
 */
public class MessageRouter {

    private static final Logger LOGGER = LoggerFactory.getLogger(MessageRouter.class);

    /**
     * @param name route name, for logs
     * @param predicate decides whether the route applies
     * @param agentName target agent
     */
    public record Route(String name, Predicate<Message> predicate, String agentName) {
        public Route {
            checkNotBlankParam("name", name);
            checkNotNullParam("predicate", predicate);
            checkNotBlankParam("agentName", agentName);
        }
    }

    private final AgentRegistry registry;
    private final List<Route> routes = new CopyOnWriteArrayList<>();
    private volatile String fallbackAgent;

    public MessageRouter(AgentRegistry registry, String fallbackAgent) {
        this.registry = checkNotNullParam("registry", registry);
        this.fallbackAgent = checkNotBlankParam("fallbackAgent", fallbackAgent);
    }

    public AgentRegistry registry() {
        return registry;
    }

    public void addRoute(Route route) {
        routes.add(checkNotNullParam("route", route));
    }

    public void addRoute(String name, Predicate<Message> predicate, String agentName) {
        addRoute(new Route(name, predicate, agentName));
    }

    public boolean removeRoute(String name) {
        return routes.removeIf(route -> route.name().equals(name));
    }

    public List<Route> routes() {
        return List.copyOf(routes);
    }

    public String fallbackAgent() {
        return fallbackAgent;
    }

    public void setFallbackAgent(String fallbackAgent) {
        this.fallbackAgent = checkNotBlankParam("fallbackAgent", fallbackAgent);
    }

    /**
     * Resolves the handling agent.
     *
     * @param requestedAgent an explicit target; when set, routing is skipped
     * @throws AgentNotFoundError if the explicit target, or the fallback, is not registered
     */
    public AgentIdentity route(Message message, @Nullable String requestedAgent) {
        checkNotNullParam("message", message);
        if (requestedAgent != null) {
            return registry.require(requestedAgent);
        }
        for (Route route : routes) {
            if (matches(route, message)) {
                AgentIdentity agent = registry.get(route.agentName());
                if (agent != null) {
                    LOGGER.debug("Message matched route {} -> {}", route.name(), agent.name());
                    return agent;
                }
                LOGGER.warn("Route {} matched but agent {} is not registered", route.name(), route.agentName());
            }
        }
        LOGGER.debug("No route matched, using fallback agent {}", fallbackAgent);
        return registry.require(fallbackAgent);
    }

    public AgentIdentity route(Message message) {
        return route(message, null);
    }

    private static boolean matches(Route route, Message message) {
        try {
            return route.predicate().test(message);
        } catch (RuntimeException e) {
            LOGGER.error("Route {} predicate failed, treating as no match", route.name(), e);
            return false;
        }
    }
}

package io.agentmesh.server.events;

import io.agentmesh.spec.Event;

/**
 * Consumes events delivered to a {@link Subscription}. Runs on the subscription's own
 * consumer thread; exceptions are reported as delivery failures and do not stop the loop.
 */
@FunctionalInterface
public interface EventHandler {

    void onEvent(Event event) throws Exception;
}

package io.agentmesh.server.events;

import java.util.List;

import io.agentmesh.spec.Event;

/**
 * Optional persistence behind the broker.
 * <p>
 * The broker appends every published event before fanning it out, and a subscription opened with
 * replay first receives the matching retained events. Delivery through a durable store is therefore
 * at-least-once: consumers that must not process an event twice wrap their handler in a
 * {@link DeduplicatingEventHandler}.
 */
public interface DurableEventStore {

    DurableEventStore NOOP = new DurableEventStore() {
        @Override
        public void append(Event event) {
        }

        @Override
        public List<Event> read(EventPattern pattern) {
            return List.of();
        }
    };

    /**
     * @throws RuntimeException if the event could not be persisted; the broker logs it and still
     *                          delivers in memory
     */
    void append(Event event);

    /**
     * Retained events matching {@code pattern}, oldest first.
     */
    List<Event> read(EventPattern pattern);
}

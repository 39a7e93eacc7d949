package io.agentmesh.server.events;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

import io.agentmesh.spec.Event;

/**
 * {@link DurableEventStore} retaining the last {@code capacity} events in memory. Useful as a
 * replay source within one process and as a stand-in for an external log in tests.
 */
public class InMemoryEventLog implements DurableEventStore {

    private final int capacity;
    private final Deque<Event> events = new ArrayDeque<>();

    public InMemoryEventLog(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive: " + capacity);
        }
        this.capacity = capacity;
    }

    @Override
    public synchronized void append(Event event) {
        if (events.size() == capacity) {
            events.removeFirst();
        }
        events.addLast(event);
    }

    @Override
    public synchronized List<Event> read(EventPattern pattern) {
        return events.stream().filter(pattern::matches).toList();
    }

    public synchronized int size() {
        return events.size();
    }
}

package io.agentmesh.server.events;

import static io.agentmesh.util.Assert.checkNotNullParam;

import java.util.LinkedHashMap;
import java.util.Map;

import io.agentmesh.spec.Event;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Passes each event id to the delegate at most once, remembering the last {@code capacity} ids.
 * An event whose delegate call failed is not remembered, so a redelivery is processed again.
 */
public class DeduplicatingEventHandler implements EventHandler {

    private static final Logger LOGGER = LoggerFactory.getLogger(DeduplicatingEventHandler.class);

    public static final int DEFAULT_CAPACITY = 10_000;

    private final EventHandler delegate;
    private final Map<String, Boolean> seen;

    public DeduplicatingEventHandler(EventHandler delegate) {
        this(delegate, DEFAULT_CAPACITY);
    }

    public DeduplicatingEventHandler(EventHandler delegate, int capacity) {
        this.delegate = checkNotNullParam("delegate", delegate);
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive: " + capacity);
        }
        this.seen = new LinkedHashMap<>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, Boolean> eldest) {
                return size() > capacity;
            }
        };
    }

    @Override
    public void onEvent(Event event) throws Exception {
        synchronized (seen) {
            if (seen.containsKey(event.id())) {
                LOGGER.debug("Skipping duplicate event {} ({})", event.id(), event.type());
                return;
            }
        }
        delegate.onEvent(event);
        synchronized (seen) {
            seen.put(event.id(), Boolean.TRUE);
        }
    }
}

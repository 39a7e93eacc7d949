package io.agentmesh.server.events;

import static io.agentmesh.util.Assert.checkNotNullParam;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.BooleanSupplier;
import java.util.function.Consumer;

import io.agentmesh.spec.Event;
import org.jspecify.annotations.Nullable;

/**
 * Handle for one broker subscription.
 * <p>
 * The subscription owns its inbound queue. A subscription opened without a handler is drained by
 * the subscriber itself through {@link #poll(long)}; with a handler, the broker runs a consumer
 * loop for it. The broker keeps a subscription only while {@link #isActive()} holds: the handle
 * must be closed explicitly, or its liveness check must start returning {@code false}.
 */
public final class Subscription implements AutoCloseable {

    private final String id;
    private final String subscriber;
    private final EventPattern pattern;
    private final SubscriberQueue<Event> queue;
    private final @Nullable EventHandler handler;
    private final BooleanSupplier liveness;
    private final Consumer<Subscription> onClose;
    private final AtomicBoolean active = new AtomicBoolean(true);

    Subscription(String id, String subscriber, EventPattern pattern, SubscriberQueue<Event> queue,
                 @Nullable EventHandler handler, BooleanSupplier liveness, Consumer<Subscription> onClose) {
        this.id = checkNotNullParam("id", id);
        this.subscriber = checkNotNullParam("subscriber", subscriber);
        this.pattern = checkNotNullParam("pattern", pattern);
        this.queue = queue;
        this.handler = handler;
        this.liveness = liveness;
        this.onClose = onClose;
    }

    public String id() {
        return id;
    }

    public String subscriber() {
        return subscriber;
    }

    public EventPattern pattern() {
        return pattern;
    }

    @Nullable EventHandler handler() {
        return handler;
    }

    /**
     * Whether the subscription still receives events. A liveness check that throws counts as dead.
     */
    public boolean isActive() {
        if (!active.get()) {
            return false;
        }
        try {
            return liveness.getAsBoolean();
        } catch (RuntimeException e) {
            return false;
        }
    }

    /**
     * Takes the next delivered event, waiting up to {@code waitMillis}.
     */
    public @Nullable Event poll(long waitMillis) throws InterruptedException {
        return queue.poll(waitMillis);
    }

    public int pending() {
        return queue.size();
    }

    /**
     * Events lost to back-pressure on this subscription.
     */
    public long droppedCount() {
        return queue.droppedCount();
    }

    boolean deliver(Event event) {
        return queue.offer(event);
    }

    @Override
    public void close() {
        if (active.compareAndSet(true, false)) {
            queue.close();
            onClose.accept(this);
        }
    }

    @Override
    public String toString() {
        return "Subscription[" + id + ", " + subscriber + ", " + pattern + "]";
    }
}

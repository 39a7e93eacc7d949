package io.agentmesh.server.events;

import static io.agentmesh.util.Assert.checkNotNullParam;

import java.time.Duration;
import java.util.concurrent.BlockingDeque;
import java.util.concurrent.LinkedBlockingDeque;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Bounded FIFO owned by one consumer.
 * <p>
 * Producers call {@link #offer(Object)}; the consumer drains with {@link #poll(long)}. When the
 * queue is full the {@link OverflowPolicy} decides between evicting the oldest item and making
 * the producer wait. Items lost either way are counted in {@link #droppedCount()}.
 *
 * @param <T> the item type
 */
public class SubscriberQueue<T> {

    private static final Logger LOGGER = LoggerFactory.getLogger(SubscriberQueue.class);

    private final String name;
    private final BlockingDeque<T> queue;
    private final OverflowPolicy policy;
    private final Duration blockTimeout;
    private final AtomicLong dropped = new AtomicLong();
    private volatile boolean closed;

    public SubscriberQueue(String name, int capacity, OverflowPolicy policy, Duration blockTimeout) {
        this.name = checkNotNullParam("name", name);
        if (capacity <= 0) {
            throw new IllegalArgumentException("Queue capacity must be positive: " + capacity);
        }
        this.queue = new LinkedBlockingDeque<>(capacity);
        this.policy = checkNotNullParam("policy", policy);
        this.blockTimeout = checkNotNullParam("blockTimeout", blockTimeout);
    }

    /**
     * Enqueues an item according to the overflow policy.
     *
     * @return {@code false} if the item was not enqueued: the queue is closed, or the producer
     * timed out waiting for room
     */
    public boolean offer(T item) {
        checkNotNullParam("item", item);
        if (closed) {
            return false;
        }
        if (policy == OverflowPolicy.DROP_OLDEST) {
            synchronized (this) {
                while (!queue.offerLast(item)) {
                    T evicted = queue.pollFirst();
                    if (evicted != null) {
                        dropped.incrementAndGet();
                        LOGGER.warn("Queue {} full, dropped oldest item", name);
                    }
                }
            }
            return true;
        }
        try {
            if (queue.offerLast(item, blockTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                return true;
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        dropped.incrementAndGet();
        LOGGER.warn("Queue {} still full after {} ms, dropped new item", name, blockTimeout.toMillis());
        return false;
    }

    /**
     * Takes the next item, waiting up to {@code waitMillis}.
     *
     * @return the item, or {@code null} if none arrived in time
     * @throws InterruptedException if the consumer thread is interrupted
     */
    public @Nullable T poll(long waitMillis) throws InterruptedException {
        if (waitMillis <= 0) {
            return queue.pollFirst();
        }
        return queue.pollFirst(waitMillis, TimeUnit.MILLISECONDS);
    }

    /**
     * Stops accepting items. Items already queued can still be polled.
     */
    public void close() {
        closed = true;
    }

    public boolean isClosed() {
        return closed;
    }

    /**
     * Closed and fully drained.
     */
    public boolean isFinished() {
        return closed && queue.isEmpty();
    }

    public int size() {
        return queue.size();
    }

    public long droppedCount() {
        return dropped.get();
    }
}

package io.agentmesh.server.events;

import static io.agentmesh.util.Assert.checkNotNullParam;

import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import io.agentmesh.spec.StreamEvent;
import io.agentmesh.spec.StreamEventType;
import io.agentmesh.spec.TaskStateConflictError;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Ordered output stream of one task.
 * <p>
 * Appends are serialized: each event gets the next sequence number and reaches every consumer in
 * sequence order. The last {@code replayBufferSize} events are retained so a reconnecting consumer
 * can resume after its last acknowledged sequence. A terminal event ({@code complete} or
 * {@code error}) closes the stream, and later appends are rejected.
 */
public class TaskEventStream {

    private static final Logger LOGGER = LoggerFactory.getLogger(TaskEventStream.class);

    private final String taskId;
    private final int replayBufferSize;
    private final int subscriberCapacity;
    private final Clock clock;
    private final Deque<StreamEvent> replayBuffer = new ArrayDeque<>();
    private final List<Consumer> consumers = new CopyOnWriteArrayList<>();
    private long lastSequence;
    private boolean closed;

    TaskEventStream(String taskId, int replayBufferSize, int subscriberCapacity, Clock clock) {
        this.taskId = checkNotNullParam("taskId", taskId);
        this.replayBufferSize = replayBufferSize;
        this.subscriberCapacity = subscriberCapacity;
        this.clock = clock;
    }

    public String taskId() {
        return taskId;
    }

    /**
     * Appends an event.
     *
     * @return the event with its assigned sequence number
     * @throws TaskStateConflictError if the stream already received its terminal event
     */
    public synchronized StreamEvent append(StreamEventType type, @Nullable Object data) {
        checkNotNullParam("type", type);
        if (closed) {
            LOGGER.warn("Rejecting late {} event for task {}: stream is closed", type.asString(), taskId);
            throw new TaskStateConflictError("Event stream for task " + taskId + " is closed");
        }
        StreamEvent event = new StreamEvent(++lastSequence, taskId, type, data, OffsetDateTime.now(clock));
        if (replayBufferSize > 0) {
            if (replayBuffer.size() == replayBufferSize) {
                replayBuffer.removeFirst();
            }
            replayBuffer.addLast(event);
        }
        for (Consumer consumer : consumers) {
            consumer.queue.offer(event);
        }
        if (type.isTerminal()) {
            closeLocked();
        }
        LOGGER.debug("Task {} stream event #{} {}", taskId, event.sequence(), type.asString());
        return event;
    }

    /**
     * Attaches a consumer.
     *
     * @param afterSequence replay retained events with a greater sequence; {@code null} replays every
     *                      retained event
     */
    public synchronized Consumer subscribe(@Nullable Long afterSequence) {
        Consumer consumer = new Consumer(new SubscriberQueue<>("stream:" + taskId,
                subscriberCapacity, OverflowPolicy.DROP_OLDEST, Duration.ofMillis(1)));
        int replayed = 0;
        for (StreamEvent event : replayBuffer) {
            if (afterSequence == null || event.sequence() > afterSequence) {
                consumer.queue.offer(event);
                replayed++;
            }
        }
        if (closed) {
            consumer.queue.close();
        } else {
            consumers.add(consumer);
        }
        LOGGER.debug("Consumer attached to task {} stream after {}, {} events replayed", taskId, afterSequence, replayed);
        return consumer;
    }

    public synchronized boolean isClosed() {
        return closed;
    }

    public synchronized long lastSequence() {
        return lastSequence;
    }

    public synchronized List<StreamEvent> retainedEvents() {
        return List.copyOf(replayBuffer);
    }

    /**
     * Closes the stream without a terminal event, e.g. when the task is cancelled or deleted.
     */
    public synchronized void close() {
        closeLocked();
    }

    private void closeLocked() {
        if (closed) {
            return;
        }
        closed = true;
        for (Consumer consumer : consumers) {
            consumer.queue.close();
        }
        consumers.clear();
    }

    private void detach(Consumer consumer) {
        consumers.remove(consumer);
        consumer.queue.close();
    }

    /**
     * One attached reader. Polling returns events in sequence order; once
     * {@link #isFinished()} is true no more events will arrive.
     */
    public final class Consumer implements AutoCloseable {
        private final SubscriberQueue<StreamEvent> queue;

        private Consumer(SubscriberQueue<StreamEvent> queue) {
            this.queue = queue;
        }

        public @Nullable StreamEvent poll(long waitMillis) throws InterruptedException {
            return queue.poll(waitMillis);
        }

        public boolean isFinished() {
            return queue.isFinished();
        }

        public long droppedCount() {
            return queue.droppedCount();
        }

        @Override
        public void close() {
            detach(this);
        }
    }
}

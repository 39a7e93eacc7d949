package io.agentmesh.server.events;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.CyclicBarrier;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Flow;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import io.agentmesh.spec.StreamEvent;
import io.agentmesh.spec.StreamEventType;
import io.agentmesh.spec.TaskNotFoundError;
import io.agentmesh.spec.TaskStateConflictError;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

public class TaskEventStreamsTest {

    private static final long WAIT_MILLIS = 2000;

    private ExecutorService executor;
    private TaskEventStreams streams;

    @BeforeEach
    public void init() {
        executor = Executors.newCachedThreadPool();
        streams = new TaskEventStreams(100, 10_000, executor);
    }

    @AfterEach
    public void cleanup() {
        executor.shutdownNow();
    }

    @Test
    public void testConcurrentAppendsKeepSubmissionOrder() throws Exception {
        TaskEventStream stream = streams.open("task-1");
        TaskEventStream.Consumer consumer = stream.subscribe(null);
        int writers = 4;
        int perWriter = 250;
        CyclicBarrier barrier = new CyclicBarrier(writers);
        List<Future<?>> futures = new ArrayList<>();
        for (int w = 0; w < writers; w++) {
            String writer = "w" + w;
            futures.add(executor.submit(() -> {
                barrier.await();
                for (int i = 0; i < perWriter; i++) {
                    stream.append(StreamEventType.OUTPUT, Map.of("writer", writer, "chunk", i));
                }
                return null;
            }));
        }
        for (Future<?> future : futures) {
            future.get(WAIT_MILLIS, TimeUnit.MILLISECONDS);
        }

        Map<Object, Integer> nextChunk = new HashMap<>();
        for (long expected = 1; expected <= writers * perWriter; expected++) {
            StreamEvent event = consumer.poll(WAIT_MILLIS);
            assertNotNull(event);
            assertEquals(expected, event.sequence());
            Map<?, ?> data = (Map<?, ?>) event.data();
            int chunk = nextChunk.getOrDefault(data.get("writer"), 0);
            assertEquals(chunk, data.get("chunk"));
            nextChunk.put(data.get("writer"), chunk + 1);
        }
        assertEquals(writers * perWriter, stream.lastSequence());
    }

    @Test
    public void testResubscribeReplaysEventsAfterLastSequence() throws Exception {
        TaskEventStream stream = streams.open("task-1");
        for (int i = 1; i <= 5; i++) {
            stream.append(StreamEventType.OUTPUT, "chunk " + i);
        }

        TaskEventStream.Consumer consumer = stream.subscribe(2L);

        assertEquals(3, consumer.poll(WAIT_MILLIS).sequence());
        assertEquals(4, consumer.poll(WAIT_MILLIS).sequence());
        assertEquals(5, consumer.poll(WAIT_MILLIS).sequence());
        stream.append(StreamEventType.OUTPUT, "chunk 6");
        assertEquals(6, consumer.poll(WAIT_MILLIS).sequence());
    }

    @Test
    public void testWithoutReplayOnlyNewEventsArrive() throws Exception {
        TaskEventStreams noReplay = new TaskEventStreams(0, 100, executor);
        TaskEventStream stream = noReplay.open("task-1");
        stream.append(StreamEventType.OUTPUT, "missed 1");
        stream.append(StreamEventType.OUTPUT, "missed 2");

        TaskEventStream.Consumer consumer = stream.subscribe(0L);
        assertNull(consumer.poll(50));

        stream.append(StreamEventType.OUTPUT, "live");
        StreamEvent event = consumer.poll(WAIT_MILLIS);
        assertEquals(3, event.sequence());
        assertEquals("live", event.data());
        assertTrue(stream.retainedEvents().isEmpty());
    }

    @Test
    public void testReplayBufferIsBounded() throws Exception {
        TaskEventStreams small = new TaskEventStreams(3, 100, executor);
        TaskEventStream stream = small.open("task-1");
        for (int i = 1; i <= 5; i++) {
            stream.append(StreamEventType.OUTPUT, i);
        }

        TaskEventStream.Consumer consumer = stream.subscribe(null);

        assertEquals(3, consumer.poll(WAIT_MILLIS).sequence());
        assertEquals(4, consumer.poll(WAIT_MILLIS).sequence());
        assertEquals(5, consumer.poll(WAIT_MILLIS).sequence());
        assertNull(consumer.poll(50));
    }

    @Test
    public void testTerminalEventClosesStream() throws Exception {
        TaskEventStream stream = streams.open("task-1");
        TaskEventStream.Consumer consumer = stream.subscribe(null);
        stream.append(StreamEventType.OUTPUT, "partial");
        stream.append(StreamEventType.COMPLETE, "done");

        TaskStateConflictError e = assertThrows(TaskStateConflictError.class,
                () -> stream.append(StreamEventType.OUTPUT, "late"));
        assertTrue(e.getMessage().contains("closed"));
        assertThrows(TaskStateConflictError.class, () -> streams.append("task-1", StreamEventType.ERROR, "late"));

        assertEquals(StreamEventType.OUTPUT, consumer.poll(WAIT_MILLIS).type());
        assertEquals(StreamEventType.COMPLETE, consumer.poll(WAIT_MILLIS).type());
        assertTrue(consumer.isFinished());
    }

    @Test
    public void testLateSubscriberToClosedStreamGetsRetainedEvents() throws Exception {
        TaskEventStream stream = streams.open("task-1");
        stream.append(StreamEventType.OUTPUT, "partial");
        stream.append(StreamEventType.ERROR, "failed");

        TaskEventStream.Consumer consumer = stream.subscribe(1L);

        assertEquals(StreamEventType.ERROR, consumer.poll(WAIT_MILLIS).type());
        assertTrue(consumer.isFinished());
    }

    @Test
    public void testAppendToUnknownTask() {
        assertThrows(TaskNotFoundError.class, () -> streams.append("missing", StreamEventType.OUTPUT, "x"));
        assertThrows(TaskNotFoundError.class, () -> streams.publisher("missing", null));
    }

    @Test
    public void testPublisherCompletesAfterTerminalEvent() throws Exception {
        streams.open("task-1");
        streams.append("task-1", StreamEventType.STATUS, "pending");
        Flow.Publisher<StreamEvent> publisher = streams.publisher("task-1", null);
        streams.append("task-1", StreamEventType.OUTPUT, "hello");

        CollectingSubscriber subscriber = new CollectingSubscriber();
        publisher.subscribe(subscriber);
        streams.append("task-1", StreamEventType.COMPLETE, "done");

        assertTrue(subscriber.completed.await(WAIT_MILLIS, TimeUnit.MILLISECONDS));
        assertNull(subscriber.failure.get());
        assertEquals(List.of(StreamEventType.STATUS, StreamEventType.OUTPUT, StreamEventType.COMPLETE),
                subscriber.events.stream().map(StreamEvent::type).toList());
    }

    @Test
    public void testPublisherCompletesWhenStreamIsClosed() throws Exception {
        streams.open("task-1");
        Flow.Publisher<StreamEvent> publisher = streams.publisher("task-1", null);
        CollectingSubscriber subscriber = new CollectingSubscriber();
        publisher.subscribe(subscriber);

        streams.append("task-1", StreamEventType.STATUS, "cancelled");
        streams.close("task-1");

        assertTrue(subscriber.completed.await(WAIT_MILLIS, TimeUnit.MILLISECONDS));
        assertEquals(1, subscriber.events.size());
    }

    @Test
    public void testRemoveDropsStream() {
        streams.open("task-1");
        assertEquals(1, streams.size());

        streams.remove("task-1");

        assertEquals(0, streams.size());
        assertNull(streams.get("task-1"));
    }

    @Test
    public void testSseFraming() {
        Clock clock = Clock.fixed(Instant.parse("2025-03-01T10:00:00Z"), ZoneOffset.UTC);
        TaskEventStreams fixed = new TaskEventStreams(10, 10, executor, clock);
        StreamEvent event = fixed.open("task-9").append(StreamEventType.TOOL_USE, Map.of("tool", "calculator"));

        String frame = SseFormatter.format(event);

        assertTrue(frame.startsWith("id: 1\nevent: tool_use\ndata: {"));
        assertTrue(frame.contains("\"task_id\":\"task-9\""));
        assertTrue(frame.contains("\"tool\":\"calculator\""));
        assertTrue(frame.endsWith("\n\n"));
        assertEquals("event: ping\ndata: a\ndata: b\n\n", SseFormatter.frame(null, "ping", "a\nb"));
    }

    static class CollectingSubscriber implements Flow.Subscriber<StreamEvent> {
        final List<StreamEvent> events = new CopyOnWriteArrayList<>();
        final CountDownLatch completed = new CountDownLatch(1);
        final AtomicReference<Throwable> failure = new AtomicReference<>();

        @Override
        public void onSubscribe(Flow.Subscription subscription) {
            subscription.request(Long.MAX_VALUE);
        }

        @Override
        public void onNext(StreamEvent item) {
            events.add(item);
        }

        @Override
        public void onError(Throwable throwable) {
            failure.set(throwable);
            completed.countDown();
        }

        @Override
        public void onComplete() {
            completed.countDown();
        }
    }
}

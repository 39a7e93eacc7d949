package io.agentmesh.server.events;

import static io.agentmesh.util.Assert.checkNotNullParam;

import java.time.Clock;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.Executor;
import java.util.concurrent.Flow;
import java.util.concurrent.atomic.AtomicBoolean;

import io.agentmesh.server.config.ServerConfig;
import io.agentmesh.server.util.AsyncUtils;
import io.agentmesh.spec.StreamEvent;
import io.agentmesh.spec.StreamEventType;
import io.agentmesh.spec.TaskNotFoundError;
import mutiny.zero.ZeroPublisher;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Multiplexes task output into per-task {@link TaskEventStream}s and exposes them as
 * {@link Flow.Publisher}s for SSE delivery.
 */
public class TaskEventStreams {

    private static final Logger LOGGER = LoggerFactory.getLogger(TaskEventStreams.class);

    private static final long POLL_INTERVAL_MILLIS = 250;

    public static final int DEFAULT_REPLAY_BUFFER_SIZE = 100;
    public static final int DEFAULT_SUBSCRIBER_CAPACITY = 1000;

    private final int replayBufferSize;
    private final int subscriberCapacity;
    private final Clock clock;
    private final Executor executor;
    private final ConcurrentMap<String, TaskEventStream> streams = new ConcurrentHashMap<>();

    public TaskEventStreams() {
        this(DEFAULT_REPLAY_BUFFER_SIZE, DEFAULT_SUBSCRIBER_CAPACITY, AsyncUtils.newDaemonExecutor("task-stream"));
    }

    public TaskEventStreams(ServerConfig config, Executor executor) {
        this(config.replayBufferSize(), config.subscriberCapacity(), executor);
    }

    public TaskEventStreams(int replayBufferSize, int subscriberCapacity, Executor executor) {
        this(replayBufferSize, subscriberCapacity, executor, Clock.systemUTC());
    }

    /**
     * @param replayBufferSize events retained per task for reconnecting consumers; {@code 0} disables replay
     */
    public TaskEventStreams(int replayBufferSize, int subscriberCapacity, Executor executor, Clock clock) {
        if (replayBufferSize < 0) {
            throw new IllegalArgumentException("replayBufferSize may not be negative: " + replayBufferSize);
        }
        if (subscriberCapacity <= 0) {
            throw new IllegalArgumentException("subscriberCapacity must be positive: " + subscriberCapacity);
        }
        this.replayBufferSize = replayBufferSize;
        this.subscriberCapacity = subscriberCapacity;
        this.executor = checkNotNullParam("executor", executor);
        this.clock = checkNotNullParam("clock", clock);
    }

    public int replayBufferSize() {
        return replayBufferSize;
    }

    /**
     * Returns the stream of {@code taskId}, creating it if needed.
     */
    public TaskEventStream open(String taskId) {
        checkNotNullParam("taskId", taskId);
        return streams.computeIfAbsent(taskId,
                id -> new TaskEventStream(id, replayBufferSize, subscriberCapacity, clock));
    }

    public @Nullable TaskEventStream get(String taskId) {
        return streams.get(taskId);
    }

    /**
     * Appends to an existing stream.
     *
     * @throws TaskNotFoundError if no stream was opened for the task
     * @throws io.agentmesh.spec.TaskStateConflictError if the stream is closed
     */
    public StreamEvent append(String taskId, StreamEventType type, @Nullable Object data) {
        TaskEventStream stream = streams.get(taskId);
        if (stream == null) {
            throw TaskNotFoundError.forTask(taskId);
        }
        return stream.append(type, data);
    }

    /**
     * Closes the task's stream without a terminal event. Attached consumers finish after draining.
     */
    public void close(String taskId) {
        TaskEventStream stream = streams.get(taskId);
        if (stream != null) {
            stream.close();
        }
    }

    public void remove(String taskId) {
        TaskEventStream stream = streams.remove(taskId);
        if (stream != null) {
            stream.close();
            LOGGER.debug("Removed event stream of task {}", taskId);
        }
    }

    public int size() {
        return streams.size();
    }

    /**
     * Streams the task's events: retained events after {@code afterSequence} first, then live ones,
     * completing after the terminal event or when the stream is closed. The returned publisher
     * accepts one subscriber.
     *
     * @throws TaskNotFoundError if no stream was opened for the task
     */
    public Flow.Publisher<StreamEvent> publisher(String taskId, @Nullable Long afterSequence) {
        TaskEventStream stream = streams.get(taskId);
        if (stream == null) {
            throw TaskNotFoundError.forTask(taskId);
        }
        // Attach now so nothing appended before the HTTP layer subscribes is missed.
        TaskEventStream.Consumer consumer = stream.subscribe(afterSequence);
        AtomicBoolean subscribed = new AtomicBoolean();
        return ZeroPublisher.create(AsyncUtils.createTubeConfig(), tube -> {
            if (!subscribed.compareAndSet(false, true)) {
                tube.fail(new IllegalStateException("Task event publisher supports a single subscriber"));
                return;
            }
            tube.whenCancelled(consumer::close);
            executor.execute(() -> {
                try {
                    while (!tube.cancelled()) {
                        StreamEvent event = consumer.poll(POLL_INTERVAL_MILLIS);
                        if (event != null) {
                            tube.send(event);
                            if (event.type().isTerminal()) {
                                break;
                            }
                        } else if (consumer.isFinished()) {
                            break;
                        }
                    }
                    tube.complete();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    tube.fail(e);
                } catch (RuntimeException e) {
                    LOGGER.error("Streaming events of task {} failed", taskId, e);
                    tube.fail(e);
                } finally {
                    consumer.close();
                }
            });
        });
    }
}

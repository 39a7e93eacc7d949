package io.agentmesh.server.events;

import static io.agentmesh.util.Assert.checkNotNullParam;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

import io.agentmesh.server.config.ServerConfig;
import io.agentmesh.server.util.AsyncUtils;
import io.agentmesh.spec.AgentNotFoundError;
import io.agentmesh.spec.Event;
import io.agentmesh.spec.Message;
import io.agentmesh.spec.ServiceUnavailableError;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * In-process {@link MessageBroker}.
 * <p>
 * Every subscription and every mailbox owns a bounded queue; publishing only enqueues, and each
 * queue is drained by its own consumer loop. A slow or failing consumer therefore never delays
 * delivery to the others. A handler exception is logged and re-published as a
 * {@link Event#DELIVERY_FAILED} event (failures to deliver that event are only logged).
 * <p>
 * Without a {@link DurableEventStore}, pub/sub delivery is at-most-once: events published while
 * nobody matches, or dropped by back-pressure, are gone.
 */
public class InMemoryMessageBroker implements MessageBroker {

    private static final Logger LOGGER = LoggerFactory.getLogger(InMemoryMessageBroker.class);

    private static final long POLL_INTERVAL_MILLIS = 200;

    public static final int DEFAULT_QUEUE_CAPACITY = 1000;
    public static final Duration DEFAULT_BLOCK_TIMEOUT = Duration.ofSeconds(5);

    private final int queueCapacity;
    private final OverflowPolicy overflowPolicy;
    private final Duration blockTimeout;
    private final DurableEventStore eventStore;
    private final ExecutorService executor;
    private final boolean ownsExecutor;

    private final List<Subscription> subscriptions = new CopyOnWriteArrayList<>();
    private final ConcurrentMap<String, Mailbox> mailboxes = new ConcurrentHashMap<>();
    // Publishers share the read lock; a replaying subscribe takes the write lock so that
    // replayed events are queued before any live one.
    private final ReadWriteLock fanOutLock = new ReentrantReadWriteLock();
    private volatile boolean closed;

    public InMemoryMessageBroker() {
        this(DEFAULT_QUEUE_CAPACITY, OverflowPolicy.DROP_OLDEST, DEFAULT_BLOCK_TIMEOUT, DurableEventStore.NOOP);
    }

    public InMemoryMessageBroker(ServerConfig config, DurableEventStore eventStore) {
        this(config.brokerQueueCapacity(), config.brokerOverflowPolicy(), config.brokerBlockTimeout(), eventStore);
    }

    public InMemoryMessageBroker(int queueCapacity, OverflowPolicy overflowPolicy, Duration blockTimeout,
                                 DurableEventStore eventStore) {
        this(queueCapacity, overflowPolicy, blockTimeout, eventStore, null);
    }

    /**
     * @param executor runs the consumer loops; a private daemon pool is created when {@code null}
     */
    public InMemoryMessageBroker(int queueCapacity, OverflowPolicy overflowPolicy, Duration blockTimeout,
                                 DurableEventStore eventStore, @Nullable ExecutorService executor) {
        if (queueCapacity <= 0) {
            throw new IllegalArgumentException("queueCapacity must be positive: " + queueCapacity);
        }
        this.queueCapacity = queueCapacity;
        this.overflowPolicy = checkNotNullParam("overflowPolicy", overflowPolicy);
        this.blockTimeout = checkNotNullParam("blockTimeout", blockTimeout);
        this.eventStore = checkNotNullParam("eventStore", eventStore);
        this.ownsExecutor = executor == null;
        this.executor = executor == null ? AsyncUtils.newDaemonExecutor("broker") : executor;
    }

    @Override
    public void openMailbox(String agentName, MailboxHandler handler) {
        checkNotNullParam("agentName", agentName);
        checkNotNullParam("handler", handler);
        checkOpen();
        Mailbox mailbox = new Mailbox(agentName, handler, queueCapacity, blockTimeout);
        if (mailboxes.putIfAbsent(agentName, mailbox) != null) {
            throw new IllegalStateException("Mailbox already open for agent " + agentName);
        }
        executor.execute(mailbox);
        LOGGER.debug("Opened mailbox for {}", agentName);
    }

    @Override
    public void closeMailbox(String agentName) {
        Mailbox mailbox = mailboxes.remove(agentName);
        if (mailbox != null) {
            mailbox.close();
            LOGGER.debug("Closed mailbox for {}", agentName);
        }
    }

    @Override
    public boolean hasMailbox(String agentName) {
        return mailboxes.containsKey(agentName);
    }

    @Override
    public CompletableFuture<@Nullable Message> send(String target, Message message, String sender) {
        checkNotNullParam("target", target);
        checkNotNullParam("message", message);
        checkNotNullParam("sender", sender);
        Mailbox mailbox = mailboxes.get(target);
        if (mailbox == null) {
            LOGGER.warn("Cannot deliver message from {}: no agent named {}", sender, target);
            throw AgentNotFoundError.forAgent(target);
        }
        CompletableFuture<@Nullable Message> reply = new CompletableFuture<>();
        if (!mailbox.offer(new Mailbox.Envelope(sender, message, reply))) {
            if (!mailboxes.containsKey(target)) {
                throw AgentNotFoundError.forAgent(target);
            }
            throw new ServiceUnavailableError("Mailbox of agent " + target + " is full");
        }
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("from", sender);
        payload.put("to", target);
        if (message.taskId() != null) {
            payload.put("task_id", message.taskId());
        }
        payload.put("text", message.joinedText());
        publish(Event.MESSAGE_SENT, payload, sender);
        return reply;
    }

    @Override
    public Event publish(String eventType, @Nullable Object payload, String source) {
        Event event = Event.of(eventType, payload, source);
        publish(event);
        return event;
    }

    @Override
    public void publish(Event event) {
        checkNotNullParam("event", event);
        if (closed) {
            LOGGER.debug("Broker closed, dropping event {} ({})", event.id(), event.type());
            return;
        }
        fanOutLock.readLock().lock();
        try {
            try {
                eventStore.append(event);
            } catch (RuntimeException e) {
                LOGGER.error("Failed to persist event {} ({}), delivering in memory only", event.id(), event.type(), e);
            }
            int delivered = 0;
            for (Subscription subscription : subscriptions) {
                if (!subscription.isActive()) {
                    drop(subscription);
                    continue;
                }
                if (subscription.pattern().matches(event) && subscription.deliver(event)) {
                    delivered++;
                }
            }
            LOGGER.debug("Published {} from {} to {} subscriptions", event.type(), event.source(), delivered);
        } finally {
            fanOutLock.readLock().unlock();
        }
    }

    @Override
    public Subscription subscribe(SubscriptionRequest request) {
        checkNotNullParam("request", request);
        checkOpen();
        SubscriberQueue<Event> queue = new SubscriberQueue<>("subscription:" + request.subscriber(),
                queueCapacity, overflowPolicy, blockTimeout);
        Subscription subscription = new Subscription(UUID.randomUUID().toString(), request.subscriber(),
                request.pattern(), queue, request.handler(), request.liveness(), subscriptions::remove);
        if (request.replay()) {
            fanOutLock.writeLock().lock();
            try {
                List<Event> retained = eventStore.read(request.pattern());
                retained.forEach(subscription::deliver);
                subscriptions.add(subscription);
                LOGGER.debug("Replayed {} events to {}", retained.size(), subscription);
            } finally {
                fanOutLock.writeLock().unlock();
            }
        } else {
            subscriptions.add(subscription);
        }
        if (subscription.handler() != null) {
            executor.execute(() -> consume(subscription));
        }
        LOGGER.debug("Opened {}", subscription);
        return subscription;
    }

    @Override
    public int pruneInactive() {
        int pruned = 0;
        for (Subscription subscription : subscriptions) {
            if (!subscription.isActive()) {
                drop(subscription);
                pruned++;
            }
        }
        return pruned;
    }

    @Override
    public int subscriptionCount() {
        return subscriptions.size();
    }

    private void drop(Subscription subscription) {
        if (subscriptions.remove(subscription)) {
            LOGGER.debug("Dropping inactive {}", subscription);
        }
        subscription.close();
    }

    private void consume(Subscription subscription) {
        EventHandler handler = subscription.handler();
        if (handler == null) {
            return;
        }
        try {
            while (!closed && subscription.isActive()) {
                Event event = subscription.poll(POLL_INTERVAL_MILLIS);
                if (event == null) {
                    continue;
                }
                try {
                    handler.onEvent(event);
                } catch (Exception e) {
                    reportDeliveryFailure(subscription, event, e);
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (RuntimeException e) {
            LOGGER.error("Consumer loop of {} ended unexpectedly", subscription, e);
        }
        drop(subscription);
    }

    private void reportDeliveryFailure(Subscription subscription, Event event, Exception failure) {
        LOGGER.error("Delivery of event {} ({}) to subscriber {} failed", event.id(), event.type(),
                subscription.subscriber(), failure);
        if (Event.DELIVERY_FAILED.equals(event.type())) {
            return;
        }
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("subscription_id", subscription.id());
        payload.put("subscriber", subscription.subscriber());
        payload.put("event_id", event.id());
        payload.put("event_type", event.type());
        payload.put("error", String.valueOf(failure.getMessage()));
        try {
            publish(Event.DELIVERY_FAILED, payload, Event.SYSTEM_SOURCE);
        } catch (RuntimeException e) {
            LOGGER.error("Could not publish delivery failure for event {}", event.id(), e);
        }
    }

    private void checkOpen() {
        if (closed) {
            throw new IllegalStateException("Broker is closed");
        }
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        for (String agent : List.copyOf(mailboxes.keySet())) {
            closeMailbox(agent);
        }
        for (Subscription subscription : subscriptions) {
            subscription.close();
        }
        subscriptions.clear();
        if (ownsExecutor) {
            executor.shutdownNow();
        }
        LOGGER.info("Message broker closed");
    }
}

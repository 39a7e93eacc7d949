package io.agentmesh.server.monitor;

import static io.agentmesh.util.Assert.checkNotBlankParam;
import static io.agentmesh.util.Assert.checkNotNullParam;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Predicate;

import com.fasterxml.jackson.core.JsonProcessingException;
import io.agentmesh.server.agents.AgentRegistry;
import io.agentmesh.server.events.EventPattern;
import io.agentmesh.server.events.MessageBroker;
import io.agentmesh.server.events.Subscription;
import io.agentmesh.spec.Event;
import io.agentmesh.spec.Message;
import io.agentmesh.spec.Task;
import io.agentmesh.spec.TaskState;
import io.agentmesh.util.Utils;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Operator view of the mesh: a bounded log of every broker event, fed by a wildcard
 * subscription, plus a way to inject messages into an agent's mailbox.
 * <p>
 * The log keeps the newest {@code capacity} events. Interventions and agent replies to them go
 * through the broker like any other traffic, so they show up in the log as
 * {@link Event#OPERATOR_INTERVENTION} and {@link Event#OPERATOR_REPLY} events.
 */
public class MessageMonitor implements AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(MessageMonitor.class);

    public static final String OPERATOR = "human-operator";
    public static final String SUBSCRIBER = "message-monitor";

    private final MessageBroker broker;
    private final AgentRegistry registry;
    private final int capacity;

    private final Deque<Recorded> log = new ArrayDeque<>();
    private long total;
    private long errors;
    private long interventions;
    private @Nullable Subscription subscription;

    private record Recorded(MonitorEntry entry, String searchText) {
    }

    public MessageMonitor(MessageBroker broker, AgentRegistry registry, int capacity) {
        this.broker = checkNotNullParam("broker", broker);
        this.registry = checkNotNullParam("registry", registry);
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive: " + capacity);
        }
        this.capacity = capacity;
    }

    /**
     * Subscribes to every broker event. Events published before this call are not recorded.
     */
    public synchronized void start() {
        if (subscription != null) {
            return;
        }
        subscription = broker.subscribe(SUBSCRIBER, EventPattern.type(EventPattern.WILDCARD), this::record);
        LOGGER.info("Message monitor started (capacity {})", capacity);
    }

    @Override
    public synchronized void close() {
        if (subscription != null) {
            subscription.close();
            subscription = null;
            LOGGER.info("Message monitor stopped");
        }
    }

    void record(Event event) {
        MonitorEntry entry = MonitorEntry.of(event);
        String searchText = (event.source() + "\n" + event.type() + "\n" + payloadText(event))
                .toLowerCase(Locale.ROOT);
        synchronized (this) {
            if (log.size() == capacity) {
                log.removeFirst();
            }
            log.addLast(new Recorded(entry, searchText));
            total++;
            if (isError(event)) {
                errors++;
            }
            if (Event.OPERATOR_INTERVENTION.equals(event.type())) {
                interventions++;
            }
        }
    }

    /**
     * The newest events, oldest first.
     *
     * @param limit maximum number of entries
     * @param typePattern an {@link EventPattern} type such as {@code task.*}, or {@code null} for all
     */
    public List<MonitorEntry> recent(int limit, @Nullable String typePattern) {
        EventPattern pattern = typePattern == null || typePattern.isBlank()
                ? EventPattern.type(EventPattern.WILDCARD)
                : EventPattern.type(typePattern);
        return newest(limit, recorded -> pattern.matches(recorded.entry().source(), recorded.entry().type()));
    }

    /**
     * Case-insensitive search over source, type and payload, newest {@code limit} matches, oldest first.
     */
    public List<MonitorEntry> search(String query, int limit) {
        String needle = checkNotBlankParam("query", query).toLowerCase(Locale.ROOT);
        return newest(limit, recorded -> recorded.searchText().contains(needle));
    }

    public synchronized MonitorStats stats() {
        long dropped = subscription != null ? subscription.droppedCount() : 0;
        return new MonitorStats(total, log.size(), errors, interventions, registry.list().size(), dropped);
    }

    /**
     * Sends {@code text} from the operator to {@code agentName}'s mailbox. The agent's reply is
     * published as {@link Event#OPERATOR_REPLY}.
     *
     * @throws io.agentmesh.spec.AgentNotFoundError if no agent has this name
     */
    public Intervention intervene(String agentName, String text) {
        checkNotBlankParam("agentName", agentName);
        checkNotBlankParam("text", text);
        registry.require(agentName);

        Intervention intervention = new Intervention(agentName, text, Utils.nowUtc());
        broker.publish(Event.OPERATOR_INTERVENTION, intervention, OPERATOR);
        broker.send(agentName, Message.text(text), OPERATOR).whenComplete((reply, failure) -> {
            if (failure != null) {
                LOGGER.warn("Agent {} failed to handle operator intervention", agentName, failure);
                return;
            }
            if (reply != null) {
                Map<String, Object> payload = new LinkedHashMap<>();
                payload.put("agent_id", agentName);
                payload.put("text", reply.joinedText());
                broker.publish(Event.OPERATOR_REPLY, payload, agentName);
            }
        });
        LOGGER.info("Operator intervention sent to agent {}", agentName);
        return intervention;
    }

    private synchronized List<MonitorEntry> newest(int limit, Predicate<Recorded> filter) {
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be positive: " + limit);
        }
        List<MonitorEntry> matches = new ArrayList<>();
        Iterator<Recorded> iterator = log.descendingIterator();
        while (iterator.hasNext() && matches.size() < limit) {
            Recorded recorded = iterator.next();
            if (filter.test(recorded)) {
                matches.add(recorded.entry());
            }
        }
        Collections.reverse(matches);
        return matches;
    }

    private static boolean isError(Event event) {
        if (Event.DELIVERY_FAILED.equals(event.type())) {
            return true;
        }
        return Event.TASK_UPDATED.equals(event.type())
                && event.payload() instanceof Task task
                && task.status() == TaskState.FAILED;
    }

    private static String payloadText(Event event) {
        if (event.payload() == null) {
            return "";
        }
        try {
            return Utils.toJson(event.payload());
        } catch (JsonProcessingException e) {
            LOGGER.debug("Payload of event {} is not serializable, indexing its string form", event.id());
            return String.valueOf(event.payload());
        }
    }
}

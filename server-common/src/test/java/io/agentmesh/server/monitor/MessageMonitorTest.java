package io.agentmesh.server.monitor;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;

import io.agentmesh.server.agents.AgentIdentity;
import io.agentmesh.server.agents.AgentRegistry;
import io.agentmesh.server.events.InMemoryMessageBroker;
import io.agentmesh.spec.AgentNotFoundError;
import io.agentmesh.spec.Event;
import io.agentmesh.spec.Message;
import io.agentmesh.spec.Task;
import io.agentmesh.spec.TaskState;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

public class MessageMonitorTest {

    private static final long WAIT_MILLIS = 2000;

    private InMemoryMessageBroker broker;
    private AgentRegistry registry;
    private MessageMonitor monitor;

    @BeforeEach
    public void init() {
        broker = new InMemoryMessageBroker();
        registry = new AgentRegistry(broker, null);
        monitor = new MessageMonitor(broker, registry, 5);
        monitor.start();
    }

    @AfterEach
    public void cleanup() {
        monitor.close();
        broker.close();
    }

    @Test
    public void testRecordsEveryEventInOrder() throws Exception {
        broker.publish("task.created", Map.of("id", "t1"), "planner");
        broker.publish("status", "thinking", "planner");
        broker.publish("task.updated", Map.of("id", "t1"), "planner");
        awaitRecorded(3);

        List<MonitorEntry> all = monitor.recent(10, null);
        assertEquals(List.of("task.created", "status", "task.updated"), all.stream().map(MonitorEntry::type).toList());
        assertEquals("planner", all.get(0).source());

        assertEquals(List.of("task.created", "task.updated"),
                monitor.recent(10, "task.*").stream().map(MonitorEntry::type).toList());
        assertEquals(List.of("task.updated"), monitor.recent(1, null).stream().map(MonitorEntry::type).toList());
        assertThrows(IllegalArgumentException.class, () -> monitor.recent(0, null));
    }

    @Test
    public void testLogKeepsNewestEntries() throws Exception {
        for (int i = 0; i < 8; i++) {
            broker.publish("tick", i, "clock");
        }
        awaitRecorded(8);

        MonitorStats stats = monitor.stats();
        assertEquals(8, stats.totalMessages());
        assertEquals(5, stats.retained());
        assertEquals(List.of(3, 4, 5, 6, 7), monitor.recent(10, null).stream().map(MonitorEntry::payload).toList());
    }

    @Test
    public void testSearchMatchesPayloadSourceAndType() throws Exception {
        broker.publish("message.sent", Map.of("text", "Deploy to Production"), "ops-agent");
        broker.publish("message.sent", Map.of("text", "run the tests"), "qa-agent");
        awaitRecorded(2);

        assertEquals(1, monitor.search("production", 10).size());
        assertEquals("qa-agent", monitor.search("QA-AGENT", 10).get(0).source());
        assertEquals(2, monitor.search("message.sent", 10).size());
        assertTrue(monitor.search("rollback", 10).isEmpty());
        assertThrows(IllegalArgumentException.class, () -> monitor.search(" ", 10));
    }

    @Test
    public void testCountsFailures() throws Exception {
        OffsetDateTime now = OffsetDateTime.now();
        Task failed = Task.builder().id("t1").status(TaskState.FAILED).createdAt(now).updatedAt(now).build();
        Task completed = Task.builder().id("t2").status(TaskState.COMPLETED).createdAt(now).updatedAt(now).build();
        broker.publish(Event.TASK_UPDATED, failed, Event.SYSTEM_SOURCE);
        broker.publish(Event.TASK_UPDATED, completed, Event.SYSTEM_SOURCE);
        broker.publish(Event.DELIVERY_FAILED, Map.of("event_id", "e1"), Event.SYSTEM_SOURCE);
        awaitRecorded(3);

        assertEquals(2, monitor.stats().errors());
    }

    @Test
    public void testInterventionReachesAgentAndIsLogged() throws Exception {
        registry.register(new AgentIdentity("helper", "Acknowledges everything", List.of(),
                (message, context) -> Message.text("Ack from " + context.agentName() + " to " + context.sender()
                        + ": " + message.joinedText())));

        Intervention intervention = monitor.intervene("helper", "please stop");

        assertEquals("helper", intervention.agentId());
        assertEquals("please stop", intervention.message());
        await(() -> monitor.recent(10, "operator.*").size() == 2);
        List<MonitorEntry> operatorEntries = monitor.recent(10, "operator.*");
        assertEquals(Event.OPERATOR_INTERVENTION, operatorEntries.get(0).type());
        assertEquals(MessageMonitor.OPERATOR, operatorEntries.get(0).source());
        assertEquals(Event.OPERATOR_REPLY, operatorEntries.get(1).type());
        assertEquals("Ack from helper to human-operator: please stop",
                ((Map<?, ?>) operatorEntries.get(1).payload()).get("text"));
        assertEquals(1, monitor.search("please stop", 10).stream()
                .filter(entry -> entry.type().equals(Event.MESSAGE_SENT)).count());

        MonitorStats stats = monitor.stats();
        assertEquals(1, stats.interventions());
        assertEquals(1, stats.activeAgents());
    }

    @Test
    public void testInterventionForUnknownAgent() {
        assertThrows(AgentNotFoundError.class, () -> monitor.intervene("ghost", "hello?"));
        assertThrows(IllegalArgumentException.class, () -> monitor.intervene("helper", ""));
    }

    @Test
    public void testClosedMonitorStopsRecording() throws Exception {
        broker.publish("tick", 1, "clock");
        awaitRecorded(1);

        monitor.close();
        broker.publish("tick", 2, "clock");
        Thread.sleep(100);

        assertEquals(1, monitor.stats().totalMessages());
        assertEquals(0, monitor.stats().droppedEvents());
    }

    private void awaitRecorded(long count) throws InterruptedException {
        await(() -> monitor.stats().totalMessages() >= count);
    }

    private static void await(BooleanSupplier condition) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(WAIT_MILLIS);
        while (!condition.getAsBoolean()) {
            if (System.nanoTime() > deadline) {
                throw new AssertionError("Condition not met within " + WAIT_MILLIS + " ms");
            }
            Thread.sleep(10);
        }
    }
}

package io.agentmesh.server.monitor;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Counters of a {@link MessageMonitor}. Totals count every recorded event since the monitor
 * started, including those already evicted from the log.
 *
 * @param totalMessages events recorded
 * @param retained events still held in the log
 * @param errors failed tasks and failed deliveries
 * @param interventions operator interventions
 * @param activeAgents agents registered right now
 * @param droppedEvents events the broker dropped because the monitor fell behind
 */
public record MonitorStats(@JsonProperty("total_messages") long totalMessages,
                           @JsonProperty("retained") int retained,
                           @JsonProperty("errors") long errors,
                           @JsonProperty("interventions") long interventions,
                           @JsonProperty("active_agents") int activeAgents,
                           @JsonProperty("dropped_events") long droppedEvents) {
}

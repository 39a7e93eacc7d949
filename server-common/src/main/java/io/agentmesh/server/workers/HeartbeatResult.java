package io.agentmesh.server.workers;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Reply to a worker heartbeat.
 *
 * @param workerId the worker
 * @param renewed ids of the tasks whose lease was renewed
 * @param interrupts ids of tasks the worker should stop; each is reported once
 */
public record HeartbeatResult(@JsonProperty("worker_id") String workerId,
                              @JsonProperty("renewed") List<String> renewed,
                              @JsonProperty("interrupts") List<String> interrupts) {

    public HeartbeatResult {
        renewed = List.copyOf(renewed);
        interrupts = List.copyOf(interrupts);
    }
}

package io.agentmesh.server.events;

import java.util.LinkedHashMap;
import java.util.Map;

import io.agentmesh.spec.Task;
import org.jspecify.annotations.Nullable;

/**
 * JSON payloads of the server-generated task stream events.
 */
public final class StreamPayloads {

    private StreamPayloads() {
    }

    public static Map<String, Object> status(Task task) {
        return status(task, null);
    }

    public static Map<String, Object> status(Task task, @Nullable String reason) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("status", task.status().asString());
        if (reason != null) {
            payload.put("reason", reason);
        }
        payload.put("task", task);
        return payload;
    }

    public static Map<String, Object> complete(Task task) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("status", task.status().asString());
        if (task.result() != null) {
            payload.put("result", task.result());
        }
        payload.put("task", task);
        return payload;
    }

    public static Map<String, Object> error(Task task) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("status", task.status().asString());
        if (task.error() != null) {
            payload.put("error", task.error());
        }
        payload.put("task", task);
        return payload;
    }
}

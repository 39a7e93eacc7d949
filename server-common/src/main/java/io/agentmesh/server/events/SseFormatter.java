package io.agentmesh.server.events;

import com.fasterxml.jackson.core.JsonProcessingException;
import io.agentmesh.spec.StreamEvent;
import io.agentmesh.util.Utils;
import org.jspecify.annotations.Nullable;

/**
 * Writes Server-Sent-Events frames.
 */
public final class SseFormatter {

    private SseFormatter() {
    }

    /**
     * Frames a task stream event with its sequence as the SSE id, so that a client can reconnect
     * with {@code Last-Event-ID} or {@code last_sequence}.
     */
    public static String format(StreamEvent event) {
        try {
            return frame(String.valueOf(event.sequence()), event.type().asString(), Utils.toJson(event));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not serialize stream event of task " + event.taskId(), e);
        }
    }

    public static String frame(@Nullable String id, @Nullable String event, String data) {
        StringBuilder sb = new StringBuilder();
        if (id != null) {
            sb.append("id: ").append(id).append('\n');
        }
        if (event != null) {
            sb.append("event: ").append(event).append('\n');
        }
        for (String line : data.split("\n", -1)) {
            sb.append("data: ").append(line).append('\n');
        }
        return sb.append('\n').toString();
    }
}

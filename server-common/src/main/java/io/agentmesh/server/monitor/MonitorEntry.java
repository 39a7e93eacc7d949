package io.agentmesh.server.monitor;

import static io.agentmesh.util.Assert.checkNotNullParam;

import java.time.OffsetDateTime;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.agentmesh.spec.Event;
import org.jspecify.annotations.Nullable;

/**
 * One broker event as recorded by the {@link MessageMonitor}.
 */
@JsonInclude(JsonInclude.Include.NON_ABSENT)
public record MonitorEntry(@JsonProperty("id") String id,
                           @JsonProperty("timestamp") OffsetDateTime timestamp,
                           @JsonProperty("type") String type,
                           @JsonProperty("source") String source,
                           @JsonProperty("payload") @Nullable Object payload) {

    public MonitorEntry {
        checkNotNullParam("id", id);
        checkNotNullParam("timestamp", timestamp);
        checkNotNullParam("type", type);
        checkNotNullParam("source", source);
    }

    public static MonitorEntry of(Event event) {
        return new MonitorEntry(event.id(), event.timestamp(), event.type(), event.source(), event.payload());
    }
}

package io.agentmesh.server.events;

import static io.agentmesh.util.Assert.checkNotBlankParam;

import io.agentmesh.spec.Event;
import org.jspecify.annotations.Nullable;

/**
 * Matches events by source agent and type.
 * <p>
 * A {@code null} source, or {@value #WILDCARD}, matches any publisher. The type is either
 * {@value #WILDCARD} (every type), a prefix pattern such as {@code task.*}, or an exact type.
 *
 * @param source the publishing agent name
 * @param type the event type pattern
 */
public record EventPattern(@Nullable String source, String type) {

    public static final String WILDCARD = "*";

    public EventPattern {
        checkNotBlankParam("type", type);
        if (WILDCARD.equals(source)) {
            source = null;
        }
    }

    public static EventPattern type(String type) {
        return new EventPattern(null, type);
    }

    public static EventPattern from(String source, String type) {
        return new EventPattern(source, type);
    }

    /**
     * Every event published by {@code source}.
     */
    public static EventPattern allFrom(String source) {
        return new EventPattern(source, WILDCARD);
    }

    public boolean matches(Event event) {
        return matches(event.source(), event.type());
    }

    public boolean matches(String eventSource, String eventType) {
        if (source != null && !source.equals(eventSource)) {
            return false;
        }
        if (WILDCARD.equals(type)) {
            return true;
        }
        if (type.endsWith(".*")) {
            return eventType.startsWith(type.substring(0, type.length() - 1));
        }
        return type.equals(eventType);
    }

    @Override
    public String toString() {
        return (source == null ? WILDCARD : source) + "/" + type;
    }
}

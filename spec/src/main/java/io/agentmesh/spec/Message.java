package io.agentmesh.spec;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.agentmesh.util.Assert;
import org.jspecify.annotations.Nullable;

/**
 * An immutable, ordered sequence of {@link Part}s exchanged between agents.
 * <p>
 * A message may carry a {@code task_id} binding it to an existing task. The parts list is
 * copied on construction, so a message never changes after it is built.
 *
 * @param parts the content parts, in order
 * @param taskId optional id of the task this message belongs to
 * @param metadata optional arbitrary key-value metadata
 */
@JsonInclude(JsonInclude.Include.NON_ABSENT)
@JsonIgnoreProperties(ignoreUnknown = true)
public record Message(@JsonProperty("parts") List<Part<?>> parts,
                      @JsonProperty("task_id") @Nullable String taskId,
                      @JsonProperty("metadata") @Nullable Map<String, Object> metadata) {

    @JsonCreator
    public Message {
        Assert.checkNotNullParam("parts", parts);
        parts = List.copyOf(parts);
        metadata = (metadata != null) ? Map.copyOf(metadata) : null;
    }

    public Message(List<Part<?>> parts) {
        this(parts, null, null);
    }

    /**
     * Creates a single text part message.
     */
    public static Message text(String content) {
        return new Message(List.of(new TextPart(content)));
    }

    /**
     * Joins the content of every text part with a single space.
     *
     * @return the joined text, empty if the message has no text parts
     */
    public String joinedText() {
        return parts.stream()
                .filter(part -> part instanceof TextPart)
                .map(part -> ((TextPart) part).content())
                .collect(Collectors.joining(" "));
    }

    /**
     * Returns a copy of this message bound to the given task.
     */
    public Message withTaskId(String taskId) {
        return new Message(parts, taskId, metadata);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static Builder builder(Message message) {
        return new Builder(message);
    }

    /**
     * Builder for constructing {@link Message} instances.
     */
    public static class Builder {
        private final List<Part<?>> parts = new ArrayList<>();
        private @Nullable String taskId;
        private @Nullable Map<String, Object> metadata;

        private Builder() {
        }

        private Builder(Message message) {
            parts.addAll(message.parts());
            taskId = message.taskId();
            metadata = message.metadata();
        }

        public Builder addPart(Part<?> part) {
            parts.add(Assert.checkNotNullParam("part", part));
            return this;
        }

        public Builder parts(List<Part<?>> parts) {
            this.parts.clear();
            this.parts.addAll(parts);
            return this;
        }

        public Builder text(String content) {
            return addPart(new TextPart(content));
        }

        public Builder taskId(@Nullable String taskId) {
            this.taskId = taskId;
            return this;
        }

        public Builder metadata(@Nullable Map<String, Object> metadata) {
            this.metadata = metadata;
            return this;
        }

        public Message build() {
            return new Message(parts, taskId, metadata);
        }
    }
}

package io.agentmesh.spec;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.agentmesh.util.Assert;

/**
 * Result of {@code message/send}: the agent's reply and the final task snapshot.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SendMessageResult(@JsonProperty("message") Message message,
                                @JsonProperty("task") Task task) {

    public SendMessageResult {
        Assert.checkNotNullParam("message", message);
        Assert.checkNotNullParam("task", task);
    }
}

package io.agentmesh.client.mcp;

import java.util.Map;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.agentmesh.util.Assert;
import org.jspecify.annotations.Nullable;

@JsonInclude(JsonInclude.Include.NON_ABSENT)
public record ToolDescriptor(
        @JsonProperty("name") String name,
        @JsonProperty("description") @Nullable String description,
        @JsonProperty("inputSchema") Map<String, Object> inputSchema) {

    public ToolDescriptor {
        Assert.checkNotNullParam("name", name);
        inputSchema = inputSchema == null ? Map.of() : Map.copyOf(inputSchema);
    }
}

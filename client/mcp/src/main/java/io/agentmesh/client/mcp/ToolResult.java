package io.agentmesh.client.mcp;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.agentmesh.util.Assert;
import org.jspecify.annotations.Nullable;

/**
 * Outcome of one tool call: exactly one of {@code result} and {@code error} is set.
 */
@JsonInclude(JsonInclude.Include.NON_ABSENT)
public record ToolResult(
        @JsonProperty("tool") String tool,
        @JsonProperty("arguments") Map<String, Object> arguments,
        @JsonProperty("result") @Nullable Map<String, Object> result,
        @JsonProperty("error") @Nullable ToolError error) {

    public ToolResult {
        Assert.checkNotNullParam("tool", tool);
        arguments = arguments == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(arguments));
        result = result == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(result));
        if ((result == null) == (error == null)) {
            throw new IllegalArgumentException("Exactly one of result and error must be set");
        }
    }

    public static ToolResult success(String tool, Map<String, Object> arguments, Map<String, Object> result) {
        return new ToolResult(tool, arguments, result, null);
    }

    public static ToolResult failure(String tool, Map<String, Object> arguments, ToolError error) {
        return new ToolResult(tool, arguments, null, error);
    }

    public boolean isSuccess() {
        return error == null;
    }

    /**
     * Looks up a value in the successful result.
     */
    public @Nullable Object get(String key) {
        return result == null ? null : result.get(key);
    }
}

package io.agentmesh.client.mcp;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonValue;
import io.agentmesh.util.Assert;

/**
 * Normalized failure of a tool call.
 *
 * @param kind what went wrong
 * @param message a human readable description, safe to show to the end user
 */
public record ToolError(@JsonProperty("kind") Kind kind, @JsonProperty("message") String message) {

    public enum Kind {
        TIMEOUT("timeout"),
        TRANSPORT("transport"),
        MALFORMED_RESPONSE("malformed_response"),
        TOOL_ERROR("tool_error"),
        UNKNOWN_TOOL("unknown_tool");

        private final String value;

        Kind(String value) {
            this.value = value;
        }

        @JsonValue
        public String asString() {
            return value;
        }
    }

    public ToolError {
        Assert.checkNotNullParam("kind", kind);
        Assert.checkNotNullParam("message", message);
    }

    public static ToolError timeout(String toolName, long timeoutMillis) {
        return new ToolError(Kind.TIMEOUT, "Tool '" + toolName + "' timed out after " + timeoutMillis + " ms");
    }

    @Override
    public String toString() {
        return kind.asString() + ": " + message;
    }
}

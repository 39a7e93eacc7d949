package io.agentmesh.server.agents;

import io.agentmesh.client.mcp.ToolError;
import io.agentmesh.client.mcp.ToolResult;

/**
 * Renders tool failures as reply text.
 */
final class ToolReplies {

    private ToolReplies() {
    }

    /**
     * @param businessPrefix prefix used when the tool itself reported the error, e.g. {@code Calculation error}
     * @param callPrefix prefix used when the call failed, e.g. {@code Error calling calculator tool}
     */
    static String describeFailure(ToolResult result, String businessPrefix, String callPrefix) {
        ToolError error = result.error();
        if (error == null) {
            return callPrefix + ": Unknown error";
        }
        if (error.kind() == ToolError.Kind.TOOL_ERROR) {
            return businessPrefix + ": " + error.message();
        }
        return callPrefix + ": " + error.message();
    }

    static String format(Object value) {
        return String.valueOf(value);
    }
}

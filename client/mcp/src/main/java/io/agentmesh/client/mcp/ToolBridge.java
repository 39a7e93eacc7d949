package io.agentmesh.client.mcp;

import java.util.List;
import java.util.Map;

/**
 * Lets an agent handler invoke tools hosted by an external tool server.
 * <p>
 * Implementations never throw from {@link #callTool(String, Map)}: every failure, including
 * timeouts and transport errors, is reported through {@link ToolResult#error()} so that
 * the calling handler can render it as text. Calls are not retried.
 */
public interface ToolBridge {

    /**
     * Lists the tools exposed by the tool server.
     *
     * @return the tool descriptors, possibly empty
     * @throws ToolBridgeException if the listing could not be obtained
     */
    List<ToolDescriptor> listTools() throws ToolBridgeException;

    ToolResult callTool(String toolName, Map<String, Object> arguments);
}

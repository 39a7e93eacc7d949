package io.agentmesh.server.agents;

import static io.agentmesh.util.Assert.checkNotNullParam;

import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.function.BooleanSupplier;

import io.agentmesh.client.mcp.ToolBridge;
import io.agentmesh.client.mcp.ToolError;
import io.agentmesh.client.mcp.ToolResult;
import io.agentmesh.server.events.MessageBroker;
import io.agentmesh.spec.Event;
import io.agentmesh.spec.Message;
import org.jspecify.annotations.Nullable;

/**
 * What a handler can reach while processing one message.
 *
 * @param agentName the handling agent
 * @param taskId the task the message belongs to, if any
 * @param sender the sending agent, or {@code null} for an external client
 * @param broker the message broker, for agent-to-agent messages and events
 * @param toolBridge the tool bridge, {@code null} when no tool server is configured
 * @param cancellation reports whether the task was cancelled while the handler runs
 */
public record AgentContext(String agentName, @Nullable String taskId, @Nullable String sender,
                           MessageBroker broker, @Nullable ToolBridge toolBridge,
                           BooleanSupplier cancellation) {

    public AgentContext {
        checkNotNullParam("agentName", agentName);
        checkNotNullParam("broker", broker);
        checkNotNullParam("cancellation", cancellation);
    }

    public AgentContext(String agentName, @Nullable String taskId, @Nullable String sender,
                        MessageBroker broker, @Nullable ToolBridge toolBridge) {
        this(agentName, taskId, sender, broker, toolBridge, () -> false);
    }

    /**
     * Whether {@code tasks/cancel} was called on this context's task. Long-running handlers should
     * check it between steps and return early; the reply of a cancelled task is discarded.
     */
    public boolean isCancelled() {
        return cancellation.getAsBoolean();
    }

    /**
     * Calls a tool. Without a tool bridge the result is a {@link ToolError.Kind#TRANSPORT} failure.
     */
    public ToolResult callTool(String toolName, Map<String, Object> arguments) {
        if (toolBridge == null) {
            return ToolResult.failure(toolName, arguments,
                    new ToolError(ToolError.Kind.TRANSPORT, "Tools are not available"));
        }
        return toolBridge.callTool(toolName, arguments);
    }

    /**
     * Sends a message to another agent's mailbox.
     *
     * @throws io.agentmesh.spec.AgentNotFoundError if the target is not registered
     */
    public CompletableFuture<@Nullable Message> sendTo(String targetAgent, Message message) {
        return broker.send(targetAgent, taskId != null ? message.withTaskId(taskId) : message, agentName);
    }

    public Event publish(String eventType, @Nullable Object payload) {
        return broker.publish(eventType, payload, agentName);
    }
}

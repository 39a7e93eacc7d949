package io.agentmesh.server.requesthandlers;

import java.util.concurrent.Flow;

import io.agentmesh.spec.JSONRPCError;
import io.agentmesh.spec.MessageSendParams;
import io.agentmesh.spec.SendMessageResult;
import io.agentmesh.spec.StreamEvent;
import io.agentmesh.spec.Task;
import io.agentmesh.spec.TaskIdParams;
import io.agentmesh.spec.TaskQueryParams;

/**
 * Typed operations behind the JSON-RPC methods.
 */
public interface RequestHandler {

    Task onGetTask(TaskQueryParams params) throws JSONRPCError;

    Task onCancelTask(TaskIdParams params) throws JSONRPCError;

    SendMessageResult onMessageSend(MessageSendParams params) throws JSONRPCError;

    /**
     * Starts the task and returns its event stream. The first event is a {@code status}
     * acknowledgement carrying the pending task.
     */
    Flow.Publisher<StreamEvent> onMessageSendStream(MessageSendParams params) throws JSONRPCError;

    /**
     * Re-attaches to a task's event stream, starting after {@link TaskIdParams#lastSequence()}.
     */
    Flow.Publisher<StreamEvent> onResubscribeToTask(TaskIdParams params) throws JSONRPCError;
}

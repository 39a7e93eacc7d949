package io.agentmesh.spec;

import org.jspecify.annotations.Nullable;

/**
 * JSON-RPC request that starts a task and streams its output as events.
 */
public final class SendStreamingMessageRequest extends StreamingJSONRPCRequest<MessageSendParams> {

    public static final String METHOD = "message/stream";

    public SendStreamingMessageRequest(@Nullable String jsonrpc, @Nullable Object id, MessageSendParams params) {
        super(jsonrpc, METHOD, id, params);
    }

    public SendStreamingMessageRequest(@Nullable Object id, MessageSendParams params) {
        this(null, id, params);
    }
}

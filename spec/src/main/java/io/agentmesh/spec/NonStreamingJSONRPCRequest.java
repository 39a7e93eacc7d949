package io.agentmesh.spec;

import org.jspecify.annotations.Nullable;

/**
 * A request answered with a single response envelope.
 *
 * @param <T> the params type
 */
public abstract sealed class NonStreamingJSONRPCRequest<T> extends JSONRPCRequest<T>
        permits CancelTaskRequest, GetTaskRequest, SendMessageRequest {

    protected NonStreamingJSONRPCRequest(@Nullable String jsonrpc, String method, @Nullable Object id, T params) {
        super(jsonrpc, method, id, params);
    }
}

package io.agentmesh.transport.jsonrpc.handler;

import static io.agentmesh.server.util.AsyncUtils.createTubeConfig;
import static io.agentmesh.util.Utils.JSONRPC_VERSION;
import static io.agentmesh.util.Utils.OBJECT_MAPPER;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.Flow;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import io.agentmesh.server.events.SseFormatter;
import io.agentmesh.server.requesthandlers.RequestHandler;
import io.agentmesh.spec.AgentCard;
import io.agentmesh.spec.CancelTaskRequest;
import io.agentmesh.spec.CancelTaskResponse;
import io.agentmesh.spec.GetTaskRequest;
import io.agentmesh.spec.GetTaskResponse;
import io.agentmesh.spec.InternalError;
import io.agentmesh.spec.InvalidParamsError;
import io.agentmesh.spec.InvalidRequestError;
import io.agentmesh.spec.JSONParseError;
import io.agentmesh.spec.JSONRPCError;
import io.agentmesh.spec.JSONRPCErrorResponse;
import io.agentmesh.spec.JSONRPCResponse;
import io.agentmesh.spec.MessageSendParams;
import io.agentmesh.spec.MethodNotFoundError;
import io.agentmesh.spec.ResubscribeTaskRequest;
import io.agentmesh.spec.SendMessageRequest;
import io.agentmesh.spec.SendMessageResponse;
import io.agentmesh.spec.SendMessageResult;
import io.agentmesh.spec.SendStreamingMessageRequest;
import io.agentmesh.spec.SendStreamingMessageResponse;
import io.agentmesh.spec.StreamEvent;
import io.agentmesh.spec.Task;
import io.agentmesh.spec.TaskIdParams;
import io.agentmesh.spec.TaskQueryParams;
import io.agentmesh.util.Utils;
import mutiny.zero.ZeroPublisher;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * JSON-RPC 2.0 endpoint of the server.
 *
 * <p>{@link #handle(String)} takes the raw POST body and returns what the HTTP layer should write:
 * a JSON envelope, or an SSE stream for {@code message/stream} and {@code tasks/resubscribe}.
 * The typed {@code onX} methods can be called directly when the request is already decoded.
 *
 * <h2>Errors</h2>
 * <p>A body that is not JSON is answered with {@code -32700} and HTTP 400 before any envelope is
 * read, with a {@code null} id. Envelope problems ({@code -32600}), unknown methods ({@code -32601})
 * and bad params ({@code -32602}) are also answered with 400. Domain errors such as
 * {@code TaskNotFound} are regular JSON-RPC errors with HTTP 200; anything unexpected becomes
 * {@code -32603} with HTTP 500. Stack traces never reach the caller.
 *
 * <h2>Streaming</h2>
 * <p>Every stream item is a {@link SendStreamingMessageResponse} carrying the request id. Its SSE
 * frame uses the event sequence as {@code id} and the event type as {@code event}. The first frame
 * of {@code message/stream} is the {@code pending} status, which acknowledges acceptance.
 */
public class JSONRPCHandler {

    private static final Logger LOGGER = LoggerFactory.getLogger(JSONRPCHandler.class);

    public static final String APPLICATION_JSON = "application/json";
    public static final String TEXT_EVENT_STREAM = "text/event-stream";

    private final AgentCard agentCard;
    private final RequestHandler requestHandler;
    private final Executor executor;

    public JSONRPCHandler(AgentCard agentCard, RequestHandler requestHandler, Executor executor) {
        this.agentCard = agentCard;
        this.requestHandler = requestHandler;
        this.executor = executor;
    }

    public AgentCard getAgentCard() {
        return agentCard;
    }

    /**
     * Decodes and dispatches one raw request body.
     */
    public JSONRPCHandlerResponse handle(@Nullable String body) {
        JsonNode root;
        try {
            if (body == null || body.isBlank()) {
                throw new JSONParseError("Empty request body");
            }
            root = OBJECT_MAPPER.readTree(body);
        } catch (JsonProcessingException e) {
            LOGGER.debug("Rejecting unparseable request: {}", e.getOriginalMessage());
            return errorResponse(null, new JSONParseError("Parse error: " + e.getOriginalMessage()));
        } catch (JSONParseError e) {
            return errorResponse(null, e);
        }

        Object id = null;
        try {
            if (!root.isObject()) {
                throw new InvalidRequestError("Request must be a JSON object");
            }
            id = readId(root.get("id"));
            JsonNode version = root.get("jsonrpc");
            if (version == null || !JSONRPC_VERSION.equals(version.asText())) {
                throw new InvalidRequestError("Unsupported jsonrpc version: "
                        + (version == null ? "missing" : version.asText()));
            }
            JsonNode methodNode = root.get("method");
            if (methodNode == null || !methodNode.isTextual()) {
                throw new InvalidRequestError("Request method is required");
            }
            String method = methodNode.asText();
            JsonNode params = root.get("params");
            LOGGER.debug("Dispatching {} (id {})", method, id);

            switch (method) {
                case SendMessageRequest.METHOD:
                    return jsonResponse(onMessageSend(
                            new SendMessageRequest(id, readParams(params, MessageSendParams.class))));
                case SendStreamingMessageRequest.METHOD:
                    return streamingResponse(onMessageSendStream(
                            new SendStreamingMessageRequest(id, readParams(params, MessageSendParams.class))));
                case GetTaskRequest.METHOD:
                    return jsonResponse(onGetTask(new GetTaskRequest(id, readParams(params, TaskQueryParams.class))));
                case CancelTaskRequest.METHOD:
                    return jsonResponse(onCancelTask(new CancelTaskRequest(id, readParams(params, TaskIdParams.class))));
                case ResubscribeTaskRequest.METHOD:
                    return streamingResponse(onResubscribeToTask(
                            new ResubscribeTaskRequest(id, readParams(params, TaskIdParams.class))));
                default:
                    throw new MethodNotFoundError("Method not found: " + method);
            }
        } catch (JSONRPCError e) {
            return errorResponse(id, e);
        } catch (Throwable t) {
            LOGGER.error("Unexpected failure handling JSON-RPC request {}", id, t);
            return errorResponse(id, new InternalError(describe(t)));
        }
    }

    public SendMessageResponse onMessageSend(SendMessageRequest request) {
        try {
            SendMessageResult result = requestHandler.onMessageSend(request.getParams());
            return new SendMessageResponse(request.getId(), result);
        } catch (JSONRPCError e) {
            return new SendMessageResponse(request.getId(), e);
        } catch (Throwable t) {
            LOGGER.error("message/send failed", t);
            return new SendMessageResponse(request.getId(), new InternalError(describe(t)));
        }
    }

    public Flow.Publisher<SendStreamingMessageResponse> onMessageSendStream(SendStreamingMessageRequest request) {
        if (!agentCard.capabilities().streaming()) {
            return ZeroPublisher.fromItems(new SendStreamingMessageResponse(request.getId(),
                    new InvalidRequestError("Streaming is not supported by the agent")));
        }
        try {
            Flow.Publisher<StreamEvent> publisher = requestHandler.onMessageSendStream(request.getParams());
            return convertToSendStreamingMessageResponse(request.getId(), publisher);
        } catch (JSONRPCError e) {
            return ZeroPublisher.fromItems(new SendStreamingMessageResponse(request.getId(), e));
        } catch (Throwable t) {
            LOGGER.error("message/stream failed", t);
            return ZeroPublisher.fromItems(new SendStreamingMessageResponse(request.getId(),
                    new InternalError(describe(t))));
        }
    }

    public GetTaskResponse onGetTask(GetTaskRequest request) {
        try {
            Task task = requestHandler.onGetTask(request.getParams());
            return new GetTaskResponse(request.getId(), task);
        } catch (JSONRPCError e) {
            return new GetTaskResponse(request.getId(), e);
        } catch (Throwable t) {
            LOGGER.error("tasks/get failed", t);
            return new GetTaskResponse(request.getId(), new InternalError(describe(t)));
        }
    }

    public CancelTaskResponse onCancelTask(CancelTaskRequest request) {
        try {
            Task task = requestHandler.onCancelTask(request.getParams());
            return new CancelTaskResponse(request.getId(), task);
        } catch (JSONRPCError e) {
            return new CancelTaskResponse(request.getId(), e);
        } catch (Throwable t) {
            LOGGER.error("tasks/cancel failed", t);
            return new CancelTaskResponse(request.getId(), new InternalError(describe(t)));
        }
    }

    public Flow.Publisher<SendStreamingMessageResponse> onResubscribeToTask(ResubscribeTaskRequest request) {
        if (!agentCard.capabilities().streaming()) {
            return ZeroPublisher.fromItems(new SendStreamingMessageResponse(request.getId(),
                    new InvalidRequestError("Streaming is not supported by the agent")));
        }
        try {
            Flow.Publisher<StreamEvent> publisher = requestHandler.onResubscribeToTask(request.getParams());
            return convertToSendStreamingMessageResponse(request.getId(), publisher);
        } catch (JSONRPCError e) {
            return ZeroPublisher.fromItems(new SendStreamingMessageResponse(request.getId(), e));
        } catch (Throwable t) {
            LOGGER.error("tasks/resubscribe failed", t);
            return ZeroPublisher.fromItems(new SendStreamingMessageResponse(request.getId(),
                    new InternalError(describe(t))));
        }
    }

    /**
     * Frames one stream item as an SSE event.
     */
    public static String toSse(SendStreamingMessageResponse response) {
        String data;
        try {
            data = Utils.toJson(response);
        } catch (JsonProcessingException e) {
            data = "{\"jsonrpc\":\"2.0\",\"id\":null,\"error\":{\"code\":-32603,\"message\":\"Failed to serialize stream event\"}}";
        }
        StreamEvent event = response.getResult();
        if (event == null) {
            return SseFormatter.frame(null, "error", data);
        }
        return SseFormatter.frame(String.valueOf(event.sequence()), event.type().asString(), data);
    }

    /**
     * HTTP status for an error envelope.
     */
    static int httpStatus(JSONRPCError error) {
        if (error instanceof JSONParseError || error instanceof InvalidRequestError
                || error instanceof MethodNotFoundError || error instanceof InvalidParamsError) {
            return 400;
        }
        if (error instanceof InternalError) {
            return 500;
        }
        return 200;
    }

    private Flow.Publisher<SendStreamingMessageResponse> convertToSendStreamingMessageResponse(
            @Nullable Object requestId, Flow.Publisher<StreamEvent> publisher) {
        // Failures become error items instead of Subscriber.onError, so the client sees them in the stream.
        return ZeroPublisher.create(createTubeConfig(), tube -> CompletableFuture.runAsync(() ->
                publisher.subscribe(new Flow.Subscriber<StreamEvent>() {
                    private Flow.@Nullable Subscription subscription;

                    @Override
                    public void onSubscribe(Flow.Subscription subscription) {
                        this.subscription = subscription;
                        tube.whenCancelled(subscription::cancel);
                        subscription.request(1);
                    }

                    @Override
                    public void onNext(StreamEvent item) {
                        tube.send(new SendStreamingMessageResponse(requestId, item));
                        if (subscription != null) {
                            subscription.request(1);
                        }
                    }

                    @Override
                    public void onError(Throwable throwable) {
                        if (throwable instanceof JSONRPCError jsonrpcError) {
                            tube.send(new SendStreamingMessageResponse(requestId, jsonrpcError));
                        } else {
                            LOGGER.error("Task stream for request {} failed", requestId, throwable);
                            tube.send(new SendStreamingMessageResponse(requestId, new InternalError(describe(throwable))));
                        }
                        onComplete();
                    }

                    @Override
                    public void onComplete() {
                        tube.complete();
                    }
                }), executor));
    }

    private static <T> T readParams(@Nullable JsonNode params, Class<T> type) {
        if (params == null || !params.isObject()) {
            throw new InvalidParamsError("params must be an object");
        }
        try {
            return OBJECT_MAPPER.treeToValue(params, type);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            String detail = e instanceof JsonProcessingException jpe ? jpe.getOriginalMessage() : e.getMessage();
            throw new InvalidParamsError("Invalid params: " + detail);
        }
    }

    private static @Nullable Object readId(@Nullable JsonNode id) {
        if (id == null || id.isNull()) {
            return null;
        }
        if (id.isTextual()) {
            return id.asText();
        }
        if (id.isIntegralNumber()) {
            return id.longValue();
        }
        throw new InvalidRequestError("Request id must be a string, an integer or null");
    }

    private JSONRPCHandlerResponse jsonResponse(JSONRPCResponse<?> response) {
        JSONRPCError error = response.getError();
        return json(error == null ? 200 : httpStatus(error), response);
    }

    private JSONRPCHandlerResponse errorResponse(@Nullable Object id, JSONRPCError error) {
        return json(httpStatus(error), new JSONRPCErrorResponse(id, error));
    }

    private JSONRPCHandlerResponse streamingResponse(Flow.Publisher<SendStreamingMessageResponse> responses) {
        return new JSONRPCHandlerStreamingResponse(ZeroPublisher.create(createTubeConfig(), tube ->
                responses.subscribe(new Flow.Subscriber<SendStreamingMessageResponse>() {
                    @Override
                    public void onSubscribe(Flow.Subscription subscription) {
                        tube.whenCancelled(subscription::cancel);
                        subscription.request(Long.MAX_VALUE);
                    }

                    @Override
                    public void onNext(SendStreamingMessageResponse item) {
                        tube.send(toSse(item));
                    }

                    @Override
                    public void onError(Throwable throwable) {
                        tube.fail(throwable);
                    }

                    @Override
                    public void onComplete() {
                        tube.complete();
                    }
                })));
    }

    private static JSONRPCHandlerResponse json(int status, Object body) {
        try {
            return new JSONRPCHandlerResponse(status, APPLICATION_JSON, Utils.toJson(body));
        } catch (JsonProcessingException e) {
            LOGGER.error("Failed to serialize JSON-RPC response", e);
            return new JSONRPCHandlerResponse(500, APPLICATION_JSON,
                    "{\"jsonrpc\":\"2.0\",\"id\":null,\"error\":{\"code\":-32603,\"message\":\"Failed to serialize response\"}}");
        }
    }

    private static String describe(Throwable t) {
        return t.getMessage() != null ? t.getMessage() : t.getClass().getSimpleName();
    }

    /**
     * What the HTTP layer writes back: a status, a content type and a body.
     */
    public static class JSONRPCHandlerResponse {
        private final int statusCode;
        private final String contentType;
        private final String body;

        public JSONRPCHandlerResponse(int statusCode, String contentType, String body) {
            this.statusCode = statusCode;
            this.contentType = contentType;
            this.body = body;
        }

        public int getStatusCode() {
            return statusCode;
        }

        public String getContentType() {
            return contentType;
        }

        public String getBody() {
            return body;
        }
    }

    /**
     * A {@code text/event-stream} response; every published string is one complete SSE frame.
     */
    public static class JSONRPCHandlerStreamingResponse extends JSONRPCHandlerResponse {
        private final Flow.Publisher<String> publisher;

        public JSONRPCHandlerStreamingResponse(Flow.Publisher<String> publisher) {
            super(200, TEXT_EVENT_STREAM, "");
            this.publisher = publisher;
        }

        public Flow.Publisher<String> getPublisher() {
            return publisher;
        }
    }
}

package io.agentmesh.httprest.handler;

import static io.agentmesh.server.util.AsyncUtils.createTubeConfig;
import static io.agentmesh.util.Utils.OBJECT_MAPPER;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Flow;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import io.agentmesh.server.agents.AgentIdentity;
import io.agentmesh.server.agents.AgentRegistry;
import io.agentmesh.server.events.SseFormatter;
import io.agentmesh.server.monitor.Intervention;
import io.agentmesh.server.monitor.MessageMonitor;
import io.agentmesh.server.requesthandlers.RequestHandler;
import io.agentmesh.server.workers.HeartbeatResult;
import io.agentmesh.server.workers.PollFilter;
import io.agentmesh.server.workers.WorkerCoordinator;
import io.agentmesh.server.workers.WorkerInfo;
import io.agentmesh.spec.AgentCard;
import io.agentmesh.spec.AgentNotFoundError;
import io.agentmesh.spec.InternalError;
import io.agentmesh.spec.InvalidParamsError;
import io.agentmesh.spec.InvalidRequestError;
import io.agentmesh.spec.JSONParseError;
import io.agentmesh.spec.JSONRPCError;
import io.agentmesh.spec.LeaseExpiredError;
import io.agentmesh.spec.Message;
import io.agentmesh.spec.MethodNotFoundError;
import io.agentmesh.spec.ServiceUnavailableError;
import io.agentmesh.spec.StreamEvent;
import io.agentmesh.spec.StreamEventType;
import io.agentmesh.spec.Task;
import io.agentmesh.spec.TaskIdParams;
import io.agentmesh.spec.TaskNotCancelableError;
import io.agentmesh.spec.TaskNotFoundError;
import io.agentmesh.spec.TaskState;
import io.agentmesh.spec.TaskStateConflictError;
import io.agentmesh.spec.WorkerNotFoundError;
import io.agentmesh.util.Utils;
import mutiny.zero.ZeroPublisher;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * REST surface of the worker protocol, plus discovery, health, the agent list and the operator
 * monitor.
 *
 * <p>Workers register, long-poll for tasks, push partial output and finish their tasks through
 * the {@code /v1/workers} and {@code /v1/tasks} routes. Operators read broker traffic and inject
 * messages through {@code /v1/monitor}. Errors are answered with a
 * {@code {"detail": ..., "code": ...}} body and an HTTP status derived from the error type.
 * Every worker route answers 503 when the server runs without a {@link WorkerCoordinator}, and
 * likewise the agent and monitor routes without an {@link AgentRegistry} or {@link MessageMonitor}.
 * Path segments and query values are percent-decoded.
 */
public class HTTPRestHandler {

    private static final Logger LOGGER = LoggerFactory.getLogger(HTTPRestHandler.class);

    public static final String APPLICATION_JSON = "application/json";
    public static final String TEXT_EVENT_STREAM = "text/event-stream";
    public static final String AGENT_CARD_PATH = "/.well-known/agent-card.json";
    public static final String HEALTH_PATH = "/health";
    public static final int DEFAULT_MONITOR_LIMIT = 100;

    private static final Pattern WORKER_PATTERN = Pattern.compile("^/v1/workers/([^/]+)$");
    private static final Pattern WORKER_ACTION_PATTERN = Pattern.compile("^/v1/workers/([^/]+)/(unregister|heartbeat|poll)$");
    private static final Pattern TASK_ACTION_PATTERN = Pattern.compile("^/v1/tasks/([^/]+)/(output|complete|error|cancel|interrupt)$");
    private static final Pattern TASK_STATUS_PATTERN = Pattern.compile("^/v1/tasks/([^/]+)/status$");
    private static final Pattern TASK_EVENTS_PATTERN = Pattern.compile("^/v1/tasks/([^/]+)/events$");
    private static final Pattern CODEBASE_ACTION_PATTERN = Pattern.compile("^/v1/codebases/([^/]+)/(tasks|interrupt)$");

    private final AgentCard agentCard;
    private final RequestHandler requestHandler;
    private final @Nullable WorkerCoordinator workerCoordinator;
    private final @Nullable AgentRegistry agentRegistry;
    private final @Nullable MessageMonitor monitor;

    public HTTPRestHandler(AgentCard agentCard, RequestHandler requestHandler,
                           @Nullable WorkerCoordinator workerCoordinator) {
        this(agentCard, requestHandler, workerCoordinator, null, null);
    }

    public HTTPRestHandler(AgentCard agentCard, RequestHandler requestHandler,
                           @Nullable WorkerCoordinator workerCoordinator,
                           @Nullable AgentRegistry agentRegistry, @Nullable MessageMonitor monitor) {
        this.agentCard = agentCard;
        this.requestHandler = requestHandler;
        this.workerCoordinator = workerCoordinator;
        this.agentRegistry = agentRegistry;
        this.monitor = monitor;
    }

    /**
     * Dispatches one request.
     *
     * @param path the request path, optionally with a query string
     * @param body the raw body, {@code null} when the request has none
     */
    public HTTPRestResponse handleRequest(String method, String path, @Nullable String body) {
        int query = path.indexOf('?');
        String route = query < 0 ? path : path.substring(0, query);
        try {
            switch (method.toUpperCase()) {
                case "GET":
                    return handleGetRequest(route,
                            query < 0 ? Map.of() : parseQuery(path.substring(query + 1)));
                case "POST":
                    return handlePostRequest(route, body);
                case "PUT":
                    return handlePutRequest(route, body);
                default:
                    return createErrorResponse(405, new MethodNotFoundError("Method not allowed: " + method));
            }
        } catch (JSONRPCError e) {
            LOGGER.debug("{} {} rejected: {}", method, route, e.getMessage());
            return createErrorResponse(mapErrorToHttpStatus(e), e);
        } catch (Exception e) {
            LOGGER.error("Unexpected failure handling {} {}", method, route, e);
            return createErrorResponse(500, new InternalError(e.getMessage() != null
                    ? e.getMessage() : e.getClass().getSimpleName()));
        }
    }

    private HTTPRestResponse handleGetRequest(String path, Map<String, String> parameters) {
        if (path.equals(AGENT_CARD_PATH)) {
            return createSuccessResponse(200, agentCard);
        }
        if (path.equals(HEALTH_PATH)) {
            Map<String, Object> health = new LinkedHashMap<>();
            health.put("status", "healthy");
            health.put("timestamp", Utils.nowUtc());
            return createSuccessResponse(200, health);
        }
        if (path.equals("/v1/workers")) {
            return createSuccessResponse(200, coordinator().workers().list());
        }
        if (path.equals("/v1/agents")) {
            return createSuccessResponse(200, registry().list().stream().map(HTTPRestHandler::describe).toList());
        }
        if (path.equals("/v1/monitor/messages")) {
            return createSuccessResponse(200, monitor().recent(limit(parameters), parameters.get("type")));
        }
        if (path.equals("/v1/monitor/messages/search")) {
            String query = parameters.get("q");
            if (query == null || query.isBlank()) {
                throw new InvalidParamsError("q is required");
            }
            List<?> results = monitor().search(query, limit(parameters));
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("query", query);
            body.put("results", results);
            body.put("count", results.size());
            return createSuccessResponse(200, body);
        }
        if (path.equals("/v1/monitor/stats")) {
            return createSuccessResponse(200, monitor().stats());
        }

        Matcher workerMatcher = WORKER_PATTERN.matcher(path);
        if (workerMatcher.matches()) {
            return createSuccessResponse(200, coordinator().workers().require(pathParam(workerMatcher)));
        }

        Matcher eventsMatcher = TASK_EVENTS_PATTERN.matcher(path);
        if (eventsMatcher.matches()) {
            if (!agentCard.capabilities().streaming()) {
                throw new InvalidRequestError("Streaming is not supported by the agent");
            }
            TaskIdParams params = new TaskIdParams(pathParam(eventsMatcher), lastSequence(parameters));
            return createStreamingResponse(requestHandler.onResubscribeToTask(params));
        }

        throw new MethodNotFoundError("No route for GET " + path);
    }

    private HTTPRestResponse handlePostRequest(String path, @Nullable String body) {
        if (path.equals("/v1/workers/register")) {
            WorkerRegistration registration = parseRequestBody(body, WorkerRegistration.class);
            if (registration.workerId() == null || registration.workerId().isBlank()) {
                throw new InvalidParamsError("worker_id is required");
            }
            WorkerInfo info = coordinator().workers().register(registration.workerId(), registration.name(),
                    registration.capabilities(), registration.hostname());
            return createSuccessResponse(200, info);
        }
        if (path.equals("/v1/monitor/intervene")) {
            InterventionRequest request = parseRequestBody(body, InterventionRequest.class);
            if (request.agentId() == null || request.agentId().isBlank()) {
                throw new InvalidParamsError("agent_id is required");
            }
            if (request.message() == null || request.message().isBlank()) {
                throw new InvalidParamsError("message is required");
            }
            Intervention intervention = monitor().intervene(request.agentId(), request.message());
            Map<String, Object> result = new LinkedHashMap<>();
            result.put("success", true);
            result.put("intervention", intervention);
            return createSuccessResponse(200, result);
        }

        Matcher workerMatcher = WORKER_ACTION_PATTERN.matcher(path);
        if (workerMatcher.matches()) {
            String workerId = pathParam(workerMatcher);
            switch (workerMatcher.group(2)) {
                case "unregister":
                    return createSuccessResponse(200, coordinator().unregister(workerId));
                case "heartbeat":
                    return createSuccessResponse(200, coordinator().heartbeat(workerId));
                default:
                    return poll(workerId, body);
            }
        }

        Matcher taskMatcher = TASK_ACTION_PATTERN.matcher(path);
        if (taskMatcher.matches()) {
            String taskId = pathParam(taskMatcher);
            switch (taskMatcher.group(2)) {
                case "output": {
                    OutputSubmission output = parseRequestBody(body, OutputSubmission.class);
                    StreamEvent event = coordinator().submitOutput(taskId, requireWorkerId(output.workerId()),
                            eventType(output.type()), output.data());
                    return createSuccessResponse(200, event);
                }
                case "complete": {
                    CompletionReport report = parseRequestBody(body, CompletionReport.class);
                    return createSuccessResponse(200, coordinator().complete(taskId,
                            requireWorkerId(report.workerId()), resultMessage(report.result())));
                }
                case "error": {
                    ErrorReport report = parseRequestBody(body, ErrorReport.class);
                    return createSuccessResponse(200, coordinator().fail(taskId,
                            requireWorkerId(report.workerId()), errorText(report.error())));
                }
                case "cancel":
                    return createSuccessResponse(200, requestHandler.onCancelTask(new TaskIdParams(taskId)));
                default: {
                    Map<String, Object> result = new LinkedHashMap<>();
                    result.put("task_id", taskId);
                    result.put("interrupted", coordinator().interrupt(taskId));
                    return createSuccessResponse(200, result);
                }
            }
        }

        Matcher codebaseMatcher = CODEBASE_ACTION_PATTERN.matcher(path);
        if (codebaseMatcher.matches()) {
            String codebaseId = pathParam(codebaseMatcher);
            if (codebaseMatcher.group(2).equals("tasks")) {
                CodebaseTaskRequest request = parseRequestBody(body, CodebaseTaskRequest.class);
                Task task = coordinator().submitTask(codebaseId, request.prompt(), request.agent(),
                        request.metadata());
                return createSuccessResponse(201, task);
            }
            Map<String, Object> result = new LinkedHashMap<>();
            result.put("codebase_id", codebaseId);
            result.put("interrupted", coordinator().interruptCodebase(codebaseId));
            return createSuccessResponse(200, result);
        }

        throw new MethodNotFoundError("No route for POST " + path);
    }

    /**
     * {@code PUT /v1/tasks/{id}/status} lets older workers report through a single endpoint.
     */
    private HTTPRestResponse handlePutRequest(String path, @Nullable String body) {
        Matcher statusMatcher = TASK_STATUS_PATTERN.matcher(path);
        if (!statusMatcher.matches()) {
            throw new MethodNotFoundError("No route for PUT " + path);
        }
        String taskId = pathParam(statusMatcher);
        StatusUpdate update = parseRequestBody(body, StatusUpdate.class);
        TaskState status = taskState(update.status());
        switch (status) {
            case RUNNING: {
                String workerId = requireWorkerId(update.workerId());
                coordinator().renew(taskId, workerId);
                HeartbeatResult heartbeat = coordinator().heartbeat(workerId);
                return createSuccessResponse(200, heartbeat);
            }
            case COMPLETED:
                return createSuccessResponse(200, coordinator().complete(taskId,
                        requireWorkerId(update.workerId()), resultMessage(update.result())));
            case FAILED:
                return createSuccessResponse(200, coordinator().fail(taskId,
                        requireWorkerId(update.workerId()), errorText(update.error())));
            case CANCELLED:
                return createSuccessResponse(200, requestHandler.onCancelTask(new TaskIdParams(taskId)));
            default:
                throw new InvalidParamsError("Workers cannot set status " + status.asString());
        }
    }

    private HTTPRestResponse poll(String workerId, @Nullable String body) {
        PollRequest request = body == null || body.isBlank()
                ? new PollRequest(null, null)
                : parseRequestBody(body, PollRequest.class);
        Duration timeout = request.timeoutMs() == null ? null : Duration.ofMillis(Math.max(0, request.timeoutMs()));
        Optional<Task> task;
        try {
            task = coordinator().poll(workerId, new PollFilter(request.codebaseId()), timeout);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ServiceUnavailableError("Poll interrupted");
        }
        if (task.isEmpty()) {
            return new HTTPRestResponse(204, APPLICATION_JSON, null);
        }
        return createSuccessResponse(200, task.get());
    }

    private WorkerCoordinator coordinator() {
        if (workerCoordinator == null) {
            throw new ServiceUnavailableError("Worker bridge is not available");
        }
        return workerCoordinator;
    }

    private AgentRegistry registry() {
        if (agentRegistry == null) {
            throw new ServiceUnavailableError("Agent registry is not available");
        }
        return agentRegistry;
    }

    private MessageMonitor monitor() {
        if (monitor == null) {
            throw new ServiceUnavailableError("Message monitor is not available");
        }
        return monitor;
    }

    private static Map<String, Object> describe(AgentIdentity agent) {
        Map<String, Object> description = new LinkedHashMap<>();
        description.put("name", agent.name());
        description.put("description", agent.description());
        description.put("skills", agent.skills());
        return description;
    }

    private static String requireWorkerId(@Nullable String workerId) {
        if (workerId == null || workerId.isBlank()) {
            throw new InvalidParamsError("worker_id is required");
        }
        return workerId;
    }

    private static StreamEventType eventType(@Nullable String type) {
        if (type == null) {
            throw new InvalidParamsError("type is required");
        }
        try {
            return StreamEventType.fromString(type);
        } catch (IllegalArgumentException e) {
            throw new InvalidParamsError(e.getMessage());
        }
    }

    private static TaskState taskState(@Nullable String status) {
        if (status == null) {
            throw new InvalidParamsError("status is required");
        }
        try {
            return TaskState.fromString(status);
        } catch (IllegalArgumentException e) {
            throw new InvalidParamsError(e.getMessage());
        }
    }

    /**
     * A worker result is either plain text or a full message.
     */
    private static Message resultMessage(@Nullable JsonNode result) {
        if (result == null || result.isNull()) {
            throw new InvalidParamsError("result is required");
        }
        if (result.isTextual()) {
            return Message.text(result.asText());
        }
        try {
            return OBJECT_MAPPER.treeToValue(result, Message.class);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new InvalidParamsError("result must be a string or a message");
        }
    }

    private static String errorText(@Nullable String error) {
        return error == null || error.isBlank() ? "Worker reported an error" : error;
    }

    private static @Nullable Long lastSequence(Map<String, String> parameters) {
        String value = parameters.get("last_sequence");
        if (value == null || value.isEmpty()) {
            return null;
        }
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            throw new InvalidParamsError("last_sequence must be an integer");
        }
    }

    private static int limit(Map<String, String> parameters) {
        String value = parameters.get("limit");
        if (value == null || value.isEmpty()) {
            return DEFAULT_MONITOR_LIMIT;
        }
        int limit;
        try {
            limit = Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new InvalidParamsError("limit must be an integer");
        }
        if (limit <= 0) {
            throw new InvalidParamsError("limit must be positive");
        }
        return limit;
    }

    private static String pathParam(Matcher matcher) {
        // '+' is literal in a path segment
        return decode(matcher.group(1).replace("+", "%2B"));
    }

    private static String decode(String value) {
        try {
            return URLDecoder.decode(value, StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            throw new InvalidRequestError("Malformed percent-encoding: " + value);
        }
    }

    private static Map<String, String> parseQuery(String query) {
        Map<String, String> parameters = new LinkedHashMap<>();
        for (String pair : query.split("&")) {
            if (pair.isEmpty()) {
                continue;
            }
            int eq = pair.indexOf('=');
            if (eq < 0) {
                parameters.put(decode(pair), "");
            } else {
                parameters.put(decode(pair.substring(0, eq)), decode(pair.substring(eq + 1)));
            }
        }
        return parameters;
    }

    private static <T> T parseRequestBody(@Nullable String body, Class<T> valueType) {
        if (body == null || body.isBlank()) {
            throw new InvalidParamsError("Request body is required");
        }
        try {
            return OBJECT_MAPPER.readValue(body, valueType);
        } catch (JsonProcessingException e) {
            throw new InvalidParamsError("Failed to parse request body: " + e.getOriginalMessage());
        }
    }

    private HTTPRestResponse createSuccessResponse(int statusCode, Object data) {
        try {
            return new HTTPRestResponse(statusCode, APPLICATION_JSON, Utils.toJson(data));
        } catch (JsonProcessingException e) {
            LOGGER.error("Failed to serialize response", e);
            return createErrorResponse(500, new InternalError("Failed to serialize response"));
        }
    }

    private HTTPRestResponse createErrorResponse(int statusCode, JSONRPCError error) {
        return new HTTPRestResponse(statusCode, APPLICATION_JSON, errorBody(error));
    }

    private static String errorBody(JSONRPCError error) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("detail", error.getMessage());
        body.put("code", error.getCode());
        try {
            return Utils.toJson(body);
        } catch (JsonProcessingException e) {
            return "{\"detail\":\"Failed to serialize error response\"}";
        }
    }

    private HTTPRestResponse createStreamingResponse(Flow.Publisher<StreamEvent> publisher) {
        return new HTTPRestStreamingResponse(ZeroPublisher.create(createTubeConfig(), tube ->
                publisher.subscribe(new Flow.Subscriber<StreamEvent>() {
                    @Override
                    public void onSubscribe(Flow.Subscription subscription) {
                        tube.whenCancelled(subscription::cancel);
                        subscription.request(Long.MAX_VALUE);
                    }

                    @Override
                    public void onNext(StreamEvent item) {
                        tube.send(SseFormatter.format(item));
                    }

                    @Override
                    public void onError(Throwable throwable) {
                        JSONRPCError error = throwable instanceof JSONRPCError jsonrpcError
                                ? jsonrpcError
                                : new InternalError("Task stream failed");
                        if (!(throwable instanceof JSONRPCError)) {
                            LOGGER.error("Task event stream failed", throwable);
                        }
                        tube.send(SseFormatter.frame(null, "error", errorBody(error)));
                        tube.complete();
                    }

                    @Override
                    public void onComplete() {
                        tube.complete();
                    }
                })));
    }

    static int mapErrorToHttpStatus(JSONRPCError error) {
        if (error instanceof InvalidRequestError || error instanceof InvalidParamsError
                || error instanceof JSONParseError || error instanceof TaskNotCancelableError) {
            return 400;
        } else if (error instanceof MethodNotFoundError || error instanceof TaskNotFoundError
                || error instanceof WorkerNotFoundError || error instanceof AgentNotFoundError) {
            return 404;
        } else if (error instanceof TaskStateConflictError || error instanceof LeaseExpiredError) {
            return 409;
        } else if (error instanceof ServiceUnavailableError) {
            return 503;
        } else {
            return 500;
        }
    }

    public AgentCard getAgentCard() {
        return agentCard;
    }

    public static class HTTPRestResponse {
        private final int statusCode;
        private final String contentType;
        private final @Nullable String body;

        public HTTPRestResponse(int statusCode, String contentType, @Nullable String body) {
            this.statusCode = statusCode;
            this.contentType = contentType;
            this.body = body;
        }

        public int getStatusCode() { return statusCode; }
        public String getContentType() { return contentType; }
        public @Nullable String getBody() { return body; }
    }

    /**
     * Each published string is one complete SSE frame.
     */
    public static class HTTPRestStreamingResponse extends HTTPRestResponse {
        private final Flow.Publisher<String> publisher;

        public HTTPRestStreamingResponse(Flow.Publisher<String> publisher) {
            super(200, TEXT_EVENT_STREAM, null);
            this.publisher = publisher;
        }

        public Flow.Publisher<String> getPublisher() { return publisher; }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record WorkerRegistration(@JsonProperty("worker_id") @Nullable String workerId,
                              @JsonProperty("name") @Nullable String name,
                              @JsonProperty("capabilities") @Nullable List<String> capabilities,
                              @JsonProperty("hostname") @Nullable String hostname) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record PollRequest(@JsonProperty("codebase_id") @Nullable String codebaseId,
                       @JsonProperty("timeout_ms") @Nullable Long timeoutMs) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record OutputSubmission(@JsonProperty("worker_id") @Nullable String workerId,
                            @JsonProperty("type") @Nullable String type,
                            @JsonProperty("data") @Nullable Object data) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record CompletionReport(@JsonProperty("worker_id") @Nullable String workerId,
                            @JsonProperty("result") @Nullable JsonNode result) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record ErrorReport(@JsonProperty("worker_id") @Nullable String workerId,
                       @JsonProperty("error") @Nullable String error) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record StatusUpdate(@JsonProperty("status") @Nullable String status,
                        @JsonProperty("worker_id") @Nullable String workerId,
                        @JsonProperty("result") @Nullable JsonNode result,
                        @JsonProperty("error") @Nullable String error) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record InterventionRequest(@JsonProperty("agent_id") @Nullable String agentId,
                               @JsonProperty("message") @Nullable String message) {
    }

    /**
     * Body of {@code POST /v1/codebases/{id}/tasks}: a {@code prompt} string or a full {@code message}.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    record CodebaseTaskRequest(@JsonProperty("prompt") @Nullable String promptText,
                               @JsonProperty("message") @Nullable Message message,
                               @JsonProperty("agent") @Nullable String agent,
                               @JsonProperty("metadata") @Nullable Map<String, Object> metadata) {

        Message prompt() {
            if (message != null && !message.parts().isEmpty()) {
                return message;
            }
            if (promptText != null && !promptText.isBlank()) {
                return Message.text(promptText);
            }
            throw new InvalidParamsError("prompt or message is required");
        }
    }
}

package io.agentmesh.client.mcp;

import static io.agentmesh.util.Assert.checkNotNullParam;

import java.io.IOException;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import io.agentmesh.client.http.HttpClient;
import io.agentmesh.client.http.HttpResponse;
import io.agentmesh.util.Utils;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link ToolBridge} speaking JSON-RPC 2.0 ({@code tools/list}, {@code tools/call}) to
 * {@code <baseUrl>/mcp/v1/rpc}.
 * <p>
 * The tool server answers {@code tools/call} with {@code {"content":[{"type":"text","text":"..."}]}}
 * where the text is usually a JSON object. A JSON object containing an {@code error} member,
 * an {@code isError} flag, or a JSON-RPC error all become {@link ToolError.Kind#TOOL_ERROR}.
 */
public class JsonRpcToolBridge implements ToolBridge {

    private static final Logger LOGGER = LoggerFactory.getLogger(JsonRpcToolBridge.class);

    public static final String RPC_PATH = "/mcp/v1/rpc";
    public static final String TOOLS_LIST_METHOD = "tools/list";
    public static final String TOOLS_CALL_METHOD = "tools/call";
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);

    static final String UNKNOWN_TOOL_PREFIX = "Unknown tool";

    private static final TypeReference<Map<String, Object>> MAP_REFERENCE = new TypeReference<>() {};
    private static final TypeReference<List<ToolDescriptor>> TOOL_LIST_REFERENCE = new TypeReference<>() {};

    // Grace on top of the HTTP timeout before the caller stops waiting.
    private static final long WAIT_GRACE_MILLIS = 250;

    private final HttpClient httpClient;
    private final Duration timeout;
    private final AtomicLong requestIds = new AtomicLong();

    public JsonRpcToolBridge(String baseUrl) {
        this(HttpClient.createHttpClient(baseUrl), DEFAULT_TIMEOUT);
    }

    public JsonRpcToolBridge(String baseUrl, Duration timeout) {
        this(HttpClient.createHttpClient(baseUrl), timeout);
    }

    public JsonRpcToolBridge(HttpClient httpClient, Duration timeout) {
        this.httpClient = checkNotNullParam("httpClient", httpClient);
        this.timeout = checkNotNullParam("timeout", timeout);
        if (timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("Tool call timeout must be positive");
        }
    }

    public Duration getTimeout() {
        return timeout;
    }

    @Override
    public List<ToolDescriptor> listTools() throws ToolBridgeException {
        Map<String, Object> result = invoke(TOOLS_LIST_METHOD, null, TOOLS_LIST_METHOD);
        Object tools = result.get("tools");
        if (tools == null) {
            return List.of();
        }
        try {
            return Utils.OBJECT_MAPPER.convertValue(tools, TOOL_LIST_REFERENCE);
        } catch (IllegalArgumentException e) {
            throw new ToolBridgeException(new ToolError(ToolError.Kind.MALFORMED_RESPONSE,
                    "Invalid tool listing: " + e.getMessage()), e);
        }
    }

    @Override
    public ToolResult callTool(String toolName, Map<String, Object> arguments) {
        checkNotNullParam("toolName", toolName);
        Map<String, Object> args = arguments == null ? Map.of() : arguments;
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("name", toolName);
        params.put("arguments", args);
        try {
            Map<String, Object> result = invoke(TOOLS_CALL_METHOD, params, toolName);
            Map<String, Object> payload = extractPayload(toolName, result);
            Object error = payload.get("error");
            if (error != null) {
                String message = String.valueOf(error);
                ToolError.Kind kind = message.startsWith(UNKNOWN_TOOL_PREFIX)
                        ? ToolError.Kind.UNKNOWN_TOOL : ToolError.Kind.TOOL_ERROR;
                LOGGER.debug("Tool {} reported an error: {}", toolName, message);
                return ToolResult.failure(toolName, args, new ToolError(kind, message));
            }
            return ToolResult.success(toolName, args, payload);
        } catch (ToolBridgeException e) {
            LOGGER.warn("Tool call {} failed: {}", toolName, e.getError());
            return ToolResult.failure(toolName, args, e.getError());
        }
    }

    private Map<String, Object> invoke(String method, @Nullable Map<String, Object> params, String toolName)
            throws ToolBridgeException {
        String body = createRequestBody(method, params);
        HttpResponse response;
        try {
            response = httpClient.post(RPC_PATH)
                    .asJson()
                    .timeout(timeout)
                    .send(body)
                    .get(timeout.toMillis() + WAIT_GRACE_MILLIS, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            throw new ToolBridgeException(ToolError.timeout(toolName, timeout.toMillis()), e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            if (cause instanceof HttpTimeoutException) {
                throw new ToolBridgeException(ToolError.timeout(toolName, timeout.toMillis()), cause);
            }
            throw new ToolBridgeException(new ToolError(ToolError.Kind.TRANSPORT,
                    "Tool server unreachable: " + cause.getMessage()), cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ToolBridgeException(new ToolError(ToolError.Kind.TRANSPORT, "Tool call interrupted"), e);
        }

        if (!response.success()) {
            throw new ToolBridgeException(new ToolError(ToolError.Kind.TRANSPORT,
                    "Tool server returned HTTP " + response.statusCode()));
        }
        return parseResponse(response.body());
    }

    private String createRequestBody(String method, @Nullable Map<String, Object> params) throws ToolBridgeException {
        Map<String, Object> request = new LinkedHashMap<>();
        request.put("jsonrpc", Utils.JSONRPC_VERSION);
        request.put("id", requestIds.incrementAndGet());
        request.put("method", method);
        if (params != null) {
            request.put("params", params);
        }
        try {
            return Utils.toJson(request);
        } catch (JsonProcessingException e) {
            throw new ToolBridgeException(new ToolError(ToolError.Kind.TRANSPORT,
                    "Tool arguments could not be serialized: " + e.getOriginalMessage()), e);
        }
    }

    private static Map<String, Object> parseResponse(String body) throws ToolBridgeException {
        Map<String, Object> envelope;
        try {
            envelope = Utils.unmarshalFrom(body, MAP_REFERENCE);
        } catch (IOException e) {
            throw new ToolBridgeException(new ToolError(ToolError.Kind.MALFORMED_RESPONSE,
                    "Tool server response is not valid JSON"), e);
        }
        if (envelope == null) {
            throw new ToolBridgeException(new ToolError(ToolError.Kind.MALFORMED_RESPONSE,
                    "Tool server response is empty"));
        }
        Object error = envelope.get("error");
        if (error != null) {
            String message = error instanceof Map<?, ?> errorMap && errorMap.get("message") != null
                    ? String.valueOf(errorMap.get("message"))
                    : String.valueOf(error);
            throw new ToolBridgeException(new ToolError(ToolError.Kind.TOOL_ERROR, message));
        }
        if (!(envelope.get("result") instanceof Map<?, ?>)) {
            throw new ToolBridgeException(new ToolError(ToolError.Kind.MALFORMED_RESPONSE,
                    "Tool server response has no result"));
        }
        return asStringMap(envelope.get("result"));
    }

    private static Map<String, Object> extractPayload(String toolName, Map<String, Object> result)
            throws ToolBridgeException {
        Object content = result.get("content");
        if (!(content instanceof List<?> items)) {
            return result;
        }
        List<String> texts = new ArrayList<>();
        for (Object item : items) {
            if (item instanceof Map<?, ?> part && part.get("text") != null) {
                texts.add(String.valueOf(part.get("text")));
            }
        }
        if (Boolean.TRUE.equals(result.get("isError"))) {
            String message = texts.isEmpty() ? "Tool '" + toolName + "' failed" : String.join(" ", texts);
            throw new ToolBridgeException(new ToolError(ToolError.Kind.TOOL_ERROR, message));
        }
        if (texts.isEmpty()) {
            return Map.of();
        }
        String text = texts.get(0);
        try {
            Map<String, Object> parsed = Utils.unmarshalFrom(text, MAP_REFERENCE);
            if (parsed != null) {
                return parsed;
            }
        } catch (IOException e) {
            LOGGER.debug("Tool {} returned plain text content", toolName);
        }
        Map<String, Object> plain = new LinkedHashMap<>();
        plain.put("result", text);
        return plain;
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> asStringMap(Object value) {
        return (Map<String, Object>) value;
    }
}

package io.agentmesh.transport.jsonrpc.handler;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Flow;
import java.util.concurrent.TimeUnit;

import com.fasterxml.jackson.databind.JsonNode;
import io.agentmesh.client.mcp.ToolBridge;
import io.agentmesh.server.AgentMeshRuntime;
import io.agentmesh.server.config.ServerConfig;
import io.agentmesh.server.requesthandlers.RequestHandler;
import io.agentmesh.spec.AgentMeshErrorCodes;
import io.agentmesh.spec.GetTaskRequest;
import io.agentmesh.spec.GetTaskResponse;
import io.agentmesh.spec.Message;
import io.agentmesh.spec.MessageSendParams;
import io.agentmesh.spec.SendMessageRequest;
import io.agentmesh.spec.SendMessageResponse;
import io.agentmesh.spec.SendStreamingMessageRequest;
import io.agentmesh.spec.SendStreamingMessageResponse;
import io.agentmesh.spec.TaskNotFoundError;
import io.agentmesh.spec.TaskQueryParams;
import io.agentmesh.util.Utils;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

public class JSONRPCHandlerTest {

    private AgentMeshRuntime runtime;
    private JSONRPCHandler handler;

    @BeforeEach
    public void init() {
        runtime = AgentMeshRuntime.builder(ServerConfig.defaults())
                .toolBridge(mock(ToolBridge.class))
                .build();
        handler = new JSONRPCHandler(runtime.agentCard(), runtime.requestHandler(), runtime.executor());
    }

    @AfterEach
    public void cleanup() {
        runtime.close();
    }

    @Test
    public void testSendMessageToEcho() throws Exception {
        JSONRPCHandler.JSONRPCHandlerResponse response = handler.handle("""
                {"jsonrpc": "2.0", "id": "req-1", "method": "message/send",
                 "params": {"message": {"parts": [{"type": "text", "content": "Hello"}]}}}
                """);

        assertEquals(200, response.getStatusCode());
        assertEquals(JSONRPCHandler.APPLICATION_JSON, response.getContentType());
        JsonNode body = Utils.OBJECT_MAPPER.readTree(response.getBody());
        assertEquals("2.0", body.get("jsonrpc").asText());
        assertEquals("req-1", body.get("id").asText());
        assertFalse(body.has("error"));
        assertEquals("Echo: Hello", body.at("/result/message/parts/0/content").asText());
        assertEquals("completed", body.at("/result/task/status").asText());
        assertEquals("echo", body.at("/result/task/agent").asText());
    }

    @Test
    public void testGetUnknownTask() throws Exception {
        JSONRPCHandler.JSONRPCHandlerResponse response = handler.handle("""
                {"jsonrpc": "2.0", "id": 7, "method": "tasks/get", "params": {"task_id": "never-issued"}}
                """);

        assertEquals(200, response.getStatusCode());
        JsonNode body = Utils.OBJECT_MAPPER.readTree(response.getBody());
        assertEquals(7, body.get("id").asInt());
        assertTrue(body.get("id").isNumber());
        assertEquals(AgentMeshErrorCodes.TASK_NOT_FOUND_ERROR_CODE, body.at("/error/code").asInt());
        assertTrue(body.at("/error/message").asText().contains("not found"));
        assertFalse(body.has("result"));
    }

    @Test
    public void testGetTaskAfterSend() throws Exception {
        JsonNode sent = Utils.OBJECT_MAPPER.readTree(handler.handle("""
                {"jsonrpc": "2.0", "id": "1", "method": "message/send",
                 "params": {"message": {"parts": [{"type": "text", "content": "Hello"}]}}}
                """).getBody());
        String taskId = sent.at("/result/task/id").asText();

        JsonNode fetched = Utils.OBJECT_MAPPER.readTree(handler.handle(
                "{\"jsonrpc\":\"2.0\",\"id\":\"2\",\"method\":\"tasks/get\",\"params\":{\"id\":\"" + taskId + "\"}}")
                .getBody());

        assertEquals(taskId, fetched.at("/result/id").asText());
        assertEquals("Echo: Hello", fetched.at("/result/result/parts/0/content").asText());
    }

    @Test
    public void testMalformedBody() throws Exception {
        JSONRPCHandler.JSONRPCHandlerResponse response = handler.handle("{\"jsonrpc\": \"2.0\", \"method\": ");

        assertEquals(400, response.getStatusCode());
        JsonNode body = Utils.OBJECT_MAPPER.readTree(response.getBody());
        assertEquals(AgentMeshErrorCodes.JSON_PARSE_ERROR_CODE, body.at("/error/code").asInt());
        assertTrue(body.get("id").isNull());

        assertEquals(400, handler.handle("").getStatusCode());
    }

    @Test
    public void testInvalidEnvelope() throws Exception {
        JsonNode wrongVersion = Utils.OBJECT_MAPPER.readTree(handler.handle(
                "{\"jsonrpc\":\"1.0\",\"id\":\"a\",\"method\":\"tasks/get\",\"params\":{\"task_id\":\"x\"}}").getBody());
        assertEquals(AgentMeshErrorCodes.INVALID_REQUEST_ERROR_CODE, wrongVersion.at("/error/code").asInt());
        assertEquals("a", wrongVersion.get("id").asText());

        JsonNode array = Utils.OBJECT_MAPPER.readTree(handler.handle("[1, 2]").getBody());
        assertEquals(AgentMeshErrorCodes.INVALID_REQUEST_ERROR_CODE, array.at("/error/code").asInt());

        JsonNode noMethod = Utils.OBJECT_MAPPER.readTree(handler.handle("{\"jsonrpc\":\"2.0\",\"id\":\"b\"}").getBody());
        assertEquals(AgentMeshErrorCodes.INVALID_REQUEST_ERROR_CODE, noMethod.at("/error/code").asInt());
    }

    @Test
    public void testUnknownMethod() throws Exception {
        JSONRPCHandler.JSONRPCHandlerResponse response = handler.handle(
                "{\"jsonrpc\":\"2.0\",\"id\":\"m\",\"method\":\"tasks/list\",\"params\":{}}");

        assertEquals(400, response.getStatusCode());
        JsonNode body = Utils.OBJECT_MAPPER.readTree(response.getBody());
        assertEquals(AgentMeshErrorCodes.METHOD_NOT_FOUND_ERROR_CODE, body.at("/error/code").asInt());
        assertEquals("m", body.get("id").asText());
    }

    @Test
    public void testInvalidParams() throws Exception {
        List<String> bodies = List.of(
                "{\"jsonrpc\":\"2.0\",\"id\":\"p\",\"method\":\"message/send\"}",
                "{\"jsonrpc\":\"2.0\",\"id\":\"p\",\"method\":\"message/send\",\"params\":{}}",
                "{\"jsonrpc\":\"2.0\",\"id\":\"p\",\"method\":\"message/send\",\"params\":{\"message\":{\"parts\":[]}}}",
                "{\"jsonrpc\":\"2.0\",\"id\":\"p\",\"method\":\"tasks/get\",\"params\":{}}",
                "{\"jsonrpc\":\"2.0\",\"id\":\"p\",\"method\":\"tasks/cancel\",\"params\":[\"x\"]}");
        for (String request : bodies) {
            JSONRPCHandler.JSONRPCHandlerResponse response = handler.handle(request);
            JsonNode body = Utils.OBJECT_MAPPER.readTree(response.getBody());
            assertEquals(AgentMeshErrorCodes.INVALID_PARAMS_ERROR_CODE, body.at("/error/code").asInt(), request);
            assertEquals(400, response.getStatusCode(), request);
        }
    }

    @Test
    public void testSendToUnknownAgent() throws Exception {
        JsonNode body = Utils.OBJECT_MAPPER.readTree(handler.handle("""
                {"jsonrpc": "2.0", "id": "x", "method": "message/send",
                 "params": {"agent": "Agent-B", "message": {"parts": [{"type": "text", "content": "Hi"}]}}}
                """).getBody());

        assertEquals(AgentMeshErrorCodes.AGENT_NOT_FOUND_ERROR_CODE, body.at("/error/code").asInt());
        assertTrue(body.at("/error/message").asText().contains("Agent-B"));
    }

    @Test
    public void testCancelTwice() throws Exception {
        String taskId = runtime.taskManager().createTask(null, null).id();
        String cancel = "{\"jsonrpc\":\"2.0\",\"id\":\"c\",\"method\":\"tasks/cancel\",\"params\":{\"task_id\":\""
                + taskId + "\"}}";

        JsonNode first = Utils.OBJECT_MAPPER.readTree(handler.handle(cancel).getBody());
        JsonNode second = Utils.OBJECT_MAPPER.readTree(handler.handle(cancel).getBody());

        assertEquals("cancelled", first.at("/result/status").asText());
        assertEquals("cancelled", second.at("/result/status").asText());
        assertEquals(first.get("result"), second.get("result"));
    }

    @Test
    public void testStreamMessage() throws Exception {
        JSONRPCHandler.JSONRPCHandlerResponse response = handler.handle("""
                {"jsonrpc": "2.0", "id": "s1", "method": "message/stream",
                 "params": {"message": {"parts": [{"type": "text", "content": "Hello"}]}}}
                """);

        JSONRPCHandler.JSONRPCHandlerStreamingResponse streaming =
                assertInstanceOf(JSONRPCHandler.JSONRPCHandlerStreamingResponse.class, response);
        assertEquals(200, streaming.getStatusCode());
        assertEquals(JSONRPCHandler.TEXT_EVENT_STREAM, streaming.getContentType());
        List<String> frames = collect(streaming.getPublisher());

        assertEquals(3, frames.size());
        assertTrue(frames.get(0).startsWith("id: 1\nevent: status\ndata: "), frames.get(0));
        assertTrue(frames.get(0).contains("\"status\":\"pending\""), frames.get(0));
        assertTrue(frames.get(1).contains("\"status\":\"running\""), frames.get(1));
        assertTrue(frames.get(2).startsWith("id: 3\nevent: complete\n"), frames.get(2));
        assertTrue(frames.get(2).contains("Echo: Hello"));
        for (String frame : frames) {
            assertTrue(frame.contains("\"id\":\"s1\""), frame);
            assertTrue(frame.endsWith("\n\n"));
        }
    }

    @Test
    public void testResubscribeReplaysAfterLastSequence() throws Exception {
        JsonNode sent = Utils.OBJECT_MAPPER.readTree(handler.handle("""
                {"jsonrpc": "2.0", "id": "1", "method": "message/send",
                 "params": {"message": {"parts": [{"type": "text", "content": "Hello"}]}}}
                """).getBody());
        String taskId = sent.at("/result/task/id").asText();

        JSONRPCHandler.JSONRPCHandlerResponse response = handler.handle(
                "{\"jsonrpc\":\"2.0\",\"id\":\"r\",\"method\":\"tasks/resubscribe\",\"params\":{\"task_id\":\""
                        + taskId + "\",\"last_sequence\":1}}");

        List<String> frames = collect(
                assertInstanceOf(JSONRPCHandler.JSONRPCHandlerStreamingResponse.class, response).getPublisher());
        assertEquals(1, frames.size());
        assertTrue(frames.get(0).startsWith("id: 2\nevent: complete\n"), frames.get(0));
    }

    @Test
    public void testStreamingErrorsAreItems() throws Exception {
        JSONRPCHandler.JSONRPCHandlerResponse response = handler.handle(
                "{\"jsonrpc\":\"2.0\",\"id\":\"r\",\"method\":\"tasks/resubscribe\",\"params\":{\"task_id\":\"nope\"}}");

        List<String> frames = collect(
                assertInstanceOf(JSONRPCHandler.JSONRPCHandlerStreamingResponse.class, response).getPublisher());
        assertEquals(1, frames.size());
        assertTrue(frames.get(0).startsWith("event: error\n"), frames.get(0));
        assertTrue(frames.get(0).contains("\"code\":" + AgentMeshErrorCodes.TASK_NOT_FOUND_ERROR_CODE));
    }

    @Test
    public void testUnexpectedFailureBecomesInternalError() throws Exception {
        RequestHandler failing = mock(RequestHandler.class);
        when(failing.onMessageSend(any())).thenThrow(new IllegalStateException("boom"));
        when(failing.onGetTask(any())).thenThrow(new TaskNotFoundError("Task not found: t-1"));
        when(failing.onMessageSendStream(any())).thenThrow(new IllegalStateException("stream boom"));
        JSONRPCHandler broken = new JSONRPCHandler(runtime.agentCard(), failing, runtime.executor());

        SendMessageResponse send = broken.onMessageSend(
                new SendMessageRequest("1", new MessageSendParams(Message.text("Hello"))));
        assertNull(send.getResult());
        assertNotNull(send.getError());
        assertEquals(AgentMeshErrorCodes.INTERNAL_ERROR_CODE, send.getError().getCode());
        assertEquals("boom", send.getError().getMessage());

        GetTaskResponse get = broken.onGetTask(new GetTaskRequest("2", new TaskQueryParams("t-1")));
        assertEquals(AgentMeshErrorCodes.TASK_NOT_FOUND_ERROR_CODE, get.getError().getCode());

        List<SendStreamingMessageResponse> items = collect(broken.onMessageSendStream(
                new SendStreamingMessageRequest("3", new MessageSendParams(Message.text("Hello")))));
        assertEquals(1, items.size());
        assertEquals(AgentMeshErrorCodes.INTERNAL_ERROR_CODE, items.get(0).getError().getCode());

        JSONRPCHandler.JSONRPCHandlerResponse raw = broken.handle("""
                {"jsonrpc": "2.0", "id": "4", "method": "message/send",
                 "params": {"message": {"parts": [{"type": "text", "content": "Hello"}]}}}
                """);
        assertEquals(500, raw.getStatusCode());
        assertFalse(raw.getBody().contains("IllegalStateException"));
    }

    private static <T> List<T> collect(Flow.Publisher<T> publisher) throws InterruptedException {
        List<T> items = new CopyOnWriteArrayList<>();
        CountDownLatch done = new CountDownLatch(1);
        publisher.subscribe(new Flow.Subscriber<T>() {
            @Override
            public void onSubscribe(Flow.Subscription subscription) {
                subscription.request(Long.MAX_VALUE);
            }

            @Override
            public void onNext(T item) {
                items.add(item);
            }

            @Override
            public void onError(Throwable throwable) {
                done.countDown();
            }

            @Override
            public void onComplete() {
                done.countDown();
            }
        });
        assertTrue(done.await(5, TimeUnit.SECONDS), "stream did not complete");
        return items;
    }
}

package io.agentmesh.server.requesthandlers;

import static io.agentmesh.util.Assert.checkNotNullParam;

import java.util.Map;
import java.util.concurrent.Executor;
import java.util.concurrent.Flow;
import java.util.concurrent.RejectedExecutionException;

import io.agentmesh.server.agents.AgentIdentity;
import io.agentmesh.server.agents.AgentRegistry;
import io.agentmesh.server.agents.MessageRouter;
import io.agentmesh.server.events.StreamPayloads;
import io.agentmesh.server.events.TaskEventStream;
import io.agentmesh.server.events.TaskEventStreams;
import io.agentmesh.server.tasks.TaskManager;
import io.agentmesh.server.workers.WorkerCoordinator;
import io.agentmesh.spec.InvalidParamsError;
import io.agentmesh.spec.JSONRPCError;
import io.agentmesh.spec.Message;
import io.agentmesh.spec.MessageSendParams;
import io.agentmesh.spec.SendMessageResult;
import io.agentmesh.spec.ServiceUnavailableError;
import io.agentmesh.spec.StreamEvent;
import io.agentmesh.spec.StreamEventType;
import io.agentmesh.spec.Task;
import io.agentmesh.spec.TaskErrorDetail;
import io.agentmesh.spec.TaskIdParams;
import io.agentmesh.spec.TaskQueryParams;
import io.agentmesh.spec.TaskState;
import io.agentmesh.spec.TaskStateConflictError;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs messages against locally registered agents, or hands them to workers when they are scoped
 * to a codebase.
 * <p>
 * {@code message/send} executes on the calling thread and returns once the task is terminal.
 * {@code message/stream} executes on the supplied executor. Every task gets an event stream so
 * that it can be observed with {@code tasks/resubscribe}.
 */
public class DefaultRequestHandler implements RequestHandler {

    private static final Logger LOGGER = LoggerFactory.getLogger(DefaultRequestHandler.class);

    public static final String ERROR_KIND = "error_kind";

    private final TaskManager taskManager;
    private final MessageRouter router;
    private final AgentRegistry registry;
    private final TaskEventStreams streams;
    private final @Nullable WorkerCoordinator workerCoordinator;
    private final Executor executor;

    public DefaultRequestHandler(TaskManager taskManager, MessageRouter router, TaskEventStreams streams,
                                 @Nullable WorkerCoordinator workerCoordinator, Executor executor) {
        this.taskManager = checkNotNullParam("taskManager", taskManager);
        this.router = checkNotNullParam("router", router);
        this.registry = router.registry();
        this.streams = checkNotNullParam("streams", streams);
        this.workerCoordinator = workerCoordinator;
        this.executor = checkNotNullParam("executor", executor);
    }

    public static DefaultRequestHandler create(TaskManager taskManager, MessageRouter router,
                                               TaskEventStreams streams,
                                               @Nullable WorkerCoordinator workerCoordinator,
                                               Executor executor) {
        return new DefaultRequestHandler(taskManager, router, streams, workerCoordinator, executor);
    }

    @Override
    public Task onGetTask(TaskQueryParams params) throws JSONRPCError {
        LOGGER.debug("onGetTask {}", params.taskId());
        return taskManager.getTask(params.taskId());
    }

    @Override
    public Task onCancelTask(TaskIdParams params) throws JSONRPCError {
        String taskId = params.taskId();
        Task task = taskManager.cancel(taskId);
        if (workerCoordinator != null) {
            workerCoordinator.release(taskId);
        }
        TaskEventStream stream = streams.get(taskId);
        if (stream != null && !stream.isClosed()) {
            try {
                stream.append(StreamEventType.STATUS, StreamPayloads.status(task));
            } catch (TaskStateConflictError e) {
                LOGGER.debug("Stream of task {} closed before the cancellation was announced", taskId);
            }
            stream.close();
        }
        LOGGER.info("Cancelled task {}", taskId);
        return task;
    }

    @Override
    public SendMessageResult onMessageSend(MessageSendParams params) throws JSONRPCError {
        Message message = validate(params);
        if (params.codebaseId() != null) {
            throw new InvalidParamsError("codebase_id is only supported by message/stream");
        }
        AgentIdentity agent = router.route(message, params.agent());
        Task task = resolveTask(message, agent, params.metadata());
        streams.open(task.id());
        Task done = execute(start(task, agent), agent, message);
        return new SendMessageResult(replyOf(done), done);
    }

    @Override
    public Flow.Publisher<StreamEvent> onMessageSendStream(MessageSendParams params) throws JSONRPCError {
        Message message = validate(params);
        if (params.codebaseId() != null) {
            WorkerCoordinator coordinator = requireCoordinator();
            Task task = coordinator.createTask(params.codebaseId(), message, params.agent(), params.metadata());
            Flow.Publisher<StreamEvent> publisher = streams.publisher(task.id(), null);
            coordinator.enqueue(task);
            return publisher;
        }

        AgentIdentity agent = router.route(message, params.agent());
        Task task = resolveTask(message, agent, params.metadata());
        streams.open(task.id());
        Flow.Publisher<StreamEvent> publisher = streams.publisher(task.id(), null);
        streams.append(task.id(), StreamEventType.STATUS, StreamPayloads.status(task));
        Task running = start(task, agent);
        try {
            executor.execute(() -> execute(running, agent, message));
        } catch (RejectedExecutionException e) {
            LOGGER.error("Could not schedule task {}", task.id(), e);
            Task failed = taskManager.fail(task.id(),
                    new TaskErrorDetail(TaskErrorDetail.HANDLER_ERROR, "Server is shutting down"));
            appendQuietly(failed.id(), StreamEventType.ERROR, StreamPayloads.error(failed));
        }
        return publisher;
    }

    @Override
    public Flow.Publisher<StreamEvent> onResubscribeToTask(TaskIdParams params) throws JSONRPCError {
        taskManager.getTask(params.taskId());
        LOGGER.debug("Resubscribing to task {} after sequence {}", params.taskId(), params.lastSequence());
        return streams.publisher(params.taskId(), params.lastSequence());
    }

    private static Message validate(MessageSendParams params) {
        Message message = params.message();
        if (message.parts().isEmpty()) {
            throw new InvalidParamsError("message.parts must not be empty");
        }
        return message;
    }

    /**
     * A message bound to an existing task runs that task, which must still be pending.
     */
    private Task resolveTask(Message message, AgentIdentity agent, @Nullable Map<String, Object> metadata) {
        if (message.taskId() != null) {
            Task existing = taskManager.getTask(message.taskId());
            if (existing.status() != TaskState.PENDING) {
                throw new TaskStateConflictError("Task " + existing.id() + " is "
                        + existing.status().asString() + ", expected pending");
            }
            return existing;
        }
        return taskManager.createTask(agent.name(), metadata);
    }

    private Task start(Task task, AgentIdentity agent) {
        Task running = taskManager.markRunning(task.id(), agent.name());
        appendQuietly(task.id(), StreamEventType.STATUS, StreamPayloads.status(running));
        return running;
    }

    private Task execute(Task running, AgentIdentity agent, Message message) {
        String taskId = running.id();
        Task done;
        try {
            Message reply = agent.handler().handle(message.withTaskId(taskId),
                    registry.contextFor(agent.name(), taskId, null, () -> isCancelled(taskId)));
            if (reply == null) {
                throw new IllegalStateException("Agent " + agent.name() + " returned no reply");
            }
            done = taskManager.complete(taskId, reply);
        } catch (Exception e) {
            LOGGER.error("Agent {} failed on task {}", agent.name(), taskId, e);
            done = taskManager.fail(taskId, new TaskErrorDetail(TaskErrorDetail.HANDLER_ERROR, describe(e)));
        }

        if (done.status() == TaskState.COMPLETED) {
            appendQuietly(taskId, StreamEventType.COMPLETE, StreamPayloads.complete(done));
        } else if (done.status() == TaskState.FAILED) {
            appendQuietly(taskId, StreamEventType.ERROR, StreamPayloads.error(done));
        }
        return done;
    }

    private boolean isCancelled(String taskId) {
        Task task = taskManager.findTask(taskId);
        return task != null && task.cancelRequested();
    }

    private static Message replyOf(Task task) {
        if (task.result() != null) {
            return task.result();
        }
        if (task.error() != null) {
            return Message.builder()
                    .text(task.error().message())
                    .taskId(task.id())
                    .metadata(Map.of(ERROR_KIND, task.error().kind()))
                    .build();
        }
        return Message.builder()
                .text("Task " + task.id() + " is " + task.status().asString())
                .taskId(task.id())
                .build();
    }

    private static String describe(Exception e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }

    private WorkerCoordinator requireCoordinator() {
        if (workerCoordinator == null) {
            throw new ServiceUnavailableError("Worker bridge is not available");
        }
        return workerCoordinator;
    }

    private void appendQuietly(String taskId, StreamEventType type, Object data) {
        TaskEventStream stream = streams.get(taskId);
        if (stream == null) {
            return;
        }
        try {
            stream.append(type, data);
        } catch (TaskStateConflictError e) {
            LOGGER.debug("Dropped {} event for task {}: {}", type.asString(), taskId, e.getMessage());
        }
    }
}

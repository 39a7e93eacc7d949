package io.agentmesh.server;

import static io.agentmesh.util.Assert.checkNotNullParam;

import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;

import io.agentmesh.client.mcp.JsonRpcToolBridge;
import io.agentmesh.client.mcp.ToolBridge;
import io.agentmesh.server.agents.AgentRegistry;
import io.agentmesh.server.agents.BuiltInAgents;
import io.agentmesh.server.agents.MessageRouter;
import io.agentmesh.server.config.ServerConfig;
import io.agentmesh.server.events.DurableEventStore;
import io.agentmesh.server.events.InMemoryMessageBroker;
import io.agentmesh.server.events.MessageBroker;
import io.agentmesh.server.events.TaskEventStreams;
import io.agentmesh.server.events.TaskLifecycleEvents;
import io.agentmesh.server.monitor.MessageMonitor;
import io.agentmesh.server.requesthandlers.DefaultRequestHandler;
import io.agentmesh.server.requesthandlers.RequestHandler;
import io.agentmesh.server.tasks.InMemoryTaskStore;
import io.agentmesh.server.tasks.TaskManager;
import io.agentmesh.server.tasks.TaskReaper;
import io.agentmesh.server.tasks.TaskStore;
import io.agentmesh.server.util.AsyncUtils;
import io.agentmesh.server.workers.WorkerCoordinator;
import io.agentmesh.server.workers.WorkerRegistry;
import io.agentmesh.spec.AgentCard;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One isolated server instance: the task manager, broker, agent registry, worker coordinator
 * and request handler wired together from a {@link ServerConfig}. Instances share nothing, so
 * several can run side by side in one JVM.
 */
public class AgentMeshRuntime implements AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(AgentMeshRuntime.class);

    private final ServerConfig config;
    private final TaskManager taskManager;
    private final MessageBroker broker;
    private final TaskEventStreams streams;
    private final AgentRegistry agentRegistry;
    private final MessageRouter router;
    private final MessageMonitor monitor;
    private final @Nullable WorkerCoordinator workerCoordinator;
    private final TaskReaper reaper;
    private final RequestHandler requestHandler;
    private final ExecutorService executor;

    private AgentMeshRuntime(Builder builder) {
        this.config = builder.config;
        this.executor = AsyncUtils.newDaemonExecutor("agentmesh-task");
        this.taskManager = new TaskManager(builder.taskStore != null ? builder.taskStore : new InMemoryTaskStore());
        this.broker = new InMemoryMessageBroker(config,
                builder.eventStore != null ? builder.eventStore : DurableEventStore.NOOP);
        taskManager.addListener(new TaskLifecycleEvents(broker));
        this.streams = new TaskEventStreams(config, executor);

        ToolBridge toolBridge = builder.toolBridge != null
                ? builder.toolBridge
                : new JsonRpcToolBridge(config.mcpUrl(), config.mcpTimeout());
        this.agentRegistry = new AgentRegistry(broker, toolBridge);
        this.monitor = new MessageMonitor(broker, agentRegistry, config.monitorCapacity());
        monitor.start();
        this.router = BuiltInAgents.install(agentRegistry);

        this.workerCoordinator = builder.workersEnabled
                ? new WorkerCoordinator(taskManager, streams, new WorkerRegistry(), config)
                : null;
        this.reaper = new TaskReaper(taskManager, config.taskRetention(), config.reaperInterval(), streams::remove);
        this.requestHandler = DefaultRequestHandler.create(taskManager, router, streams, workerCoordinator, executor);
    }

    public static Builder builder(ServerConfig config) {
        return new Builder(config);
    }

    public static AgentMeshRuntime create(ServerConfig config) {
        return builder(config).build();
    }

    /**
     * Starts the background sweeps: task retention and worker lease expiry.
     */
    public void start() {
        reaper.start();
        if (workerCoordinator != null) {
            workerCoordinator.start();
        }
        LOGGER.info("AgentMesh runtime '{}' started with agents {}", config.agentName(),
                agentRegistry.list().stream().map(agent -> agent.name()).toList());
    }

    @Override
    public void close() {
        if (workerCoordinator != null) {
            workerCoordinator.close();
        }
        reaper.close();
        monitor.close();
        broker.close();
        executor.shutdownNow();
        LOGGER.info("AgentMesh runtime '{}' stopped", config.agentName());
    }

    public ServerConfig config() {
        return config;
    }

    public TaskManager taskManager() {
        return taskManager;
    }

    public MessageBroker broker() {
        return broker;
    }

    public TaskEventStreams streams() {
        return streams;
    }

    public AgentRegistry agentRegistry() {
        return agentRegistry;
    }

    public MessageRouter router() {
        return router;
    }

    /**
     * Operator log of broker traffic, recording since the runtime was built.
     */
    public MessageMonitor monitor() {
        return monitor;
    }

    public @Nullable WorkerCoordinator workerCoordinator() {
        return workerCoordinator;
    }

    public RequestHandler requestHandler() {
        return requestHandler;
    }

    /**
     * Runs streamed tasks and stream delivery.
     */
    public Executor executor() {
        return executor;
    }

    /**
     * The discovery document, reflecting the agents registered right now.
     */
    public AgentCard agentCard() {
        return AgentCards.create(config, agentRegistry, workerCoordinator != null);
    }

    public static class Builder {
        private final ServerConfig config;
        private @Nullable ToolBridge toolBridge;
        private @Nullable DurableEventStore eventStore;
        private @Nullable TaskStore taskStore;
        private boolean workersEnabled = true;

        private Builder(ServerConfig config) {
            this.config = checkNotNullParam("config", config);
        }

        public Builder toolBridge(ToolBridge toolBridge) {
            this.toolBridge = toolBridge;
            return this;
        }

        public Builder eventStore(DurableEventStore eventStore) {
            this.eventStore = eventStore;
            return this;
        }

        public Builder taskStore(TaskStore taskStore) {
            this.taskStore = taskStore;
            return this;
        }

        /**
         * Without workers, codebase-scoped tasks are rejected as unavailable.
         */
        public Builder workersEnabled(boolean workersEnabled) {
            this.workersEnabled = workersEnabled;
            return this;
        }

        public AgentMeshRuntime build() {
            return new AgentMeshRuntime(this);
        }
    }
}

package io.agentmesh.server.config;

import java.time.Duration;
import java.util.Locale;

import io.agentmesh.server.events.OverflowPolicy;
import io.agentmesh.util.Assert;

/**
 * Typed, immutable view of the server configuration.
 */
public record ServerConfig(
        String host,
        int port,
        String publicUrl,
        String agentName,
        String agentDescription,
        String agentVersion,
        int brokerQueueCapacity,
        OverflowPolicy brokerOverflowPolicy,
        Duration brokerBlockTimeout,
        Duration taskRetention,
        Duration reaperInterval,
        int replayBufferSize,
        int subscriberCapacity,
        Duration pollTimeout,
        Duration leaseTimeout,
        int maxLeaseReclaims,
        String mcpUrl,
        Duration mcpTimeout,
        int monitorCapacity) {

    public static final String PREFIX = "agentmesh.";
    public static final String HOST = PREFIX + "host";
    public static final String PORT = PREFIX + "port";
    public static final String PUBLIC_URL = PREFIX + "public-url";
    public static final String LOG_LEVEL = PREFIX + "log-level";
    public static final String AGENT_NAME = PREFIX + "agent.name";
    public static final String AGENT_DESCRIPTION = PREFIX + "agent.description";
    public static final String AGENT_VERSION = PREFIX + "agent.version";
    public static final String BROKER_QUEUE_CAPACITY = PREFIX + "broker.queue-capacity";
    public static final String BROKER_OVERFLOW_POLICY = PREFIX + "broker.overflow-policy";
    public static final String BROKER_BLOCK_TIMEOUT_MS = PREFIX + "broker.block-timeout-ms";
    public static final String TASKS_RETENTION_MS = PREFIX + "tasks.retention-ms";
    public static final String TASKS_REAPER_INTERVAL_MS = PREFIX + "tasks.reaper-interval-ms";
    public static final String STREAM_REPLAY_BUFFER_SIZE = PREFIX + "stream.replay-buffer-size";
    public static final String STREAM_SUBSCRIBER_CAPACITY = PREFIX + "stream.subscriber-capacity";
    public static final String WORKER_POLL_TIMEOUT_MS = PREFIX + "worker.poll-timeout-ms";
    public static final String WORKER_LEASE_TIMEOUT_MS = PREFIX + "worker.lease-timeout-ms";
    public static final String WORKER_MAX_LEASE_RECLAIMS = PREFIX + "worker.max-lease-reclaims";
    public static final String MCP_URL = PREFIX + "mcp.url";
    public static final String MCP_TIMEOUT_MS = PREFIX + "mcp.timeout-ms";
    public static final String MONITOR_CAPACITY = PREFIX + "monitor.capacity";

    public ServerConfig {
        Assert.checkNotBlankParam("host", host);
        Assert.checkNotBlankParam("publicUrl", publicUrl);
        Assert.checkNotBlankParam("agentName", agentName);
        Assert.checkNotNullParam("agentDescription", agentDescription);
        Assert.checkNotNullParam("agentVersion", agentVersion);
        Assert.checkNotNullParam("brokerOverflowPolicy", brokerOverflowPolicy);
        Assert.checkNotBlankParam("mcpUrl", mcpUrl);
        Assert.checkPositiveParam("brokerQueueCapacity", brokerQueueCapacity);
        Assert.checkPositiveParam("subscriberCapacity", subscriberCapacity);
        Assert.checkPositiveParam("monitorCapacity", monitorCapacity);
        if (replayBufferSize < 0) {
            throw new IllegalArgumentException("replayBufferSize may not be negative");
        }
        if (maxLeaseReclaims < 0) {
            throw new IllegalArgumentException("maxLeaseReclaims may not be negative");
        }
        checkPositive("brokerBlockTimeout", brokerBlockTimeout);
        checkPositive("taskRetention", taskRetention);
        checkPositive("reaperInterval", reaperInterval);
        checkPositive("pollTimeout", pollTimeout);
        checkPositive("leaseTimeout", leaseTimeout);
        checkPositive("mcpTimeout", mcpTimeout);
    }

    private static void checkPositive(String name, Duration value) {
        Assert.checkNotNullParam(name, value);
        if (value.isZero() || value.isNegative()) {
            throw new IllegalArgumentException("Parameter '" + name + "' must be positive but was " + value);
        }
    }

    /**
     * Configuration from the bundled defaults overlaid with environment variables.
     */
    public static ServerConfig load() {
        return from(new EnvironmentConfigProvider(new DefaultValuesConfigProvider()));
    }

    public static ServerConfig defaults() {
        return from(new DefaultValuesConfigProvider());
    }

    public static ServerConfig from(ConfigProvider provider) {
        return new ServerConfig(
                provider.getValue(HOST),
                intValue(provider, PORT),
                provider.getValue(PUBLIC_URL),
                provider.getValue(AGENT_NAME),
                provider.getValue(AGENT_DESCRIPTION),
                provider.getValue(AGENT_VERSION),
                intValue(provider, BROKER_QUEUE_CAPACITY),
                OverflowPolicy.valueOf(provider.getValue(BROKER_OVERFLOW_POLICY).trim().toUpperCase(Locale.ROOT)),
                millis(provider, BROKER_BLOCK_TIMEOUT_MS),
                millis(provider, TASKS_RETENTION_MS),
                millis(provider, TASKS_REAPER_INTERVAL_MS),
                intValue(provider, STREAM_REPLAY_BUFFER_SIZE),
                intValue(provider, STREAM_SUBSCRIBER_CAPACITY),
                millis(provider, WORKER_POLL_TIMEOUT_MS),
                millis(provider, WORKER_LEASE_TIMEOUT_MS),
                intValue(provider, WORKER_MAX_LEASE_RECLAIMS),
                provider.getValue(MCP_URL),
                millis(provider, MCP_TIMEOUT_MS),
                intValue(provider, MONITOR_CAPACITY));
    }

    private static int intValue(ConfigProvider provider, String name) {
        String value = provider.getValue(name);
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Configuration value '" + name + "' is not an integer: " + value, e);
        }
    }

    private static Duration millis(ConfigProvider provider, String name) {
        String value = provider.getValue(name);
        try {
            return Duration.ofMillis(Long.parseLong(value.trim()));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Configuration value '" + name + "' is not a number: " + value, e);
        }
    }

    public static Builder builder() {
        return new Builder(defaults());
    }

    public static Builder builder(ServerConfig config) {
        return new Builder(config);
    }

    public static class Builder {
        private String host;
        private int port;
        private String publicUrl;
        private String agentName;
        private String agentDescription;
        private String agentVersion;
        private int brokerQueueCapacity;
        private OverflowPolicy brokerOverflowPolicy;
        private Duration brokerBlockTimeout;
        private Duration taskRetention;
        private Duration reaperInterval;
        private int replayBufferSize;
        private int subscriberCapacity;
        private Duration pollTimeout;
        private Duration leaseTimeout;
        private int maxLeaseReclaims;
        private String mcpUrl;
        private Duration mcpTimeout;
        private int monitorCapacity;

        private Builder(ServerConfig config) {
            this.host = config.host;
            this.port = config.port;
            this.publicUrl = config.publicUrl;
            this.agentName = config.agentName;
            this.agentDescription = config.agentDescription;
            this.agentVersion = config.agentVersion;
            this.brokerQueueCapacity = config.brokerQueueCapacity;
            this.brokerOverflowPolicy = config.brokerOverflowPolicy;
            this.brokerBlockTimeout = config.brokerBlockTimeout;
            this.taskRetention = config.taskRetention;
            this.reaperInterval = config.reaperInterval;
            this.replayBufferSize = config.replayBufferSize;
            this.subscriberCapacity = config.subscriberCapacity;
            this.pollTimeout = config.pollTimeout;
            this.leaseTimeout = config.leaseTimeout;
            this.maxLeaseReclaims = config.maxLeaseReclaims;
            this.mcpUrl = config.mcpUrl;
            this.mcpTimeout = config.mcpTimeout;
            this.monitorCapacity = config.monitorCapacity;
        }

        public Builder host(String host) {
            this.host = host;
            return this;
        }

        public Builder port(int port) {
            this.port = port;
            return this;
        }

        public Builder publicUrl(String publicUrl) {
            this.publicUrl = publicUrl;
            return this;
        }

        public Builder agentName(String agentName) {
            this.agentName = agentName;
            return this;
        }

        public Builder agentDescription(String agentDescription) {
            this.agentDescription = agentDescription;
            return this;
        }

        public Builder agentVersion(String agentVersion) {
            this.agentVersion = agentVersion;
            return this;
        }

        public Builder brokerQueueCapacity(int brokerQueueCapacity) {
            this.brokerQueueCapacity = brokerQueueCapacity;
            return this;
        }

        public Builder brokerOverflowPolicy(OverflowPolicy brokerOverflowPolicy) {
            this.brokerOverflowPolicy = brokerOverflowPolicy;
            return this;
        }

        public Builder brokerBlockTimeout(Duration brokerBlockTimeout) {
            this.brokerBlockTimeout = brokerBlockTimeout;
            return this;
        }

        public Builder taskRetention(Duration taskRetention) {
            this.taskRetention = taskRetention;
            return this;
        }

        public Builder reaperInterval(Duration reaperInterval) {
            this.reaperInterval = reaperInterval;
            return this;
        }

        public Builder replayBufferSize(int replayBufferSize) {
            this.replayBufferSize = replayBufferSize;
            return this;
        }

        public Builder subscriberCapacity(int subscriberCapacity) {
            this.subscriberCapacity = subscriberCapacity;
            return this;
        }

        public Builder pollTimeout(Duration pollTimeout) {
            this.pollTimeout = pollTimeout;
            return this;
        }

        public Builder leaseTimeout(Duration leaseTimeout) {
            this.leaseTimeout = leaseTimeout;
            return this;
        }

        public Builder maxLeaseReclaims(int maxLeaseReclaims) {
            this.maxLeaseReclaims = maxLeaseReclaims;
            return this;
        }

        public Builder mcpUrl(String mcpUrl) {
            this.mcpUrl = mcpUrl;
            return this;
        }

        public Builder mcpTimeout(Duration mcpTimeout) {
            this.mcpTimeout = mcpTimeout;
            return this;
        }

        public Builder monitorCapacity(int monitorCapacity) {
            this.monitorCapacity = monitorCapacity;
            return this;
        }

        public ServerConfig build() {
            return new ServerConfig(host, port, publicUrl, agentName, agentDescription, agentVersion,
                    brokerQueueCapacity, brokerOverflowPolicy, brokerBlockTimeout, taskRetention, reaperInterval,
                    replayBufferSize, subscriberCapacity, pollTimeout, leaseTimeout, maxLeaseReclaims,
                    mcpUrl, mcpTimeout, monitorCapacity);
        }
    }
}

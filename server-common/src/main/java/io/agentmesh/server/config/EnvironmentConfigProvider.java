package io.agentmesh.server.config;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;

import io.agentmesh.util.Assert;

/**
 * Overlays environment variables on top of a delegate provider.
 * <p>
 * {@code agentmesh.worker.lease-timeout-ms} is looked up as {@code AGENTMESH_WORKER_LEASE_TIMEOUT_MS}.
 * A few legacy {@code A2A_*} variable names are honored as aliases.
 */
public class EnvironmentConfigProvider implements ConfigProvider {

    private static final Map<String, String> LEGACY_ALIASES = Map.of(
            ServerConfig.HOST, "A2A_HOST",
            ServerConfig.PORT, "A2A_PORT",
            ServerConfig.LOG_LEVEL, "A2A_LOG_LEVEL",
            ServerConfig.MCP_URL, "A2A_MCP_URL");

    private final ConfigProvider delegate;
    private final Map<String, String> environment;

    public EnvironmentConfigProvider(ConfigProvider delegate) {
        this(delegate, System.getenv());
    }

    public EnvironmentConfigProvider(ConfigProvider delegate, Map<String, String> environment) {
        this.delegate = Assert.checkNotNullParam("delegate", delegate);
        this.environment = Map.copyOf(Assert.checkNotNullParam("environment", environment));
    }

    static String toEnvironmentName(String name) {
        StringBuilder sb = new StringBuilder(name.length());
        for (char c : name.toCharArray()) {
            sb.append(Character.isLetterOrDigit(c) ? c : '_');
        }
        return sb.toString().toUpperCase(Locale.ROOT);
    }

    @Override
    public String getValue(String name) {
        return getOptionalValue(name)
                .orElseThrow(() -> new IllegalArgumentException("No configuration value found for: " + name));
    }

    @Override
    public Optional<String> getOptionalValue(String name) {
        String value = environment.get(toEnvironmentName(name));
        if (value == null && LEGACY_ALIASES.containsKey(name)) {
            value = environment.get(LEGACY_ALIASES.get(name));
        }
        if (value != null && !value.isBlank()) {
            return Optional.of(value.trim());
        }
        return delegate.getOptionalValue(name);
    }
}

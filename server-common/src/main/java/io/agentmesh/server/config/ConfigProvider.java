package io.agentmesh.server.config;

import java.util.Optional;

/**
 * Source of configuration values keyed by dotted names such as {@code agentmesh.worker.poll-timeout-ms}.
 */
public interface ConfigProvider {

    /**
     * Returns the value for {@code name}.
     *
     * @throws IllegalArgumentException if no value is defined
     */
    String getValue(String name);

    Optional<String> getOptionalValue(String name);
}

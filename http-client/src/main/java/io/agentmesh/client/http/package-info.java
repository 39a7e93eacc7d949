/**
 * HTTP client abstraction used for outbound calls, such as the MCP tool bridge.
 *
 * <p>The default implementation wraps {@code java.net.http.HttpClient}; alternatives can be
 * supplied through {@link io.agentmesh.client.http.HttpClientBuilder}.
 */
@NullMarked
package io.agentmesh.client.http;

import org.jspecify.annotations.NullMarked;

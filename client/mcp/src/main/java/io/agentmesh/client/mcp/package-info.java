/**
 * Outbound bridge to an external MCP tool server.
 */
@NullMarked
package io.agentmesh.client.mcp;

import org.jspecify.annotations.NullMarked;

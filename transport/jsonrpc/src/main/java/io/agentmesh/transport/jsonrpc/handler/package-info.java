@NullMarked
package io.agentmesh.transport.jsonrpc.handler;

import org.jspecify.annotations.NullMarked;

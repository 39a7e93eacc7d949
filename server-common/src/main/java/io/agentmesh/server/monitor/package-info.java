@NullMarked
package io.agentmesh.server.monitor;

import org.jspecify.annotations.NullMarked;

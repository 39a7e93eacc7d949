@NullMarked
package io.agentmesh.server.workers;

import org.jspecify.annotations.NullMarked;

@NullMarked
package io.agentmesh.server.agents;

import org.jspecify.annotations.NullMarked;

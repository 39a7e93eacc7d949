@NullMarked
package io.agentmesh.server.events;

import org.jspecify.annotations.NullMarked;

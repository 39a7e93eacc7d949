@NullMarked
package io.agentmesh.server.tasks;

import org.jspecify.annotations.NullMarked;

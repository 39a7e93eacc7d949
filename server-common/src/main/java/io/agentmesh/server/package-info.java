@NullMarked
package io.agentmesh.server;

import org.jspecify.annotations.NullMarked;

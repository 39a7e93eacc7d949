@NullMarked
package io.agentmesh.server.requesthandlers;

import org.jspecify.annotations.NullMarked;

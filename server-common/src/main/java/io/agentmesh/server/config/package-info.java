@NullMarked
package io.agentmesh.server.config;

import org.jspecify.annotations.NullMarked;

@NullMarked
package io.agentmesh.server.util;

import org.jspecify.annotations.NullMarked;

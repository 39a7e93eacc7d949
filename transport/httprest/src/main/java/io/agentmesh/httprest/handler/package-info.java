@NullMarked
package io.agentmesh.httprest.handler;

import org.jspecify.annotations.NullMarked;

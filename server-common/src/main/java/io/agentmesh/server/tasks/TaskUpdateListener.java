package io.agentmesh.server.tasks;

import io.agentmesh.spec.Task;
import io.agentmesh.spec.TaskState;
import org.jspecify.annotations.Nullable;

/**
 * Notified after {@link TaskManager} applied a change. Invoked outside the task lock, on the
 * thread that made the change.
 */
@FunctionalInterface
public interface TaskUpdateListener {

    /**
     * @param previousStatus the status before the change, {@code null} when the task was just created
     * @param task the new snapshot
     */
    void onTaskUpdate(@Nullable TaskState previousStatus, Task task);
}

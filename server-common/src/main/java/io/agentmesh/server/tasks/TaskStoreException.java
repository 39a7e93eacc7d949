package io.agentmesh.server.tasks;

import org.jspecify.annotations.Nullable;

/**
 * Base failure of a {@link TaskStore} operation.
 */
public class TaskStoreException extends RuntimeException {

    @Nullable
    private final String taskId;

    public TaskStoreException(final String msg) {
        super(msg);
        this.taskId = null;
    }

    public TaskStoreException(final String msg, final Throwable cause) {
        super(msg, cause);
        this.taskId = null;
    }

    public TaskStoreException(@Nullable final String taskId, final String msg) {
        super(msg);
        this.taskId = taskId;
    }

    public TaskStoreException(@Nullable final String taskId, final String msg, final Throwable cause) {
        super(msg, cause);
        this.taskId = taskId;
    }

    @Nullable
    public String getTaskId() {
        return taskId;
    }
}

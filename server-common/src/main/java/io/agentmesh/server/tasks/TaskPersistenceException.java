package io.agentmesh.server.tasks;

import org.jspecify.annotations.Nullable;

/**
 * A storage backend could not persist or read a task. Transient failures (timeouts,
 * lost connections) may succeed when retried by the caller.
 */
public class TaskPersistenceException extends TaskStoreException {

    private final boolean isTransientFailure;

    public TaskPersistenceException(final String msg) {
        this(null, msg, false);
    }

    public TaskPersistenceException(@Nullable final String taskId, final String msg, final boolean isTransient) {
        super(taskId, msg);
        this.isTransientFailure = isTransient;
    }

    public TaskPersistenceException(@Nullable final String taskId, final String msg, final Throwable cause,
                                    final boolean isTransient) {
        super(taskId, msg, cause);
        this.isTransientFailure = isTransient;
    }

    public boolean isTransient() {
        return isTransientFailure;
    }
}

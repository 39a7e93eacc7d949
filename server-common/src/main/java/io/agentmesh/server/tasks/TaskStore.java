package io.agentmesh.server.tasks;

import java.util.List;

import io.agentmesh.spec.Task;
import org.jspecify.annotations.Nullable;

/**
 * Storage for task snapshots.
 * <p>
 * The store is a plain repository: it does not enforce state transitions. All mutations go
 * through {@link TaskManager}, which serializes writers per task id.
 * <p>
 * Implementations backed by external storage signal failures with {@link TaskStoreException}
 * or {@link TaskPersistenceException}; the in-memory store never does.
 */
public interface TaskStore {

    /**
     * Saves or replaces the snapshot with the task's id.
     *
     * @throws TaskStoreException if the snapshot could not be written
     */
    void save(Task task);

    @Nullable Task get(String taskId);

    /**
     * @return {@code true} if a task was removed
     */
    boolean delete(String taskId);

    /**
     * Lists all stored tasks ordered by creation time, oldest first.
     */
    List<Task> list();
}

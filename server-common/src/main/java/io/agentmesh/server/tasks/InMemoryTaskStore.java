package io.agentmesh.server.tasks;

import java.util.Comparator;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import io.agentmesh.spec.Task;
import org.jspecify.annotations.Nullable;

/**
 * {@link TaskStore} keeping snapshots in a {@link ConcurrentHashMap}. Tasks are lost on restart.
 */
public class InMemoryTaskStore implements TaskStore {

    private final ConcurrentMap<String, Task> tasks = new ConcurrentHashMap<>();

    @Override
    public void save(Task task) {
        tasks.put(task.id(), task);
    }

    @Override
    public @Nullable Task get(String taskId) {
        return tasks.get(taskId);
    }

    @Override
    public boolean delete(String taskId) {
        return tasks.remove(taskId) != null;
    }

    @Override
    public List<Task> list() {
        return tasks.values().stream()
                .sorted(Comparator.comparing(Task::createdAt).thenComparing(Task::id))
                .toList();
    }
}

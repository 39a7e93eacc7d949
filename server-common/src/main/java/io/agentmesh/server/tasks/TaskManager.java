package io.agentmesh.server.tasks;

import static io.agentmesh.util.Assert.checkNotNullParam;

import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.UnaryOperator;

import io.agentmesh.spec.Message;
import io.agentmesh.spec.Task;
import io.agentmesh.spec.TaskErrorDetail;
import io.agentmesh.spec.TaskNotCancelableError;
import io.agentmesh.spec.TaskNotFoundError;
import io.agentmesh.spec.TaskState;
import io.agentmesh.spec.TaskStateConflictError;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Single writer for task state.
 * <p>
 * Every mutation of a task runs under that task's own lock, so operations on one task id are
 * linearized while unrelated tasks never contend. Reads go straight to the {@link TaskStore}.
 * <p>
 * Transitions follow {@link TaskState#canTransitionTo(TaskState)}. The first terminal write wins:
 * <ul>
 *   <li>{@link #cancel(String)} on a completed or failed task throws {@link TaskNotCancelableError},
 *   and is idempotent on a cancelled one;</li>
 *   <li>{@link #complete(String, Message)} and {@link #fail(String, TaskErrorDetail)} on a terminal
 *   task are logged no-ops returning the stored snapshot.</li>
 * </ul>
 * {@code updated_at} never goes backwards, even if the clock does.
 */
public class TaskManager {

    private static final Logger LOGGER = LoggerFactory.getLogger(TaskManager.class);

    private final TaskStore taskStore;
    private final Clock clock;
    private final ConcurrentMap<String, Object> taskLocks = new ConcurrentHashMap<>();
    private final List<TaskUpdateListener> listeners = new CopyOnWriteArrayList<>();

    public TaskManager(TaskStore taskStore) {
        this(taskStore, Clock.systemUTC());
    }

    public TaskManager(TaskStore taskStore, Clock clock) {
        this.taskStore = checkNotNullParam("taskStore", taskStore);
        this.clock = checkNotNullParam("clock", clock);
    }

    public void addListener(TaskUpdateListener listener) {
        listeners.add(checkNotNullParam("listener", listener));
    }

    public void removeListener(TaskUpdateListener listener) {
        listeners.remove(listener);
    }

    /**
     * Creates a new {@code pending} task.
     *
     * @param agent the owning agent, if already known
     * @param metadata task metadata, may carry {@link Task#CODEBASE_ID}
     */
    public Task createTask(@Nullable String agent, @Nullable Map<String, Object> metadata) {
        OffsetDateTime now = OffsetDateTime.now(clock);
        Task task = Task.builder()
                .id(UUID.randomUUID().toString())
                .status(TaskState.PENDING)
                .createdAt(now)
                .updatedAt(now)
                .agent(agent)
                .metadata(metadata)
                .build();
        synchronized (lockFor(task.id())) {
            taskStore.save(task);
        }
        LOGGER.debug("Created task {} for agent {}", task.id(), agent);
        notifyListeners(null, task);
        return task;
    }

    /**
     * @throws TaskNotFoundError if no task has this id
     */
    public Task getTask(String taskId) {
        Task task = findTask(taskId);
        if (task == null) {
            throw TaskNotFoundError.forTask(taskId);
        }
        return task;
    }

    public @Nullable Task findTask(String taskId) {
        checkNotNullParam("taskId", taskId);
        return taskStore.get(taskId);
    }

    public List<Task> listTasks(@Nullable TaskState status) {
        List<Task> tasks = taskStore.list();
        if (status == null) {
            return tasks;
        }
        return tasks.stream().filter(t -> t.status() == status).toList();
    }

    /**
     * @return {@code true} if the task existed
     */
    public boolean deleteTask(String taskId) {
        boolean deleted;
        synchronized (lockFor(taskId)) {
            deleted = taskStore.delete(taskId);
        }
        taskLocks.remove(taskId);
        if (deleted) {
            LOGGER.debug("Deleted task {}", taskId);
        }
        return deleted;
    }

    /**
     * Claims a pending task for in-process execution by {@code agent}.
     *
     * @throws TaskStateConflictError if the task is not pending
     */
    public Task markRunning(String taskId, @Nullable String agent) {
        return transition(taskId, current -> {
            requirePending(current);
            Task.Builder builder = Task.builder(current).status(TaskState.RUNNING);
            if (agent != null) {
                builder.agent(agent);
            }
            return builder;
        });
    }

    /**
     * Claims a pending task for {@code workerId}.
     *
     * @throws TaskStateConflictError if the task is not pending
     */
    public Task claim(String taskId, String workerId) {
        checkNotNullParam("workerId", workerId);
        return transition(taskId, current -> {
            requirePending(current);
            return Task.builder(current).status(TaskState.RUNNING).workerId(workerId);
        });
    }

    public Task complete(String taskId, Message result) {
        checkNotNullParam("result", result);
        return finish(taskId, null, builder -> builder
                .status(TaskState.COMPLETED)
                .result(result.withTaskId(taskId)));
    }

    public Task fail(String taskId, TaskErrorDetail error) {
        checkNotNullParam("error", error);
        return finish(taskId, null, builder -> builder
                .status(TaskState.FAILED)
                .error(error));
    }

    /**
     * Completes a task on behalf of the worker holding its lease.
     *
     * @throws TaskStateConflictError if the task is not running under {@code workerId}, or already
     *                                completed or failed
     */
    public Task completeByWorker(String taskId, String workerId, Message result) {
        checkNotNullParam("workerId", workerId);
        checkNotNullParam("result", result);
        return finish(taskId, workerId, builder -> builder
                .status(TaskState.COMPLETED)
                .result(result.withTaskId(taskId)));
    }

    public Task failByWorker(String taskId, String workerId, TaskErrorDetail error) {
        checkNotNullParam("workerId", workerId);
        checkNotNullParam("error", error);
        return finish(taskId, workerId, builder -> builder
                .status(TaskState.FAILED)
                .error(error));
    }

    /**
     * Cancels a non-terminal task.
     *
     * @return the cancelled snapshot; the stored one if the task was already cancelled
     * @throws TaskNotCancelableError if the task already completed or failed
     */
    public Task cancel(String taskId) {
        return transition(taskId, current -> {
            if (current.status() == TaskState.CANCELLED) {
                return null;
            }
            if (current.status().isFinal()) {
                throw new TaskNotCancelableError("Cannot cancel task " + taskId
                        + " in status " + current.status().asString());
            }
            return Task.builder(current).status(TaskState.CANCELLED).cancelRequested(true);
        });
    }

    /**
     * Returns a running task to {@code pending} after its worker lease ended.
     *
     * @param expectedWorkerId only revert if this worker still owns the task
     * @param countAttempt whether the lease expired, as opposed to the worker leaving cleanly
     * @param maxAttempts once {@code attempts} would exceed this, the task fails with
     *                    {@link TaskErrorDetail#LEASE_EXPIRED} instead
     * @return the new snapshot, or the unchanged one if the task moved on in the meantime
     */
    public Task revertToPending(String taskId, String expectedWorkerId, boolean countAttempt, int maxAttempts) {
        return transition(taskId, current -> {
            if (current.status() != TaskState.RUNNING || !expectedWorkerId.equals(current.workerId())) {
                LOGGER.debug("Not reverting task {}: status {} owner {}", taskId, current.status(), current.workerId());
                return null;
            }
            int attempts = countAttempt ? current.attempts() + 1 : current.attempts();
            if (attempts > maxAttempts) {
                LOGGER.warn("Task {} exhausted {} lease reclaims, failing it", taskId, maxAttempts);
                return Task.builder(current)
                        .status(TaskState.FAILED)
                        .attempts(attempts)
                        .error(new TaskErrorDetail(TaskErrorDetail.LEASE_EXPIRED,
                                "Worker lease expired " + attempts + " times"));
            }
            return Task.builder(current)
                    .status(TaskState.PENDING)
                    .workerId(null)
                    .attempts(attempts);
        });
    }

    /**
     * Removes terminal tasks whose last update is older than {@code retention}.
     *
     * @return the ids of the removed tasks
     */
    public List<String> purgeExpired(Duration retention) {
        OffsetDateTime cutoff = OffsetDateTime.now(clock).minus(retention);
        List<String> removed = new ArrayList<>();
        for (Task task : taskStore.list()) {
            if (task.status().isFinal() && task.updatedAt().isBefore(cutoff)) {
                boolean deleted;
                synchronized (lockFor(task.id())) {
                    Task current = taskStore.get(task.id());
                    deleted = current != null && current.status().isFinal()
                            && current.updatedAt().isBefore(cutoff)
                            && taskStore.delete(task.id());
                }
                if (deleted) {
                    taskLocks.remove(task.id());
                    removed.add(task.id());
                }
            }
        }
        if (!removed.isEmpty()) {
            LOGGER.debug("Purged {} expired tasks", removed.size());
        }
        return removed;
    }

    private Task finish(String taskId, @Nullable String workerId, UnaryOperator<Task.Builder> terminal) {
        return transition(taskId, current -> {
            if (current.status().isFinal()) {
                if (workerId != null && current.status() != TaskState.CANCELLED) {
                    throw new TaskStateConflictError("Task " + taskId + " is already "
                            + current.status().asString());
                }
                LOGGER.warn("Ignoring terminal update for task {}: already {}", taskId, current.status().asString());
                return null;
            }
            if (workerId != null && (current.status() != TaskState.RUNNING || !workerId.equals(current.workerId()))) {
                throw new TaskStateConflictError("Task " + taskId + " is not leased to worker " + workerId);
            }
            return terminal.apply(Task.builder(current));
        });
    }

    private static void requirePending(Task current) {
        if (current.status() != TaskState.PENDING) {
            throw new TaskStateConflictError("Task " + current.id() + " is "
                    + current.status().asString() + ", expected pending");
        }
    }

    @FunctionalInterface
    private interface Mutation {
        /**
         * @return the builder for the new snapshot, or {@code null} to leave the task unchanged
         */
        Task.@Nullable Builder apply(Task current);
    }

    private Task transition(String taskId, Mutation mutation) {
        checkNotNullParam("taskId", taskId);
        Task previous;
        Task updated;
        synchronized (lockFor(taskId)) {
            previous = taskStore.get(taskId);
            if (previous == null) {
                throw TaskNotFoundError.forTask(taskId);
            }
            Task.Builder builder = mutation.apply(previous);
            if (builder == null) {
                return previous;
            }
            OffsetDateTime now = OffsetDateTime.now(clock);
            updated = builder.updatedAt(now.isAfter(previous.updatedAt()) ? now : previous.updatedAt()).build();
            if (previous.status() != updated.status() && !previous.status().canTransitionTo(updated.status())) {
                throw new TaskStateConflictError("Illegal transition for task " + taskId + ": "
                        + previous.status().asString() + " -> " + updated.status().asString());
            }
            taskStore.save(updated);
        }
        LOGGER.debug("Task {} {} -> {}", taskId, previous.status().asString(), updated.status().asString());
        notifyListeners(previous.status(), updated);
        return updated;
    }

    private Object lockFor(String taskId) {
        return taskLocks.computeIfAbsent(taskId, id -> new Object());
    }

    private void notifyListeners(@Nullable TaskState previousStatus, Task task) {
        for (TaskUpdateListener listener : listeners) {
            try {
                listener.onTaskUpdate(previousStatus, task);
            } catch (Exception e) {
                LOGGER.error("Task update listener failed for task {}", task.id(), e);
            }
        }
    }
}

package io.agentmesh.server.workers;

import static io.agentmesh.util.Assert.checkNotNullParam;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

import io.agentmesh.server.config.ServerConfig;
import io.agentmesh.server.events.StreamPayloads;
import io.agentmesh.server.events.TaskEventStream;
import io.agentmesh.server.events.TaskEventStreams;
import io.agentmesh.server.tasks.TaskManager;
import io.agentmesh.spec.InvalidParamsError;
import io.agentmesh.spec.JSONRPCError;
import io.agentmesh.spec.LeaseExpiredError;
import io.agentmesh.spec.Message;
import io.agentmesh.spec.StreamEvent;
import io.agentmesh.spec.StreamEventType;
import io.agentmesh.spec.Task;
import io.agentmesh.spec.TaskErrorDetail;
import io.agentmesh.spec.TaskNotFoundError;
import io.agentmesh.spec.TaskState;
import io.agentmesh.spec.TaskStateConflictError;
import io.agentmesh.spec.WorkerNotFoundError;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Hands pending worker-bound tasks to polling workers and tracks their leases.
 * <p>
 * The pending queue is guarded by one lock with a condition that long-polls wait on. Leases live
 * in a concurrent map and are only replaced or removed with compare-and-set style map operations.
 * Task transitions always go through {@link TaskManager}, never while the queue lock is held.
 * <p>
 * Expired leases are reclaimed on every poll and by a background sweep started with {@link #start()}.
 */
public class WorkerCoordinator implements AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(WorkerCoordinator.class);

    public static final String PROMPT = "prompt";
    public static final String MESSAGE = "message";
    public static final String LEASE_EXPIRED_REASON = "lease_expired";
    public static final String WORKER_LEFT_REASON = "worker_unregistered";

    private static final long MIN_SWEEP_NANOS = TimeUnit.MILLISECONDS.toNanos(10);
    private static final long MAX_SWEEP_NANOS = TimeUnit.SECONDS.toNanos(1);

    private final TaskManager taskManager;
    private final TaskEventStreams streams;
    private final WorkerRegistry workers;
    private final Duration pollTimeout;
    private final Duration leaseTimeout;
    private final int maxLeaseReclaims;
    private final Clock clock;

    private final ReentrantLock pendingLock = new ReentrantLock();
    private final Condition taskAvailable = pendingLock.newCondition();
    private final Deque<PendingTask> pending = new ArrayDeque<>();
    private final ConcurrentMap<String, WorkerLease> leases = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, Set<String>> interrupts = new ConcurrentHashMap<>();
    private @Nullable ScheduledExecutorService sweeper;

    private record PendingTask(String taskId, @Nullable String codebaseId) {
    }

    public WorkerCoordinator(TaskManager taskManager, TaskEventStreams streams, WorkerRegistry workers,
                             ServerConfig config) {
        this(taskManager, streams, workers, config.pollTimeout(), config.leaseTimeout(),
                config.maxLeaseReclaims(), Clock.systemUTC());
    }

    public WorkerCoordinator(TaskManager taskManager, TaskEventStreams streams, WorkerRegistry workers,
                             Duration pollTimeout, Duration leaseTimeout, int maxLeaseReclaims, Clock clock) {
        this.taskManager = checkNotNullParam("taskManager", taskManager);
        this.streams = checkNotNullParam("streams", streams);
        this.workers = checkNotNullParam("workers", workers);
        this.pollTimeout = checkNotNullParam("pollTimeout", pollTimeout);
        this.leaseTimeout = checkNotNullParam("leaseTimeout", leaseTimeout);
        if (leaseTimeout.isNegative() || leaseTimeout.isZero()) {
            throw new IllegalArgumentException("leaseTimeout must be positive: " + leaseTimeout);
        }
        if (maxLeaseReclaims < 0) {
            throw new IllegalArgumentException("maxLeaseReclaims must not be negative: " + maxLeaseReclaims);
        }
        this.maxLeaseReclaims = maxLeaseReclaims;
        this.clock = checkNotNullParam("clock", clock);
    }

    public WorkerRegistry workers() {
        return workers;
    }

    public Duration leaseTimeout() {
        return leaseTimeout;
    }

    /**
     * Starts the background lease sweep.
     */
    public synchronized void start() {
        if (sweeper != null) {
            return;
        }
        sweeper = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread thread = new Thread(r, "WorkerLeaseSweeper");
            thread.setDaemon(true);
            return thread;
        });
        long period = sweepNanos();
        sweeper.scheduleWithFixedDelay(() -> {
            try {
                reclaimExpiredLeases();
            } catch (Exception e) {
                LOGGER.error("Lease sweep failed", e);
            }
        }, period, period, TimeUnit.NANOSECONDS);
        LOGGER.info("WorkerCoordinator started (lease timeout {} ms, max reclaims {})",
                leaseTimeout.toMillis(), maxLeaseReclaims);
    }

    @Override
    public synchronized void close() {
        if (sweeper != null) {
            sweeper.shutdownNow();
            sweeper = null;
            LOGGER.info("WorkerCoordinator stopped");
        }
    }

    /**
     * Creates a pending worker-bound task and queues it for the next matching poll.
     *
     * @param codebaseId the codebase the task belongs to, or {@code null} for any worker
     * @param prompt what the worker should do
     * @param agent the agent type the worker should run, if any
     */
    public Task submitTask(@Nullable String codebaseId, Message prompt, @Nullable String agent,
                           @Nullable Map<String, Object> metadata) {
        Task task = createTask(codebaseId, prompt, agent, metadata);
        enqueue(task);
        return task;
    }

    /**
     * Creates a worker-bound task and opens its event stream without queueing it, so that callers
     * can attach to the stream before the first event. Follow up with {@link #enqueue(Task)}.
     */
    public Task createTask(@Nullable String codebaseId, Message prompt, @Nullable String agent,
                           @Nullable Map<String, Object> metadata) {
        checkNotNullParam("prompt", prompt);
        Map<String, Object> taskMetadata = new LinkedHashMap<>();
        if (metadata != null) {
            taskMetadata.putAll(metadata);
        }
        if (codebaseId != null) {
            taskMetadata.put(Task.CODEBASE_ID, codebaseId);
        }
        taskMetadata.put(PROMPT, prompt.joinedText());
        taskMetadata.put(MESSAGE, prompt);
        Task task = taskManager.createTask(agent, taskMetadata);
        streams.open(task.id());
        return task;
    }

    /**
     * Announces a task created by {@link #createTask} on its stream and queues it.
     */
    public void enqueue(Task task) {
        appendQuietly(task.id(), StreamEventType.STATUS, StreamPayloads.status(task));
        enqueue(new PendingTask(task.id(), task.codebaseId()), false);
        LOGGER.debug("Queued worker task {} (codebase {})", task.id(), task.codebaseId());
    }

    public int pendingCount() {
        pendingLock.lock();
        try {
            return pending.size();
        } finally {
            pendingLock.unlock();
        }
    }

    /**
     * Waits for a pending task matching {@code filter} and claims it for {@code workerId}.
     * Unknown workers are registered on their first poll.
     *
     * @param timeout how long to wait; capped at the configured poll timeout, which is also used
     *                when {@code null}
     * @return the claimed task, or empty if none became available in time
     */
    public Optional<Task> poll(String workerId, PollFilter filter, @Nullable Duration timeout)
            throws InterruptedException {
        checkNotNullParam("workerId", workerId);
        checkNotNullParam("filter", filter);
        if (workers.contains(workerId)) {
            workers.touch(workerId);
        } else {
            workers.register(workerId, null, null, null);
        }

        Duration wait = timeout == null || timeout.compareTo(pollTimeout) > 0 ? pollTimeout : timeout;
        long deadline = System.nanoTime() + Math.max(0, wait.toNanos());
        while (true) {
            reclaimExpiredLeases();
            long remaining = deadline - System.nanoTime();
            PendingTask candidate = awaitPending(filter, Math.max(0, Math.min(remaining, sweepNanos())));
            if (candidate != null) {
                Task claimed = tryClaim(candidate, workerId);
                if (claimed != null) {
                    return Optional.of(claimed);
                }
                continue;
            }
            if (deadline - System.nanoTime() <= 0) {
                return Optional.empty();
            }
        }
    }

    /**
     * Renews every lease held by the worker and hands over its pending interrupts.
     *
     * @throws WorkerNotFoundError if the worker is not registered
     */
    public HeartbeatResult heartbeat(String workerId) {
        workers.touch(workerId);
        Instant now = clock.instant();
        List<String> renewed = new ArrayList<>();
        for (WorkerLease lease : leases.values()) {
            if (lease.workerId().equals(workerId)
                    && leases.replace(lease.taskId(), lease, lease.renew(now))) {
                renewed.add(lease.taskId());
            }
        }
        Set<String> signalled = interrupts.remove(workerId);
        List<String> interrupted = signalled == null ? List.of() : signalled.stream().sorted().toList();
        LOGGER.debug("Heartbeat from worker {}: renewed {}, interrupts {}", workerId, renewed, interrupted);
        return new HeartbeatResult(workerId, renewed.stream().sorted().toList(), interrupted);
    }

    /**
     * Renews the worker's lease on a single task.
     *
     * @throws LeaseExpiredError if the worker no longer holds the lease
     * @throws TaskStateConflictError if the task already finished
     */
    public WorkerLease renew(String taskId, String workerId) {
        WorkerLease renewed = leases.computeIfPresent(taskId,
                (id, lease) -> lease.workerId().equals(workerId) ? lease.renew(clock.instant()) : lease);
        if (renewed == null || !renewed.workerId().equals(workerId)) {
            throw leaseNotHeld(taskId, workerId);
        }
        if (workers.contains(workerId)) {
            workers.touch(workerId);
        }
        return renewed;
    }

    /**
     * Appends partial output of a leased task to its event stream and renews the lease.
     *
     * @throws InvalidParamsError if {@code type} is not a worker output type
     * @throws LeaseExpiredError if the worker no longer holds the lease
     * @throws TaskStateConflictError if the task's stream is already closed
     */
    public StreamEvent submitOutput(String taskId, String workerId, StreamEventType type, @Nullable Object data) {
        checkNotNullParam("type", type);
        if (!type.isWorkerOutput()) {
            throw new InvalidParamsError("Worker output type must be output, tool_use or file_change, got "
                    + type.asString());
        }
        renew(taskId, workerId);
        try {
            return streams.append(taskId, type, data);
        } catch (TaskStateConflictError e) {
            LOGGER.warn("Rejected {} output for task {} from worker {}: {}", type.asString(), taskId, workerId,
                    e.getMessage());
            throw e;
        }
    }

    /**
     * Completes a leased task. A task cancelled in the meantime stays cancelled.
     *
     * @throws LeaseExpiredError if the task was reclaimed from the worker
     * @throws TaskStateConflictError if the task already completed or failed
     */
    public Task complete(String taskId, String workerId, Message result) {
        Task task;
        try {
            task = taskManager.completeByWorker(taskId, workerId, result);
        } catch (TaskStateConflictError e) {
            throw rejected(taskId, workerId, e);
        }
        dropLease(taskId, workerId);
        if (task.status() == TaskState.COMPLETED) {
            appendQuietly(taskId, StreamEventType.COMPLETE, StreamPayloads.complete(task));
            LOGGER.info("Worker {} completed task {}", workerId, taskId);
        }
        return task;
    }

    /**
     * Fails a leased task with a {@link TaskErrorDetail#WORKER_ERROR}. A task cancelled in the
     * meantime stays cancelled.
     *
     * @throws LeaseExpiredError if the task was reclaimed from the worker
     * @throws TaskStateConflictError if the task already completed or failed
     */
    public Task fail(String taskId, String workerId, String error) {
        Task task;
        try {
            task = taskManager.failByWorker(taskId, workerId,
                    new TaskErrorDetail(TaskErrorDetail.WORKER_ERROR, error));
        } catch (TaskStateConflictError e) {
            throw rejected(taskId, workerId, e);
        }
        dropLease(taskId, workerId);
        if (task.status() == TaskState.FAILED) {
            appendQuietly(taskId, StreamEventType.ERROR, StreamPayloads.error(task));
            LOGGER.info("Worker {} failed task {}: {}", workerId, taskId, error);
        }
        return task;
    }

    /**
     * Asks the worker holding the task's lease to stop. Delivered with its next heartbeat.
     *
     * @return whether a worker was signalled; {@code false} if the task is not leased
     * @throws TaskNotFoundError if the task does not exist
     */
    public boolean interrupt(String taskId) {
        taskManager.getTask(taskId);
        WorkerLease lease = leases.get(taskId);
        if (lease == null) {
            return false;
        }
        signal(lease.workerId(), taskId);
        return true;
    }

    /**
     * Interrupts every leased task of a codebase.
     *
     * @return the ids of the interrupted tasks
     */
    public List<String> interruptCodebase(String codebaseId) {
        checkNotNullParam("codebaseId", codebaseId);
        List<String> interrupted = new ArrayList<>();
        for (WorkerLease lease : leases.values()) {
            if (codebaseId.equals(lease.codebaseId())) {
                signal(lease.workerId(), lease.taskId());
                interrupted.add(lease.taskId());
            }
        }
        interrupted.sort(null);
        return interrupted;
    }

    /**
     * Forgets a task that was cancelled: removes it from the queue, drops its lease and
     * interrupts the worker that held it.
     */
    public void release(String taskId) {
        pendingLock.lock();
        try {
            pending.removeIf(entry -> entry.taskId().equals(taskId));
        } finally {
            pendingLock.unlock();
        }
        WorkerLease lease = leases.remove(taskId);
        if (lease != null) {
            signal(lease.workerId(), taskId);
        }
    }

    /**
     * Unregisters a worker and returns its tasks to the queue without counting a reclaim.
     *
     * @throws WorkerNotFoundError if the worker is not registered
     */
    public WorkerInfo unregister(String workerId) {
        WorkerInfo info = workers.unregister(workerId);
        if (info == null) {
            throw new WorkerNotFoundError();
        }
        interrupts.remove(workerId);
        for (WorkerLease lease : leases.values()) {
            if (lease.workerId().equals(workerId) && leases.remove(lease.taskId(), lease)) {
                revert(lease, false, WORKER_LEFT_REASON);
            }
        }
        return info;
    }

    public @Nullable WorkerLease lease(String taskId) {
        return leases.get(taskId);
    }

    public List<WorkerLease> leases() {
        return List.copyOf(leases.values());
    }

    /**
     * Reverts every task whose lease was not renewed within the lease timeout.
     *
     * @return the ids of the reclaimed tasks
     */
    public List<String> reclaimExpiredLeases() {
        Instant now = clock.instant();
        List<String> reclaimed = new ArrayList<>();
        for (WorkerLease lease : leases.values()) {
            if (lease.isExpired(now, leaseTimeout) && leases.remove(lease.taskId(), lease)) {
                LOGGER.warn("Lease of worker {} on task {} expired (last seen {})",
                        lease.workerId(), lease.taskId(), lease.lastSeen());
                revert(lease, true, LEASE_EXPIRED_REASON);
                reclaimed.add(lease.taskId());
            }
        }
        return reclaimed;
    }

    private void revert(WorkerLease lease, boolean countAttempt, String reason) {
        Task task;
        try {
            task = taskManager.revertToPending(lease.taskId(), lease.workerId(), countAttempt, maxLeaseReclaims);
        } catch (TaskNotFoundError e) {
            LOGGER.debug("Task {} disappeared before its lease could be reclaimed", lease.taskId());
            return;
        }
        if (task.status() == TaskState.PENDING) {
            appendQuietly(task.id(), StreamEventType.STATUS, StreamPayloads.status(task, reason));
            enqueue(new PendingTask(task.id(), task.codebaseId()), true);
        } else if (task.status() == TaskState.FAILED && task.error() != null
                && TaskErrorDetail.LEASE_EXPIRED.equals(task.error().kind())) {
            appendQuietly(task.id(), StreamEventType.ERROR, StreamPayloads.error(task));
        }
    }

    private void enqueue(PendingTask entry, boolean first) {
        pendingLock.lock();
        try {
            if (first) {
                pending.addFirst(entry);
            } else {
                pending.addLast(entry);
            }
            taskAvailable.signalAll();
        } finally {
            pendingLock.unlock();
        }
    }

    private @Nullable PendingTask awaitPending(PollFilter filter, long waitNanos) throws InterruptedException {
        pendingLock.lockInterruptibly();
        try {
            PendingTask candidate = removeFirstMatching(filter);
            if (candidate == null && waitNanos > 0) {
                taskAvailable.awaitNanos(waitNanos);
                candidate = removeFirstMatching(filter);
            }
            return candidate;
        } finally {
            pendingLock.unlock();
        }
    }

    private @Nullable PendingTask removeFirstMatching(PollFilter filter) {
        Iterator<PendingTask> iterator = pending.iterator();
        while (iterator.hasNext()) {
            PendingTask entry = iterator.next();
            if (filter.accepts(entry.codebaseId())) {
                iterator.remove();
                return entry;
            }
        }
        return null;
    }

    private @Nullable Task tryClaim(PendingTask entry, String workerId) {
        Task task;
        try {
            task = taskManager.claim(entry.taskId(), workerId);
        } catch (TaskNotFoundError | TaskStateConflictError e) {
            LOGGER.debug("Skipping queued task {}: {}", entry.taskId(), e.getMessage());
            return null;
        }
        WorkerLease lease = new WorkerLease(task.id(), workerId, entry.codebaseId(),
                UUID.randomUUID().toString(), clock.instant());
        leases.put(task.id(), lease);
        // A cancel between the claim and the put found no lease to release.
        Task current = taskManager.findTask(task.id());
        if (current == null || current.status().isFinal()) {
            leases.remove(task.id(), lease);
            LOGGER.debug("Task {} finished before worker {} took its lease", task.id(), workerId);
            return null;
        }
        appendQuietly(task.id(), StreamEventType.STATUS, StreamPayloads.status(task));
        LOGGER.info("Worker {} claimed task {}", workerId, task.id());
        return task;
    }

    private void dropLease(String taskId, String workerId) {
        leases.computeIfPresent(taskId, (id, lease) -> lease.workerId().equals(workerId) ? null : lease);
    }

    private void signal(String workerId, String taskId) {
        interrupts.computeIfAbsent(workerId, id -> ConcurrentHashMap.newKeySet()).add(taskId);
        LOGGER.info("Interrupt queued for worker {} on task {}", workerId, taskId);
    }

    private void appendQuietly(String taskId, StreamEventType type, Object data) {
        TaskEventStream stream = streams.get(taskId);
        if (stream == null) {
            return;
        }
        try {
            stream.append(type, data);
        } catch (TaskStateConflictError e) {
            LOGGER.debug("Dropped {} event for task {}: {}", type.asString(), taskId, e.getMessage());
        }
    }

    private JSONRPCError leaseNotHeld(String taskId, String workerId) {
        Task task = taskManager.getTask(taskId);
        if (task.status().isFinal()) {
            return new TaskStateConflictError("Task " + taskId + " is already " + task.status().asString());
        }
        return new LeaseExpiredError("Worker " + workerId + " does not hold the lease on task " + taskId);
    }

    private JSONRPCError rejected(String taskId, String workerId, TaskStateConflictError cause) {
        Task current = taskManager.findTask(taskId);
        LOGGER.warn("Rejected terminal submission for task {} from worker {}: {}", taskId, workerId,
                cause.getMessage());
        if (current != null && !current.status().isFinal()) {
            return new LeaseExpiredError("Worker " + workerId + " does not hold the lease on task " + taskId);
        }
        return cause;
    }

    private long sweepNanos() {
        long quarter = leaseTimeout.toNanos() / 4;
        return Math.max(MIN_SWEEP_NANOS, Math.min(MAX_SWEEP_NANOS, quarter));
    }
}

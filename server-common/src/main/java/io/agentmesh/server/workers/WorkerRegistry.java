package io.agentmesh.server.workers;

import static io.agentmesh.util.Assert.checkNotNullParam;

import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import io.agentmesh.spec.WorkerNotFoundError;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Known workers, keyed by worker id.
 */
public class WorkerRegistry {

    private static final Logger LOGGER = LoggerFactory.getLogger(WorkerRegistry.class);

    private final ConcurrentMap<String, WorkerInfo> workers = new ConcurrentHashMap<>();
    private final Clock clock;

    public WorkerRegistry() {
        this(Clock.systemUTC());
    }

    public WorkerRegistry(Clock clock) {
        this.clock = checkNotNullParam("clock", clock);
    }

    /**
     * Registers a worker, or refreshes its details if it is already known.
     */
    public WorkerInfo register(String workerId, @Nullable String name, @Nullable List<String> capabilities,
                               @Nullable String hostname) {
        Instant now = clock.instant();
        WorkerInfo info = workers.compute(workerId, (id, existing) -> new WorkerInfo(id,
                name != null ? name : existing != null ? existing.name() : id,
                capabilities != null ? capabilities : existing != null ? existing.capabilities() : List.of(),
                hostname != null ? hostname : existing != null ? existing.hostname() : null,
                existing != null ? existing.registeredAt() : now,
                now));
        LOGGER.info("Registered worker {} ({})", workerId, info.name());
        return info;
    }

    public @Nullable WorkerInfo unregister(String workerId) {
        WorkerInfo removed = workers.remove(workerId);
        if (removed != null) {
            LOGGER.info("Unregistered worker {}", workerId);
        }
        return removed;
    }

    public @Nullable WorkerInfo get(String workerId) {
        return workers.get(workerId);
    }

    /**
     * @throws WorkerNotFoundError if the worker is not registered
     */
    public WorkerInfo require(String workerId) {
        WorkerInfo info = workers.get(workerId);
        if (info == null) {
            throw new WorkerNotFoundError();
        }
        return info;
    }

    public boolean contains(String workerId) {
        return workers.containsKey(workerId);
    }

    /**
     * Records activity of a registered worker.
     *
     * @throws WorkerNotFoundError if the worker is not registered
     */
    public WorkerInfo touch(String workerId) {
        WorkerInfo info = workers.computeIfPresent(workerId, (id, existing) -> existing.seenAt(clock.instant()));
        if (info == null) {
            throw new WorkerNotFoundError();
        }
        return info;
    }

    public List<WorkerInfo> list() {
        return workers.values().stream()
                .sorted(Comparator.comparing(WorkerInfo::registeredAt).thenComparing(WorkerInfo::workerId))
                .toList();
    }
}

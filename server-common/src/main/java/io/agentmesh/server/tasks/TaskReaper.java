package io.agentmesh.server.tasks;

import static io.agentmesh.util.Assert.checkNotNullParam;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Periodically removes terminal tasks older than the retention window.
 */
public class TaskReaper implements AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(TaskReaper.class);

    private final TaskManager taskManager;
    private final Duration retention;
    private final Duration interval;
    private final Consumer<String> onPurged;
    private @Nullable ScheduledExecutorService scheduler;

    /**
     * @param onPurged called with the id of every removed task, e.g. to drop its event stream
     */
    public TaskReaper(TaskManager taskManager, Duration retention, Duration interval, Consumer<String> onPurged) {
        this.taskManager = checkNotNullParam("taskManager", taskManager);
        this.retention = checkNotNullParam("retention", retention);
        this.interval = checkNotNullParam("interval", interval);
        this.onPurged = checkNotNullParam("onPurged", onPurged);
    }

    public synchronized void start() {
        if (scheduler != null) {
            return;
        }
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread thread = new Thread(r, "TaskReaper");
            thread.setDaemon(true);
            return thread;
        });
        scheduler.scheduleWithFixedDelay(this::reap, interval.toMillis(), interval.toMillis(), TimeUnit.MILLISECONDS);
        LOGGER.info("TaskReaper started (retention {} ms, interval {} ms)", retention.toMillis(), interval.toMillis());
    }

    /**
     * Runs one sweep on the calling thread.
     *
     * @return the number of removed tasks
     */
    public int reap() {
        try {
            List<String> removed = taskManager.purgeExpired(retention);
            for (String taskId : removed) {
                onPurged.accept(taskId);
            }
            return removed.size();
        } catch (Exception e) {
            LOGGER.error("Task reaper sweep failed", e);
            return 0;
        }
    }

    @Override
    public synchronized void close() {
        if (scheduler != null) {
            scheduler.shutdownNow();
            scheduler = null;
            LOGGER.info("TaskReaper stopped");
        }
    }
}

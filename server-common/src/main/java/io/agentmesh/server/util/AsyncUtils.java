package io.agentmesh.server.util;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

import mutiny.zero.BackpressureStrategy;
import mutiny.zero.TubeConfiguration;

public final class AsyncUtils {

    private static final int STREAM_BUFFER_SIZE = 256;

    private AsyncUtils() {
    }

    /**
     * Tube configuration for server-sent streams: items are buffered while the HTTP layer is
     * not requesting.
     */
    public static TubeConfiguration createTubeConfig() {
        return new TubeConfiguration()
                .withBackpressureStrategy(BackpressureStrategy.BUFFER)
                .withBufferSize(STREAM_BUFFER_SIZE);
    }

    /**
     * Cached pool of daemon threads named {@code <prefix>-<n>}.
     */
    public static ExecutorService newDaemonExecutor(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newCachedThreadPool(r -> {
            Thread thread = new Thread(r, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }
}

package io.agentmesh.server.events;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;

import io.agentmesh.spec.AgentNotFoundError;
import io.agentmesh.spec.Message;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Inbound queue of one agent, drained by a single consumer loop.
 */
class Mailbox implements Runnable {

    private static final Logger LOGGER = LoggerFactory.getLogger(Mailbox.class);

    private static final long POLL_INTERVAL_MILLIS = 200;

    record Envelope(String sender, Message message, CompletableFuture<@Nullable Message> reply) {
    }

    private final String agentName;
    private final MailboxHandler handler;
    private final SubscriberQueue<Envelope> queue;
    private volatile boolean running = true;

    Mailbox(String agentName, MailboxHandler handler, int capacity, Duration blockTimeout) {
        this.agentName = agentName;
        this.handler = handler;
        this.queue = new SubscriberQueue<>("mailbox:" + agentName, capacity, OverflowPolicy.BLOCK_PUBLISHER,
                blockTimeout);
    }

    String agentName() {
        return agentName;
    }

    boolean offer(Envelope envelope) {
        if (!running || !queue.offer(envelope)) {
            return false;
        }
        // Closed while enqueueing: the consumer may already have drained, so fail what is left.
        if (!running) {
            failRemaining();
        }
        return true;
    }

    void close() {
        running = false;
        queue.close();
    }

    @Override
    public void run() {
        LOGGER.debug("Mailbox loop for {} started", agentName);
        try {
            while (running) {
                Envelope envelope = queue.poll(POLL_INTERVAL_MILLIS);
                if (envelope != null) {
                    dispatch(envelope);
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        failRemaining();
        LOGGER.debug("Mailbox loop for {} ended", agentName);
    }

    private void dispatch(Envelope envelope) {
        try {
            envelope.reply().complete(handler.onMessage(envelope.sender(), envelope.message()));
        } catch (Exception e) {
            LOGGER.error("Agent {} failed to handle message from {}", agentName, envelope.sender(), e);
            envelope.reply().completeExceptionally(e);
        }
    }

    private void failRemaining() {
        try {
            Envelope envelope;
            while ((envelope = queue.poll(0)) != null) {
                envelope.reply().completeExceptionally(AgentNotFoundError.forAgent(agentName));
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}

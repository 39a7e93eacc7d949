package io.agentmesh.server.events;

import java.util.concurrent.CompletableFuture;

import io.agentmesh.spec.AgentNotFoundError;
import io.agentmesh.spec.Event;
import io.agentmesh.spec.Message;
import org.jspecify.annotations.Nullable;

/**
 * Internal bus with two delivery modes.
 * <ul>
 *   <li>Direct addressing: {@link #send(String, Message, String)} hands a message to exactly one
 *   agent mailbox, FIFO per mailbox.</li>
 *   <li>Publish/subscribe: {@link #publish(String, Object, String)} fans an event out to every
 *   active subscription whose {@link EventPattern} matches. For one publisher, each subscriber sees
 *   events in publish order.</li>
 * </ul>
 */
public interface MessageBroker extends AutoCloseable {

    /**
     * Opens the inbound mailbox of an agent. Messages are handled one at a time on the mailbox's
     * own consumer loop.
     *
     * @throws IllegalStateException if the agent already has a mailbox
     */
    void openMailbox(String agentName, MailboxHandler handler);

    /**
     * Closes a mailbox. Messages still queued fail with {@link AgentNotFoundError}.
     */
    void closeMailbox(String agentName);

    boolean hasMailbox(String agentName);

    /**
     * Delivers {@code message} to {@code target}'s mailbox.
     *
     * @return completes with the handler's reply, or exceptionally with the handler's failure
     * @throws AgentNotFoundError if {@code target} has no mailbox
     * @throws io.agentmesh.spec.ServiceUnavailableError if the mailbox stayed full past the block timeout
     */
    CompletableFuture<@Nullable Message> send(String target, Message message, String sender);

    /**
     * Publishes a new event.
     *
     * @return the published event
     */
    Event publish(String eventType, @Nullable Object payload, String source);

    void publish(Event event);

    /**
     * Opens a pull subscription; the caller drains it with {@link Subscription#poll(long)}.
     */
    default Subscription subscribe(String subscriber, EventPattern pattern) {
        return subscribe(SubscriptionRequest.builder(subscriber, pattern).build());
    }

    /**
     * Opens a subscription whose events the broker passes to {@code handler}.
     */
    default Subscription subscribe(String subscriber, EventPattern pattern, EventHandler handler) {
        return subscribe(SubscriptionRequest.builder(subscriber, pattern).handler(handler).build());
    }

    Subscription subscribe(SubscriptionRequest request);

    /**
     * Same as {@link Subscription#close()}.
     */
    default void unsubscribe(Subscription subscription) {
        subscription.close();
    }

    /**
     * Drops every subscription that is no longer {@linkplain Subscription#isActive() active}.
     *
     * @return the number of subscriptions dropped
     */
    int pruneInactive();

    int subscriptionCount();

    @Override
    void close();
}

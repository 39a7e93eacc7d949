package io.agentmesh.server.events;

import static io.agentmesh.util.Assert.checkNotNullParam;

import java.util.function.BooleanSupplier;

import org.jspecify.annotations.Nullable;

/**
 * Options for {@link MessageBroker#subscribe(SubscriptionRequest)}.
 *
 * @param subscriber identity of the subscribing agent or component
 * @param pattern which events to receive
 * @param handler consumer run by the broker, or {@code null} for a pull subscription
 * @param liveness check checked by the broker; once it returns {@code false} the subscription is dropped
 * @param replay whether to first deliver matching events retained by the {@link DurableEventStore}
 */
public record SubscriptionRequest(String subscriber, EventPattern pattern, @Nullable EventHandler handler,
                                  BooleanSupplier liveness, boolean replay) {

    private static final BooleanSupplier ALWAYS_ALIVE = () -> true;

    public SubscriptionRequest {
        checkNotNullParam("subscriber", subscriber);
        checkNotNullParam("pattern", pattern);
        liveness = liveness == null ? ALWAYS_ALIVE : liveness;
    }

    public static Builder builder(String subscriber, EventPattern pattern) {
        return new Builder(subscriber, pattern);
    }

    public static class Builder {
        private final String subscriber;
        private final EventPattern pattern;
        private @Nullable EventHandler handler;
        private @Nullable BooleanSupplier liveness;
        private boolean replay;

        private Builder(String subscriber, EventPattern pattern) {
            this.subscriber = subscriber;
            this.pattern = pattern;
        }

        public Builder handler(@Nullable EventHandler handler) {
            this.handler = handler;
            return this;
        }

        public Builder liveness(@Nullable BooleanSupplier liveness) {
            this.liveness = liveness;
            return this;
        }

        public Builder replay(boolean replay) {
            this.replay = replay;
            return this;
        }

        public SubscriptionRequest build() {
            return new SubscriptionRequest(subscriber, pattern, handler,
                    liveness == null ? ALWAYS_ALIVE : liveness, replay);
        }
    }
}

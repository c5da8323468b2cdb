package io.forged.events;

import io.forged.model.Event;

import java.util.List;

/**
 * Result of {@link EventBus#subscribe(SubscribeRequest)}. Callers send {@code replay}
 * first, then read {@code receiver}.
 */
public record Subscription(String subscriberId, EventReceiver receiver, List<Event> replay) {
    public Subscription {
        replay = replay == null ? List.of() : List.copyOf(replay);
    }
}

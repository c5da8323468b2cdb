package io.forged.events;

import io.forged.model.Event;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Active subscribers keyed by id ({@code sub-1}, {@code sub-2}, ...).
 *
 * <p>Not thread-safe. {@link EventBus} serializes every access.
 */
public final class SubscriptionRegistry {
    private final Map<String, Subscriber> subscribers;
    private final AtomicLong idSequence;

    public SubscriptionRegistry() {
        this.subscribers = new LinkedHashMap<>();
        this.idSequence = new AtomicLong(0L);
    }

    public Subscriber register(EventFilter filter, BlockingQueue<Event> channel) {
        String id = "sub-" + idSequence.incrementAndGet();
        Subscriber subscriber = new Subscriber(id, filter, channel);
        subscribers.put(id, subscriber);
        return subscriber;
    }

    public boolean remove(String subscriberId) {
        if (subscriberId == null) {
            return false;
        }
        Subscriber removed = subscribers.remove(subscriberId);
        if (removed == null) {
            return false;
        }
        removed.markClosed();
        return true;
    }

    /**
     * Offers {@code event} to every matching subscriber without blocking. Subscribers whose
     * receiver has been closed are dropped from the registry on the way.
     *
     * <p>Nothing is logged here; the caller reports {@link BroadcastResult#saturated()} once it
     * has left its critical section.
     */
    public BroadcastResult broadcast(Event event) {
        int delivered = 0;
        int dropped = 0;
        int reaped = 0;
        List<String> saturated = new ArrayList<>();
        Iterator<Subscriber> it = subscribers.values().iterator();
        while (it.hasNext()) {
            Subscriber subscriber = it.next();
            if (subscriber.isClosed()) {
                it.remove();
                reaped++;
                continue;
            }
            if (!FilterEvaluator.matches(event, subscriber.filter())) {
                continue;
            }
            if (subscriber.offer(event)) {
                delivered++;
            } else {
                dropped++;
                if (subscriber.droppedCount() == 1L) {
                    saturated.add(subscriber.id());
                }
            }
        }
        return new BroadcastResult(delivered, dropped, reaped, saturated);
    }

    public int size() {
        return subscribers.size();
    }

    /**
     * @param saturated ids of subscribers that lost their first event in this broadcast
     */
    public record BroadcastResult(int delivered, int dropped, int reaped, List<String> saturated) {
        public BroadcastResult {
            saturated = saturated == null ? List.of() : List.copyOf(saturated);
        }
    }
}

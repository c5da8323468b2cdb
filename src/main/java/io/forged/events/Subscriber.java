package io.forged.events;

import io.forged.model.Event;

import java.util.concurrent.BlockingQueue;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Registry entry: a filter plus the send side of the subscriber's bounded channel.
 */
public final class Subscriber {
    private final String id;
    private final EventFilter filter;
    private final BlockingQueue<Event> channel;
    private final AtomicBoolean closed;
    private final AtomicLong delivered;
    private final AtomicLong dropped;

    Subscriber(String id, EventFilter filter, BlockingQueue<Event> channel) {
        this.id = id;
        this.filter = filter == null ? EventFilter.ALL : filter;
        this.channel = channel;
        this.closed = new AtomicBoolean(false);
        this.delivered = new AtomicLong(0L);
        this.dropped = new AtomicLong(0L);
    }

    public String id() {
        return id;
    }

    public EventFilter filter() {
        return filter;
    }

    public boolean isClosed() {
        return closed.get();
    }

    public long deliveredCount() {
        return delivered.get();
    }

    public long droppedCount() {
        return dropped.get();
    }

    BlockingQueue<Event> channel() {
        return channel;
    }

    /**
     * Returns true only for the call that actually closed the subscriber.
     */
    boolean markClosed() {
        return closed.compareAndSet(false, true);
    }

    /**
     * Non-blocking send. A full channel drops the event and counts the drop.
     */
    boolean offer(Event event) {
        if (channel.offer(event)) {
            delivered.incrementAndGet();
            return true;
        }
        dropped.incrementAndGet();
        return false;
    }
}

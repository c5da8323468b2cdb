package io.forged.events;

import io.forged.model.Event;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Bounded in-memory retention of recently published events, oldest first.
 *
 * <p>Ids start at 0 and increase by one per append; the deque is therefore always sorted
 * by id. When full, the oldest entry is evicted before the new one is added.
 *
 * <p>Not thread-safe. {@link EventBus} serializes every access.
 */
public final class EventStore {
    private final int capacity;
    private final Deque<StoredEvent> events;
    private long nextId;

    public EventStore(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be >= 1: " + capacity);
        }
        this.capacity = capacity;
        this.events = new ArrayDeque<>(Math.min(capacity, 4096));
        this.nextId = 0L;
    }

    public StoredEvent append(Event event) {
        long id = nextId;
        StoredEvent stored = new StoredEvent(id, event.withId(Long.toString(id)));
        nextId = id + 1L;
        if (events.size() >= capacity) {
            events.pollFirst();
        }
        events.addLast(stored);
        return stored;
    }

    /**
     * Events with {@code id >= cursor} matching {@code filter}, ascending. A cursor of zero
     * or below never replays.
     */
    public List<Event> replay(long cursor, EventFilter filter) {
        if (cursor <= 0L) {
            return List.of();
        }
        return snapshot(cursor, filter);
    }

    public List<Event> snapshot(long fromId, EventFilter filter) {
        List<Event> out = new ArrayList<>();
        for (StoredEvent stored : events) {
            if (stored.id() >= fromId && FilterEvaluator.matches(stored.event(), filter)) {
                out.add(stored.event());
            }
        }
        return out;
    }

    public List<StoredEvent> entries() {
        return List.copyOf(events);
    }

    public int size() {
        return events.size();
    }

    public int capacity() {
        return capacity;
    }

    public long nextId() {
        return nextId;
    }

    /**
     * Lowest retained id, or -1 when nothing is stored.
     */
    public long oldestId() {
        StoredEvent first = events.peekFirst();
        return first == null ? -1L : first.id();
    }
}

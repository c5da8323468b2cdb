package io.forged.events;

import io.forged.config.EventBusConfig;
import io.forged.model.Event;
import io.forged.model.EventKind;
import io.forged.model.EventPayload;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Daemon-wide event bus: bounded retention, filtered fan-out and cursor replay.
 *
 * <p>The store and the subscriber registry share one monitor. Publishing stamps, stores
 * and broadcasts inside it, and subscribing takes the replay snapshot and registers inside
 * it, so a new subscriber receives every event at or after its cursor through exactly one
 * of the replay list or its live channel. Live delivery uses non-blocking offers; a full
 * channel loses the event for that subscriber only.
 */
public final class EventBus {
    private static final Logger logger = LoggerFactory.getLogger(EventBus.class);

    private final EventBusConfig config;
    private final EventStore store;
    private final SubscriptionRegistry registry;
    private final Object lock;
    private final AtomicLong publishedTotal;
    private final AtomicLong deliveredTotal;
    private final AtomicLong droppedTotal;
    private final AtomicLong replayedTotal;
    private final AtomicLong subscribeRejectedTotal;

    public EventBus() {
        this(EventBusConfig.defaults());
    }

    public EventBus(EventBusConfig config) {
        this.config = Objects.requireNonNull(config, "config");
        this.store = new EventStore(config.maxStoredEvents());
        this.registry = new SubscriptionRegistry();
        this.lock = new Object();
        this.publishedTotal = new AtomicLong(0L);
        this.deliveredTotal = new AtomicLong(0L);
        this.droppedTotal = new AtomicLong(0L);
        this.replayedTotal = new AtomicLong(0L);
        this.subscribeRejectedTotal = new AtomicLong(0L);
    }

    public EventBusConfig config() {
        return config;
    }

    /**
     * Assigns the next id, retains the event and fans it out. Never blocks on subscribers.
     *
     * @return the stamped event as stored and delivered
     */
    public Event publish(Event event) {
        Objects.requireNonNull(event, "event");
        StoredEvent stored;
        SubscriptionRegistry.BroadcastResult result;
        synchronized (lock) {
            stored = store.append(event);
            result = registry.broadcast(stored.event());
            publishedTotal.incrementAndGet();
            deliveredTotal.addAndGet(result.delivered());
            droppedTotal.addAndGet(result.dropped());
        }
        logBroadcast(stored.event(), result);
        return stored.event();
    }

    /**
     * Registers a subscriber and returns the events it missed since {@code request.cursor()}.
     *
     * @throws InvalidCursorException when the cursor is non-empty and not an integer; nothing
     *                                is registered in that case
     */
    public Subscription subscribe(SubscribeRequest request) {
        Objects.requireNonNull(request, "request");
        EventFilter filter = request.toFilter();
        long cursor;
        try {
            cursor = parseCursor(request.cursor());
        } catch (InvalidCursorException e) {
            subscribeRejectedTotal.incrementAndGet();
            logger.debug("Rejected subscribe request: {}", e.getMessage());
            throw e;
        }
        boolean replayAll = config.replayFromZeroCursor() && cursor == 0L && !request.cursor().isEmpty();

        ArrayBlockingQueue<Event> channel = new ArrayBlockingQueue<>(config.eventChannelBuffer());
        Subscriber subscriber;
        List<Event> replay;
        synchronized (lock) {
            replay = replayAll ? store.snapshot(0L, filter) : store.replay(cursor, filter);
            subscriber = registry.register(filter, channel);
            replayedTotal.addAndGet(replay.size());
        }
        logger.debug(
                "Subscriber {} registered (cursor='{}', replay={}, filter={})",
                subscriber.id(),
                request.cursor(),
                replay.size(),
                filter
        );
        EventReceiver receiver = new EventReceiver(subscriber, this::unsubscribe);
        return new Subscription(subscriber.id(), receiver, replay);
    }

    /**
     * Removes the subscriber; no further events reach its channel. Unknown ids are ignored.
     */
    public void unsubscribe(String subscriberId) {
        boolean removed;
        synchronized (lock) {
            removed = registry.remove(subscriberId);
        }
        if (removed) {
            logger.debug("Subscriber {} unsubscribed", subscriberId);
        }
    }

    private static void logBroadcast(Event event, SubscriptionRegistry.BroadcastResult result) {
        for (String subscriberId : result.saturated()) {
            logger.warn(
                    "Subscriber {} channel is full; dropping events until it drains (first dropped id={})",
                    subscriberId,
                    event.id()
            );
        }
        if (result.dropped() > result.saturated().size()) {
            logger.debug("Dropped event {} for {} slow subscriber(s)", event.id(), result.dropped());
        }
        if (result.reaped() > 0) {
            logger.debug("Reaped {} closed subscriber(s) during broadcast of event {}", result.reaped(), event.id());
        }
    }

    public Event publishAgentStateChanged(
            String agentId,
            String workspaceId,
            int previousState,
            int newState,
            String reason
    ) {
        return publishPayload(agentId, workspaceId, new EventPayload.AgentStateChanged(previousState, newState, reason));
    }

    public Event publishError(
            String agentId,
            String workspaceId,
            String code,
            String message,
            boolean recoverable
    ) {
        return publishPayload(agentId, workspaceId, new EventPayload.Error(code, message, recoverable));
    }

    public Event publishPaneContentChanged(
            String agentId,
            String workspaceId,
            String contentHash,
            int linesChanged
    ) {
        return publishPayload(agentId, workspaceId, new EventPayload.PaneContentChanged(contentHash, linesChanged));
    }

    public Event publishResourceViolation(
            String agentId,
            String workspaceId,
            int resourceType,
            double currentValue,
            double limitValue,
            int violationCount,
            int actionTaken
    ) {
        return publishPayload(
                agentId,
                workspaceId,
                new EventPayload.ResourceViolation(resourceType, currentValue, limitValue, violationCount, actionTaken)
        );
    }

    private Event publishPayload(String agentId, String workspaceId, EventPayload payload) {
        EventKind kind = payload.kind();
        return publish(new Event("", kind, Instant.now(), agentId, workspaceId, payload));
    }

    public int storedCount() {
        synchronized (lock) {
            return store.size();
        }
    }

    public int subscriberCount() {
        synchronized (lock) {
            return registry.size();
        }
    }

    List<StoredEvent> storedEvents() {
        synchronized (lock) {
            return store.entries();
        }
    }

    public EventBusStats stats() {
        synchronized (lock) {
            return new EventBusStats(
                    store.size(),
                    store.capacity(),
                    store.oldestId(),
                    store.nextId(),
                    registry.size(),
                    publishedTotal.get(),
                    deliveredTotal.get(),
                    droppedTotal.get(),
                    replayedTotal.get(),
                    subscribeRejectedTotal.get()
            );
        }
    }

    static long parseCursor(String raw) {
        if (raw == null || raw.isEmpty()) {
            return 0L;
        }
        try {
            return Long.parseLong(raw);
        } catch (NumberFormatException e) {
            throw new InvalidCursorException(raw, e);
        }
    }
}

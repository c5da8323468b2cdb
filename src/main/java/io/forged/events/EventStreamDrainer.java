package io.forged.events;

import io.forged.model.Event;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Bounded stream session over the bus: replay first, then a fixed number of live polls.
 * Used where a full streaming transport is not available (CLI, tests).
 */
public final class EventStreamDrainer {
    private final EventBus bus;
    private final Duration pollInterval;

    public EventStreamDrainer(EventBus bus) {
        this(bus, Duration.ofMillis(bus.config().streamPollIntervalMs()));
    }

    public EventStreamDrainer(EventBus bus, Duration pollInterval) {
        this.bus = bus;
        this.pollInterval = pollInterval == null || pollInterval.isNegative() ? Duration.ZERO : pollInterval;
    }

    /**
     * Collects the replay for {@code request} and whatever arrives live over {@code maxPolls}
     * polls. The subscriber is always removed before returning.
     *
     * @throws InvalidCursorException for an unparsable cursor
     * @throws InterruptedException   if interrupted between polls
     */
    public List<Event> drain(SubscribeRequest request, int maxPolls) throws InterruptedException {
        Subscription subscription = bus.subscribe(request);
        List<Event> out = new ArrayList<>(subscription.replay());
        try (EventReceiver receiver = subscription.receiver()) {
            for (int poll = 0; poll < maxPolls; poll++) {
                if (poll > 0) {
                    Thread.sleep(pollInterval.toMillis());
                }
                receiver.drainTo(out);
            }
        }
        return out;
    }
}

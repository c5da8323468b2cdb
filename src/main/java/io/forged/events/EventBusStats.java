package io.forged.events;

public record EventBusStats(
        int storedEvents,
        int storeCapacity,
        long oldestEventId,
        long nextEventId,
        int subscribers,
        long publishedTotal,
        long deliveredTotal,
        long droppedTotal,
        long replayedTotal,
        long subscribeRejectedTotal
) {
}

package io.forged.events;

import io.forged.model.Event;

/**
 * Store entry pairing the numeric id used for cursor comparison with the stamped event.
 */
public record StoredEvent(long id, Event event) {
}

package io.forged.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Immutable bus event. {@code id} stays empty until the bus stamps it at publish time;
 * empty agent or workspace ids mark an event as unscoped on that dimension.
 */
public record Event(
        String id,
        EventKind kind,
        Instant timestamp,
        String agentId,
        String workspaceId,
        EventPayload payload
) {
    public Event {
        Objects.requireNonNull(kind, "kind");
        id = id == null ? "" : id;
        timestamp = timestamp == null ? Instant.now() : timestamp;
        agentId = agentId == null ? "" : agentId;
        workspaceId = workspaceId == null ? "" : workspaceId;
        if (payload != null && payload.kind() != kind) {
            throw new IllegalArgumentException(
                    "Payload " + payload.kind() + " does not match event kind " + kind
            );
        }
    }

    public static Event of(EventKind kind, String agentId, String workspaceId, EventPayload payload) {
        return new Event("", kind, Instant.now(), agentId, workspaceId, payload);
    }

    public Event withId(String newId) {
        return new Event(newId, kind, timestamp, agentId, workspaceId, payload);
    }

    public boolean isAgentScoped() {
        return !agentId.isEmpty();
    }

    public boolean isWorkspaceScoped() {
        return !workspaceId.isEmpty();
    }
}

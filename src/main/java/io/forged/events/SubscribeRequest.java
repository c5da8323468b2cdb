package io.forged.events;

import java.util.List;

/**
 * Consumer-side stream request. Empty lists leave that dimension unrestricted; an empty
 * cursor means "live events only".
 */
public record SubscribeRequest(
        String cursor,
        List<Integer> kinds,
        List<String> agentIds,
        List<String> workspaceIds
) {
    public SubscribeRequest {
        cursor = cursor == null ? "" : cursor;
        kinds = kinds == null ? List.of() : List.copyOf(kinds);
        agentIds = agentIds == null ? List.of() : List.copyOf(agentIds);
        workspaceIds = workspaceIds == null ? List.of() : List.copyOf(workspaceIds);
    }

    public static SubscribeRequest live() {
        return new SubscribeRequest("", List.of(), List.of(), List.of());
    }

    public static SubscribeRequest fromCursor(String cursor) {
        return new SubscribeRequest(cursor, List.of(), List.of(), List.of());
    }

    public SubscribeRequest withKinds(Integer... values) {
        return new SubscribeRequest(cursor, List.of(values), agentIds, workspaceIds);
    }

    public SubscribeRequest withAgentIds(String... values) {
        return new SubscribeRequest(cursor, kinds, List.of(values), workspaceIds);
    }

    public SubscribeRequest withWorkspaceIds(String... values) {
        return new SubscribeRequest(cursor, kinds, agentIds, List.of(values));
    }

    public EventFilter toFilter() {
        return EventFilter.of(kinds, agentIds, workspaceIds);
    }
}

package io.forged.events;

import io.forged.model.Event;

/**
 * Decides whether an event passes a subscriber filter.
 *
 * <p>Agent and workspace sets mean "these scopes plus anything unscoped": an event with
 * an empty agent id is never rejected by an agent set, likewise for workspaces. Kinds
 * have no such exemption.
 */
public final class FilterEvaluator {
    private FilterEvaluator() {
    }

    public static boolean matches(Event event, EventFilter filter) {
        if (filter == null) {
            return true;
        }
        if (filter.kinds() != null && !filter.kinds().contains(event.kind().code())) {
            return false;
        }
        if (filter.agentIds() != null
                && event.isAgentScoped()
                && !filter.agentIds().contains(event.agentId())) {
            return false;
        }
        if (filter.workspaceIds() != null
                && event.isWorkspaceScoped()
                && !filter.workspaceIds().contains(event.workspaceId())) {
            return false;
        }
        return true;
    }
}

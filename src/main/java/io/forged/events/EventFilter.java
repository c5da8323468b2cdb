package io.forged.events;

import java.util.Collection;
import java.util.Set;

/**
 * Per-subscriber inclusion sets. A {@code null} dimension places no restriction on it;
 * a present dimension is never empty.
 */
public record EventFilter(
        Set<Integer> kinds,
        Set<String> agentIds,
        Set<String> workspaceIds
) {
    public static final EventFilter ALL = new EventFilter(null, null, null);

    public EventFilter {
        kinds = immutableNonEmpty(kinds, "kinds");
        agentIds = immutableNonEmpty(agentIds, "agentIds");
        workspaceIds = immutableNonEmpty(workspaceIds, "workspaceIds");
    }

    public static EventFilter of(
            Collection<Integer> kinds,
            Collection<String> agentIds,
            Collection<String> workspaceIds
    ) {
        return new EventFilter(toSetOrNull(kinds), toSetOrNull(agentIds), toSetOrNull(workspaceIds));
    }

    public boolean isUnrestricted() {
        return kinds == null && agentIds == null && workspaceIds == null;
    }

    private static <T> Set<T> toSetOrNull(Collection<T> values) {
        if (values == null || values.isEmpty()) {
            return null;
        }
        return Set.copyOf(values);
    }

    private static <T> Set<T> immutableNonEmpty(Set<T> values, String dimension) {
        if (values == null) {
            return null;
        }
        if (values.isEmpty()) {
            throw new IllegalArgumentException("Filter dimension " + dimension + " must be absent or non-empty");
        }
        return Set.copyOf(values);
    }
}

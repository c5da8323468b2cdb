package io.forged.model;

/**
 * Kind-specific body of an {@link Event}. Each variant reports the kind it belongs to,
 * and {@link Event} refuses a payload whose kind differs from its own.
 */
public sealed interface EventPayload permits
        EventPayload.AgentStateChanged,
        EventPayload.Error,
        EventPayload.PaneContentChanged,
        EventPayload.ResourceViolation {

    EventKind kind();

    /**
     * Agent state transition. States are the daemon's wire codes for the agent
     * state machine.
     */
    record AgentStateChanged(int previousState, int newState, String reason) implements EventPayload {
        public AgentStateChanged {
            reason = reason == null ? "" : reason;
        }

        @Override
        public EventKind kind() {
            return EventKind.AGENT_STATE_CHANGED;
        }
    }

    record Error(String code, String message, boolean recoverable) implements EventPayload {
        public Error {
            code = code == null ? "" : code;
            message = message == null ? "" : message;
        }

        @Override
        public EventKind kind() {
            return EventKind.ERROR;
        }
    }

    record PaneContentChanged(String contentHash, int linesChanged) implements EventPayload {
        public PaneContentChanged {
            contentHash = contentHash == null ? "" : contentHash;
        }

        @Override
        public EventKind kind() {
            return EventKind.PANE_CONTENT_CHANGED;
        }
    }

    record ResourceViolation(
            int resourceType,
            double currentValue,
            double limitValue,
            int violationCount,
            int actionTaken
    ) implements EventPayload {
        @Override
        public EventKind kind() {
            return EventKind.RESOURCE_VIOLATION;
        }
    }
}

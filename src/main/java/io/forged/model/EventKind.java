package io.forged.model;

public enum EventKind {
    UNSPECIFIED(0),
    AGENT_STATE_CHANGED(1),
    ERROR(2),
    PANE_CONTENT_CHANGED(3),
    RESOURCE_VIOLATION(4);

    private final int code;

    EventKind(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }

    public static EventKind fromCode(int code) {
        for (EventKind value : values()) {
            if (value.code == code) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown event kind code: " + code);
    }
}

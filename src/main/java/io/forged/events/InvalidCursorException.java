package io.forged.events;

/**
 * Rejected subscribe request: the cursor is neither empty nor a decimal integer.
 */
public final class InvalidCursorException extends IllegalArgumentException {
    private final String cursor;

    public InvalidCursorException(String cursor, Throwable cause) {
        super("invalid cursor: " + cursor, cause);
        this.cursor = cursor;
    }

    public String cursor() {
        return cursor;
    }
}

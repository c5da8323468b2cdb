package io.forged.config;

import io.forged.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Sizing and replay policy of the daemon's event bus.
 *
 * <p>Values come from {@value #SETTINGS_FILE_NAME} under the daemon root when present;
 * every field is optional there and falls back to the defaults below.
 */
public final class EventBusConfig {
    private static final Logger logger = LoggerFactory.getLogger(EventBusConfig.class);

    public static final String SETTINGS_FILE_NAME = "forged-events.json";
    public static final int MAX_STORED_EVENTS = 1000;
    public static final int EVENT_CHANNEL_BUFFER = 100;
    public static final long DEFAULT_STREAM_POLL_INTERVAL_MS = 100L;

    private final int maxStoredEvents;
    private final int eventChannelBuffer;
    private final boolean replayFromZeroCursor;
    private final long streamPollIntervalMs;

    public EventBusConfig(
            int maxStoredEvents,
            int eventChannelBuffer,
            boolean replayFromZeroCursor,
            long streamPollIntervalMs
    ) {
        if (maxStoredEvents < 1) {
            throw new IllegalArgumentException("maxStoredEvents must be >= 1: " + maxStoredEvents);
        }
        if (eventChannelBuffer < 1) {
            throw new IllegalArgumentException("eventChannelBuffer must be >= 1: " + eventChannelBuffer);
        }
        if (streamPollIntervalMs < 1L) {
            throw new IllegalArgumentException("streamPollIntervalMs must be >= 1: " + streamPollIntervalMs);
        }
        this.maxStoredEvents = maxStoredEvents;
        this.eventChannelBuffer = eventChannelBuffer;
        this.replayFromZeroCursor = replayFromZeroCursor;
        this.streamPollIntervalMs = streamPollIntervalMs;
    }

    public static EventBusConfig defaults() {
        return new EventBusConfig(MAX_STORED_EVENTS, EVENT_CHANNEL_BUFFER, false, DEFAULT_STREAM_POLL_INTERVAL_MS);
    }

    public static EventBusConfig fromRoot(String root) {
        Path resolved = root == null || root.isBlank()
                ? Paths.get("data")
                : Paths.get(root);
        return load(resolved.toAbsolutePath().normalize().resolve(SETTINGS_FILE_NAME));
    }

    public static EventBusConfig load(Path settingsFile) {
        EventBusConfig defaults = defaults();
        if (settingsFile == null || !Files.isRegularFile(settingsFile)) {
            logger.debug("No event bus settings at {}; using defaults", settingsFile);
            return defaults;
        }
        SettingsFile file;
        try {
            file = Jsons.mapper().readValue(settingsFile.toFile(), SettingsFile.class);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to load event bus settings: " + settingsFile, e);
        }
        EventBusConfig resolved = fromFile(file, defaults);
        logger.info(
                "Loaded event bus settings from {}: maxStoredEvents={}, eventChannelBuffer={}, replayFromZeroCursor={}",
                settingsFile,
                resolved.maxStoredEvents,
                resolved.eventChannelBuffer,
                resolved.replayFromZeroCursor
        );
        return resolved;
    }

    static EventBusConfig fromFile(SettingsFile file, EventBusConfig defaults) {
        if (file == null) {
            return defaults;
        }
        return new EventBusConfig(
                sanitizeInt(file.maxStoredEvents(), defaults.maxStoredEvents, 1),
                sanitizeInt(file.eventChannelBuffer(), defaults.eventChannelBuffer, 1),
                file.replayFromZeroCursor() == null ? defaults.replayFromZeroCursor : file.replayFromZeroCursor(),
                sanitizeLong(file.streamPollIntervalMs(), defaults.streamPollIntervalMs, 1L)
        );
    }

    private static int sanitizeInt(Integer value, int fallback, int min) {
        if (value == null) {
            return fallback;
        }
        return Math.max(min, value);
    }

    private static long sanitizeLong(Long value, long fallback, long min) {
        if (value == null) {
            return fallback;
        }
        return Math.max(min, value);
    }

    public EventBusConfig withMaxStoredEvents(int value) {
        return new EventBusConfig(value, eventChannelBuffer, replayFromZeroCursor, streamPollIntervalMs);
    }

    public EventBusConfig withEventChannelBuffer(int value) {
        return new EventBusConfig(maxStoredEvents, value, replayFromZeroCursor, streamPollIntervalMs);
    }

    public EventBusConfig withReplayFromZeroCursor(boolean value) {
        return new EventBusConfig(maxStoredEvents, eventChannelBuffer, value, streamPollIntervalMs);
    }

    public int maxStoredEvents() {
        return maxStoredEvents;
    }

    public int eventChannelBuffer() {
        return eventChannelBuffer;
    }

    public boolean replayFromZeroCursor() {
        return replayFromZeroCursor;
    }

    public long streamPollIntervalMs() {
        return streamPollIntervalMs;
    }

    public SettingsView toView() {
        return new SettingsView(maxStoredEvents, eventChannelBuffer, replayFromZeroCursor, streamPollIntervalMs);
    }

    public record SettingsView(
            int maxStoredEvents,
            int eventChannelBuffer,
            boolean replayFromZeroCursor,
            long streamPollIntervalMs
    ) {
    }

    record SettingsFile(
            Integer maxStoredEvents,
            Integer eventChannelBuffer,
            Boolean replayFromZeroCursor,
            Long streamPollIntervalMs
    ) {
    }
}

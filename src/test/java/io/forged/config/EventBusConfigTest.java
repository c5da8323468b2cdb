package io.forged.config;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;

final class EventBusConfigTest {

    @Test
    void defaultsMatchDaemonSizing() {
        EventBusConfig config = EventBusConfig.defaults();
        Assertions.assertEquals(1000, config.maxStoredEvents());
        Assertions.assertEquals(100, config.eventChannelBuffer());
        Assertions.assertFalse(config.replayFromZeroCursor());
        Assertions.assertEquals(100L, config.streamPollIntervalMs());
    }

    @Test
    void missingSettingsFileFallsBackToDefaults() throws Exception {
        Path root = Files.createTempDirectory("forged-events-config-missing-");
        try {
            EventBusConfig config = EventBusConfig.fromRoot(root.toString());
            Assertions.assertEquals(EventBusConfig.defaults().toView(), config.toView());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void settingsFileOverridesAndClampsValues() throws Exception {
        Path root = Files.createTempDirectory("forged-events-config-override-");
        try {
            Files.writeString(
                    root.resolve(EventBusConfig.SETTINGS_FILE_NAME),
                    """
                            {
                              "maxStoredEvents": 250,
                              "eventChannelBuffer": 0,
                              "replayFromZeroCursor": true,
                              "streamPollIntervalMs": 0,
                              "unknownField": "ignored"
                            }
                            """,
                    StandardCharsets.UTF_8
            );
            EventBusConfig config = EventBusConfig.fromRoot(root.toString());
            Assertions.assertEquals(250, config.maxStoredEvents());
            Assertions.assertEquals(1, config.eventChannelBuffer());
            Assertions.assertTrue(config.replayFromZeroCursor());
            Assertions.assertEquals(1L, config.streamPollIntervalMs());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void malformedSettingsFileFailsLoudly() throws Exception {
        Path root = Files.createTempDirectory("forged-events-config-bad-");
        try {
            Path file = root.resolve(EventBusConfig.SETTINGS_FILE_NAME);
            Files.writeString(file, "{ not json", StandardCharsets.UTF_8);
            IllegalStateException error = Assertions.assertThrows(
                    IllegalStateException.class,
                    () -> EventBusConfig.load(file)
            );
            Assertions.assertNotNull(error.getCause());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void constructorRejectsNonPositiveValues() {
        Assertions.assertThrows(IllegalArgumentException.class, () -> new EventBusConfig(0, 10, false, 100L));
        Assertions.assertThrows(IllegalArgumentException.class, () -> new EventBusConfig(10, 0, false, 100L));
        Assertions.assertThrows(IllegalArgumentException.class, () -> new EventBusConfig(10, 10, false, 0L));
        Assertions.assertThrows(IllegalArgumentException.class, () -> new EventBusConfig(10, 10, false, -5L));
    }

    private static void deleteRecursively(Path root) throws IOException {
        if (root == null || !Files.exists(root)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            for (Path path : walk.sorted((a, b) -> Integer.compare(b.getNameCount(), a.getNameCount())).toList()) {
                Files.deleteIfExists(path);
            }
        }
    }
}

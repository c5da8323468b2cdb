package io.forged.cli;

import com.fasterxml.jackson.databind.JsonNode;
import io.forged.util.Jsons;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

final class ForgedEventsCommandTest {

    @Test
    void settingsPrintsResolvedConfiguration() throws Exception {
        Path root = Files.createTempDirectory("forged-events-cli-settings-");
        try {
            Files.writeString(root.resolve("forged-events.json"), "{\"maxStoredEvents\": 42}", StandardCharsets.UTF_8);
            Run run = execute("--root", root.toString(), "settings");
            Assertions.assertEquals(0, run.exitCode());
            JsonNode node = Jsons.mapper().readTree(run.out());
            Assertions.assertEquals(42, node.path("maxStoredEvents").asInt());
            Assertions.assertEquals(100, node.path("eventChannelBuffer").asInt());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void simulateReplaysFromCursorThenStreamsLiveEvents() throws Exception {
        Path root = Files.createTempDirectory("forged-events-cli-simulate-");
        try {
            Run run = execute("--root", root.toString(), "simulate", "--count", "4", "--live", "2", "--cursor", "2");
            Assertions.assertEquals(0, run.exitCode());
            List<JsonNode> lines = jsonLines(run.out());
            List<String> ids = new ArrayList<>();
            for (JsonNode line : lines) {
                ids.add(line.path("id").asText());
            }
            Assertions.assertEquals(List.of("2", "3", "4", "5"), ids);
            Assertions.assertTrue(lines.get(0).path("payload").has("resource_violation"));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void simulateAppliesKindFilterAndPrintsMetrics() throws Exception {
        Path root = Files.createTempDirectory("forged-events-cli-filter-");
        try {
            Run run = execute("--root", root.toString(), "simulate", "--count", "8", "--live", "4",
                    "--cursor", "1", "--kind", "2", "--metrics", "--namespace", "fleet");
            Assertions.assertEquals(0, run.exitCode());
            List<JsonNode> lines = jsonLines(run.out());
            Assertions.assertEquals(3, lines.size());
            for (JsonNode line : lines) {
                Assertions.assertEquals(2, line.path("kind").asInt());
            }
            Assertions.assertTrue(run.out().contains("forged_events_published_total{namespace=\"fleet\"} 12"));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void simulateRejectsInvalidCursor() throws Exception {
        Path root = Files.createTempDirectory("forged-events-cli-invalid-");
        try {
            Run run = execute("--root", root.toString(), "simulate", "--cursor", "abc");
            Assertions.assertEquals(2, run.exitCode());
            Assertions.assertTrue(run.err().contains("invalid cursor: abc"));
        } finally {
            deleteRecursively(root);
        }
    }

    private static Run execute(String... args) {
        StringWriter out = new StringWriter();
        StringWriter err = new StringWriter();
        CommandLine cmd = new CommandLine(new ForgedEventsCommand());
        cmd.setOut(new PrintWriter(out, true));
        cmd.setErr(new PrintWriter(err, true));
        int code = cmd.execute(args);
        return new Run(code, out.toString(), err.toString());
    }

    private static List<JsonNode> jsonLines(String text) throws IOException {
        List<JsonNode> out = new ArrayList<>();
        for (String line : text.split("\\r?\\n")) {
            if (line.startsWith("{")) {
                out.add(Jsons.mapper().readTree(line));
            }
        }
        return out;
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

    private record Run(int exitCode, String out, String err) {
    }
}

package io.phaseline.cli;

import com.fasterxml.jackson.databind.JsonNode;
import io.phaseline.config.PhaselineConfig;
import io.phaseline.error.StepMismatchException;
import io.phaseline.util.Jsons;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.stream.Stream;

final class PhaselineCommandTest {

    @Test
    void inProcessCommandsDriveASession() throws Exception {
        Path root = Files.createTempDirectory("phaseline-test-cli-");
        try {
            Run init = run(root, "init", "graph", "theory", "foundations", "--mode", "hybrid");
            Assertions.assertEquals(0, init.code(), init.err());
            JsonNode created = Jsons.mapper().readTree(init.out());
            String id = created.path("sessionId").asText();
            Assertions.assertEquals("graph theory foundations", created.path("query").asText());
            Assertions.assertEquals("hybrid", created.path("dataSourceMode").asText());

            Run next = run(root, "next", id);
            Assertions.assertEquals("self-ask-decomposer",
                    Jsons.mapper().readTree(next.out()).path("agent").path("key").asText());

            Run complete = run(root, "complete", id, "self-ask-decomposer", "--result", "{\"questions\":3}");
            Assertions.assertEquals(0, complete.code(), complete.err());
            Assertions.assertEquals("step-back-analyzer",
                    Jsons.mapper().readTree(complete.out()).path("nextAgent").asText());

            Path notes = root.resolve("notes.md");
            Files.writeString(notes, "plain text, not json", StandardCharsets.UTF_8);
            Run fromFile = run(root, "complete", id, "step-back-analyzer", "--file", notes.toString());
            Assertions.assertEquals(0, fromFile.code(), fromFile.err());

            Run status = run(root, "status", id);
            JsonNode statusJson = Jsons.mapper().readTree(status.out());
            Assertions.assertEquals(2, statusJson.path("progress").path("completed").asInt());
            Assertions.assertEquals("running", statusJson.path("status").asText());

            String stored = Files.readString(PhaselineConfig.fromRoot(root).sessionFile(id), StandardCharsets.UTF_8);
            Assertions.assertTrue(stored.contains("plain text, not json"));

            Run list = run(root, "list");
            Assertions.assertEquals(1, Jsons.mapper().readTree(list.out()).path("total").asInt());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void failuresAreReportedAsJsonOnStderr() throws Exception {
        Path root = Files.createTempDirectory("phaseline-test-cli-errors-");
        try {
            String id = Jsons.mapper().readTree(run(root, "init", "graph theory").out()).path("sessionId").asText();

            Run mismatch = run(root, "complete", id, "research-planner");
            Assertions.assertEquals(1, mismatch.code());
            JsonNode error = Jsons.mapper().readTree(mismatch.err());
            Assertions.assertEquals("mismatch", error.path("kind").asText());
            Assertions.assertEquals("self-ask-decomposer", error.path("expected").asText());

            Run missing = run(root, "status", "3b241101-e2bb-4255-8caf-4136c566a962");
            Assertions.assertEquals(1, missing.code());
            Assertions.assertEquals("not_found", Jsons.mapper().readTree(missing.err()).path("kind").asText());

            Run badMode = run(root, "init", "q", "--mode", "satellite");
            Assertions.assertEquals("invalid_request", Jsons.mapper().readTree(badMode.err()).path("kind").asText());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void describeFallsBackForPlainExceptions() {
        Map<String, Object> plain = JsonErrorReporter.describe(new IllegalStateException());
        Assertions.assertEquals("IllegalStateException", plain.get("error"));
        Assertions.assertEquals("internal", plain.get("kind"));

        Map<String, Object> typed = JsonErrorReporter.describe(new StepMismatchException("a", "b"));
        Assertions.assertEquals("mismatch", typed.get("kind"));
        Assertions.assertEquals("b", typed.get("got"));
    }

    private static Run run(Path root, String... args) {
        String[] full = new String[args.length + 3];
        full[0] = "--root";
        full[1] = root.toString();
        full[2] = "--no-daemon";
        System.arraycopy(args, 0, full, 3, args.length);

        PrintStream originalOut = System.out;
        PrintStream originalErr = System.err;
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        ByteArrayOutputStream err = new ByteArrayOutputStream();
        int code;
        try {
            System.setOut(new PrintStream(out, true, StandardCharsets.UTF_8));
            System.setErr(new PrintStream(err, true, StandardCharsets.UTF_8));
            code = PhaselineCommand.newCommandLine().execute(full);
        } finally {
            System.setOut(originalOut);
            System.setErr(originalErr);
        }
        return new Run(code, out.toString(StandardCharsets.UTF_8), err.toString(StandardCharsets.UTF_8));
    }

    private record Run(int code, String out, String err) {
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

package io.phaseline.observability;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

final class AuditLoggerTest {

    @Test
    void rowsFormAVerifiableHashChain() throws Exception {
        Path root = Files.createTempDirectory("phaseline-test-audit-chain-");
        try {
            Path file = root.resolve("audit").resolve("audit.log");
            AuditLogger logger = new AuditLogger(file);
            logger.log(AuditLogger.AuditEvent.of("session.init", "session/s1", "ok", "s1", null, Map.of("mode", "local")));
            logger.log(AuditLogger.AuditEvent.of("step.complete", "session/s1", "ok", "s1", "self-ask-decomposer",
                    Map.of("index", 0)));

            AuditLogger.VerifyOutcome verified = logger.verify();
            Assertions.assertTrue(verified.ok(), String.valueOf(verified.problems()));
            Assertions.assertEquals(2, verified.rows());

            AuditLogger reopened = new AuditLogger(file);
            Assertions.assertEquals(logger.currentHash(), reopened.currentHash());
            reopened.log(AuditLogger.AuditEvent.of("session.abort", "session/s1", "ok", "s1", null, null));
            Assertions.assertTrue(reopened.verify().ok());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void editedRowBreaksVerification() throws Exception {
        Path root = Files.createTempDirectory("phaseline-test-audit-tamper-");
        try {
            Path file = root.resolve("audit.log");
            AuditLogger logger = new AuditLogger(file);
            logger.log(AuditLogger.AuditEvent.of("session.init", "session/s1", "ok", "s1", null, Map.of()));
            logger.log(AuditLogger.AuditEvent.of("session.abort", "session/s1", "ok", "s1", null, Map.of()));

            List<String> lines = new ArrayList<>(Files.readAllLines(file, StandardCharsets.UTF_8));
            lines.set(0, lines.get(0).replace("session.init", "session.hack"));
            Files.write(file, lines, StandardCharsets.UTF_8);

            AuditLogger.VerifyOutcome verified = logger.verify();
            Assertions.assertFalse(verified.ok());
            Assertions.assertTrue(verified.problems().get(0).contains("row 1"));
        } finally {
            deleteRecursively(root);
        }
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

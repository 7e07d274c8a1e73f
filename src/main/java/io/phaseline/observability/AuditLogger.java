package io.phaseline.observability;

import com.fasterxml.jackson.databind.JsonNode;
import io.phaseline.util.Hashing;
import io.phaseline.util.Jsons;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Append-only JSONL trail of pipeline transitions. Each row carries the hash of the previous
 * row, so truncation or edits in the middle are detectable with {@link #verify()}.
 */
public final class AuditLogger {
    private final Path auditFile;
    private String previousHash;

    public AuditLogger(Path auditFile) {
        this.auditFile = auditFile;
        try {
            Files.createDirectories(auditFile.getParent());
            if (!Files.exists(auditFile)) {
                try {
                    Files.createFile(auditFile);
                } catch (FileAlreadyExistsException ignored) {
                    // Another process created it between exists() and createFile().
                }
            }
        } catch (IOException e) {
            throw new RuntimeException("Failed to initialize audit log file: " + auditFile, e);
        }
        this.previousHash = loadLastHash();
    }

    public synchronized void log(AuditEvent event) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("timestamp", Instant.now().toString());
        row.put("action", event.action());
        row.put("actor", event.actor());
        row.put("resource", event.resource());
        row.put("result", event.result());
        row.put("session_id", event.sessionId());
        row.put("step_key", event.stepKey());
        row.put("details", event.details());
        row.put("prev_hash", previousHash);
        String rowHash = Hashing.sha256Hex(Jsons.toCompactJson(row));
        row.put("hash", rowHash);
        String line = Jsons.toCompactJson(row) + System.lineSeparator();
        try {
            Files.writeString(auditFile, line, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
            previousHash = rowHash;
        } catch (IOException e) {
            throw new RuntimeException("Failed to write audit log", e);
        }
    }

    public synchronized String currentHash() {
        return previousHash;
    }

    /**
     * Re-derives every row hash and checks the chain links.
     */
    public synchronized VerifyOutcome verify() {
        List<String> problems = new ArrayList<>();
        String prev = "";
        int rows = 0;
        for (String line : readLines()) {
            if (line.isBlank()) {
                continue;
            }
            rows++;
            try {
                JsonNode node = Jsons.mapper().readTree(line);
                String recorded = node.path("hash").asText("");
                if (!prev.equals(node.path("prev_hash").asText(""))) {
                    problems.add("row " + rows + ": broken prev_hash link");
                }
                Map<String, Object> row = new LinkedHashMap<>();
                node.fields().forEachRemaining(e -> {
                    if (!"hash".equals(e.getKey())) {
                        row.put(e.getKey(), e.getValue());
                    }
                });
                if (!recorded.equals(Hashing.sha256Hex(Jsons.toCompactJson(row)))) {
                    problems.add("row " + rows + ": hash mismatch");
                }
                prev = recorded;
            } catch (IOException e) {
                problems.add("row " + rows + ": unparsable");
            }
        }
        return new VerifyOutcome(problems.isEmpty(), rows, problems);
    }

    private List<String> readLines() {
        try {
            return Files.readAllLines(auditFile, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new RuntimeException("Failed to read audit log: " + auditFile, e);
        }
    }

    private String loadLastHash() {
        String last = "";
        for (String line : readLines()) {
            if (line != null && !line.isBlank()) {
                last = line;
            }
        }
        if (last.isBlank()) {
            return "";
        }
        try {
            return Jsons.mapper().readTree(last).path("hash").asText("");
        } catch (IOException e) {
            return "";
        }
    }

    public record AuditEvent(
            String action,
            String actor,
            String resource,
            String result,
            String sessionId,
            String stepKey,
            Map<String, Object> details
    ) {
        public static AuditEvent of(
                String action,
                String resource,
                String result,
                String sessionId,
                String stepKey,
                Map<String, Object> details
        ) {
            return new AuditEvent(action, "pipeline", resource, result, sessionId, stepKey,
                    details == null ? Map.of() : details);
        }
    }

    public record VerifyOutcome(boolean ok, int rows, List<String> problems) {
    }
}

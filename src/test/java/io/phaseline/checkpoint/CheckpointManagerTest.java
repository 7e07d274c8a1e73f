package io.phaseline.checkpoint;

import com.fasterxml.jackson.core.type.TypeReference;
import io.phaseline.config.PhaselineConfig;
import io.phaseline.config.PhaselineSettings;
import io.phaseline.model.Checkpoint;
import io.phaseline.model.CheckpointState;
import io.phaseline.model.DataSourceMode;
import io.phaseline.model.Session;
import io.phaseline.storage.SessionStore;
import io.phaseline.util.Jsons;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.stream.Stream;

final class CheckpointManagerTest {

    @Test
    void validCheckpointRestoresExactSnapshotBytes() throws Exception {
        Path root = Files.createTempDirectory("phaseline-test-checkpoint-valid-");
        try {
            PhaselineConfig config = PhaselineConfig.fromRoot(root);
            SessionStore store = newStore(config);
            String id = savedSession(store, List.of("self-ask-decomposer"));
            CheckpointManager manager = new CheckpointManager(config, store);

            Path context = config.contextFile(id);
            Files.createDirectories(context.getParent());
            byte[] original = "{\"notes\":[\"ä\",\"b\"]}\n".getBytes(StandardCharsets.UTF_8);
            Files.write(context, original);

            String cp = manager.createCheckpoint(id, 1, "self-ask-decomposer", 0.7d);
            Assertions.assertTrue(cp.startsWith("cp_"));
            Checkpoint stored = manager.find(id, cp).orElseThrow();
            Assertions.assertEquals(CheckpointState.VALID, stored.state());
            Assertions.assertEquals(List.of("self-ask-decomposer"), stored.completedAgents());

            Files.writeString(context, "{\"notes\":[]}", StandardCharsets.UTF_8);
            Assertions.assertTrue(manager.rollbackToCheckpoint(id, cp));
            Assertions.assertArrayEquals(original, Files.readAllBytes(context));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void corruptedCheckpointIsRefusedAndContextUntouched() throws Exception {
        Path root = Files.createTempDirectory("phaseline-test-checkpoint-corrupted-");
        try {
            PhaselineConfig config = PhaselineConfig.fromRoot(root);
            SessionStore store = newStore(config);
            String id = savedSession(store, List.of());
            CheckpointManager manager = new CheckpointManager(config, store);

            Path context = config.contextFile(id);
            Files.createDirectories(context.getParent());
            Files.writeString(context, "{\"v\":1}", StandardCharsets.UTF_8);
            String cp = manager.createCheckpoint(id, 1, "self-ask-decomposer", 0.5d);

            markCorrupted(config, id, cp);
            CheckpointManager reopened = new CheckpointManager(config, store);
            Files.writeString(context, "{\"v\":2}", StandardCharsets.UTF_8);

            Assertions.assertFalse(reopened.rollbackToCheckpoint(id, cp));
            Assertions.assertEquals("{\"v\":2}", Files.readString(context, StandardCharsets.UTF_8));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void checkpointWithoutContextIsPartialAndNotRestorable() throws Exception {
        Path root = Files.createTempDirectory("phaseline-test-checkpoint-partial-");
        try {
            PhaselineConfig config = PhaselineConfig.fromRoot(root);
            SessionStore store = newStore(config);
            String id = savedSession(store, List.of());
            CheckpointManager manager = new CheckpointManager(config, store);

            Assertions.assertTrue(manager.loadCheckpoints(id).isEmpty());
            Assertions.assertTrue(manager.getLatestCheckpoint(id).isEmpty());

            String first = manager.createCheckpoint(id, 1, "self-ask-decomposer", 2.0d);
            String second = manager.createCheckpoint(id, 1, "step-back-analyzer", -1.0d);
            List<Checkpoint> all = manager.loadCheckpoints(id);
            Assertions.assertEquals(2, all.size());
            Assertions.assertEquals(first, all.get(0).id());
            Assertions.assertEquals(second, manager.getLatestCheckpoint(id).orElseThrow().id());
            Assertions.assertEquals(CheckpointState.PARTIAL, all.get(0).state());
            Assertions.assertNull(all.get(0).snapshotPath());
            Assertions.assertEquals(1.0d, all.get(0).quality());
            Assertions.assertEquals(0.0d, all.get(1).quality());

            Assertions.assertFalse(manager.rollbackToCheckpoint(id, first));
            Assertions.assertFalse(manager.rollbackToCheckpoint(id, "cp_unknown"));
            Assertions.assertEquals(2, new CheckpointManager(config, store).loadCheckpoints(id).size());
        } finally {
            deleteRecursively(root);
        }
    }

    private static void markCorrupted(PhaselineConfig config, String sessionId, String checkpointId) throws IOException {
        Path log = config.checkpointLog(sessionId);
        List<Checkpoint> all = Jsons.mapper().readValue(log.toFile(), new TypeReference<List<Checkpoint>>() {
        });
        List<Checkpoint> updated = new ArrayList<>();
        for (Checkpoint c : all) {
            updated.add(c.id().equals(checkpointId)
                    ? new Checkpoint(c.id(), c.timestamp(), c.phase(), c.stepKey(), c.sessionId(), c.snapshotPath(),
                    c.completedAgents(), c.quality(), CheckpointState.CORRUPTED)
                    : c);
        }
        Files.writeString(log, Jsons.toJson(updated), StandardCharsets.UTF_8);
    }

    private static SessionStore newStore(PhaselineConfig config) {
        PhaselineSettings settings = new PhaselineSettings(
                24L * 60L * 60L * 1000L, 3, 0L, 7, 365, false, 2_000L, 2_000L, 60_000L, 4, 3);
        return new SessionStore(config, settings);
    }

    private static String savedSession(SessionStore store, List<String> completed) {
        String id = UUID.randomUUID().toString();
        Session session = store.create(id, "q", "pipeline-x", DataSourceMode.EXTERNAL);
        session.setCompletedAgents(completed);
        session.setCurrentAgentIndex(completed.size());
        store.save(session);
        return id;
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

package io.phaseline.checkpoint;

import com.fasterxml.jackson.core.type.TypeReference;
import io.phaseline.config.PhaselineConfig;
import io.phaseline.model.Checkpoint;
import io.phaseline.model.CheckpointState;
import io.phaseline.storage.SessionStore;
import io.phaseline.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Snapshots the opaque per-session context blob after every completed step and restores it on
 * rollback. The per-session log is a JSON array rewritten in full on each append; checkpoints
 * are never removed automatically.
 */
public final class CheckpointManager {
    private static final Logger log = LoggerFactory.getLogger(CheckpointManager.class);
    private static final TypeReference<List<Checkpoint>> CHECKPOINT_LIST = new TypeReference<>() {
    };

    private final PhaselineConfig config;
    private final SessionStore sessionStore;
    private final Map<String, List<Checkpoint>> cache = new ConcurrentHashMap<>();
    private final Object lock = new Object();

    public CheckpointManager(PhaselineConfig config, SessionStore sessionStore) {
        this.config = config;
        this.sessionStore = sessionStore;
    }

    public String createCheckpoint(String sessionId, int phase, String stepKey, double quality) {
        synchronized (lock) {
            List<Checkpoint> existing = loadCheckpoints(sessionId);
            String id = "cp_" + UUID.randomUUID();
            List<String> completed = sessionStore.load(sessionId).getCompletedAgents();
            Path context = config.contextFile(sessionId);
            String snapshotPath = null;
            CheckpointState state;
            if (Files.isRegularFile(context)) {
                Path snapshot = config.snapshotFile(sessionId, id);
                state = copySnapshot(context, snapshot);
                snapshotPath = snapshot.toString();
            } else {
                state = CheckpointState.PARTIAL;
            }
            Checkpoint checkpoint = new Checkpoint(
                    id,
                    System.currentTimeMillis(),
                    phase,
                    stepKey,
                    sessionId,
                    snapshotPath,
                    completed,
                    Math.max(0.0d, Math.min(1.0d, quality)),
                    state
            );
            List<Checkpoint> updated = new ArrayList<>(existing);
            updated.add(checkpoint);
            writeLog(sessionId, updated);
            cache.put(sessionId, List.copyOf(updated));
            log.debug("Checkpoint {} for session {} at {} ({})", id, sessionId, stepKey, state);
            return id;
        }
    }

    /**
     * Reads the on-disk log, falling back to the in-memory copy. A missing log is an empty list.
     */
    public List<Checkpoint> loadCheckpoints(String sessionId) {
        Path file = config.checkpointLog(sessionId);
        if (!Files.isRegularFile(file)) {
            return cache.getOrDefault(sessionId, List.of());
        }
        try {
            List<Checkpoint> loaded = Jsons.mapper().readValue(file.toFile(), CHECKPOINT_LIST);
            List<Checkpoint> safe = loaded == null ? List.of() : List.copyOf(loaded);
            cache.put(sessionId, safe);
            return safe;
        } catch (IOException e) {
            throw new RuntimeException("Failed to read checkpoint log: " + file, e);
        }
    }

    public Optional<Checkpoint> getLatestCheckpoint(String sessionId) {
        List<Checkpoint> all = loadCheckpoints(sessionId);
        return all.isEmpty() ? Optional.empty() : Optional.of(all.get(all.size() - 1));
    }

    public Optional<Checkpoint> find(String sessionId, String checkpointId) {
        for (Checkpoint checkpoint : loadCheckpoints(sessionId)) {
            if (checkpoint.id().equals(checkpointId)) {
                return Optional.of(checkpoint);
            }
        }
        return Optional.empty();
    }

    /**
     * Copies the snapshot back over the live context. Refuses (false) when the checkpoint is
     * unknown, corrupted or has nothing captured.
     */
    public boolean rollbackToCheckpoint(String sessionId, String checkpointId) {
        synchronized (lock) {
            Optional<Checkpoint> found = find(sessionId, checkpointId);
            if (found.isEmpty()) {
                log.warn("Rollback refused: checkpoint {} not found for session {}", checkpointId, sessionId);
                return false;
            }
            Checkpoint checkpoint = found.get();
            if (checkpoint.state() == CheckpointState.CORRUPTED) {
                log.warn("Rollback refused: checkpoint {} is corrupted", checkpointId);
                return false;
            }
            if (checkpoint.snapshotPath() == null || !Files.isRegularFile(Path.of(checkpoint.snapshotPath()))) {
                log.warn("Rollback refused: checkpoint {} has no snapshot on disk", checkpointId);
                return false;
            }
            Path live = config.contextFile(sessionId);
            try {
                Files.createDirectories(live.getParent());
                Path temp = live.resolveSibling(live.getFileName() + ".restore");
                Files.copy(Path.of(checkpoint.snapshotPath()), temp, StandardCopyOption.REPLACE_EXISTING);
                moveIntoPlace(temp, live);
            } catch (IOException e) {
                throw new RuntimeException("Failed to restore checkpoint " + checkpointId, e);
            }
            log.info("Restored context of session {} from checkpoint {}", sessionId, checkpointId);
            return true;
        }
    }

    private static CheckpointState copySnapshot(Path context, Path snapshot) {
        try {
            Files.createDirectories(snapshot.getParent());
            Files.copy(context, snapshot, StandardCopyOption.REPLACE_EXISTING);
            return Files.size(snapshot) == Files.size(context) ? CheckpointState.VALID : CheckpointState.CORRUPTED;
        } catch (IOException e) {
            log.warn("Snapshot copy failed for {}: {}", context, e.toString());
            return CheckpointState.CORRUPTED;
        }
    }

    private void writeLog(String sessionId, List<Checkpoint> checkpoints) {
        Path file = config.checkpointLog(sessionId);
        Path temp = file.resolveSibling("checkpoints.json.tmp");
        try {
            Files.createDirectories(file.getParent());
            Files.writeString(temp, Jsons.toJson(checkpoints), StandardCharsets.UTF_8);
            moveIntoPlace(temp, file);
        } catch (IOException e) {
            throw new RuntimeException("Failed to write checkpoint log: " + file, e);
        }
    }

    private static void moveIntoPlace(Path temp, Path target) throws IOException {
        try {
            Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }
}

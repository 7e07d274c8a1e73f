package io.phaseline.storage;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import io.phaseline.config.PhaselineConfig;
import io.phaseline.config.PhaselineSettings;
import io.phaseline.error.ErrorKind;
import io.phaseline.error.PipelineException;
import io.phaseline.error.SessionCorruptedException;
import io.phaseline.error.SessionNotFoundException;
import io.phaseline.error.SessionPersistException;
import io.phaseline.model.DataSourceMode;
import io.phaseline.model.Session;
import io.phaseline.model.SessionStatus;
import io.phaseline.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * One JSON document per session under {@code <root>/sessions}.
 *
 * <p>Writes go to a sibling temp file that is then renamed over the target, so a reader never
 * sees a half-written session. There is no cross-process lock: two writers on the same id race
 * and the later rename wins.
 */
public final class SessionStore {
    private static final Logger log = LoggerFactory.getLogger(SessionStore.class);
    private static final Pattern UUID_PATTERN = Pattern.compile(
            "^[0-9a-f]{8}-[0-9a-f]{4}-[1-8][0-9a-f]{3}-[89ab][0-9a-f]{3}-[0-9a-f]{12}$",
            Pattern.CASE_INSENSITIVE
    );
    private static final long DAY_MS = 24L * 60L * 60L * 1000L;

    private final PhaselineConfig config;
    private final PhaselineSettings settings;

    public SessionStore(PhaselineConfig config, PhaselineSettings settings) {
        this.config = config;
        this.settings = settings;
    }

    public static boolean isValidId(String sessionId) {
        return sessionId != null && UUID_PATTERN.matcher(sessionId).matches();
    }

    /**
     * Builds a fresh running session. Nothing is written until {@link #save(Session)}.
     */
    public Session create(String sessionId, String query, String pipelineId, DataSourceMode mode) {
        if (!isValidId(sessionId)) {
            throw new PipelineException(ErrorKind.INVALID_REQUEST, "Invalid session id: " + sessionId);
        }
        long now = System.currentTimeMillis();
        Session session = new Session();
        session.setSessionId(sessionId);
        session.setQuery(query);
        session.setPipelineId(pipelineId);
        session.setDataSourceMode(mode == null ? DataSourceMode.EXTERNAL : mode);
        session.setStatus(SessionStatus.RUNNING);
        session.setCurrentPhase(1);
        session.setCurrentAgentIndex(0);
        session.setStartTime(now);
        session.setLastActivityTime(now);
        return session;
    }

    public void save(Session session) {
        String sessionId = session.getSessionId();
        if (!isValidId(sessionId)) {
            throw new PipelineException(ErrorKind.INVALID_REQUEST, "Invalid session id: " + sessionId);
        }
        Path target = config.sessionFile(sessionId);
        Path temp = target.resolveSibling(sessionId + ".json.tmp");
        String body = Jsons.toJson(session);
        int attempts = settings.writeRetries();
        IOException last = null;
        for (int attempt = 1; attempt <= attempts; attempt++) {
            try {
                Files.createDirectories(target.getParent());
                Files.writeString(temp, body, StandardCharsets.UTF_8);
                moveIntoPlace(temp, target);
                return;
            } catch (IOException e) {
                last = e;
                log.warn("Session write attempt {}/{} failed for {}: {}", attempt, attempts, sessionId, e.toString());
                discardTemp(temp);
                if (attempt < attempts) {
                    pause(session, attempt);
                }
            }
        }
        throw new SessionPersistException(session, attempts, last);
    }

    public Session load(String sessionId) {
        if (!isValidId(sessionId)) {
            throw new SessionNotFoundException(sessionId);
        }
        Path file = config.sessionFile(sessionId);
        String raw;
        try {
            raw = Files.readString(file, StandardCharsets.UTF_8);
        } catch (NoSuchFileException e) {
            throw new SessionNotFoundException(sessionId);
        } catch (IOException e) {
            throw new SessionCorruptedException(sessionId, "unreadable", e);
        }
        JsonNode tree;
        try {
            tree = Jsons.mapper().readTree(raw);
        } catch (JsonProcessingException e) {
            throw new SessionCorruptedException(sessionId, "invalid JSON", e);
        }
        if (tree == null || !tree.isObject()) {
            throw new SessionCorruptedException(sessionId, "not a JSON object");
        }
        for (String field : Session.REQUIRED_FIELDS) {
            if (!tree.hasNonNull(field)) {
                throw new SessionCorruptedException(sessionId, "missing field " + field);
            }
        }
        Session session;
        try {
            session = Jsons.mapper().treeToValue(tree, Session.class);
        } catch (JsonProcessingException e) {
            throw new SessionCorruptedException(sessionId, "invalid field value", e);
        }
        if (!sessionId.equals(session.getSessionId())) {
            throw new SessionCorruptedException(sessionId, "session id does not match file name");
        }
        if (session.getCompletedAgents().size() != session.getCurrentAgentIndex()) {
            throw new SessionCorruptedException(sessionId, "completedAgents does not match currentAgentIndex");
        }
        return session;
    }

    public boolean exists(String sessionId) {
        if (!isValidId(sessionId)) {
            return false;
        }
        return Files.isRegularFile(config.sessionFile(sessionId));
    }

    public boolean isExpired(Session session) {
        return System.currentTimeMillis() - session.getLastActivityTime() > settings.sessionTtlMs();
    }

    /**
     * Best-effort listing: unreadable sessions are skipped. Newest activity first.
     */
    public List<Session> list(boolean includeAll, int maxAgeDays) {
        Path dir = config.sessionsDir();
        if (!Files.isDirectory(dir)) {
            return List.of();
        }
        List<String> ids;
        try (Stream<Path> files = Files.list(dir)) {
            ids = files.map(p -> p.getFileName().toString())
                    .filter(name -> name.endsWith(".json"))
                    .map(name -> name.substring(0, name.length() - ".json".length()))
                    .collect(Collectors.toList());
        } catch (IOException e) {
            throw new RuntimeException("Failed to list sessions: " + dir, e);
        }
        long cutoff = System.currentTimeMillis() - Math.max(0, maxAgeDays) * DAY_MS;
        List<Session> out = new ArrayList<>();
        for (String id : ids) {
            Session session;
            try {
                session = load(id);
            } catch (SessionCorruptedException | SessionNotFoundException e) {
                log.debug("Skipping session {} while listing: {}", id, e.getMessage());
                continue;
            }
            if (!includeAll && session.getLastActivityTime() < cutoff) {
                continue;
            }
            out.add(session);
        }
        out.sort(Comparator.comparingLong(Session::getLastActivityTime).reversed());
        return out;
    }

    public void delete(String sessionId) {
        if (!isValidId(sessionId)) {
            throw new SessionNotFoundException(sessionId);
        }
        try {
            if (!Files.deleteIfExists(config.sessionFile(sessionId))) {
                throw new SessionNotFoundException(sessionId);
            }
        } catch (IOException e) {
            throw new RuntimeException("Failed to delete session: " + sessionId, e);
        }
    }

    public Session updateActivity(Session session) {
        session.setLastActivityTime(System.currentTimeMillis());
        save(session);
        return session;
    }

    public Session updateStatus(Session session, SessionStatus status) {
        session.setStatus(status);
        return updateActivity(session);
    }

    private static void moveIntoPlace(Path temp, Path target) throws IOException {
        try {
            Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static void discardTemp(Path temp) {
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            log.debug("Could not remove temp session file {}: {}", temp, e.toString());
        }
    }

    private void pause(Session session, int attempt) {
        try {
            Thread.sleep(settings.writeRetryDelayMs());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SessionPersistException(session, attempt, e);
        }
    }
}

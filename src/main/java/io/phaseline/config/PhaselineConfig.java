package io.phaseline.config;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Filesystem layout of one data root. Every component resolves its paths through here.
 */
public final class PhaselineConfig {
    public static final String DEFAULT_ROOT = "data";
    public static final String SETTINGS_FILE = "phaseline-settings.json";
    public static final String CATALOG_OVERRIDE_FILE = "catalog.json";
    public static final String STRUCTURE_FILE = "chapter-structure.json";
    public static final String SOCKET_FILE = "phaseline.sock";

    public static final long DEFAULT_SESSION_TTL_MS = 24L * 60L * 60L * 1000L;
    public static final int DEFAULT_WRITE_RETRIES = 3;
    public static final long DEFAULT_WRITE_RETRY_DELAY_MS = 100L;
    public static final int DEFAULT_LIST_MAX_AGE_DAYS = 7;
    public static final int DEFAULT_LIST_ALL_MAX_AGE_DAYS = 365;
    public static final long DEFAULT_DAEMON_REQUEST_TIMEOUT_MS = 30_000L;
    public static final long DEFAULT_DAEMON_STARTUP_TIMEOUT_MS = 10_000L;
    public static final long DEFAULT_DAEMON_IDLE_TIMEOUT_MS = 30L * 60L * 1000L;
    public static final int DEFAULT_DAEMON_MAX_CLIENTS = 16;
    public static final int DEFAULT_EPISODIC_WINDOW = 3;

    private final Path rootDir;

    public PhaselineConfig(Path rootDir) {
        this.rootDir = rootDir;
    }

    public static PhaselineConfig fromRoot(String root) {
        Path resolved = root == null || root.isBlank()
                ? Paths.get(DEFAULT_ROOT)
                : Paths.get(root);
        return new PhaselineConfig(resolved.toAbsolutePath().normalize());
    }

    public static PhaselineConfig fromRoot(Path root) {
        return new PhaselineConfig(root.toAbsolutePath().normalize());
    }

    public Path rootDir() {
        return rootDir;
    }

    public Path sessionsDir() {
        return rootDir.resolve("sessions");
    }

    public Path sessionFile(String sessionId) {
        return sessionsDir().resolve(sessionId + ".json");
    }

    public Path checkpointsDir(String sessionId) {
        return rootDir.resolve("checkpoints").resolve(sessionId);
    }

    public Path checkpointLog(String sessionId) {
        return checkpointsDir(sessionId).resolve("checkpoints.json");
    }

    public Path snapshotFile(String sessionId, String checkpointId) {
        return checkpointsDir(sessionId).resolve("snapshots").resolve(checkpointId + ".json");
    }

    public Path contextDir() {
        return rootDir.resolve("context");
    }

    /**
     * Opaque external context blob owned by the memory subsystem.
     */
    public Path contextFile(String sessionId) {
        return contextDir().resolve(sessionId + ".json");
    }

    public Path episodesFile() {
        return contextDir().resolve("episodes.jsonl");
    }

    public Path researchDir(String slug) {
        return rootDir.resolve("research").resolve(slug);
    }

    public Path structureFile(String slug) {
        return researchDir(slug).resolve(STRUCTURE_FILE);
    }

    public Path auditDir() {
        return rootDir.resolve("audit");
    }

    public Path auditLogFile() {
        return auditDir().resolve("audit.log");
    }

    public Path daemonDir() {
        return rootDir.resolve("daemon");
    }

    public Path socketPath() {
        return daemonDir().resolve(SOCKET_FILE);
    }

    public Path daemonLogFile() {
        return daemonDir().resolve("daemon.log");
    }

    public Path settingsFile() {
        return rootDir.resolve(SETTINGS_FILE);
    }

    public Path catalogOverrideFile() {
        return rootDir.resolve(CATALOG_OVERRIDE_FILE);
    }
}

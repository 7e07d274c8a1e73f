package io.phaseline.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.phaseline.util.Jsons;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Tunables merged from {@code phaseline-settings.json} over built-in defaults. Values below a
 * field's floor are clamped rather than rejected.
 */
public record PhaselineSettings(
        long sessionTtlMs,
        int writeRetries,
        long writeRetryDelayMs,
        int listMaxAgeDays,
        int listAllMaxAgeDays,
        boolean daemonAutoStart,
        long daemonRequestTimeoutMs,
        long daemonStartupTimeoutMs,
        long daemonIdleTimeoutMs,
        int daemonMaxClients,
        int episodicWindow
) {
    public static PhaselineSettings defaults() {
        return new PhaselineSettings(
                PhaselineConfig.DEFAULT_SESSION_TTL_MS,
                PhaselineConfig.DEFAULT_WRITE_RETRIES,
                PhaselineConfig.DEFAULT_WRITE_RETRY_DELAY_MS,
                PhaselineConfig.DEFAULT_LIST_MAX_AGE_DAYS,
                PhaselineConfig.DEFAULT_LIST_ALL_MAX_AGE_DAYS,
                true,
                PhaselineConfig.DEFAULT_DAEMON_REQUEST_TIMEOUT_MS,
                PhaselineConfig.DEFAULT_DAEMON_STARTUP_TIMEOUT_MS,
                PhaselineConfig.DEFAULT_DAEMON_IDLE_TIMEOUT_MS,
                PhaselineConfig.DEFAULT_DAEMON_MAX_CLIENTS,
                PhaselineConfig.DEFAULT_EPISODIC_WINDOW
        );
    }

    public static PhaselineSettings load(PhaselineConfig config) {
        Path file = config.settingsFile();
        if (!Files.exists(file)) {
            return defaults();
        }
        try {
            SettingsFile raw = Jsons.mapper().readValue(file.toFile(), SettingsFile.class);
            return fromFile(raw, defaults());
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read settings file: " + file, e);
        }
    }

    static PhaselineSettings fromFile(SettingsFile file, PhaselineSettings defaults) {
        if (file == null) {
            return defaults;
        }
        int listMaxAge = sanitizeInt(file.listMaxAgeDays(), defaults.listMaxAgeDays(), 1);
        return new PhaselineSettings(
                sanitizeLong(file.sessionTtlMs(), defaults.sessionTtlMs(), 1_000L),
                sanitizeInt(file.writeRetries(), defaults.writeRetries(), 1),
                sanitizeLong(file.writeRetryDelayMs(), defaults.writeRetryDelayMs(), 0L),
                listMaxAge,
                sanitizeInt(file.listAllMaxAgeDays(), defaults.listAllMaxAgeDays(), listMaxAge),
                sanitizeBoolean(file.daemonAutoStart(), defaults.daemonAutoStart()),
                sanitizeLong(file.daemonRequestTimeoutMs(), defaults.daemonRequestTimeoutMs(), 100L),
                sanitizeLong(file.daemonStartupTimeoutMs(), defaults.daemonStartupTimeoutMs(), 100L),
                sanitizeLong(file.daemonIdleTimeoutMs(), defaults.daemonIdleTimeoutMs(), 1_000L),
                sanitizeInt(file.daemonMaxClients(), defaults.daemonMaxClients(), 1),
                sanitizeInt(file.episodicWindow(), defaults.episodicWindow(), 0)
        );
    }

    public PhaselineSettings withDaemonAutoStart(boolean autoStart) {
        return new PhaselineSettings(sessionTtlMs, writeRetries, writeRetryDelayMs, listMaxAgeDays,
                listAllMaxAgeDays, autoStart, daemonRequestTimeoutMs, daemonStartupTimeoutMs,
                daemonIdleTimeoutMs, daemonMaxClients, episodicWindow);
    }

    private static boolean sanitizeBoolean(Boolean raw, boolean fallback) {
        if (raw == null) {
            return fallback;
        }
        return raw;
    }

    private static long sanitizeLong(Long raw, long fallback, long min) {
        if (raw == null) {
            return fallback;
        }
        return Math.max(min, raw);
    }

    private static int sanitizeInt(Integer raw, int fallback, int min) {
        if (raw == null) {
            return fallback;
        }
        return Math.max(min, raw);
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record SettingsFile(
            Long sessionTtlMs,
            Integer writeRetries,
            Long writeRetryDelayMs,
            Integer listMaxAgeDays,
            Integer listAllMaxAgeDays,
            Boolean daemonAutoStart,
            Long daemonRequestTimeoutMs,
            Long daemonStartupTimeoutMs,
            Long daemonIdleTimeoutMs,
            Integer daemonMaxClients,
            Integer episodicWindow
    ) {
    }
}

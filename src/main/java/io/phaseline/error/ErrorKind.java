package io.phaseline.error;

import java.util.Locale;

/**
 * Stable error categories surfaced to callers. The tag is what appears in CLI and daemon
 * error payloads; the code is the daemon wire code.
 */
public enum ErrorKind {
    NOT_FOUND(-32001),
    CORRUPTED(-32002),
    EXPIRED(-32003),
    MISMATCH(-32004),
    PERSIST_FAILURE(-32005),
    NOT_READY(-32006),
    NOT_LOCKED(-32007),
    STRUCTURE_INVALID(-32008),
    TIMEOUT(-32009),
    DAEMON_UNAVAILABLE(-32010),
    INVALID_REQUEST(-32011),
    INVALID_STATE(-32012),
    INTERNAL(-32603);

    private final int code;

    ErrorKind(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }

    public String tag() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static ErrorKind fromTag(String tag) {
        if (tag == null || tag.isBlank()) {
            return INTERNAL;
        }
        try {
            return valueOf(tag.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return INTERNAL;
        }
    }
}

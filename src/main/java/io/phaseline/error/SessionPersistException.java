package io.phaseline.error;

import io.phaseline.model.Session;

import java.util.Map;

/**
 * Write retries exhausted. Carries the in-memory session so the caller can retry elsewhere.
 */
public final class SessionPersistException extends PipelineException {
    private final transient Session session;
    private final int attempts;

    public SessionPersistException(Session session, int attempts, Throwable cause) {
        super(ErrorKind.PERSIST_FAILURE,
                "Failed to persist session " + (session == null ? "?" : session.getSessionId())
                        + " after " + attempts + " attempts",
                cause);
        this.session = session;
        this.attempts = attempts;
    }

    public Session session() {
        return session;
    }

    public int attempts() {
        return attempts;
    }

    @Override
    public Map<String, Object> details() {
        return session == null ? Map.of("attempts", attempts) : Map.of("attempts", attempts, "session", session);
    }
}

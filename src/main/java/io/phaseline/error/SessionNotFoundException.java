package io.phaseline.error;

public final class SessionNotFoundException extends PipelineException {
    private final String sessionId;

    public SessionNotFoundException(String sessionId) {
        super(ErrorKind.NOT_FOUND, "Session not found: " + sessionId);
        this.sessionId = sessionId;
    }

    public String sessionId() {
        return sessionId;
    }
}

package io.phaseline.error;

public final class SessionCorruptedException extends PipelineException {
    private final String sessionId;

    public SessionCorruptedException(String sessionId, String reason) {
        super(ErrorKind.CORRUPTED, "Session file corrupted: " + sessionId + " (" + reason + ")");
        this.sessionId = sessionId;
    }

    public SessionCorruptedException(String sessionId, String reason, Throwable cause) {
        super(ErrorKind.CORRUPTED, "Session file corrupted: " + sessionId + " (" + reason + ")", cause);
        this.sessionId = sessionId;
    }

    public String sessionId() {
        return sessionId;
    }
}

package io.phaseline.error;

import java.util.Map;

public final class SessionExpiredException extends PipelineException {
    private final String sessionId;
    private final long lastActivityTime;

    public SessionExpiredException(String sessionId, long lastActivityTime) {
        super(ErrorKind.EXPIRED, "Session expired: " + sessionId);
        this.sessionId = sessionId;
        this.lastActivityTime = lastActivityTime;
    }

    public String sessionId() {
        return sessionId;
    }

    @Override
    public Map<String, Object> details() {
        return Map.of("sessionId", sessionId, "lastActivityTime", lastActivityTime);
    }
}

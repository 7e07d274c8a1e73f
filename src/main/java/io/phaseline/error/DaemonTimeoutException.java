package io.phaseline.error;

public final class DaemonTimeoutException extends PipelineException {
    private final String method;
    private final long timeoutMs;

    public DaemonTimeoutException(String method, long timeoutMs) {
        super(ErrorKind.TIMEOUT, "Daemon call '" + method + "' timed out after " + timeoutMs + "ms");
        this.method = method;
        this.timeoutMs = timeoutMs;
    }

    public String method() {
        return method;
    }

    public long timeoutMs() {
        return timeoutMs;
    }
}

package io.phaseline.error;

public final class DaemonUnavailableException extends PipelineException {
    public DaemonUnavailableException(String message) {
        super(ErrorKind.DAEMON_UNAVAILABLE, message);
    }

    public DaemonUnavailableException(String message, Throwable cause) {
        super(ErrorKind.DAEMON_UNAVAILABLE, message, cause);
    }
}

package io.phaseline.error;

import java.util.Map;

/**
 * Base of every typed failure raised by the session store, catalog, orchestrator and daemon.
 *
 * Unchecked: the CLI and the daemon dispatcher are the only layers that catch it, and both
 * render it as one structured error with {@link #kind()} as the stable tag.
 */
public class PipelineException extends RuntimeException {
    private final ErrorKind kind;

    public PipelineException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public PipelineException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind kind() {
        return kind;
    }

    /**
     * Extra structured fields carried next to the message, e.g. expected/received for a mismatch.
     */
    public Map<String, Object> details() {
        return Map.of();
    }
}

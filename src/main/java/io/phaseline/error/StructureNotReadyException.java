package io.phaseline.error;

public final class StructureNotReadyException extends PipelineException {
    public StructureNotReadyException(String slug) {
        super(ErrorKind.NOT_READY, "Locked structure not available yet for " + slug);
    }
}

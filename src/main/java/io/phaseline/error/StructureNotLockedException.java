package io.phaseline.error;

public final class StructureNotLockedException extends PipelineException {
    public StructureNotLockedException(String slug) {
        super(ErrorKind.NOT_LOCKED, "Structure for " + slug + " exists but is not locked");
    }
}

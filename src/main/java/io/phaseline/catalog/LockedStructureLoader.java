package io.phaseline.catalog;

/**
 * Produces the locked structure for a slug, or raises
 * {@link io.phaseline.error.StructureNotReadyException} /
 * {@link io.phaseline.error.StructureNotLockedException} while it is not usable yet.
 */
@FunctionalInterface
public interface LockedStructureLoader {
    LockedStructure load(String slug);
}

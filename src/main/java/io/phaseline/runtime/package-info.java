/**
 * Session orchestration package.
 *
 * <p>{@link io.phaseline.runtime.Orchestrator} owns the step lifecycle: init, next, complete,
 * resume, rollback and cleanup. {@link io.phaseline.runtime.StepRouter} maps a session position
 * onto the static catalog or the session's generated steps.
 */
package io.phaseline.runtime;

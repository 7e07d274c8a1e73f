/**
 * Phaseline source tree root.
 *
 * <p>Primary entry points while reading code:
 *
 * <ul>
 *   <li>{@code io.phaseline.Main} bootstraps the CLI process.</li>
 *   <li>{@code io.phaseline.cli.PhaselineCommand} maps commands to the daemon or to a local bundle.</li>
 *   <li>{@code io.phaseline.runtime.Orchestrator} drives a session through the step catalog.</li>
 *   <li>{@code io.phaseline.storage.SessionStore} is the authoritative persistence layer.</li>
 *   <li>{@code io.phaseline.daemon.DaemonServer} keeps a warm orchestrator behind a local socket.</li>
 * </ul>
 */
package io.phaseline;

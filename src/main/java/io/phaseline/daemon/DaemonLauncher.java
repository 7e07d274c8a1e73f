package io.phaseline.daemon;

import java.io.IOException;

/**
 * Starts a daemon server in the background and hands back the supervised child.
 */
@FunctionalInterface
public interface DaemonLauncher {
    Process launch() throws IOException;
}

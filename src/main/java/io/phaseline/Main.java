package io.phaseline;

import io.phaseline.cli.PhaselineCommand;

public final class Main {
    private Main() {
    }

    public static void main(String[] args) {
        int code = PhaselineCommand.newCommandLine().execute(args);
        System.exit(code);
    }
}

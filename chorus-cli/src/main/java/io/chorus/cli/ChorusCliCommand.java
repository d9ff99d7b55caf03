package io.chorus.cli;

import picocli.CommandLine.Command;

@Command(name = "chorus", mixinStandardHelpOptions = true, description = "Budgeted round-robin conversations between LLMs")
public final class ChorusCliCommand implements Runnable {

    @Override
    public void run() {
        // Root command only shows help when no subcommand is provided.
    }
}

package io.fareway.cli;

import picocli.CommandLine.Command;

@Command(name = "fareway", mixinStandardHelpOptions = true, version = "fareway 1.0.0",
    description = "Fareway golf-travel tool gateway")
public final class FarewayCliCommand implements Runnable {

    @Override
    public void run() {
        // Root command only shows help when no subcommand is provided.
    }
}

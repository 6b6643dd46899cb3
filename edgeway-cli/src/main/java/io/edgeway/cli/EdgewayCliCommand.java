package io.edgeway.cli;

import picocli.CommandLine.Command;

@Command(name = "edgeway", mixinStandardHelpOptions = true, description = "Edgeway HTTP and WebSocket edge gateway")
public final class EdgewayCliCommand implements Runnable {

    @Override
    public void run() {
        // Root command only shows help when no subcommand is provided.
    }
}

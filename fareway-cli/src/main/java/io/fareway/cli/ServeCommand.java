package io.fareway.cli;

import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(name = "serve", description = "Start the HTTP API and MCP WebSocket endpoint")
public final class ServeCommand implements Callable<Integer> {
    private final CliContext context;

    @Option(names = {"--port"}, description = "Listener port (overrides FAREWAY_PORT)")
    Integer port;

    public ServeCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            return context.gatewayRunner().run(port);
        } catch (Exception e) {
            System.err.println("Serve command failed: " + e.getMessage());
            return 1;
        }
    }
}

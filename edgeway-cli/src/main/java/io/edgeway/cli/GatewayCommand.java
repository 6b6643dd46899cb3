package io.edgeway.cli;

import java.nio.file.Path;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(name = "gateway", description = "Start the HTTP and WebSocket gateway")
public final class GatewayCommand implements Callable<Integer> {
    private final CliContext context;

    @Option(names = {"--port"}, description = "Listener port (overrides config)")
    Integer port;

    @Option(names = {"--host"}, description = "Listener host (overrides config)")
    String host;

    @Option(names = {"--config"}, description = "Config file path")
    Path config;

    public GatewayCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        if (port != null && (port < 0 || port > 65_535)) {
            System.err.println("Invalid port: " + port);
            return 2;
        }
        try {
            return context.gatewayRunner().run(context.resolveConfigPath(config), host, port);
        } catch (Exception e) {
            System.err.println("Gateway command failed: " + e.getMessage());
            return 1;
        }
    }
}

package io.edgeway.cli;

import io.edgeway.core.config.model.GatewayConfig;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(name = "status", description = "Show effective configuration")
public final class StatusCommand implements Callable<Integer> {
    private final CliContext context;

    @Option(names = {"--config"}, description = "Config file path")
    Path config;

    @Option(names = {"--json"}, description = "Print the full effective config as JSON")
    boolean json;

    public StatusCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        Path configPath = context.resolveConfigPath(config);
        try {
            GatewayConfig effective = context.configService().load(configPath);
            if (json) {
                System.out.println(context.configService().toPrettyJson(effective));
                return 0;
            }
            System.out.println("Config path: " + configPath);
            System.out.println("Config exists: " + Files.exists(configPath));
            System.out.println("Listen: " + effective.server().host() + ":" + effective.server().port());
            System.out.println("API prefix: " + effective.server().normalizedApiPrefix());
            System.out.println("WebSocket path: " + effective.websocket().path());
            System.out.println("Allowed origins: " + effective.origins().allowed());
            System.out.println(
                "Connection limits: " + effective.admission().maxPerUser() + " per session, "
                    + effective.admission().maxGlobal() + " global"
            );
            System.out.println(
                "Message rate limits: " + effective.rateLimit().maxPerSecond() + "/s, "
                    + effective.rateLimit().maxPerMinute() + "/min"
            );
            System.out.println("Token validator configured: " + effective.auth().validatorConfigured());
            System.out.println("Backend configured: " + effective.backend().configured());
            return 0;
        } catch (Exception e) {
            System.err.println("Status command failed: " + e.getMessage());
            return 1;
        }
    }
}

package io.edgeway.cli;

import io.edgeway.core.config.ConfigService;
import java.nio.file.Path;

public record CliContext(
    ConfigService configService,
    Path configPath,
    GatewayRunner gatewayRunner
) {
    public CliContext(ConfigService configService, Path configPath) {
        this(configService, configPath, (path, host, port) -> {
            throw new UnsupportedOperationException("gateway runner is not configured");
        });
    }

    public Path resolveConfigPath(Path override) {
        return override == null ? configPath : override;
    }
}

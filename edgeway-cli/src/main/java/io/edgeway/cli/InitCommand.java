package io.edgeway.cli;

import io.edgeway.core.config.InitResult;
import java.io.IOException;
import java.nio.file.Path;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(name = "init", description = "Write a config file with default settings")
public final class InitCommand implements Callable<Integer> {
    private final CliContext context;

    @Option(names = "--overwrite", description = "Replace an existing config file with the defaults")
    boolean overwrite;

    @Option(names = {"--config"}, description = "Config file path")
    Path config;

    public InitCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        Path target = context.resolveConfigPath(config);
        InitResult result;
        try {
            result = context.configService().init(target, overwrite);
        } catch (IOException e) {
            System.err.println("Could not write " + target + ": " + e.getMessage());
            return 1;
        }
        String action = result.createdConfig() ? "Created config"
            : result.overwrittenConfig() ? "Reset config to defaults"
            : "Updated config, existing values kept";
        System.out.println(action + ": " + result.configPath());
        return 0;
    }
}

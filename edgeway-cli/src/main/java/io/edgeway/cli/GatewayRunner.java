package io.edgeway.cli;

import java.nio.file.Path;

@FunctionalInterface
public interface GatewayRunner {

    int run(Path configPath, String host, Integer port) throws Exception;
}

package io.edgeway.core.config;

import java.nio.file.Path;

public final class ConfigPaths {
    static final String CONFIG_ENV = "EDGEWAY_CONFIG";

    private ConfigPaths() {
    }

    public static Path defaultConfigPath() {
        String fromEnv = System.getenv(CONFIG_ENV);
        if (fromEnv != null && !fromEnv.isBlank()) {
            return expandHome(fromEnv.trim());
        }
        return Path.of(System.getProperty("user.home"), ".edgeway", "config.json");
    }

    public static Path expandHome(String rawPath) {
        if (rawPath == null || rawPath.isBlank()) {
            return Path.of(System.getProperty("user.home"), ".edgeway");
        }
        if (rawPath.startsWith("~/")) {
            return Path.of(System.getProperty("user.home")).resolve(rawPath.substring(2));
        }
        return Path.of(rawPath);
    }
}

package io.edgeway.core.config;

import java.nio.file.Path;

public record InitResult(Path configPath, boolean createdConfig, boolean overwrittenConfig) {
}

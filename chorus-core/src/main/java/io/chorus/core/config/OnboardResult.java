package io.chorus.core.config;

import java.nio.file.Path;

public record OnboardResult(Path configPath, Path logDir, boolean createdConfig, boolean overwrittenConfig) {
}

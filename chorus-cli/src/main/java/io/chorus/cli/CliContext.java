package io.chorus.cli;

import io.chorus.core.config.ConfigService;
import java.nio.file.Path;
import java.util.Map;

public record CliContext(
    ConfigService configService,
    Path configPath,
    ParticipantFactory participantFactory,
    Map<String, String> environment
) {
    public CliContext {
        environment = environment == null ? Map.of() : Map.copyOf(environment);
    }
}

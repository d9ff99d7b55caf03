package io.chorus.core.session;

import java.nio.file.Path;
import java.time.Instant;

public record SessionArtifacts(Path textLog, Path snapshot, Instant endedAt) {
}

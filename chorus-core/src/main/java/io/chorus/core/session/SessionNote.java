package io.chorus.core.session;

import java.time.Instant;

public record SessionNote(Instant timestamp, String message) {
}

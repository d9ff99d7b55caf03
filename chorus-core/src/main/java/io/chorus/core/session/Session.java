package io.chorus.core.session;

import java.time.Instant;
import java.util.Objects;

public record Session(String name, Instant startedAt) {
    public Session {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(startedAt, "startedAt must not be null");
    }
}

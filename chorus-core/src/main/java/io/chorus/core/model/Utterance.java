package io.chorus.core.model;

import java.time.Instant;
import java.util.Objects;

/**
 * One recorded turn of the conversation. Immutable once created.
 */
public record Utterance(String speaker, String content, Instant timestamp, long tokens, double cost) {

    public Utterance {
        Objects.requireNonNull(speaker, "speaker must not be null");
        Objects.requireNonNull(timestamp, "timestamp must not be null");
        content = content == null ? "" : content;
        if (tokens < 0) {
            throw new IllegalArgumentException("tokens must not be negative: " + tokens);
        }
        if (cost < 0 || Double.isNaN(cost)) {
            throw new IllegalArgumentException("cost must not be negative: " + cost);
        }
    }
}

package io.chorus.core.conversation;

import io.chorus.core.budget.TokenRates;
import io.chorus.core.context.ContextBuilder;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable configuration of one session, resolved once before the session starts.
 *
 * @param rates per-participant token rates; participants without an entry are free
 */
public record ConversationSettings(
    String topic,
    long tokenLimit,
    double warningThreshold,
    int contextWindowSize,
    Duration interTurnDelay,
    Duration failureBackoff,
    int maxResponseLength,
    Map<String, TokenRates> rates
) {
    public static final double DEFAULT_WARNING_THRESHOLD = 0.9;
    public static final int DEFAULT_MAX_RESPONSE_LENGTH = 1000;

    public ConversationSettings {
        Objects.requireNonNull(topic, "topic must not be null");
        Objects.requireNonNull(interTurnDelay, "interTurnDelay must not be null");
        Objects.requireNonNull(failureBackoff, "failureBackoff must not be null");
        if (tokenLimit <= 0) {
            throw new IllegalArgumentException("tokenLimit must be positive: " + tokenLimit);
        }
        if (warningThreshold <= 0 || warningThreshold > 1 || Double.isNaN(warningThreshold)) {
            throw new IllegalArgumentException("warningThreshold must be in (0, 1]: " + warningThreshold);
        }
        if (contextWindowSize < 1) {
            throw new IllegalArgumentException("contextWindowSize must be at least 1: " + contextWindowSize);
        }
        if (interTurnDelay.isNegative() || failureBackoff.isNegative()) {
            throw new IllegalArgumentException("delays must not be negative");
        }
        if (maxResponseLength < 1) {
            throw new IllegalArgumentException("maxResponseLength must be at least 1: " + maxResponseLength);
        }
        rates = rates == null ? Map.of() : Map.copyOf(rates);
    }

    public static ConversationSettings defaults(String topic, long tokenLimit) {
        return new ConversationSettings(
            topic,
            tokenLimit,
            DEFAULT_WARNING_THRESHOLD,
            ContextBuilder.DEFAULT_WINDOW_SIZE,
            Duration.ofSeconds(2),
            Duration.ofSeconds(2),
            DEFAULT_MAX_RESPONSE_LENGTH,
            Map.of()
        );
    }

    public ConversationSettings withDelays(Duration newInterTurnDelay, Duration newFailureBackoff) {
        return new ConversationSettings(
            topic,
            tokenLimit,
            warningThreshold,
            contextWindowSize,
            newInterTurnDelay,
            newFailureBackoff,
            maxResponseLength,
            rates
        );
    }
}

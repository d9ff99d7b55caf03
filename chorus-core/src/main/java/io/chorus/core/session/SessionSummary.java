package io.chorus.core.session;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public record SessionSummary(
    String sessionName,
    Instant firstMessageAt,
    Instant lastMessageAt,
    double durationMinutes,
    int messageCount,
    long totalTokens,
    double totalCost,
    Map<String, ParticipantStats> byParticipant
) {
    public SessionSummary {
        byParticipant = byParticipant == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(byParticipant));
    }

    public static SessionSummary empty(String sessionName) {
        return new SessionSummary(sessionName, null, null, 0.0, 0, 0, 0.0, Map.of());
    }
}

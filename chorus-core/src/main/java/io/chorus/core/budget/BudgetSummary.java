package io.chorus.core.budget;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public record BudgetSummary(
    long totalTokens,
    double totalCost,
    long tokenLimit,
    double usagePercentage,
    long remainingTokens,
    boolean warning,
    boolean exceeded,
    Map<String, ParticipantUsage> byParticipant
) {
    public BudgetSummary {
        byParticipant = byParticipant == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(byParticipant));
    }
}

package io.chorus.core.budget;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Token and cost accounting for one session. The limit is a hard stop that is only checked
 * between turns, so the realized total may exceed it by the usage of the last turn.
 *
 * <p>Single writer: the orchestration loop is the only caller of {@link #record}.
 */
public final class BudgetLedger {
    private final TokenCounter tokenCounter;
    private final Map<String, TokenRates> rates;
    private final long tokenLimit;
    private final double warningThreshold;
    private final Map<String, ParticipantUsage> usage = new LinkedHashMap<>();
    private long totalTokens;
    private double totalCost;

    public BudgetLedger(TokenCounter tokenCounter, Map<String, TokenRates> rates, long tokenLimit, double warningThreshold) {
        this.tokenCounter = Objects.requireNonNull(tokenCounter, "tokenCounter must not be null");
        this.rates = rates == null ? Map.of() : Map.copyOf(rates);
        this.tokenLimit = tokenLimit;
        this.warningThreshold = warningThreshold;
    }

    /**
     * Counts both texts, charges them to {@code participant} and returns the turn's usage.
     * Counters are untouched when tokenization fails.
     */
    public TurnUsage record(String participant, String inputText, String outputText) {
        Objects.requireNonNull(participant, "participant must not be null");
        long inputTokens = tokenCounter.count(inputText == null ? "" : inputText);
        long outputTokens = tokenCounter.count(outputText == null ? "" : outputText);
        double cost = rates.getOrDefault(participant, TokenRates.FREE).cost(inputTokens, outputTokens);

        TurnUsage turn = new TurnUsage(inputTokens, outputTokens, cost);
        usage.merge(participant, ParticipantUsage.EMPTY.plus(turn), (current, ignored) -> current.plus(turn));
        totalTokens += turn.tokens();
        totalCost += cost;
        return turn;
    }

    public boolean isExceeded() {
        return totalTokens >= tokenLimit;
    }

    public boolean isWarning() {
        if (tokenLimit <= 0) {
            return false;
        }
        return usagePercentage() >= warningThreshold * 100.0;
    }

    public double usagePercentage() {
        if (tokenLimit <= 0) {
            return 0.0;
        }
        return (double) totalTokens / tokenLimit * 100.0;
    }

    public long remaining() {
        return Math.max(0, tokenLimit - totalTokens);
    }

    public long totalTokens() {
        return totalTokens;
    }

    public double totalCost() {
        return totalCost;
    }

    public long tokenLimit() {
        return tokenLimit;
    }

    public BudgetSummary summary() {
        Map<String, ParticipantUsage> byParticipant = new LinkedHashMap<>();
        usage.forEach((name, value) -> byParticipant.put(
            name,
            new ParticipantUsage(value.inputTokens(), value.outputTokens(), round(value.cost(), 4))
        ));
        return new BudgetSummary(
            totalTokens,
            round(totalCost, 4),
            tokenLimit,
            round(usagePercentage(), 1),
            remaining(),
            isWarning(),
            isExceeded(),
            byParticipant
        );
    }

    private static double round(double value, int places) {
        double scale = Math.pow(10, places);
        return Math.round(value * scale) / scale;
    }
}

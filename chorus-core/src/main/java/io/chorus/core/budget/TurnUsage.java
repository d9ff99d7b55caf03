package io.chorus.core.budget;

public record TurnUsage(long inputTokens, long outputTokens, double cost) {
    public long tokens() {
        return inputTokens + outputTokens;
    }
}

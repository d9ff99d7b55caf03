package io.chorus.core.budget;

public record ParticipantUsage(long inputTokens, long outputTokens, double cost) {
    public static final ParticipantUsage EMPTY = new ParticipantUsage(0, 0, 0.0);

    public long totalTokens() {
        return inputTokens + outputTokens;
    }

    ParticipantUsage plus(TurnUsage turn) {
        return new ParticipantUsage(inputTokens + turn.inputTokens(), outputTokens + turn.outputTokens(), cost + turn.cost());
    }
}

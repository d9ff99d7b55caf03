package io.chorus.core.session;

public record ParticipantStats(int count, long tokens, double cost) {
}

package io.chorus.core.conversation;

public enum TerminationReason {
    BUDGET_EXHAUSTED,
    CANCELLED,
    INTERRUPTED
}

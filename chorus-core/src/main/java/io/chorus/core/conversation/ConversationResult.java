package io.chorus.core.conversation;

import io.chorus.core.budget.BudgetSummary;
import io.chorus.core.model.Utterance;
import io.chorus.core.session.Session;
import io.chorus.core.session.SessionArtifacts;
import io.chorus.core.session.SessionSummary;
import java.util.List;

public record ConversationResult(
    Session session,
    TerminationReason reason,
    int turns,
    int failedAttempts,
    List<Utterance> history,
    BudgetSummary budget,
    SessionSummary summary,
    SessionArtifacts artifacts
) {
    public ConversationResult {
        history = history == null ? List.of() : List.copyOf(history);
    }
}

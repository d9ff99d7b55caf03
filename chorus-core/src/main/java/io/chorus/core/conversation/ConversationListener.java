package io.chorus.core.conversation;

import io.chorus.core.budget.BudgetSummary;
import io.chorus.core.model.Utterance;
import io.chorus.core.session.Session;
import java.util.List;

/**
 * Advisory notifications for a presentation layer. None of them can change the course of the
 * session; exceptions thrown here are logged and ignored.
 */
public interface ConversationListener {
    ConversationListener NONE = new ConversationListener() {
    };

    default void onSessionStarted(Session session, List<String> participants, ConversationSettings settings) {
    }

    default void onTurnStarted(String speaker) {
    }

    default void onUtterance(Utterance utterance, BudgetSummary budget) {
    }

    default void onTurnFailed(String speaker, Exception error) {
    }

    default void onBudgetWarning(BudgetSummary budget) {
    }

    default void onFinished(ConversationResult result) {
    }
}

package io.chorus.cli;

import io.chorus.core.budget.BudgetSummary;
import io.chorus.core.budget.ParticipantUsage;
import io.chorus.core.conversation.ConversationListener;
import io.chorus.core.conversation.ConversationResult;
import io.chorus.core.conversation.ConversationSettings;
import io.chorus.core.model.Utterance;
import io.chorus.core.session.Session;
import java.io.PrintStream;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Renders session progress on the terminal.
 */
final class ConsoleReporter implements ConversationListener {
    private static final DateTimeFormatter CLOCK = DateTimeFormatter.ofPattern("HH:mm:ss");
    private static final String RULE = "-".repeat(60);

    private final PrintStream out;
    private final ZoneId zone;

    ConsoleReporter(PrintStream out, ZoneId zone) {
        this.out = out;
        this.zone = zone;
    }

    @Override
    public void onSessionStarted(Session session, List<String> participants, ConversationSettings settings) {
        out.println("Session: " + session.name());
        out.println("Topic: " + settings.topic());
        out.println("Participants: " + String.join(", ", participants));
        out.println(String.format(Locale.ROOT, "Token limit: %,d", settings.tokenLimit()));
        out.println("Press Ctrl+C to end the conversation.");
        out.println();
    }

    @Override
    public void onTurnStarted(String speaker) {
        out.println(speaker + " is thinking...");
    }

    @Override
    public void onUtterance(Utterance utterance, BudgetSummary budget) {
        out.println(RULE);
        out.println("[" + CLOCK.format(utterance.timestamp().atZone(zone)) + "] " + utterance.speaker());
        out.println(utterance.content());
        out.println(String.format(
            Locale.ROOT,
            "(%d tokens, $%.4f | total %,d/%,d tokens, %.1f%%, $%.4f)",
            utterance.tokens(),
            utterance.cost(),
            budget.totalTokens(),
            budget.tokenLimit(),
            budget.usagePercentage(),
            budget.totalCost()
        ));
        out.println();
    }

    @Override
    public void onTurnFailed(String speaker, Exception error) {
        out.println("! " + speaker + " could not respond: " + error.getMessage());
    }

    @Override
    public void onBudgetWarning(BudgetSummary budget) {
        out.println(String.format(
            Locale.ROOT,
            "! Warning: %.1f%% of the token limit used, %,d tokens remaining",
            budget.usagePercentage(),
            budget.remainingTokens()
        ));
    }

    @Override
    public void onFinished(ConversationResult result) {
        BudgetSummary budget = result.budget();
        out.println(RULE);
        out.println("Conversation ended: " + describe(result));
        out.println("Messages: " + result.turns() + " (failed attempts: " + result.failedAttempts() + ")");
        out.println(String.format(Locale.ROOT, "Total tokens: %,d of %,d", budget.totalTokens(), budget.tokenLimit()));
        out.println(String.format(Locale.ROOT, "Total cost: $%.4f", budget.totalCost()));
        for (Map.Entry<String, ParticipantUsage> entry : budget.byParticipant().entrySet()) {
            ParticipantUsage usage = entry.getValue();
            out.println(String.format(
                Locale.ROOT,
                "- %s: %,d in / %,d out tokens, $%.4f",
                entry.getKey(),
                usage.inputTokens(),
                usage.outputTokens(),
                usage.cost()
            ));
        }
        out.println("Log: " + result.artifacts().textLog());
        out.println("Snapshot: " + result.artifacts().snapshot());
    }

    private static String describe(ConversationResult result) {
        return switch (result.reason()) {
            case BUDGET_EXHAUSTED -> "token limit reached";
            case CANCELLED -> "stopped by user";
            case INTERRUPTED -> "interrupted";
        };
    }
}

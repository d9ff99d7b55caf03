package io.chorus.core.conversation;

import io.chorus.core.budget.BudgetLedger;
import io.chorus.core.budget.BudgetSummary;
import io.chorus.core.budget.TokenCounter;
import io.chorus.core.budget.TurnUsage;
import io.chorus.core.context.ContextBuilder;
import io.chorus.core.model.ChatMessage;
import io.chorus.core.model.Utterance;
import io.chorus.core.participant.GenerationException;
import io.chorus.core.participant.Participant;
import io.chorus.core.schedule.TurnScheduler;
import io.chorus.core.session.Session;
import io.chorus.core.session.SessionArtifacts;
import io.chorus.core.session.SessionRecorder;
import io.chorus.core.session.SessionSummary;
import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Drives one conversation session: picks a speaker, builds its context, asks it for a reply,
 * charges the budget and records the utterance, until the budget is exhausted or the session
 * is cancelled. The session record is finalized on every exit path.
 *
 * <p>Single use; one thread drives the whole loop, so none of the collaborators need locking.
 */
public final class ConversationOrchestrator {
    private static final Logger LOG = LoggerFactory.getLogger(ConversationOrchestrator.class);

    private final ConversationSettings settings;
    private final TokenCounter tokenCounter;
    private final SessionRecorder recorder;
    private final TurnScheduler scheduler;
    private final Clock clock;
    private final ConversationListener listener;
    private volatile OrchestratorState state = OrchestratorState.IDLE;

    public ConversationOrchestrator(ConversationSettings settings, TokenCounter tokenCounter, SessionRecorder recorder) {
        this(settings, tokenCounter, recorder, new TurnScheduler(), Clock.systemUTC(), ConversationListener.NONE);
    }

    public ConversationOrchestrator(
        ConversationSettings settings,
        TokenCounter tokenCounter,
        SessionRecorder recorder,
        TurnScheduler scheduler,
        Clock clock,
        ConversationListener listener
    ) {
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
        this.tokenCounter = Objects.requireNonNull(tokenCounter, "tokenCounter must not be null");
        this.recorder = Objects.requireNonNull(recorder, "recorder must not be null");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.listener = listener == null ? ConversationListener.NONE : listener;
    }

    public OrchestratorState state() {
        return state;
    }

    /**
     * Runs the session to completion.
     *
     * @throws IllegalArgumentException when fewer than two distinct participants are supplied;
     *     no session is created in that case
     * @throws IOException when the session record cannot be written; the session is still
     *     finalized on a best-effort basis
     */
    public ConversationResult run(List<Participant> participants, String sessionName, CancellationToken cancellation)
        throws IOException {
        Objects.requireNonNull(cancellation, "cancellation must not be null");
        if (state != OrchestratorState.IDLE) {
            throw new IllegalStateException("Orchestrator already used; state=" + state);
        }
        Map<String, Participant> roster = roster(participants);

        state = OrchestratorState.INITIALIZING;
        List<String> names = List.copyOf(roster.keySet());
        Run run = new Run(
            roster,
            names,
            new BudgetLedger(tokenCounter, settings.rates(), settings.tokenLimit(), settings.warningThreshold()),
            new ContextBuilder(settings.contextWindowSize(), names),
            new ConversationState(settings.topic())
        );

        Session session;
        try {
            session = recorder.start(sessionName);
        } catch (IOException | RuntimeException e) {
            state = OrchestratorState.DONE;
            throw e;
        }

        TerminationReason reason;
        try {
            open(session, run);
            state = OrchestratorState.RUNNING;
            reason = converse(run, cancellation);
        } catch (Throwable t) {
            abandon(run, t);
            throw t;
        }

        state = OrchestratorState.TERMINATING;
        ConversationResult result;
        try {
            result = finish(session, run, reason);
        } finally {
            state = OrchestratorState.DONE;
            if (run.interrupted) {
                Thread.currentThread().interrupt();
            }
        }
        notifyListener(l -> l.onFinished(result));
        return result;
    }

    private Map<String, Participant> roster(List<Participant> participants) {
        if (participants == null || participants.size() < 2) {
            throw new IllegalArgumentException("A conversation needs at least 2 participants");
        }
        Map<String, Participant> roster = new LinkedHashMap<>();
        for (Participant participant : participants) {
            Objects.requireNonNull(participant, "participant must not be null");
            if (roster.putIfAbsent(participant.name(), participant) != null) {
                throw new IllegalArgumentException("Duplicate participant name: " + participant.name());
            }
        }
        return roster;
    }

    private void open(Session session, Run run) throws IOException {
        recorder.note("Topic: " + settings.topic());
        recorder.note(String.format(Locale.ROOT, "Token limit: %,d", settings.tokenLimit()));
        recorder.note("Participants: " + String.join(", ", run.names));
        run.conversation.open(new Utterance(
            ContextBuilder.TOPIC_LABEL,
            ContextBuilder.TOPIC_LABEL + ": " + settings.topic(),
            clock.instant(),
            0,
            0.0
        ));
        LOG.info("Session {} running with {} on topic '{}'", session.name(), run.names, settings.topic());
        notifyListener(l -> l.onSessionStarted(session, run.names, settings));
    }

    private TerminationReason converse(Run run, CancellationToken cancellation) throws IOException {
        while (true) {
            if (run.interrupted) {
                return TerminationReason.INTERRUPTED;
            }
            if (cancellation.isCancellationRequested()) {
                LOG.info("Cancellation requested; ending session after {} turns", run.turns);
                return TerminationReason.CANCELLED;
            }
            if (run.ledger.isExceeded()) {
                LOG.info("Token limit reached: {}/{}", run.ledger.totalTokens(), run.ledger.tokenLimit());
                return TerminationReason.BUDGET_EXHAUSTED;
            }

            String speaker = scheduler.selectNext(run.names);
            notifyListener(l -> l.onTurnStarted(speaker));
            List<ChatMessage> context = run.contextBuilder.build(run.conversation.history(), settings.topic());

            Utterance utterance;
            try {
                String reply = run.participants.get(speaker).generate(context, settings.maxResponseLength());
                TurnUsage usage = run.ledger.record(speaker, settings.topic(), reply);
                utterance = new Utterance(speaker, reply, clock.instant(), usage.tokens(), usage.cost());
            } catch (GenerationException | RuntimeException e) {
                // Tokenizer and participant runtime failures cost the turn, never the session.
                run.failedAttempts++;
                LOG.warn("Turn for {} failed, continuing the conversation: {}", speaker, e.getMessage());
                notifyListener(l -> l.onTurnFailed(speaker, e));
                pause(run, cancellation, settings.failureBackoff());
                continue;
            }

            recorder.append(utterance);
            run.conversation.append(utterance);
            run.turns++;
            BudgetSummary budget = run.ledger.summary();
            notifyListener(l -> l.onUtterance(utterance, budget));

            if (!run.warned && run.ledger.isWarning()) {
                run.warned = true;
                LOG.warn("Token usage at {}% of the limit", budget.usagePercentage());
                notifyListener(l -> l.onBudgetWarning(budget));
            }
            if (!run.ledger.isExceeded() && !cancellation.isCancellationRequested()) {
                pause(run, cancellation, settings.interTurnDelay());
            }
        }
    }

    private void pause(Run run, CancellationToken cancellation, Duration duration) {
        try {
            cancellation.pause(duration);
        } catch (InterruptedException e) {
            // Restored once the session record is closed; NIO writes fail while the flag is set.
            LOG.info("Interrupted while pausing between turns");
            run.interrupted = true;
        }
    }

    private ConversationResult finish(Session session, Run run, TerminationReason reason) throws IOException {
        SessionSummary summary = recorder.summary();
        SessionArtifacts artifacts = recorder.finalizeSession(summary);
        return new ConversationResult(
            session,
            reason,
            run.turns,
            run.failedAttempts,
            recordedHistory(run.conversation),
            run.ledger.summary(),
            summary,
            artifacts
        );
    }

    private void abandon(Run run, Throwable cause) {
        state = OrchestratorState.TERMINATING;
        try {
            recorder.finalizeSession(recorder.summary());
        } catch (IOException | RuntimeException e) {
            cause.addSuppressed(e);
        } finally {
            state = OrchestratorState.DONE;
        }
        LOG.error("Session ended after {} turns because of an unrecoverable error", run.turns, cause);
    }

    private List<Utterance> recordedHistory(ConversationState conversation) {
        List<Utterance> history = conversation.history();
        return history.isEmpty() ? history : new ArrayList<>(history.subList(1, history.size()));
    }

    private void notifyListener(Consumer<ConversationListener> event) {
        try {
            event.accept(listener);
        } catch (RuntimeException e) {
            LOG.warn("Conversation listener failed", e);
        }
    }

    private static final class Run {
        private final Map<String, Participant> participants;
        private final List<String> names;
        private final BudgetLedger ledger;
        private final ContextBuilder contextBuilder;
        private final ConversationState conversation;
        private int turns;
        private int failedAttempts;
        private boolean warned;
        private boolean interrupted;

        private Run(
            Map<String, Participant> participants,
            List<String> names,
            BudgetLedger ledger,
            ContextBuilder contextBuilder,
            ConversationState conversation
        ) {
            this.participants = participants;
            this.names = names;
            this.ledger = ledger;
            this.contextBuilder = contextBuilder;
            this.conversation = conversation;
        }
    }
}

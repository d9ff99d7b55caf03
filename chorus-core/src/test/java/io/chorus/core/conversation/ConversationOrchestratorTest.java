package io.chorus.core.conversation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.chorus.core.budget.BudgetSummary;
import io.chorus.core.budget.TokenCounter;
import io.chorus.core.budget.TokenizationException;
import io.chorus.core.model.ChatMessage;
import io.chorus.core.model.Utterance;
import io.chorus.core.participant.GenerationException;
import io.chorus.core.participant.Participant;
import io.chorus.core.schedule.TurnScheduler;
import io.chorus.core.session.FileSessionRecorder;
import io.chorus.core.session.Session;
import io.chorus.core.session.SessionArtifacts;
import io.chorus.core.session.SessionRecorder;
import io.chorus.core.session.SessionSnapshot;
import io.chorus.core.session.SessionSummary;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Stream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ConversationOrchestratorTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-05-01T12:00:00Z"), ZoneOffset.UTC);
    private static final TokenCounter TWENTY_PER_TEXT = text -> 20;

    @TempDir
    Path tempDir;

    @Test
    void shouldStopOnceTheBudgetIsExhausted() throws Exception {
        List<BudgetSummary> warnings = new ArrayList<>();
        ConversationListener listener = new ConversationListener() {
            @Override
            public void onBudgetWarning(BudgetSummary budget) {
                warnings.add(budget);
            }
        };
        ConversationOrchestrator orchestrator = orchestrator(settings(100), new TurnScheduler(new Random(11)), listener);

        ConversationResult result = orchestrator.run(
            List.of(new ScriptedParticipant("A"), new ScriptedParticipant("B"), new ScriptedParticipant("C")),
            "budget",
            new CancellationToken()
        );

        assertThat(result.reason()).isEqualTo(TerminationReason.BUDGET_EXHAUSTED);
        assertThat(result.turns()).isEqualTo(3);
        assertThat(result.history()).hasSize(3);
        assertThat(result.budget().totalTokens()).isEqualTo(120);
        assertThat(result.budget().exceeded()).isTrue();
        assertThat(result.summary().messageCount()).isEqualTo(3);
        assertThat(warnings).hasSize(1);
        assertThat(orchestrator.state()).isEqualTo(OrchestratorState.DONE);
        for (int i = 1; i < result.history().size(); i++) {
            assertThat(result.history().get(i).speaker()).isNotEqualTo(result.history().get(i - 1).speaker());
        }

        SessionSnapshot snapshot = new FileSessionRecorder(tempDir, CLOCK).readSnapshot(result.artifacts().snapshot());
        assertThat(snapshot.messages()).hasSize(3);
        assertThat(snapshot.endedAt()).isNotNull();
        assertThat(snapshot.notes()).extracting(note -> note.message())
            .containsExactly("Topic: rivers", "Token limit: 100", "Participants: A, B, C");
    }

    @Test
    void failedTurnShouldNotChangeHistoryOrBudget() throws Exception {
        ScriptedParticipant first = new ScriptedParticipant("A");
        ScriptedParticipant flaky = new ScriptedParticipant("B", 1);
        List<String> failures = new ArrayList<>();
        ConversationListener listener = new ConversationListener() {
            @Override
            public void onTurnFailed(String speaker, Exception error) {
                failures.add(speaker);
            }
        };
        ConversationOrchestrator orchestrator = orchestrator(settings(100), firstCandidateScheduler(), listener);

        ConversationResult result = orchestrator.run(List.of(first, flaky), "flaky", new CancellationToken());

        assertThat(result.turns()).isEqualTo(3);
        assertThat(result.failedAttempts()).isEqualTo(1);
        assertThat(failures).containsExactly("B");
        assertThat(result.history()).extracting(Utterance::speaker).containsExactly("A", "A", "B");
        assertThat(result.budget().totalTokens()).isEqualTo(120);
        assertThat(result.budget().byParticipant().get("B").totalTokens()).isEqualTo(40);
        assertThat(flaky.contexts).hasSize(2);
        assertThat(first.contexts.get(1)).isEqualTo(flaky.contexts.get(0));
        assertThat(flaky.contexts.get(0)).hasSize(3);
    }

    @Test
    void permanentlyFailingParticipantShouldNotStarveTheOthers() throws Exception {
        ScriptedParticipant dead = new ScriptedParticipant("B", Integer.MAX_VALUE);
        ConversationOrchestrator orchestrator = orchestrator(
            settings(100),
            new TurnScheduler(new Random(3)),
            ConversationListener.NONE
        );

        ConversationResult result = orchestrator.run(
            List.of(new ScriptedParticipant("A"), dead),
            "outage",
            new CancellationToken()
        );

        assertThat(result.reason()).isEqualTo(TerminationReason.BUDGET_EXHAUSTED);
        assertThat(result.turns()).isEqualTo(3);
        assertThat(result.history()).extracting(Utterance::speaker).containsOnly("A");
        assertThat(result.failedAttempts()).isPositive();
        assertThat(result.failedAttempts()).isEqualTo(dead.contexts.size());
    }

    @Test
    void runtimeFailureFromParticipantShouldCostOnlyTheTurn() throws Exception {
        ScriptedParticipant crashing = new ScriptedParticipant("B") {
            private boolean crashed;

            @Override
            public String generate(List<ChatMessage> context, int maxLength) throws GenerationException {
                if (!crashed) {
                    crashed = true;
                    throw new IllegalStateException("client closed");
                }
                return super.generate(context, maxLength);
            }
        };
        List<Exception> failures = new ArrayList<>();
        ConversationListener listener = new ConversationListener() {
            @Override
            public void onTurnFailed(String speaker, Exception error) {
                failures.add(error);
            }
        };
        ConversationOrchestrator orchestrator = orchestrator(settings(100), firstCandidateScheduler(), listener);

        ConversationResult result = orchestrator.run(
            List.of(new ScriptedParticipant("A"), crashing),
            "crash",
            new CancellationToken()
        );

        assertThat(result.reason()).isEqualTo(TerminationReason.BUDGET_EXHAUSTED);
        assertThat(result.turns()).isEqualTo(3);
        assertThat(result.failedAttempts()).isEqualTo(1);
        assertThat(failures).singleElement().isInstanceOf(IllegalStateException.class);
        assertThat(result.history()).extracting(Utterance::speaker).containsExactly("A", "A", "B");
        assertThat(Files.readString(result.artifacts().textLog())).contains("=== Conversation session ended");
    }

    @Test
    void tokenizerFailureShouldLeaveHistoryAndBudgetUntouched() throws Exception {
        AtomicInteger counts = new AtomicInteger();
        TokenCounter failsFirst = text -> {
            if (counts.getAndIncrement() == 0) {
                throw new TokenizationException("encoder unavailable", null);
            }
            return 20;
        };
        ConversationOrchestrator orchestrator = new ConversationOrchestrator(
            settings(100),
            failsFirst,
            new FileSessionRecorder(tempDir, CLOCK),
            firstCandidateScheduler(),
            CLOCK,
            ConversationListener.NONE
        );

        ConversationResult result = orchestrator.run(
            List.of(new ScriptedParticipant("A"), new ScriptedParticipant("B")),
            "tokens",
            new CancellationToken()
        );

        assertThat(result.reason()).isEqualTo(TerminationReason.BUDGET_EXHAUSTED);
        assertThat(result.failedAttempts()).isEqualTo(1);
        assertThat(result.turns()).isEqualTo(3);
        assertThat(result.history()).hasSize(3);
        assertThat(result.budget().totalTokens()).isEqualTo(120);
        assertThat(result.summary().messageCount()).isEqualTo(3);
    }

    @Test
    void interruptDuringPauseShouldEndSessionAndRestoreFlag() throws Exception {
        ConversationListener interrupter = new ConversationListener() {
            @Override
            public void onUtterance(Utterance utterance, BudgetSummary budget) {
                Thread.currentThread().interrupt();
            }
        };
        ConversationSettings slow = ConversationSettings.defaults("rivers", 10_000)
            .withDelays(Duration.ofSeconds(5), Duration.ZERO);
        ConversationOrchestrator orchestrator = orchestrator(slow, firstCandidateScheduler(), interrupter);

        ConversationResult result;
        boolean interruptedAfterRun;
        try {
            result = orchestrator.run(
                List.of(new ScriptedParticipant("A"), new ScriptedParticipant("B")),
                "interrupt",
                new CancellationToken()
            );
        } finally {
            interruptedAfterRun = Thread.interrupted();
        }

        assertThat(interruptedAfterRun).isTrue();
        assertThat(result.reason()).isEqualTo(TerminationReason.INTERRUPTED);
        assertThat(result.turns()).isEqualTo(1);
        assertThat(orchestrator.state()).isEqualTo(OrchestratorState.DONE);
        assertThat(Files.readString(result.artifacts().textLog())).contains("=== Conversation session ended");
    }

    @Test
    void shouldStopWhenCancelled() throws Exception {
        CancellationToken cancellation = new CancellationToken();
        ScriptedParticipant canceller = new ScriptedParticipant("A") {
            @Override
            public String generate(List<ChatMessage> context, int maxLength) throws GenerationException {
                cancellation.cancel();
                return super.generate(context, maxLength);
            }
        };
        ConversationOrchestrator orchestrator = orchestrator(
            settings(10_000),
            firstCandidateScheduler(),
            ConversationListener.NONE
        );

        ConversationResult result = orchestrator.run(List.of(canceller, new ScriptedParticipant("B")), "stop", cancellation);

        assertThat(result.reason()).isEqualTo(TerminationReason.CANCELLED);
        assertThat(result.turns()).isEqualTo(1);
        assertThat(Files.readString(result.artifacts().textLog())).contains("=== Conversation session ended");
    }

    @Test
    void shouldRequireAtLeastTwoParticipantsBeforeStartingASession() throws Exception {
        ConversationOrchestrator orchestrator = orchestrator(settings(100), new TurnScheduler(), ConversationListener.NONE);

        assertThatThrownBy(() -> orchestrator.run(List.of(new ScriptedParticipant("A")), "solo", new CancellationToken()))
            .isInstanceOf(IllegalArgumentException.class);

        try (Stream<Path> files = Files.list(tempDir)) {
            assertThat(files).isEmpty();
        }
    }

    @Test
    void shouldRejectDuplicateParticipantNames() {
        ConversationOrchestrator orchestrator = orchestrator(settings(100), new TurnScheduler(), ConversationListener.NONE);

        assertThatThrownBy(() -> orchestrator.run(
            List.of(new ScriptedParticipant("A"), new ScriptedParticipant("A")),
            "dupes",
            new CancellationToken()
        )).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shouldFinalizeSessionWhenRecordingFails() {
        FailingRecorder recorder = new FailingRecorder();
        ConversationOrchestrator orchestrator = new ConversationOrchestrator(
            settings(100),
            TWENTY_PER_TEXT,
            recorder,
            new TurnScheduler(),
            CLOCK,
            ConversationListener.NONE
        );

        assertThatThrownBy(() -> orchestrator.run(
            List.of(new ScriptedParticipant("A"), new ScriptedParticipant("B")),
            "broken",
            new CancellationToken()
        )).isInstanceOf(IOException.class).hasMessage("disk full");

        assertThat(recorder.finalizeCalls).isEqualTo(1);
        assertThat(orchestrator.state()).isEqualTo(OrchestratorState.DONE);
    }

    @Test
    void listenerFailuresShouldNotStopTheConversation() throws Exception {
        ConversationListener noisy = new ConversationListener() {
            @Override
            public void onUtterance(Utterance utterance, BudgetSummary budget) {
                throw new IllegalStateException("render failed");
            }
        };
        ConversationOrchestrator orchestrator = orchestrator(settings(100), new TurnScheduler(), noisy);

        ConversationResult result = orchestrator.run(
            List.of(new ScriptedParticipant("A"), new ScriptedParticipant("B")),
            "noisy",
            new CancellationToken()
        );

        assertThat(result.turns()).isEqualTo(3);
    }

    @Test
    void orchestratorShouldBeSingleUse() throws Exception {
        ConversationOrchestrator orchestrator = orchestrator(settings(10), new TurnScheduler(), ConversationListener.NONE);
        List<Participant> participants = List.of(new ScriptedParticipant("A"), new ScriptedParticipant("B"));
        orchestrator.run(participants, "once", new CancellationToken());

        assertThatThrownBy(() -> orchestrator.run(participants, "twice", new CancellationToken()))
            .isInstanceOf(IllegalStateException.class);
    }

    private ConversationOrchestrator orchestrator(
        ConversationSettings settings,
        TurnScheduler scheduler,
        ConversationListener listener
    ) {
        return new ConversationOrchestrator(
            settings,
            TWENTY_PER_TEXT,
            new FileSessionRecorder(tempDir, CLOCK),
            scheduler,
            CLOCK,
            listener
        );
    }

    private static ConversationSettings settings(long tokenLimit) {
        return ConversationSettings.defaults("rivers", tokenLimit).withDelays(Duration.ZERO, Duration.ZERO);
    }

    private static TurnScheduler firstCandidateScheduler() {
        return new TurnScheduler(new Random() {
            @Override
            public int nextInt(int bound) {
                return 0;
            }
        });
    }

    private static class ScriptedParticipant implements Participant {
        private final String name;
        private int failuresLeft;
        private int calls;
        final List<List<ChatMessage>> contexts = new ArrayList<>();

        ScriptedParticipant(String name) {
            this(name, 0);
        }

        ScriptedParticipant(String name, int failures) {
            this.name = name;
            this.failuresLeft = failures;
        }

        @Override
        public String name() {
            return name;
        }

        @Override
        public String generate(List<ChatMessage> context, int maxLength) throws GenerationException {
            contexts.add(context);
            calls++;
            if (failuresLeft > 0) {
                failuresLeft--;
                throw new GenerationException(name, "backend unavailable");
            }
            return name + " reply " + calls;
        }
    }

    private static final class FailingRecorder implements SessionRecorder {
        private int finalizeCalls;

        @Override
        public Session start(String sessionName) {
            return new Session(sessionName, CLOCK.instant());
        }

        @Override
        public void note(String message) {
        }

        @Override
        public void append(Utterance utterance) throws IOException {
            throw new IOException("disk full");
        }

        @Override
        public SessionSummary summary() {
            return SessionSummary.empty("broken");
        }

        @Override
        public SessionArtifacts finalizeSession(SessionSummary summary) {
            finalizeCalls++;
            return new SessionArtifacts(Path.of("broken.txt"), Path.of("broken.json"), CLOCK.instant());
        }
    }
}

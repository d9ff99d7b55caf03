package io.chorus.cli;

import io.chorus.core.budget.JtokkitTokenCounter;
import io.chorus.core.config.ConfigPaths;
import io.chorus.core.config.model.ChorusConfig;
import io.chorus.core.config.model.ConversationDefaults;
import io.chorus.core.conversation.CancellationToken;
import io.chorus.core.conversation.ConversationOrchestrator;
import io.chorus.core.conversation.ConversationResult;
import io.chorus.core.conversation.ConversationSettings;
import io.chorus.core.participant.Participant;
import io.chorus.core.participant.ParticipantRoster;
import io.chorus.core.schedule.TurnScheduler;
import io.chorus.core.session.FileSessionRecorder;
import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(name = "converse", description = "Run a budgeted conversation between the configured participants")
public final class ConverseCommand implements Callable<Integer> {
    private static final Logger LOG = LoggerFactory.getLogger(ConverseCommand.class);
    private static final long SHUTDOWN_GRACE_SECONDS = 30;

    private final CliContext context;

    @Option(names = {"-t", "--topic"}, description = "Conversation topic")
    String topic;

    @Option(names = {"-l", "--token-limit"}, description = "Token budget for the session")
    Long tokenLimit;

    @Option(names = {"-n", "--session-name"}, description = "Base name of the log files")
    String sessionName;

    @Option(names = "--delay", description = "Seconds to wait between turns")
    Integer delaySeconds;

    @Option(names = "--probe", description = "Send a short greeting to every participant first and drop the ones that fail")
    boolean probe;

    public ConverseCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            ChorusConfig config = resolveConfig();
            ConversationSettings settings = config.conversationSettings();
            if (delaySeconds != null) {
                settings = settings.withDelays(Duration.ofSeconds(delaySeconds), settings.failureBackoff());
            }

            List<Participant> participants = context.participantFactory().create(config);
            if (probe) {
                participants = ParticipantRoster.probe(participants);
            }
            if (participants.size() < 2) {
                System.err.println("At least 2 participants are required, found " + participants.size()
                    + ". Configure more API keys (see the status command).");
                return 1;
            }
            System.out.println("Participants: " + participants.stream().map(Participant::name).collect(Collectors.joining(", ")));

            Clock clock = Clock.systemDefaultZone();
            ConversationOrchestrator orchestrator = new ConversationOrchestrator(
                settings,
                new JtokkitTokenCounter(),
                new FileSessionRecorder(ConfigPaths.resolveLogDir(config.conversation().logDir()), clock),
                new TurnScheduler(),
                clock,
                new ConsoleReporter(System.out, clock.getZone())
            );
            return runWithShutdownHook(orchestrator, participants);
        } catch (Exception e) {
            System.err.println("Converse command failed: " + e.getMessage());
            return 1;
        }
    }

    private ChorusConfig resolveConfig() throws IOException {
        ChorusConfig loaded = context.configService().applyEnvironment(
            context.configService().load(context.configPath()),
            context.environment()
        );
        ConversationDefaults conversation = loaded.conversation();
        if (topic != null && !topic.isBlank()) {
            conversation = conversation.withTopic(topic.trim());
        }
        if (tokenLimit != null) {
            conversation = conversation.withTokenLimit(tokenLimit);
        }
        return new ChorusConfig(conversation, loaded.providers());
    }

    private int runWithShutdownHook(ConversationOrchestrator orchestrator, List<Participant> participants)
        throws IOException {
        CancellationToken cancellation = new CancellationToken();
        CountDownLatch finished = new CountDownLatch(1);
        Thread hook = new Thread(() -> {
            cancellation.cancel();
            try {
                if (!finished.await(SHUTDOWN_GRACE_SECONDS, TimeUnit.SECONDS)) {
                    LOG.warn("Session did not finish within {}s of the shutdown request", SHUTDOWN_GRACE_SECONDS);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }, "chorus-shutdown");
        Runtime.getRuntime().addShutdownHook(hook);

        try {
            ConversationResult result = orchestrator.run(participants, sessionName, cancellation);
            LOG.info("Session {} ended: {}", result.session().name(), result.reason());
            return 0;
        } finally {
            finished.countDown();
            removeHook(hook);
        }
    }

    private static void removeHook(Thread hook) {
        try {
            Runtime.getRuntime().removeShutdownHook(hook);
        } catch (IllegalStateException e) {
            // Already shutting down; the hook is running.
            LOG.debug("Shutdown in progress, hook stays registered");
        }
    }
}

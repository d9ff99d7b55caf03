package io.chorus.core.session;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.chorus.core.model.Utterance;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes {@code <name>.txt} (append-only, synced on every write) and {@code <name>.json}
 * (full snapshot, replaced atomically) under the log directory.
 */
public final class FileSessionRecorder implements SessionRecorder {
    private static final Logger LOG = LoggerFactory.getLogger(FileSessionRecorder.class);
    private static final DateTimeFormatter DISPLAY_TIME = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");
    private static final DateTimeFormatter NAME_TIME = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");
    private static final String RULE = "-".repeat(50);
    private static final String SEPARATOR = "=".repeat(80);

    private final Path logDir;
    private final Clock clock;
    private final ObjectMapper mapper;
    private final List<Utterance> messages = new ArrayList<>();
    private final List<SessionNote> notes = new ArrayList<>();

    private Session session;
    private Path textLogPath;
    private Path snapshotPath;
    private SessionArtifacts artifacts;

    public FileSessionRecorder(Path logDir, Clock clock) {
        this.logDir = Objects.requireNonNull(logDir, "logDir must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.mapper = new ObjectMapper();
        this.mapper.registerModule(new JavaTimeModule());
        this.mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    @Override
    public Session start(String sessionName) throws IOException {
        if (session != null) {
            throw new IllegalStateException("Session " + session.name() + " already started");
        }
        Instant now = clock.instant();
        Files.createDirectories(logDir);
        String name;
        if (sessionName == null || sessionName.isBlank()) {
            name = firstFreeName("conversation_" + NAME_TIME.format(now.atZone(clock.getZone())));
        } else {
            name = validateName(sessionName.trim());
            if (recordExists(name)) {
                throw new FileAlreadyExistsException(
                    logDir.resolve(name + ".txt").toString(),
                    null,
                    "a session with this name was already recorded; choose another session name"
                );
            }
        }

        textLogPath = logDir.resolve(name + ".txt");
        snapshotPath = logDir.resolve(name + ".json");
        session = new Session(name, now);

        Files.writeString(
            textLogPath,
            "=== Conversation session started: " + display(now) + " ===" + System.lineSeparator(),
            StandardCharsets.UTF_8,
            StandardOpenOption.CREATE_NEW,
            StandardOpenOption.WRITE,
            StandardOpenOption.SYNC
        );
        writeSnapshot(null, null);
        LOG.info("Session {} started, logging to {}", name, textLogPath);
        return session;
    }

    @Override
    public void note(String message) throws IOException {
        ensureWritable();
        SessionNote note = new SessionNote(clock.instant(), message == null ? "" : message);
        notes.add(note);
        appendText("[" + display(note.timestamp()) + "] System: " + note.message() + System.lineSeparator());
        writeSnapshot(null, null);
    }

    @Override
    public void append(Utterance utterance) throws IOException {
        Objects.requireNonNull(utterance, "utterance must not be null");
        ensureWritable();
        appendText(formatUtterance(utterance));
        messages.add(utterance);
        writeSnapshot(null, null);
    }

    @Override
    public SessionSummary summary() {
        String name = session == null ? "" : session.name();
        if (messages.isEmpty()) {
            return SessionSummary.empty(name);
        }

        long totalTokens = 0;
        double totalCost = 0.0;
        Map<String, ParticipantStats> stats = new LinkedHashMap<>();
        for (Utterance message : messages) {
            totalTokens += message.tokens();
            totalCost += message.cost();
            stats.merge(
                message.speaker(),
                new ParticipantStats(1, message.tokens(), message.cost()),
                (a, b) -> new ParticipantStats(a.count() + b.count(), a.tokens() + b.tokens(), a.cost() + b.cost())
            );
        }
        Map<String, ParticipantStats> rounded = new LinkedHashMap<>();
        stats.forEach((speaker, value) -> rounded.put(
            speaker,
            new ParticipantStats(value.count(), value.tokens(), round(value.cost(), 4))
        ));

        Instant first = messages.get(0).timestamp();
        Instant last = messages.get(messages.size() - 1).timestamp();
        return new SessionSummary(
            name,
            first,
            last,
            durationMinutes(),
            messages.size(),
            totalTokens,
            round(totalCost, 4),
            rounded
        );
    }

    @Override
    public SessionArtifacts finalizeSession(SessionSummary summary) throws IOException {
        if (session == null) {
            throw new IllegalStateException("Session has not been started");
        }
        if (artifacts != null) {
            LOG.warn("Session {} already finalized; keeping the existing record", session.name());
            return artifacts;
        }

        SessionSummary effective = summary == null ? summary() : summary;
        Instant endedAt = clock.instant();
        appendText(formatEnd(endedAt, effective));
        writeSnapshot(endedAt, effective);
        artifacts = new SessionArtifacts(textLogPath, snapshotPath, endedAt);
        LOG.info("Session {} finalized: {} messages, {} tokens", session.name(), effective.messageCount(), effective.totalTokens());
        return artifacts;
    }

    public SessionSnapshot readSnapshot(Path path) throws IOException {
        return mapper.readValue(Files.readString(path, StandardCharsets.UTF_8), SessionSnapshot.class);
    }

    private double durationMinutes() {
        if (messages.size() < 2) {
            return 0.0;
        }
        Duration duration = Duration.between(messages.get(0).timestamp(), messages.get(messages.size() - 1).timestamp());
        return round(duration.toMillis() / 60_000.0, 2);
    }

    private String firstFreeName(String base) {
        String candidate = base;
        for (int suffix = 2; recordExists(candidate); suffix++) {
            candidate = base + "_" + suffix;
        }
        return candidate;
    }

    private boolean recordExists(String name) {
        return Files.exists(logDir.resolve(name + ".txt")) || Files.exists(logDir.resolve(name + ".json"));
    }

    private void ensureWritable() {
        if (session == null) {
            throw new IllegalStateException("Session has not been started");
        }
        if (artifacts != null) {
            throw new IllegalStateException("Session " + session.name() + " is already finalized");
        }
    }

    private void appendText(String text) throws IOException {
        Files.writeString(
            textLogPath,
            text,
            StandardCharsets.UTF_8,
            StandardOpenOption.CREATE,
            StandardOpenOption.APPEND,
            StandardOpenOption.WRITE,
            StandardOpenOption.SYNC
        );
    }

    private void writeSnapshot(Instant endedAt, SessionSummary summary) throws IOException {
        SessionSnapshot snapshot = new SessionSnapshot(
            session.name(),
            session.startedAt(),
            endedAt,
            messages.size(),
            notes,
            messages,
            summary
        );
        String json = mapper.writerWithDefaultPrettyPrinter().writeValueAsString(snapshot);
        Path tmp = snapshotPath.resolveSibling(snapshotPath.getFileName() + ".tmp");
        Files.writeString(
            tmp,
            json + System.lineSeparator(),
            StandardCharsets.UTF_8,
            StandardOpenOption.CREATE,
            StandardOpenOption.TRUNCATE_EXISTING,
            StandardOpenOption.WRITE,
            StandardOpenOption.SYNC
        );
        Files.move(tmp, snapshotPath, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    }

    private String formatUtterance(Utterance utterance) {
        String nl = System.lineSeparator();
        return nl
            + "[" + display(utterance.timestamp()) + "] " + utterance.speaker() + nl
            + RULE + nl
            + utterance.content() + nl
            + nl
            + String.format(Locale.ROOT, "Tokens: %d, Cost: $%.4f", utterance.tokens(), utterance.cost()) + nl
            + SEPARATOR + nl;
    }

    private String formatEnd(Instant endedAt, SessionSummary summary) {
        String nl = System.lineSeparator();
        StringBuilder end = new StringBuilder()
            .append(nl)
            .append("=== Conversation session ended: ").append(display(endedAt)).append(" ===").append(nl)
            .append(nl)
            .append("Session statistics:").append(nl)
            .append("- Messages: ").append(summary.messageCount()).append(nl)
            .append(String.format(Locale.ROOT, "- Total tokens: %,d", summary.totalTokens())).append(nl)
            .append(String.format(Locale.ROOT, "- Total cost: $%.4f", summary.totalCost())).append(nl)
            .append(String.format(Locale.ROOT, "- Duration: %.1f min", summary.durationMinutes())).append(nl);
        summary.byParticipant().forEach((speaker, stats) -> end
            .append(String.format(
                Locale.ROOT,
                "- %s: %d messages, %,d tokens, $%.4f",
                speaker,
                stats.count(),
                stats.tokens(),
                stats.cost()
            ))
            .append(nl));
        return end.toString();
    }

    private String display(Instant instant) {
        return DISPLAY_TIME.format(instant.atZone(clock.getZone()));
    }

    private static String validateName(String name) {
        if (name.contains("/") || name.contains("\\") || name.contains("..")) {
            throw new IllegalArgumentException("Invalid session name: " + name);
        }
        return name;
    }

    private static double round(double value, int places) {
        double scale = Math.pow(10, places);
        return Math.round(value * scale) / scale;
    }
}

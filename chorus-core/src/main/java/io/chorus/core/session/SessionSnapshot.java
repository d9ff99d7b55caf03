package io.chorus.core.session;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.chorus.core.model.Utterance;
import java.time.Instant;
import java.util.List;

/**
 * Structured view of a whole session as persisted in {@code <name>.json}. {@code endedAt} and
 * {@code summary} stay {@code null} until the session is finalized.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SessionSnapshot(
    String sessionName,
    Instant startedAt,
    Instant endedAt,
    int messageCount,
    List<SessionNote> notes,
    List<Utterance> messages,
    SessionSummary summary
) {
    public SessionSnapshot {
        notes = notes == null ? List.of() : List.copyOf(notes);
        messages = messages == null ? List.of() : List.copyOf(messages);
    }
}

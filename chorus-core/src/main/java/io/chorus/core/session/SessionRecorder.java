package io.chorus.core.session;

import io.chorus.core.model.Utterance;
import java.io.IOException;

/**
 * Durable record of one conversation session: an append-only text log plus a structured
 * snapshot that is rewritten after every change.
 */
public interface SessionRecorder {

    /**
     * Opens the session's sinks and writes the start marker.
     *
     * @param sessionName session name, or {@code null} to derive one from the current time
     */
    Session start(String sessionName) throws IOException;

    /**
     * Records a system note (topic, limits, participants). Notes are not utterances.
     */
    void note(String message) throws IOException;

    /**
     * Writes the utterance durably before returning.
     */
    void append(Utterance utterance) throws IOException;

    SessionSummary summary();

    /**
     * Writes the end marker and the final snapshot. Calling it again returns the artifacts of
     * the first call and leaves the persisted record untouched.
     */
    SessionArtifacts finalizeSession(SessionSummary summary) throws IOException;
}

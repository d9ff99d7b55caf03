package io.chorus.core.conversation;

import io.chorus.core.model.Utterance;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Ordered history of a conversation. Only the orchestrator mutates it, after a turn succeeds.
 */
public final class ConversationState {
    private final String topic;
    private final List<Utterance> history = new ArrayList<>();

    public ConversationState(String topic) {
        this.topic = Objects.requireNonNull(topic, "topic must not be null");
    }

    public String topic() {
        return topic;
    }

    public List<Utterance> history() {
        return List.copyOf(history);
    }

    public int size() {
        return history.size();
    }

    void open(Utterance announcement) {
        if (!history.isEmpty()) {
            throw new IllegalStateException("Conversation already opened");
        }
        history.add(announcement);
    }

    void append(Utterance utterance) {
        history.add(utterance);
    }
}

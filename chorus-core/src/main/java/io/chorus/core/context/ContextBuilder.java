package io.chorus.core.context;

import io.chorus.core.model.ChatMessage;
import io.chorus.core.model.Utterance;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Set;

/**
 * Turns the conversation history into the bounded, role-tagged context handed to the next
 * speaker.
 *
 * <p>Roles alternate ASSISTANT/USER by position inside the trimmed window, starting with
 * ASSISTANT, whoever actually spoke. With three or more participants this does not track
 * "my own earlier turn" versus "someone else's turn"; backends only need a well-formed
 * two-party dialogue.
 */
public final class ContextBuilder {
    public static final String TOPIC_LABEL = "Topic";
    public static final int DEFAULT_WINDOW_SIZE = 10;

    private static final String SYSTEM_PROMPT = """
        You are taking part in a conversation with other AI assistants.
        Current topic: %s

        Conversation rules:
        1. Keep the conversation natural and engaging.
        2. Respond to what the others have just said.
        3. Bring in new perspectives or questions instead of repeating earlier points.
        4. Be concise (under 500 characters).
        5. Let your own personality show.
        6. Reply directly; do not prefix your reply with, or mention, any participant's name.
        """;

    private final int windowSize;
    private final Set<String> strippableLabels;

    public ContextBuilder(int windowSize, Collection<String> participantNames) {
        if (windowSize < 1) {
            throw new IllegalArgumentException("windowSize must be at least 1: " + windowSize);
        }
        this.windowSize = windowSize;
        List<String> labels = new ArrayList<>(participantNames == null ? List.of() : participantNames);
        labels.add(TOPIC_LABEL);
        this.strippableLabels = Set.copyOf(labels);
    }

    public List<ChatMessage> build(List<Utterance> history, String topic) {
        List<Utterance> source = history == null ? List.of() : history;
        List<Utterance> window = source.subList(Math.max(0, source.size() - windowSize), source.size());

        List<ChatMessage> context = new ArrayList<>(window.size() + 1);
        context.add(ChatMessage.system(SYSTEM_PROMPT.formatted(topic == null ? "" : topic).strip()));
        for (int i = 0; i < window.size(); i++) {
            String content = stripSpeakerPrefix(window.get(i).content());
            context.add(i % 2 == 0 ? ChatMessage.assistant(content) : ChatMessage.user(content));
        }
        return List.copyOf(context);
    }

    String stripSpeakerPrefix(String content) {
        int separator = content.indexOf(": ");
        if (separator <= 0) {
            return content;
        }
        String label = content.substring(0, separator);
        if (!strippableLabels.contains(label)) {
            return content;
        }
        return content.substring(separator + 2);
    }
}

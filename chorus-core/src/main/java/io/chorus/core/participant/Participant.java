package io.chorus.core.participant;

import io.chorus.core.model.ChatMessage;
import java.util.List;

/**
 * One voice in a conversation. Implementations wrap a single generation backend.
 */
public interface Participant {
    String name();

    /**
     * Produces the participant's next reply.
     *
     * @param context role-tagged context, system instruction first
     * @param maxLength upper bound hint for the reply length, in tokens
     * @throws GenerationException when the backend cannot produce a reply
     */
    String generate(List<ChatMessage> context, int maxLength) throws GenerationException;
}

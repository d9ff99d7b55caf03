package io.chorus.core.context;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.chorus.core.model.ChatMessage;
import io.chorus.core.model.MessageRole;
import io.chorus.core.model.Utterance;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class ContextBuilderTest {

    private static final List<String> PARTICIPANTS = List.of("ChatGPT", "Claude", "Gemini");

    @Test
    void shouldKeepLastTenUtterancesWithAlternatingRoles() {
        List<Utterance> history = new ArrayList<>();
        for (int i = 1; i <= 15; i++) {
            history.add(utterance(PARTICIPANTS.get(i % 3), "message " + i));
        }

        List<ChatMessage> context = new ContextBuilder(10, PARTICIPANTS).build(history, "space travel");

        assertThat(context).hasSize(11);
        assertThat(context.get(0).role()).isEqualTo(MessageRole.SYSTEM);
        assertThat(context.get(0).content()).contains("Current topic: space travel");
        for (int i = 1; i < context.size(); i++) {
            MessageRole expected = (i - 1) % 2 == 0 ? MessageRole.ASSISTANT : MessageRole.USER;
            assertThat(context.get(i).role()).isEqualTo(expected);
            assertThat(context.get(i).content()).isEqualTo("message " + (i + 5));
        }
    }

    @Test
    void shouldIncludeWholeHistoryWhenShorterThanWindow() {
        List<Utterance> history = List.of(
            utterance("Topic", "Topic: tides"),
            utterance("Claude", "The moon pulls the oceans.")
        );

        List<ChatMessage> context = new ContextBuilder(10, PARTICIPANTS).build(history, "tides");

        assertThat(context).extracting(ChatMessage::role)
            .containsExactly(MessageRole.SYSTEM, MessageRole.ASSISTANT, MessageRole.USER);
        assertThat(context.get(1).content()).isEqualTo("tides");
        assertThat(context.get(2).content()).isEqualTo("The moon pulls the oceans.");
    }

    @Test
    void shouldOnlyStripKnownSpeakerPrefixes() {
        ContextBuilder builder = new ContextBuilder(10, PARTICIPANTS);

        assertThat(builder.stripSpeakerPrefix("Claude: I agree.")).isEqualTo("I agree.");
        assertThat(builder.stripSpeakerPrefix("Note: this stays")).isEqualTo("Note: this stays");
        assertThat(builder.stripSpeakerPrefix("No prefix at all")).isEqualTo("No prefix at all");
        assertThat(builder.stripSpeakerPrefix(": leading separator")).isEqualTo(": leading separator");
    }

    @Test
    void shouldReturnImmutableContext() {
        List<ChatMessage> context = new ContextBuilder(3, PARTICIPANTS).build(List.of(), "anything");

        assertThat(context).hasSize(1);
        assertThatThrownBy(() -> context.add(ChatMessage.user("extra")))
            .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void shouldRejectNonPositiveWindow() {
        assertThatThrownBy(() -> new ContextBuilder(0, PARTICIPANTS))
            .isInstanceOf(IllegalArgumentException.class);
    }

    private static Utterance utterance(String speaker, String content) {
        return new Utterance(speaker, content, Instant.parse("2026-01-01T00:00:00Z"), 1, 0.0);
    }
}

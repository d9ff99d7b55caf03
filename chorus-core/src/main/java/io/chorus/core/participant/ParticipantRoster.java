package io.chorus.core.participant;

import io.chorus.core.config.model.ChorusConfig;
import io.chorus.core.config.model.ProviderConfig;
import io.chorus.core.model.ChatMessage;
import io.chorus.core.provider.AnthropicProvider;
import io.chorus.core.provider.GeminiProvider;
import io.chorus.core.provider.LlmProvider;
import io.chorus.core.provider.OpenAiCompatProvider;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.BiFunction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds the participants available for a session from the provider configuration.
 * A provider without an API key contributes no participant.
 */
public final class ParticipantRoster {
    private static final Logger LOG = LoggerFactory.getLogger(ParticipantRoster.class);

    static final String OPENAI_BASE = "https://api.openai.com/v1";
    static final String ANTHROPIC_BASE = "https://api.anthropic.com/v1";
    static final String GEMINI_BASE = "https://generativelanguage.googleapis.com/v1beta";
    static final String PROBE_PROMPT = "Hello";
    static final int PROBE_MAX_TOKENS = 10;

    private ParticipantRoster() {
    }

    public static List<Participant> fromConfig(ChorusConfig config) {
        double temperature = config.conversation().temperature();
        List<Participant> participants = new ArrayList<>();
        add(participants, config.providers().openai(), temperature,
            (name, provider) -> new OpenAiCompatProvider(name, provider.apiKey(), resolveBase(provider, OPENAI_BASE), Map.of()));
        add(participants, config.providers().anthropic(), temperature,
            (name, provider) -> new AnthropicProvider(name, provider.apiKey(), resolveBase(provider, ANTHROPIC_BASE)));
        add(participants, config.providers().gemini(), temperature,
            (name, provider) -> new GeminiProvider(name, provider.apiKey(), resolveBase(provider, GEMINI_BASE)));
        return participants;
    }

    /**
     * Keeps only the participants that answer a short greeting.
     */
    public static List<Participant> probe(List<Participant> candidates) {
        List<Participant> reachable = new ArrayList<>();
        for (Participant candidate : candidates) {
            try {
                candidate.generate(List.of(ChatMessage.user(PROBE_PROMPT)), PROBE_MAX_TOKENS);
                reachable.add(candidate);
            } catch (GenerationException e) {
                LOG.warn("Dropping {}: connection test failed: {}", candidate.name(), e.getMessage());
            }
        }
        return reachable;
    }

    private static void add(
        List<Participant> participants,
        ProviderConfig provider,
        double temperature,
        BiFunction<String, ProviderConfig, LlmProvider> factory
    ) {
        if (provider == null || !provider.configured()) {
            return;
        }
        if (provider.participant() == null || provider.participant().isBlank()) {
            LOG.warn("Skipping provider for model {}: no participant name configured", provider.model());
            return;
        }
        String name = provider.participant();
        participants.add(new ProviderParticipant(name, factory.apply(name, provider), provider.model(), temperature));
    }

    private static String resolveBase(ProviderConfig provider, String defaultBase) {
        return provider.apiBase() == null || provider.apiBase().isBlank() ? defaultBase : provider.apiBase();
    }
}

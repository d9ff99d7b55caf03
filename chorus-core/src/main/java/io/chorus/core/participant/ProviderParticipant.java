package io.chorus.core.participant;

import io.chorus.core.model.ChatMessage;
import io.chorus.core.provider.LlmProvider;
import io.chorus.core.provider.LlmResponse;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Adapts an {@link LlmProvider} to the participant contract. Error replies from the provider
 * and blank replies become {@link GenerationException}s.
 */
public final class ProviderParticipant implements Participant {
    private static final Logger LOG = LoggerFactory.getLogger(ProviderParticipant.class);

    private final String name;
    private final LlmProvider provider;
    private final String model;
    private final double temperature;

    public ProviderParticipant(String name, LlmProvider provider, String model, double temperature) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.provider = Objects.requireNonNull(provider, "provider must not be null");
        this.model = Objects.requireNonNull(model, "model must not be null");
        this.temperature = temperature;
    }

    @Override
    public String name() {
        return name;
    }

    public String model() {
        return model;
    }

    @Override
    public String generate(List<ChatMessage> context, int maxLength) throws GenerationException {
        LlmResponse response;
        try {
            response = provider.chat(model, context, maxLength, temperature);
        } catch (RuntimeException e) {
            throw new GenerationException(name, "provider " + provider.name() + " failed", e);
        }
        if (response.isError()) {
            throw new GenerationException(name, truncate(response.content(), 300));
        }
        String content = response.content() == null ? "" : response.content().strip();
        if (content.isEmpty()) {
            throw new GenerationException(name, "empty reply from provider " + provider.name());
        }
        LOG.debug("{} replied via {} ({}) usage={}", name, provider.name(), model, response.usage());
        return content;
    }

    private String truncate(String value, int max) {
        if (value.length() <= max) {
            return value;
        }
        return value.substring(0, max) + "...";
    }
}

package io.chorus.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.chorus.core.budget.TokenRates;
import io.chorus.core.conversation.ConversationSettings;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ChorusConfig(
    ConversationDefaults conversation,
    ProvidersConfig providers
) {

    public static ChorusConfig defaults() {
        return new ChorusConfig(
            ConversationDefaults.defaults(),
            ProvidersConfig.defaults()
        );
    }

    public List<ProviderConfig> allProviders() {
        return List.of(providers.openai(), providers.anthropic(), providers.gemini());
    }

    /**
     * Session settings with the per-participant rates of every provider.
     */
    public ConversationSettings conversationSettings() {
        Map<String, TokenRates> rates = new LinkedHashMap<>();
        for (ProviderConfig provider : allProviders()) {
            rates.put(provider.participant(), provider.rates());
        }
        return new ConversationSettings(
            conversation.topic(),
            conversation.tokenLimit(),
            conversation.warningThreshold(),
            conversation.contextWindowSize(),
            Duration.ofSeconds(conversation.interTurnDelaySeconds()),
            Duration.ofSeconds(conversation.failureBackoffSeconds()),
            conversation.maxResponseLength(),
            rates
        );
    }
}

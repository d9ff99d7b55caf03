package io.chorus.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ProvidersConfig(
    ProviderConfig openai,
    ProviderConfig anthropic,
    ProviderConfig gemini
) {

    public static ProvidersConfig defaults() {
        return new ProvidersConfig(
            ProviderConfig.openaiDefaults(),
            ProviderConfig.anthropicDefaults(),
            ProviderConfig.geminiDefaults()
        );
    }
}

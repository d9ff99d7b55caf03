package io.chorus.core.config.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.chorus.core.budget.TokenRates;

/**
 * One generation backend and the participant it plays. Costs are in USD per million tokens.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ProviderConfig(
    String participant,
    @JsonAlias({"api_key"}) String apiKey,
    @JsonAlias({"api_base"}) String apiBase,
    String model,
    @JsonAlias({"input_cost_per_million"}) double inputCostPerMillion,
    @JsonAlias({"output_cost_per_million"}) double outputCostPerMillion
) {

    public static ProviderConfig openaiDefaults() {
        return new ProviderConfig("ChatGPT", "", "https://api.openai.com/v1", "gpt-4o", 2.50, 10.00);
    }

    public static ProviderConfig anthropicDefaults() {
        return new ProviderConfig("Claude", "", "https://api.anthropic.com/v1", "claude-3-5-sonnet-20241022", 3.00, 15.00);
    }

    public static ProviderConfig geminiDefaults() {
        return new ProviderConfig(
            "Gemini",
            "",
            "https://generativelanguage.googleapis.com/v1beta",
            "gemini-2.0-flash-exp",
            0.0,
            0.0
        );
    }

    public boolean configured() {
        return apiKey != null && !apiKey.isBlank();
    }

    public TokenRates rates() {
        return TokenRates.perMillion(Math.max(0, inputCostPerMillion), Math.max(0, outputCostPerMillion));
    }

    public ProviderConfig withApiKey(String newApiKey) {
        return new ProviderConfig(participant, newApiKey, apiBase, model, inputCostPerMillion, outputCostPerMillion);
    }
}

package io.chorus.core.provider;

import com.fasterxml.jackson.databind.JsonNode;
import io.chorus.core.model.ChatMessage;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import okhttp3.HttpUrl;

/**
 * Google Generative Language API ({@code models/{model}:generateContent}).
 * The role-tagged history is flattened into a single prompt.
 */
public final class GeminiProvider implements LlmProvider {
    static final String REPLY_CUE = "Your reply:";

    private final String name;
    private final String apiKey;
    private final HttpUrl apiBase;
    private final ChatTransport transport;

    public GeminiProvider(String name, String apiKey, String apiBase) {
        this(name, apiKey, apiBase, 3);
    }

    public GeminiProvider(String name, String apiKey, String apiBase, int maxAttempts) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.apiKey = apiKey == null ? "" : apiKey;
        this.apiBase = HttpUrl.get(Objects.requireNonNull(apiBase, "apiBase must not be null"));
        this.transport = new ChatTransport(name, maxAttempts);
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public LlmResponse chat(String model, List<ChatMessage> messages, int maxTokens, double temperature) {
        if (apiKey.isBlank()) {
            return LlmResponse.error("missing API key for provider " + name, Map.of());
        }
        Map<String, Object> generationConfig = new LinkedHashMap<>();
        generationConfig.put("maxOutputTokens", Math.max(1, maxTokens));
        generationConfig.put("temperature", temperature);

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("contents", List.of(Map.of(
            "role", "user",
            "parts", List.of(Map.of("text", flatten(messages)))
        )));
        payload.put("generationConfig", generationConfig);

        HttpUrl url = apiBase.newBuilder()
            .addPathSegment("models")
            .addPathSegment(model + ":generateContent")
            .build();
        return transport.post(url, Map.of("x-goog-api-key", apiKey), payload, GeminiProvider::readReply);
    }

    static String flatten(List<ChatMessage> messages) {
        StringBuilder prompt = new StringBuilder();
        for (ChatMessage message : messages) {
            String label = switch (message.role()) {
                case SYSTEM -> "System";
                case USER -> "User";
                case ASSISTANT -> "Assistant";
            };
            prompt.append(label).append(": ").append(message.content()).append("\n\n");
        }
        return prompt.append(REPLY_CUE).toString();
    }

    private static LlmResponse readReply(JsonNode root) {
        StringBuilder content = new StringBuilder();
        for (JsonNode part : root.path("candidates").path(0).path("content").path("parts")) {
            content.append(part.path("text").asText(""));
        }
        JsonNode usage = root.path("usageMetadata");
        return new LlmResponse(
            content.toString(),
            ChatTransport.usage(usage.get("promptTokenCount"), usage.get("candidatesTokenCount"))
        );
    }
}

package io.chorus.core.provider;

import com.fasterxml.jackson.databind.JsonNode;
import io.chorus.core.model.ChatMessage;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import okhttp3.HttpUrl;

/**
 * Any backend speaking the OpenAI {@code chat/completions} dialect. Replies are requested in
 * one piece; the whole role-tagged context is sent as is.
 */
public final class OpenAiCompatProvider implements LlmProvider {
    private final String name;
    private final String apiKey;
    private final HttpUrl completionsUrl;
    private final Map<String, String> headers;
    private final ChatTransport transport;

    public OpenAiCompatProvider(String name, String apiKey, String apiBase, Map<String, String> extraHeaders) {
        this(name, apiKey, apiBase, extraHeaders, 3);
    }

    public OpenAiCompatProvider(
        String name,
        String apiKey,
        String apiBase,
        Map<String, String> extraHeaders,
        int maxAttempts
    ) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.apiKey = apiKey == null ? "" : apiKey;
        this.completionsUrl = HttpUrl.get(Objects.requireNonNull(apiBase, "apiBase must not be null"))
            .newBuilder()
            .addPathSegment("chat")
            .addPathSegment("completions")
            .build();
        Map<String, String> allHeaders = new LinkedHashMap<>();
        allHeaders.put("Authorization", "Bearer " + this.apiKey);
        if (extraHeaders != null) {
            allHeaders.putAll(extraHeaders);
        }
        this.headers = Map.copyOf(allHeaders);
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
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("model", model);
        payload.put("messages", messages.stream().map(OpenAiCompatProvider::toWire).toList());
        payload.put("max_tokens", Math.max(1, maxTokens));
        payload.put("temperature", temperature);
        return transport.post(completionsUrl, headers, payload, OpenAiCompatProvider::readReply);
    }

    private static Map<String, Object> toWire(ChatMessage message) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("role", message.role().name().toLowerCase(Locale.ROOT));
        row.put("content", message.content());
        return row;
    }

    private static LlmResponse readReply(JsonNode root) {
        String content = root.path("choices").path(0).path("message").path("content").asText("");
        JsonNode usage = root.path("usage");
        return new LlmResponse(content, ChatTransport.usage(usage.get("prompt_tokens"), usage.get("completion_tokens")));
    }
}

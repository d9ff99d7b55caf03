package io.chorus.core.provider;

import com.fasterxml.jackson.databind.JsonNode;
import io.chorus.core.model.ChatMessage;
import io.chorus.core.model.MessageRole;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;
import okhttp3.HttpUrl;

/**
 * Anthropic messages API. System entries become the top-level {@code system} field and the
 * dialogue must open with a user turn, so an opener is inserted when the window starts with
 * an assistant entry.
 */
public final class AnthropicProvider implements LlmProvider {
    static final String CONVERSATION_OPENER = "Please continue the conversation.";
    private static final String API_VERSION = "2023-06-01";

    private final String name;
    private final String apiKey;
    private final HttpUrl messagesUrl;
    private final ChatTransport transport;

    public AnthropicProvider(String name, String apiKey, String apiBase) {
        this(name, apiKey, apiBase, 3);
    }

    public AnthropicProvider(String name, String apiKey, String apiBase, int maxAttempts) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.apiKey = apiKey == null ? "" : apiKey;
        this.messagesUrl = HttpUrl.get(Objects.requireNonNull(apiBase, "apiBase must not be null"))
            .newBuilder()
            .addPathSegment("messages")
            .build();
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
        payload.put("max_tokens", Math.max(1, maxTokens));
        payload.put("temperature", temperature);
        String system = messages.stream()
            .filter(message -> message.role() == MessageRole.SYSTEM)
            .map(ChatMessage::content)
            .filter(content -> !content.isBlank())
            .collect(Collectors.joining("\n\n"));
        if (!system.isEmpty()) {
            payload.put("system", system);
        }
        payload.put("messages", dialogue(messages));

        return transport.post(
            messagesUrl,
            Map.of("x-api-key", apiKey, "anthropic-version", API_VERSION),
            payload,
            AnthropicProvider::readReply
        );
    }

    private static List<Map<String, Object>> dialogue(List<ChatMessage> messages) {
        List<Map<String, Object>> turns = new ArrayList<>();
        for (ChatMessage message : messages) {
            if (message.role() != MessageRole.SYSTEM) {
                turns.add(turn(message.role() == MessageRole.ASSISTANT ? "assistant" : "user", message.content()));
            }
        }
        if (turns.isEmpty() || "assistant".equals(turns.get(0).get("role"))) {
            turns.add(0, turn("user", CONVERSATION_OPENER));
        }
        return turns;
    }

    private static Map<String, Object> turn(String role, String content) {
        Map<String, Object> turn = new LinkedHashMap<>();
        turn.put("role", role);
        turn.put("content", content);
        return turn;
    }

    private static LlmResponse readReply(JsonNode root) {
        StringBuilder text = new StringBuilder();
        for (JsonNode block : root.path("content")) {
            if ("text".equals(block.path("type").asText(""))) {
                text.append(block.path("text").asText(""));
            }
        }
        JsonNode usage = root.path("usage");
        return new LlmResponse(text.toString(), ChatTransport.usage(usage.get("input_tokens"), usage.get("output_tokens")));
    }
}

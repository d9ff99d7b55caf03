package io.chorus.core.provider;

import io.chorus.core.model.ChatMessage;
import java.util.List;

public interface LlmProvider {
    String ERROR_PREFIX = "Error calling LLM:";

    String name();

    LlmResponse chat(String model, List<ChatMessage> messages, int maxTokens, double temperature);
}

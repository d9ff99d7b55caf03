package io.chorus.core.provider;

import java.util.LinkedHashMap;
import java.util.Map;

public record LlmResponse(String content, Map<String, Object> usage) {
    public LlmResponse {
        usage = usage == null ? Map.of() : withoutNullValues(usage);
    }

    public boolean isError() {
        return content != null && content.startsWith(LlmProvider.ERROR_PREFIX);
    }

    static LlmResponse error(String detail, Map<String, Object> usage) {
        return new LlmResponse(LlmProvider.ERROR_PREFIX + " " + detail, usage);
    }

    private static Map<String, Object> withoutNullValues(Map<String, Object> source) {
        Map<String, Object> copy = new LinkedHashMap<>();
        source.forEach((key, value) -> {
            if (key != null && value != null) {
                copy.put(key, value);
            }
        });
        return Map.copyOf(copy);
    }
}

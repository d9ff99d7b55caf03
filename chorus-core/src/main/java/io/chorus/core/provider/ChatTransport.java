package io.chorus.core.provider;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One-shot JSON POST shared by the chat backends. Rate limits, server errors and I/O failures
 * are retried with doubling backoff; every outcome, including failures, is an {@link LlmResponse}.
 */
final class ChatTransport {
    private static final Logger LOG = LoggerFactory.getLogger(ChatTransport.class);
    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");
    private static final long INITIAL_BACKOFF_MS = 250;
    private static final long MAX_BACKOFF_MS = 2000;

    static final String INPUT_TOKENS = "input_tokens";
    static final String OUTPUT_TOKENS = "output_tokens";

    @FunctionalInterface
    interface ReplyParser {
        LlmResponse parse(JsonNode root);
    }

    private final String providerName;
    private final OkHttpClient client;
    private final ObjectMapper mapper;
    private final int maxAttempts;

    ChatTransport(String providerName, int maxAttempts) {
        this.providerName = providerName;
        this.maxAttempts = Math.max(1, maxAttempts);
        this.client = new OkHttpClient.Builder()
            .connectTimeout(Duration.ofSeconds(20))
            .readTimeout(Duration.ofSeconds(90))
            .writeTimeout(Duration.ofSeconds(20))
            .build();
        this.mapper = new ObjectMapper();
    }

    LlmResponse post(HttpUrl url, Map<String, String> headers, Map<String, Object> payload, ReplyParser parser) {
        RequestBody body;
        try {
            body = RequestBody.create(mapper.writeValueAsString(payload), JSON);
        } catch (JsonProcessingException e) {
            return LlmResponse.error("cannot encode request: " + e.getOriginalMessage(), Map.of());
        }
        Request.Builder builder = new Request.Builder().url(url).post(body);
        headers.forEach(builder::header);
        Request request = builder.build();

        long backoffMs = INITIAL_BACKOFF_MS;
        String lastFailure = "no attempt made";
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            int status;
            String responseBody;
            try (Response response = client.newCall(request).execute()) {
                status = response.code();
                responseBody = response.body() == null ? "" : response.body().string();
            } catch (IOException e) {
                lastFailure = String.valueOf(e.getMessage());
                LOG.debug("{} attempt {}/{} failed: {}", providerName, attempt, maxAttempts, lastFailure);
                if (attempt < maxAttempts && backOff(backoffMs)) {
                    backoffMs = Math.min(backoffMs * 2, MAX_BACKOFF_MS);
                    continue;
                }
                return LlmResponse.error(lastFailure, Map.of());
            }

            if (status >= 200 && status < 300) {
                return parse(responseBody, parser);
            }
            boolean retryable = status == 429 || status >= 500;
            LOG.debug("{} attempt {}/{} returned HTTP {}", providerName, attempt, maxAttempts, status);
            if (retryable && attempt < maxAttempts && backOff(backoffMs)) {
                backoffMs = Math.min(backoffMs * 2, MAX_BACKOFF_MS);
                continue;
            }
            return LlmResponse.error("HTTP " + status + " " + responseBody, Map.of("http_status", status));
        }
        return LlmResponse.error(lastFailure, Map.of());
    }

    /**
     * Usage in the provider-neutral shape; counts the backend did not report are left out.
     */
    static Map<String, Object> usage(JsonNode inputCount, JsonNode outputCount) {
        Map<String, Object> usage = new LinkedHashMap<>();
        if (inputCount != null && inputCount.isNumber()) {
            usage.put(INPUT_TOKENS, inputCount.asInt());
        }
        if (outputCount != null && outputCount.isNumber()) {
            usage.put(OUTPUT_TOKENS, outputCount.asInt());
        }
        return usage;
    }

    private LlmResponse parse(String responseBody, ReplyParser parser) {
        if (responseBody.isBlank()) {
            return new LlmResponse("", Map.of());
        }
        try {
            return parser.parse(mapper.readTree(responseBody));
        } catch (JsonProcessingException e) {
            return LlmResponse.error("unreadable reply from " + providerName + ": " + e.getOriginalMessage(), Map.of());
        }
    }

    private boolean backOff(long delayMs) {
        try {
            Thread.sleep(delayMs);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}

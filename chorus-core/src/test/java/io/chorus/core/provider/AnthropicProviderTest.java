package io.chorus.core.provider;

import static org.assertj.core.api.Assertions.assertThat;

import io.chorus.core.model.ChatMessage;
import java.io.IOException;
import java.util.List;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class AnthropicProviderTest {

    private MockWebServer server;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    @Test
    void shouldLiftSystemPromptAndParseTextBlocks() throws Exception {
        server.enqueue(new MockResponse()
            .setHeader("Content-Type", "application/json")
            .setBody("""
                {
                  "content": [
                    {"type": "text", "text": "Tides follow "},
                    {"type": "text", "text": "the moon."}
                  ],
                  "usage": {"input_tokens": 10, "output_tokens": 7}
                }
                """));

        AnthropicProvider provider = new AnthropicProvider("Claude", "sk-ant", server.url("/v1/").toString(), 1);

        LlmResponse response = provider.chat(
            "claude-3-5-sonnet-20241022",
            List.of(ChatMessage.system("sys"), ChatMessage.user("hi")),
            500,
            0.7
        );

        assertThat(response.content()).isEqualTo("Tides follow the moon.");
        assertThat(response.usage()).containsEntry("input_tokens", 10);

        RecordedRequest request = server.takeRequest();
        assertThat(request.getPath()).isEqualTo("/v1/messages");
        assertThat(request.getHeader("x-api-key")).isEqualTo("sk-ant");
        assertThat(request.getHeader("anthropic-version")).isEqualTo("2023-06-01");
        String body = request.getBody().readUtf8();
        assertThat(body).contains("\"system\":\"sys\"");
        assertThat(body).contains("\"messages\":[{\"role\":\"user\",\"content\":\"hi\"}]");
    }

    @Test
    void shouldOpenWithUserTurnWhenContextStartsWithAssistant() throws Exception {
        server.enqueue(new MockResponse()
            .setHeader("Content-Type", "application/json")
            .setBody("{\"content\":[{\"type\":\"text\",\"text\":\"ok\"}],\"usage\":{}}"));

        AnthropicProvider provider = new AnthropicProvider("Claude", "sk-ant", server.url("/v1/").toString(), 1);

        provider.chat(
            "claude-3-5-sonnet-20241022",
            List.of(ChatMessage.system("sys"), ChatMessage.assistant("rivers")),
            500,
            0.7
        );

        String body = server.takeRequest().getBody().readUtf8();
        assertThat(body).contains(
            "\"messages\":[{\"role\":\"user\",\"content\":\"" + AnthropicProvider.CONVERSATION_OPENER + "\"},"
                + "{\"role\":\"assistant\",\"content\":\"rivers\"}]"
        );
    }

    @Test
    void shouldReportClientErrorsWithoutRetrying() {
        server.enqueue(new MockResponse().setResponseCode(401).setBody("{\"error\":\"bad key\"}"));

        AnthropicProvider provider = new AnthropicProvider("Claude", "sk-ant", server.url("/v1/").toString(), 3);

        LlmResponse response = provider.chat("claude-3-5-sonnet-20241022", List.of(ChatMessage.user("hi")), 10, 0.7);

        assertThat(response.isError()).isTrue();
        assertThat(response.content()).contains("HTTP 401");
        assertThat(server.getRequestCount()).isEqualTo(1);
    }
}

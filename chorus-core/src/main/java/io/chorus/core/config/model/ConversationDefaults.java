package io.chorus.core.config.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ConversationDefaults(
    String topic,
    @JsonAlias({"token_limit"}) long tokenLimit,
    @JsonAlias({"warning_threshold"}) double warningThreshold,
    @JsonAlias({"context_window_size"}) int contextWindowSize,
    @JsonAlias({"inter_turn_delay_seconds"}) int interTurnDelaySeconds,
    @JsonAlias({"failure_backoff_seconds"}) int failureBackoffSeconds,
    @JsonAlias({"max_response_length"}) int maxResponseLength,
    double temperature,
    @JsonAlias({"log_dir"}) String logDir
) {

    public static ConversationDefaults defaults() {
        return new ConversationDefaults(
            "Discuss a general topic freely",
            50_000,
            0.9,
            10,
            2,
            2,
            1000,
            0.7,
            "~/.chorus/logs"
        );
    }

    public ConversationDefaults withTopic(String newTopic) {
        return new ConversationDefaults(
            newTopic,
            tokenLimit,
            warningThreshold,
            contextWindowSize,
            interTurnDelaySeconds,
            failureBackoffSeconds,
            maxResponseLength,
            temperature,
            logDir
        );
    }

    public ConversationDefaults withTokenLimit(long newTokenLimit) {
        return new ConversationDefaults(
            topic,
            newTokenLimit,
            warningThreshold,
            contextWindowSize,
            interTurnDelaySeconds,
            failureBackoffSeconds,
            maxResponseLength,
            temperature,
            logDir
        );
    }
}

package io.chorus.core.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.chorus.core.config.model.ChorusConfig;
import io.chorus.core.config.model.ConversationDefaults;
import io.chorus.core.config.model.ProviderConfig;
import io.chorus.core.config.model.ProvidersConfig;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class ConfigService {
    private static final Logger LOG = LoggerFactory.getLogger(ConfigService.class);

    private final ObjectMapper mapper;

    public ConfigService() {
        mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    public ChorusConfig load(Path configPath) throws IOException {
        Objects.requireNonNull(configPath, "configPath must not be null");
        if (!Files.exists(configPath)) {
            return ChorusConfig.defaults();
        }

        JsonNode defaultsNode = mapper.valueToTree(ChorusConfig.defaults());
        JsonNode existingNode = mapper.readTree(Files.readString(configPath));
        JsonNode merged = deepMerge(defaultsNode, existingNode);
        return mapper.treeToValue(merged, ChorusConfig.class);
    }

    public void save(Path configPath, ChorusConfig config) throws IOException {
        Objects.requireNonNull(configPath, "configPath must not be null");
        Objects.requireNonNull(config, "config must not be null");
        Path parent = configPath.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        String json = mapper.writerWithDefaultPrettyPrinter().writeValueAsString(config);
        Files.writeString(configPath, json + System.lineSeparator());
    }

    public OnboardResult onboard(Path configPath, boolean overwrite) throws IOException {
        boolean created = !Files.exists(configPath);
        boolean overwritten = false;

        ChorusConfig config;
        if (created || overwrite) {
            config = ChorusConfig.defaults();
            overwritten = !created && overwrite;
        } else {
            config = load(configPath);
        }

        save(configPath, config);

        Path logDir = ConfigPaths.resolveLogDir(config.conversation().logDir());
        Files.createDirectories(logDir);
        return new OnboardResult(configPath, logDir, created, overwritten);
    }

    /**
     * Overlays API keys and the default token limit from environment variables. Values already
     * present in the file win for API keys; {@code DEFAULT_TOKEN_LIMIT} always wins when it parses.
     */
    public ChorusConfig applyEnvironment(ChorusConfig config, Map<String, String> env) {
        Objects.requireNonNull(config, "config must not be null");
        if (env == null || env.isEmpty()) {
            return config;
        }

        ProvidersConfig providers = new ProvidersConfig(
            withEnvKey(config.providers().openai(), env.get("OPENAI_API_KEY")),
            withEnvKey(config.providers().anthropic(), env.get("ANTHROPIC_API_KEY")),
            withEnvKey(config.providers().gemini(), env.get("GOOGLE_API_KEY"))
        );

        ConversationDefaults conversation = config.conversation();
        String rawLimit = env.get("DEFAULT_TOKEN_LIMIT");
        if (rawLimit != null && !rawLimit.isBlank()) {
            try {
                long limit = Long.parseLong(rawLimit.trim());
                if (limit > 0) {
                    conversation = conversation.withTokenLimit(limit);
                } else {
                    LOG.warn("Ignoring non-positive DEFAULT_TOKEN_LIMIT={}", rawLimit);
                }
            } catch (NumberFormatException e) {
                LOG.warn("Ignoring unparseable DEFAULT_TOKEN_LIMIT={}", rawLimit);
            }
        }
        return new ChorusConfig(conversation, providers);
    }

    private static ProviderConfig withEnvKey(ProviderConfig provider, String envKey) {
        if (provider.configured() || envKey == null || envKey.isBlank()) {
            return provider;
        }
        return provider.withApiKey(envKey.trim());
    }

    private JsonNode deepMerge(JsonNode base, JsonNode override) {
        if (base == null) {
            return override;
        }
        if (override == null) {
            return base;
        }
        if (!base.isObject() || !override.isObject()) {
            return override;
        }

        ObjectNode merged = ((ObjectNode) base).deepCopy();
        override.fields().forEachRemaining(entry -> {
            JsonNode existing = merged.get(entry.getKey());
            merged.set(entry.getKey(), deepMerge(existing, entry.getValue()));
        });
        return merged;
    }
}

package fr.lapetina.thoughts.ai.domain.model;

import java.time.Duration;
import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Closed set of reasoning backends known to the orchestrator.
 * The per-backend defaults apply when the configuration leaves a value out.
 */
public enum BackendId {
    CLAUDE("claude", Duration.ofSeconds(30),
            "https://api.anthropic.com/v1/messages", "claude-3-5-sonnet-20241022", 200_000),
    OLLAMA("ollama", Duration.ofSeconds(120),
            "http://localhost:11434", "gemma3:27b", 8_192),
    OPENAI("openai", Duration.ofSeconds(60),
            "http://localhost:1234/v1", "local-model", 8_192),
    STUB("stub", Duration.ofSeconds(5),
            null, "mock-v1.0", 100_000);

    private final String configName;
    private final Duration defaultTimeout;
    private final String defaultEndpoint;
    private final String defaultModel;
    private final int defaultContextWindowTokens;

    BackendId(String configName, Duration defaultTimeout, String defaultEndpoint,
              String defaultModel, int defaultContextWindowTokens) {
        this.configName = configName;
        this.defaultTimeout = defaultTimeout;
        this.defaultEndpoint = defaultEndpoint;
        this.defaultModel = defaultModel;
        this.defaultContextWindowTokens = defaultContextWindowTokens;
    }

    public String configName() {
        return configName;
    }

    public Duration defaultTimeout() {
        return defaultTimeout;
    }

    public String defaultEndpoint() {
        return defaultEndpoint;
    }

    public String defaultModel() {
        return defaultModel;
    }

    public int defaultContextWindowTokens() {
        return defaultContextWindowTokens;
    }

    /**
     * Resolves a configuration name. {@code mock} is accepted as an alias of {@link #STUB}.
     *
     * @throws IllegalArgumentException if the name matches no backend
     */
    public static BackendId fromName(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Backend name is required");
        }
        String normalized = name.trim().toLowerCase(Locale.ROOT);
        if (normalized.equals("mock")) {
            return STUB;
        }
        for (BackendId id : values()) {
            if (id.configName.equals(normalized)) {
                return id;
            }
        }
        throw new IllegalArgumentException("Unknown backend '" + name + "', known backends: "
                + Arrays.stream(values()).map(BackendId::configName).collect(Collectors.joining(", ")));
    }

    @Override
    public String toString() {
        return configName;
    }
}

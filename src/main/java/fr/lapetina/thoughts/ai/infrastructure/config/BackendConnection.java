package fr.lapetina.thoughts.ai.infrastructure.config;

import fr.lapetina.thoughts.ai.domain.model.BackendId;
import fr.lapetina.thoughts.ai.domain.model.ErrorKind;

import java.net.URI;
import java.time.Duration;
import java.util.Objects;

/**
 * Resolved connection parameters of one backend. Immutable.
 * {@link #toString()} never prints the credential.
 */
public record BackendConnection(
        BackendId id,
        URI endpoint,
        String apiKey,
        String model,
        Duration timeout,
        int maxTokens,
        double temperature,
        int contextWindowTokens,
        int maxContentLength,
        double inputCostPerMillion,
        double outputCostPerMillion,
        ErrorKind stubFailure,
        Duration stubLatency
) {
    public static final int DEFAULT_MAX_TOKENS = 2048;
    public static final double DEFAULT_TEMPERATURE = 0.7;
    public static final int DEFAULT_MAX_CONTENT_LENGTH = 5000;

    public BackendConnection {
        Objects.requireNonNull(id, "Backend id is required");
        Objects.requireNonNull(model, "Model is required");
        Objects.requireNonNull(timeout, "Timeout is required");
        if (id != BackendId.STUB && endpoint == null) {
            throw new IllegalArgumentException("Endpoint is required for backend " + id);
        }
        if (apiKey != null && apiKey.isBlank()) {
            apiKey = null;
        }
        if (stubLatency == null) {
            stubLatency = Duration.ZERO;
        }
    }

    public boolean hasApiKey() {
        return apiKey != null;
    }

    /**
     * Connection with every value at the backend's default and no credential.
     */
    public static BackendConnection defaults(BackendId id) {
        return new BackendConnection(
                id,
                id.defaultEndpoint() != null ? URI.create(id.defaultEndpoint()) : null,
                null,
                id.defaultModel(),
                id.defaultTimeout(),
                DEFAULT_MAX_TOKENS,
                DEFAULT_TEMPERATURE,
                id.defaultContextWindowTokens(),
                DEFAULT_MAX_CONTENT_LENGTH,
                id == BackendId.CLAUDE ? 3.0 : 0.0,
                id == BackendId.CLAUDE ? 15.0 : 0.0,
                null,
                Duration.ZERO
        );
    }

    public BackendConnection withStubFailure(ErrorKind failure) {
        return new BackendConnection(id, endpoint, apiKey, model, timeout, maxTokens, temperature,
                contextWindowTokens, maxContentLength, inputCostPerMillion, outputCostPerMillion,
                failure, stubLatency);
    }

    @Override
    public String toString() {
        return "BackendConnection{" +
                "id=" + id +
                ", endpoint=" + endpoint +
                ", apiKey=" + (apiKey != null ? "****" : "none") +
                ", model=" + model +
                ", timeout=" + timeout +
                ", contextWindowTokens=" + contextWindowTokens +
                ", maxContentLength=" + maxContentLength +
                (stubFailure != null ? ", stubFailure=" + stubFailure : "") +
                '}';
    }
}

package fr.lapetina.thoughts.ai.infrastructure.config;

import fr.lapetina.thoughts.ai.domain.model.BackendId;
import fr.lapetina.thoughts.ai.domain.model.ErrorKind;
import fr.lapetina.thoughts.ai.domain.selection.SelectionStrategy;
import fr.lapetina.thoughts.ai.infrastructure.config.ConfigLoader.ConfigurationException;

import java.net.URI;
import java.time.Duration;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Validated, immutable configuration of the orchestration subsystem.
 *
 * <p>Built once at startup and handed to constructors. Environment variables are read
 * only while building it, to resolve credentials.
 */
public record OrchestrationSettings(
        Set<BackendId> availableBackends,
        BackendId primaryBackend,
        BackendId secondaryBackend,
        SelectionStrategy strategy,
        Duration rateLimitBackoff,
        Duration adapterGrace,
        int adapterThreads,
        QueueSettings queue,
        Duration connectTimeout,
        Duration healthCheckTimeout,
        Map<BackendId, BackendConnection> connections,
        String metricsPrefix
) {
    static final String DEFAULT_CLAUDE_KEY_ENV = "ANTHROPIC_API_KEY";

    public OrchestrationSettings {
        Objects.requireNonNull(primaryBackend, "Primary backend is required");
        Objects.requireNonNull(secondaryBackend, "Secondary backend is required");
        Objects.requireNonNull(strategy, "Selection strategy is required");
        Objects.requireNonNull(queue, "Queue settings are required");
        availableBackends = Collections.unmodifiableSet(EnumSet.copyOf(availableBackends));
        connections = Collections.unmodifiableMap(new EnumMap<>(connections));
    }

    /**
     * Attempt timeout of every configured backend.
     */
    public Map<BackendId, Duration> timeouts() {
        Map<BackendId, Duration> timeouts = new EnumMap<>(BackendId.class);
        connections.forEach((id, connection) -> timeouts.put(id, connection.timeout()));
        return Collections.unmodifiableMap(timeouts);
    }

    public BackendConnection connection(BackendId id) {
        BackendConnection connection = connections.get(id);
        if (connection == null) {
            throw new IllegalArgumentException("No connection configured for backend " + id);
        }
        return connection;
    }

    /**
     * Settings of the bounded analysis queue.
     */
    public record QueueSettings(int ringBufferSize, int workers, String waitStrategy, Duration shutdownTimeout) {
        public QueueSettings {
            if (Integer.bitCount(ringBufferSize) != 1) {
                throw new IllegalArgumentException("Ring buffer size must be power of 2: " + ringBufferSize);
            }
            if (workers < 1) {
                throw new IllegalArgumentException("At least one queue worker is required");
            }
            Objects.requireNonNull(waitStrategy, "Wait strategy is required");
            Objects.requireNonNull(shutdownTimeout, "Shutdown timeout is required");
        }
    }

    /**
     * Validates a bound configuration and resolves every backend connection.
     *
     * @param config      configuration as read from YAML
     * @param environment environment variables used to resolve {@code apiKeyEnv}
     * @throws ConfigurationException if the configuration is inconsistent
     */
    public static OrchestrationSettings from(OrchestratorConfig config, Map<String, String> environment) {
        OrchestratorConfig.SelectionConfig selection = config.getSelection();

        List<String> names = selection.getAvailableBackends();
        if (names == null || names.isEmpty()) {
            throw new ConfigurationException("selection.availableBackends must list at least one backend");
        }
        Set<BackendId> available = EnumSet.noneOf(BackendId.class);
        for (String name : names) {
            available.add(parseBackend(name, "selection.availableBackends"));
        }

        BackendId primary = parseBackend(selection.getPrimaryBackend(), "selection.primaryBackend");
        BackendId secondary = parseBackend(selection.getSecondaryBackend(), "selection.secondaryBackend");
        if (!available.contains(primary)) {
            throw new ConfigurationException("Primary backend '" + primary
                    + "' is not in availableBackends " + available);
        }
        if (!available.contains(secondary)) {
            throw new ConfigurationException("Secondary backend '" + secondary
                    + "' is not in availableBackends " + available);
        }

        SelectionStrategy strategy;
        try {
            strategy = SelectionStrategy.fromName(selection.getStrategy());
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException(e.getMessage(), e);
        }

        OrchestratorConfig.OrchestratorSection orchestrator = config.getOrchestrator();
        if (orchestrator.getRateLimitBackoffMs() < 0 || orchestrator.getAdapterGraceMs() < 0) {
            throw new ConfigurationException("orchestrator backoff and grace must not be negative");
        }
        if (orchestrator.getAdapterThreads() < 1) {
            throw new ConfigurationException("orchestrator.adapterThreads must be at least 1");
        }

        QueueSettings queue;
        try {
            OrchestratorConfig.QueueConfig q = config.getQueue();
            queue = new QueueSettings(q.getRingBufferSize(), q.getWorkers(), q.getWaitStrategy(),
                    Duration.ofMillis(q.getShutdownTimeoutMs()));
        } catch (IllegalArgumentException | NullPointerException e) {
            throw new ConfigurationException("Invalid queue configuration: " + e.getMessage(), e);
        }

        Map<BackendId, BackendConnection> connections = new EnumMap<>(BackendId.class);
        if (config.getBackends() != null) {
            for (OrchestratorConfig.BackendConfig backend : config.getBackends()) {
                BackendId id = parseBackend(backend.getId(), "backends[].id");
                if (connections.containsKey(id)) {
                    throw new ConfigurationException("Backend configured twice: " + id);
                }
                connections.put(id, resolveConnection(id, backend, environment));
            }
        }
        for (BackendId id : available) {
            connections.computeIfAbsent(id, missing -> resolveConnection(missing, null, environment));
        }

        return new OrchestrationSettings(
                available,
                primary,
                secondary,
                strategy,
                Duration.ofMillis(orchestrator.getRateLimitBackoffMs()),
                Duration.ofMillis(orchestrator.getAdapterGraceMs()),
                orchestrator.getAdapterThreads(),
                queue,
                Duration.ofMillis(config.getTimeouts().getConnectTimeoutMs()),
                Duration.ofMillis(config.getTimeouts().getHealthCheckTimeoutMs()),
                connections,
                config.getMetrics().getPrefix()
        );
    }

    private static BackendConnection resolveConnection(
            BackendId id,
            OrchestratorConfig.BackendConfig backend,
            Map<String, String> environment
    ) {
        BackendConnection defaults = BackendConnection.defaults(id);
        if (backend == null) {
            return new BackendConnection(id, defaults.endpoint(), resolveApiKey(id, null, null, environment),
                    defaults.model(), defaults.timeout(), defaults.maxTokens(), defaults.temperature(),
                    defaults.contextWindowTokens(), defaults.maxContentLength(),
                    defaults.inputCostPerMillion(), defaults.outputCostPerMillion(), null, Duration.ZERO);
        }

        URI endpoint = defaults.endpoint();
        if (backend.getEndpoint() != null) {
            try {
                endpoint = URI.create(backend.getEndpoint().trim());
            } catch (IllegalArgumentException e) {
                throw new ConfigurationException("Invalid endpoint for backend " + id + ": " + backend.getEndpoint(), e);
            }
        }

        if (backend.getTimeoutSeconds() != null && backend.getTimeoutSeconds() <= 0) {
            throw new ConfigurationException("timeoutSeconds must be positive for backend " + id);
        }
        requireNotNegative(id, "stubLatencyMs", backend.getStubLatencyMs());
        requireNotNegative(id, "inputCostPerMillion", backend.getInputCostPerMillion());
        requireNotNegative(id, "outputCostPerMillion", backend.getOutputCostPerMillion());
        requirePositive(id, "maxTokens", backend.getMaxTokens());
        requirePositive(id, "contextWindowTokens", backend.getContextWindowTokens());
        requirePositive(id, "maxContentLength", backend.getMaxContentLength());

        ErrorKind stubFailure = null;
        if (backend.getStubFailure() != null && !backend.getStubFailure().isBlank()
                && !backend.getStubFailure().equalsIgnoreCase("success")) {
            if (id != BackendId.STUB) {
                throw new ConfigurationException("stubFailure is only allowed on the stub backend, found on " + id);
            }
            try {
                stubFailure = ErrorKind.valueOf(
                        backend.getStubFailure().trim().toUpperCase(Locale.ROOT).replace('-', '_'));
            } catch (IllegalArgumentException e) {
                throw new ConfigurationException("Unknown stubFailure: " + backend.getStubFailure(), e);
            }
        }

        return new BackendConnection(
                id,
                endpoint,
                resolveApiKey(id, backend.getApiKey(), backend.getApiKeyEnv(), environment),
                backend.getModel() != null ? backend.getModel() : defaults.model(),
                backend.getTimeoutSeconds() != null
                        ? Duration.ofSeconds(backend.getTimeoutSeconds())
                        : defaults.timeout(),
                valueOr(backend.getMaxTokens(), defaults.maxTokens()),
                valueOr(backend.getTemperature(), defaults.temperature()),
                valueOr(backend.getContextWindowTokens(), defaults.contextWindowTokens()),
                valueOr(backend.getMaxContentLength(), defaults.maxContentLength()),
                valueOr(backend.getInputCostPerMillion(), defaults.inputCostPerMillion()),
                valueOr(backend.getOutputCostPerMillion(), defaults.outputCostPerMillion()),
                stubFailure,
                backend.getStubLatencyMs() != null ? Duration.ofMillis(backend.getStubLatencyMs()) : Duration.ZERO
        );
    }

    private static void requireNotNegative(BackendId id, String field, Number value) {
        if (value != null && value.doubleValue() < 0) {
            throw new ConfigurationException(field + " must not be negative for backend " + id + ", got " + value);
        }
    }

    private static void requirePositive(BackendId id, String field, Number value) {
        if (value != null && value.doubleValue() <= 0) {
            throw new ConfigurationException(field + " must be positive for backend " + id + ", got " + value);
        }
    }

    private static String resolveApiKey(BackendId id, String literal, String envName, Map<String, String> environment) {
        if (literal != null && !literal.isBlank()) {
            return literal;
        }
        String variable = envName;
        if (variable == null && id == BackendId.CLAUDE) {
            variable = DEFAULT_CLAUDE_KEY_ENV;
        }
        return variable != null ? environment.get(variable) : null;
    }

    private static BackendId parseBackend(String name, String field) {
        try {
            return BackendId.fromName(name);
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException(field + ": " + e.getMessage(), e);
        }
    }

    private static <T> T valueOr(T value, T fallback) {
        return value != null ? value : fallback;
    }
}

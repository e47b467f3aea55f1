package fr.lapetina.thoughts.ai;

import fr.lapetina.thoughts.ai.disruptor.AnalysisQueue;
import fr.lapetina.thoughts.ai.domain.model.AnalysisRequest;
import fr.lapetina.thoughts.ai.domain.model.BackendId;
import fr.lapetina.thoughts.ai.domain.selection.BackendSelector;
import fr.lapetina.thoughts.ai.domain.selection.SelectorFactory;
import fr.lapetina.thoughts.ai.infrastructure.backend.BackendAdapter;
import fr.lapetina.thoughts.ai.infrastructure.backend.BackendRegistry;
import fr.lapetina.thoughts.ai.infrastructure.backend.ClaudeAdapter;
import fr.lapetina.thoughts.ai.infrastructure.backend.OllamaAdapter;
import fr.lapetina.thoughts.ai.infrastructure.backend.OpenAiCompatibleAdapter;
import fr.lapetina.thoughts.ai.infrastructure.backend.StubAdapter;
import fr.lapetina.thoughts.ai.infrastructure.config.BackendConnection;
import fr.lapetina.thoughts.ai.infrastructure.config.ConfigLoader;
import fr.lapetina.thoughts.ai.infrastructure.config.OrchestrationSettings;
import fr.lapetina.thoughts.ai.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.thoughts.ai.orchestrator.BackendOrchestrator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.http.HttpClient;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Factory for creating a fully-wired orchestration subsystem from configuration.
 * This is the primary entry point for obtaining a configured orchestrator and queue.
 *
 * <p>Usage:
 * <pre>{@code
 * try (OrchestratorFactory factory = OrchestratorFactory.create("config.yaml").start()) {
 *     OrchestrationOutcome outcome = factory.getOrchestrator()
 *             .analyze(factory.newRequest("I should answer that email"));
 * }
 * }</pre>
 */
public class OrchestratorFactory implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(OrchestratorFactory.class);

    private final OrchestrationSettings settings;
    private final MetricsRegistry metricsRegistry;
    private final HttpClient httpClient;
    private final BackendRegistry backendRegistry;
    private final BackendSelector selector;
    private final BackendOrchestrator orchestrator;
    private final AnalysisQueue queue;

    /**
     * @param adapterOverride replaces the adapter built for a backend when it returns
     *                        non-null; used by tests
     */
    protected OrchestratorFactory(OrchestrationSettings settings, Function<BackendId, BackendAdapter> adapterOverride) {
        this.settings = settings;
        log.info("Initializing OrchestratorFactory: available={}, primary={}, secondary={}",
                settings.availableBackends(), settings.primaryBackend(), settings.secondaryBackend());

        this.metricsRegistry = new MetricsRegistry(settings.metricsPrefix());

        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(settings.connectTimeout())
                .version(HttpClient.Version.HTTP_1_1)
                .build();

        List<BackendAdapter> adapters = new ArrayList<>();
        for (Map.Entry<BackendId, BackendConnection> entry : settings.connections().entrySet()) {
            BackendAdapter override = adapterOverride != null ? adapterOverride.apply(entry.getKey()) : null;
            adapters.add(override != null ? override : createAdapter(entry.getValue()));
        }
        this.backendRegistry = new BackendRegistry(adapters);
        for (BackendId id : backendRegistry.registeredBackends()) {
            metricsRegistry.registerBackendHealth(id, () -> backendRegistry.isHealthy(id) ? 1 : 0);
        }

        this.selector = SelectorFactory.create(
                settings.strategy(),
                settings.primaryBackend(),
                settings.secondaryBackend(),
                settings.timeouts());
        log.info("Using selection strategy: {}", selector.getName());

        this.orchestrator = BackendOrchestrator.builder()
                .fromSettings(settings)
                .selector(selector)
                .registry(backendRegistry)
                .metrics(metricsRegistry)
                .build();

        this.queue = AnalysisQueue.builder()
                .fromSettings(settings)
                .orchestrator(orchestrator)
                .metrics(metricsRegistry)
                .build();

        log.info("OrchestratorFactory initialized with {} backends", backendRegistry.size());
    }

    /**
     * Creates a factory from the specified configuration file.
     */
    public static OrchestratorFactory create(String configPath) {
        return new OrchestratorFactory(new ConfigLoader(configPath).load(), null);
    }

    /**
     * Creates a factory from the default configuration (config.yaml).
     */
    public static OrchestratorFactory create() {
        return create("config.yaml");
    }

    /**
     * Creates a factory from already loaded settings.
     */
    public static OrchestratorFactory create(OrchestrationSettings settings) {
        return new OrchestratorFactory(settings, null);
    }

    /**
     * Starts the queue workers and runs a first health check of every backend.
     */
    public OrchestratorFactory start() {
        queue.start();
        backendRegistry.healthCheckAll().thenAccept(results ->
                log.info("Initial backend health: {}", results));
        log.info("Orchestrator started");
        return this;
    }

    /**
     * Request builder pre-filled with the configured available backends.
     */
    public AnalysisRequest.Builder requestBuilder() {
        return AnalysisRequest.builder().availableBackends(settings.availableBackends());
    }

    public AnalysisRequest newRequest(String content) {
        return requestBuilder().content(content).build();
    }

    public BackendOrchestrator getOrchestrator() {
        return orchestrator;
    }

    public AnalysisQueue getQueue() {
        return queue;
    }

    public BackendRegistry getBackendRegistry() {
        return backendRegistry;
    }

    public BackendSelector getSelector() {
        return selector;
    }

    public MetricsRegistry getMetricsRegistry() {
        return metricsRegistry;
    }

    public OrchestrationSettings getSettings() {
        return settings;
    }

    private BackendAdapter createAdapter(BackendConnection connection) {
        return switch (connection.id()) {
            case CLAUDE -> new ClaudeAdapter(connection, httpClient,
                    settings.adapterGrace(), settings.healthCheckTimeout());
            case OLLAMA -> new OllamaAdapter(connection, httpClient,
                    settings.adapterGrace(), settings.healthCheckTimeout());
            case OPENAI -> new OpenAiCompatibleAdapter(connection, httpClient,
                    settings.adapterGrace(), settings.healthCheckTimeout());
            case STUB -> new StubAdapter(connection);
        };
    }

    @Override
    public void close() {
        log.info("Shutting down OrchestratorFactory...");

        try {
            queue.close();
        } catch (Exception e) {
            log.warn("Error closing analysis queue", e);
        }

        try {
            orchestrator.close();
        } catch (Exception e) {
            log.warn("Error closing orchestrator", e);
        }

        try {
            metricsRegistry.close();
        } catch (Exception e) {
            log.warn("Error closing metrics registry", e);
        }

        log.info("OrchestratorFactory shut down");
    }
}

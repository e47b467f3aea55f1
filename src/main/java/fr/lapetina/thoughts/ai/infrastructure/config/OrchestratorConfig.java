package fr.lapetina.thoughts.ai.infrastructure.config;

import java.util.ArrayList;
import java.util.List;

/**
 * Root configuration object, populated from YAML.
 * Mutable only while SnakeYAML binds it; {@link OrchestrationSettings#from} turns it
 * into the immutable value the rest of the system uses.
 */
public class OrchestratorConfig {

    private SelectionConfig selection = new SelectionConfig();
    private OrchestratorSection orchestrator = new OrchestratorSection();
    private QueueConfig queue = new QueueConfig();
    private TimeoutsConfig timeouts = new TimeoutsConfig();
    private List<BackendConfig> backends = new ArrayList<>();
    private MetricsConfig metrics = new MetricsConfig();

    // Getters and Setters
    public SelectionConfig getSelection() { return selection; }
    public void setSelection(SelectionConfig selection) { this.selection = selection; }

    public OrchestratorSection getOrchestrator() { return orchestrator; }
    public void setOrchestrator(OrchestratorSection orchestrator) { this.orchestrator = orchestrator; }

    public QueueConfig getQueue() { return queue; }
    public void setQueue(QueueConfig queue) { this.queue = queue; }

    public TimeoutsConfig getTimeouts() { return timeouts; }
    public void setTimeouts(TimeoutsConfig timeouts) { this.timeouts = timeouts; }

    public List<BackendConfig> getBackends() { return backends; }
    public void setBackends(List<BackendConfig> backends) { this.backends = backends; }

    public MetricsConfig getMetrics() { return metrics; }
    public void setMetrics(MetricsConfig metrics) { this.metrics = metrics; }

    /**
     * Which backends exist and in which order they are tried.
     */
    public static class SelectionConfig {
        private List<String> availableBackends = new ArrayList<>(List.of("claude", "ollama"));
        private String primaryBackend = "claude";
        private String secondaryBackend = "ollama";
        private String strategy = "sequential";

        public List<String> getAvailableBackends() { return availableBackends; }
        public void setAvailableBackends(List<String> availableBackends) { this.availableBackends = availableBackends; }

        public String getPrimaryBackend() { return primaryBackend; }
        public void setPrimaryBackend(String primaryBackend) { this.primaryBackend = primaryBackend; }

        public String getSecondaryBackend() { return secondaryBackend; }
        public void setSecondaryBackend(String secondaryBackend) { this.secondaryBackend = secondaryBackend; }

        public String getStrategy() { return strategy; }
        public void setStrategy(String strategy) { this.strategy = strategy; }
    }

    /**
     * Retry and deadline tuning.
     */
    public static class OrchestratorSection {
        private long rateLimitBackoffMs = 5_000;
        private long adapterGraceMs = 200;
        private int adapterThreads = 16;

        public long getRateLimitBackoffMs() { return rateLimitBackoffMs; }
        public void setRateLimitBackoffMs(long rateLimitBackoffMs) { this.rateLimitBackoffMs = rateLimitBackoffMs; }

        public long getAdapterGraceMs() { return adapterGraceMs; }
        public void setAdapterGraceMs(long adapterGraceMs) { this.adapterGraceMs = adapterGraceMs; }

        public int getAdapterThreads() { return adapterThreads; }
        public void setAdapterThreads(int adapterThreads) { this.adapterThreads = adapterThreads; }
    }

    /**
     * Bounded analysis queue settings.
     */
    public static class QueueConfig {
        private int ringBufferSize = 1024;
        private int workers = 4;
        private String waitStrategy = "blocking";
        private long shutdownTimeoutMs = 10_000;

        public int getRingBufferSize() { return ringBufferSize; }
        public void setRingBufferSize(int ringBufferSize) { this.ringBufferSize = ringBufferSize; }

        public int getWorkers() { return workers; }
        public void setWorkers(int workers) { this.workers = workers; }

        public String getWaitStrategy() { return waitStrategy; }
        public void setWaitStrategy(String waitStrategy) { this.waitStrategy = waitStrategy; }

        public long getShutdownTimeoutMs() { return shutdownTimeoutMs; }
        public void setShutdownTimeoutMs(long shutdownTimeoutMs) { this.shutdownTimeoutMs = shutdownTimeoutMs; }
    }

    /**
     * Transport-level timeouts shared by the HTTP adapters.
     */
    public static class TimeoutsConfig {
        private long connectTimeoutMs = 5_000;
        private long healthCheckTimeoutMs = 5_000;

        public long getConnectTimeoutMs() { return connectTimeoutMs; }
        public void setConnectTimeoutMs(long connectTimeoutMs) { this.connectTimeoutMs = connectTimeoutMs; }

        public long getHealthCheckTimeoutMs() { return healthCheckTimeoutMs; }
        public void setHealthCheckTimeoutMs(long healthCheckTimeoutMs) { this.healthCheckTimeoutMs = healthCheckTimeoutMs; }
    }

    /**
     * Connection parameters of one backend. Unset values fall back to the backend's defaults.
     */
    public static class BackendConfig {
        private String id;
        private String endpoint;
        private String apiKey;
        private String apiKeyEnv;
        private String model;
        private Integer timeoutSeconds;
        private Integer maxTokens;
        private Double temperature;
        private Integer contextWindowTokens;
        private Integer maxContentLength;
        private Double inputCostPerMillion;
        private Double outputCostPerMillion;
        private String stubFailure;
        private Long stubLatencyMs;

        public String getId() { return id; }
        public void setId(String id) { this.id = id; }

        public String getEndpoint() { return endpoint; }
        public void setEndpoint(String endpoint) { this.endpoint = endpoint; }

        public String getApiKey() { return apiKey; }
        public void setApiKey(String apiKey) { this.apiKey = apiKey; }

        public String getApiKeyEnv() { return apiKeyEnv; }
        public void setApiKeyEnv(String apiKeyEnv) { this.apiKeyEnv = apiKeyEnv; }

        public String getModel() { return model; }
        public void setModel(String model) { this.model = model; }

        public Integer getTimeoutSeconds() { return timeoutSeconds; }
        public void setTimeoutSeconds(Integer timeoutSeconds) { this.timeoutSeconds = timeoutSeconds; }

        public Integer getMaxTokens() { return maxTokens; }
        public void setMaxTokens(Integer maxTokens) { this.maxTokens = maxTokens; }

        public Double getTemperature() { return temperature; }
        public void setTemperature(Double temperature) { this.temperature = temperature; }

        public Integer getContextWindowTokens() { return contextWindowTokens; }
        public void setContextWindowTokens(Integer contextWindowTokens) { this.contextWindowTokens = contextWindowTokens; }

        public Integer getMaxContentLength() { return maxContentLength; }
        public void setMaxContentLength(Integer maxContentLength) { this.maxContentLength = maxContentLength; }

        public Double getInputCostPerMillion() { return inputCostPerMillion; }
        public void setInputCostPerMillion(Double inputCostPerMillion) { this.inputCostPerMillion = inputCostPerMillion; }

        public Double getOutputCostPerMillion() { return outputCostPerMillion; }
        public void setOutputCostPerMillion(Double outputCostPerMillion) { this.outputCostPerMillion = outputCostPerMillion; }

        public String getStubFailure() { return stubFailure; }
        public void setStubFailure(String stubFailure) { this.stubFailure = stubFailure; }

        public Long getStubLatencyMs() { return stubLatencyMs; }
        public void setStubLatencyMs(Long stubLatencyMs) { this.stubLatencyMs = stubLatencyMs; }
    }

    /**
     * Metrics configuration.
     */
    public static class MetricsConfig {
        private String prefix = "thought_ai";

        public String getPrefix() { return prefix; }
        public void setPrefix(String prefix) { this.prefix = prefix; }
    }
}

package fr.lapetina.thoughts.ai.infrastructure.metrics;

import fr.lapetina.thoughts.ai.domain.model.BackendId;
import fr.lapetina.thoughts.ai.domain.model.ExecutionState;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.binder.jvm.JvmGcMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmMemoryMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmThreadMetrics;
import io.micrometer.core.instrument.binder.system.ProcessorMetrics;
import io.micrometer.prometheus.PrometheusConfig;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

/**
 * Centralized metrics registry using Micrometer.
 *
 * Provides:
 * - Attempt counters and latency per backend
 * - Final decision counters per terminal state
 * - Rate-limit retry counters
 * - Queue capacity and in-flight gauges
 * - JVM and system metrics, Prometheus exposition
 */
public final class MetricsRegistry implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(MetricsRegistry.class);

    private final PrometheusMeterRegistry registry;
    private final String prefix;

    // Cache for dynamic meters
    private final ConcurrentHashMap<String, Counter> attemptCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<BackendId, Timer> latencyTimers = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<ExecutionState, Counter> decisionCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<BackendId, Counter> rateLimitRetries = new ConcurrentHashMap<>();

    private final AtomicLong queueRemaining = new AtomicLong(0);
    private final AtomicLong queueInFlight = new AtomicLong(0);

    public MetricsRegistry(String prefix) {
        this.prefix = prefix;
        this.registry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);

        // Register JVM metrics
        new JvmMemoryMetrics().bindTo(registry);
        new JvmGcMetrics().bindTo(registry);
        new JvmThreadMetrics().bindTo(registry);
        new ProcessorMetrics().bindTo(registry);

        Gauge.builder(prefix + "_queue_remaining", queueRemaining, AtomicLong::get)
                .description("Remaining capacity in the analysis queue")
                .register(registry);

        Gauge.builder(prefix + "_queue_inflight", queueInFlight, AtomicLong::get)
                .description("Analyses accepted by the queue and not yet completed")
                .register(registry);

        log.info("MetricsRegistry initialized with prefix: {}", prefix);
    }

    public MetricsRegistry() {
        this("thought_ai");
    }

    /**
     * Counts one adapter attempt and records how long it took.
     *
     * @param outcome {@code SUCCESS} or the error kind name
     */
    public void recordAttempt(BackendId backend, String outcome, Duration latency) {
        String key = backend.configName() + ":" + outcome;
        attemptCounters.computeIfAbsent(key, k ->
                Counter.builder(prefix + "_attempts_total")
                        .description("Backend attempts by outcome")
                        .tag("backend", backend.configName())
                        .tag("outcome", outcome)
                        .register(registry)
        ).increment();

        latencyTimers.computeIfAbsent(backend, b ->
                Timer.builder(prefix + "_attempt_latency")
                        .description("Backend attempt latency")
                        .tag("backend", b.configName())
                        .publishPercentileHistogram()
                        .publishPercentiles(0.5, 0.9, 0.95, 0.99)
                        .register(registry)
        ).record(latency);
    }

    /**
     * Counts a request reaching a terminal state.
     */
    public void incrementDecision(ExecutionState state) {
        decisionCounters.computeIfAbsent(state, s ->
                Counter.builder(prefix + "_decisions_total")
                        .description("Requests by final orchestration state")
                        .tag("state", s.name())
                        .register(registry)
        ).increment();
    }

    public void incrementRateLimitRetry(BackendId backend) {
        rateLimitRetries.computeIfAbsent(backend, b ->
                Counter.builder(prefix + "_rate_limit_retries_total")
                        .description("Same-backend retries after a rate limit")
                        .tag("backend", b.configName())
                        .register(registry)
        ).increment();
    }

    /**
     * Registers a gauge for backend health (1 healthy, 0 not).
     */
    public void registerBackendHealth(BackendId backend, Supplier<Number> healthValue) {
        Gauge.builder(prefix + "_backend_health", healthValue, s -> s.get().doubleValue())
                .description("Backend health status (0=DOWN, 1=UP)")
                .tag("backend", backend.configName())
                .strongReference(true)
                .register(registry);
    }

    public void setQueueRemaining(long value) {
        queueRemaining.set(value);
    }

    public void setQueueInFlight(long value) {
        queueInFlight.set(value);
    }

    /**
     * Returns the Prometheus scrape output.
     */
    public String scrape() {
        return registry.scrape();
    }

    /**
     * Returns the underlying Micrometer registry.
     */
    public MeterRegistry getRegistry() {
        return registry;
    }

    @Override
    public void close() {
        registry.close();
    }
}

package fr.lapetina.thoughts.ai.infrastructure.backend;

import fr.lapetina.thoughts.ai.domain.model.BackendId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Lookup from {@link BackendId} to its adapter, built once at startup.
 *
 * Thread-safe. The adapter map never changes; only the last known health of each
 * backend is updated by {@link #healthCheckAll()}.
 */
public final class BackendRegistry {

    private static final Logger log = LoggerFactory.getLogger(BackendRegistry.class);

    private final Map<BackendId, BackendAdapter> adapters;
    private final Map<BackendId, AtomicBoolean> lastKnownHealth;

    public BackendRegistry(Collection<? extends BackendAdapter> adapters) {
        Map<BackendId, BackendAdapter> byId = new EnumMap<>(BackendId.class);
        Map<BackendId, AtomicBoolean> health = new EnumMap<>(BackendId.class);
        for (BackendAdapter adapter : adapters) {
            if (byId.putIfAbsent(adapter.id(), adapter) != null) {
                throw new IllegalArgumentException("Adapter registered twice for backend " + adapter.id());
            }
            health.put(adapter.id(), new AtomicBoolean(true));
            log.info("Registered backend adapter: backend={}, adapter={}",
                    adapter.id(), adapter.getClass().getSimpleName());
        }
        this.adapters = Collections.unmodifiableMap(byId);
        this.lastKnownHealth = Collections.unmodifiableMap(health);
    }

    /**
     * @throws IllegalStateException if no adapter is registered for the backend
     */
    public BackendAdapter get(BackendId id) {
        BackendAdapter adapter = adapters.get(id);
        if (adapter == null) {
            throw new IllegalStateException("No adapter registered for backend " + id);
        }
        return adapter;
    }

    public boolean contains(BackendId id) {
        return adapters.containsKey(id);
    }

    public Set<BackendId> registeredBackends() {
        return adapters.keySet();
    }

    public int size() {
        return adapters.size();
    }

    /**
     * Last health check result; a backend is assumed healthy until checked.
     */
    public boolean isHealthy(BackendId id) {
        AtomicBoolean healthy = lastKnownHealth.get(id);
        return healthy != null && healthy.get();
    }

    /**
     * Checks every registered backend concurrently.
     */
    public CompletableFuture<Map<BackendId, Boolean>> healthCheckAll() {
        Map<BackendId, CompletableFuture<Boolean>> checks = new EnumMap<>(BackendId.class);
        adapters.forEach((id, adapter) -> checks.put(id, adapter.healthCheck()
                .exceptionally(ex -> {
                    log.warn("Health check error: backend={}, error={}", id, ex.getMessage());
                    return false;
                })));

        return CompletableFuture.allOf(checks.values().toArray(new CompletableFuture[0]))
                .thenApply(ignored -> {
                    Map<BackendId, Boolean> results = new EnumMap<>(BackendId.class);
                    checks.forEach((id, check) -> {
                        boolean healthy = check.join();
                        boolean previous = lastKnownHealth.get(id).getAndSet(healthy);
                        if (previous != healthy) {
                            log.info("Backend health changed: backend={}, healthy={}", id, healthy);
                        }
                        results.put(id, healthy);
                    });
                    return Collections.unmodifiableMap(results);
                });
    }
}

package fr.lapetina.thoughts.ai.domain.model;

import java.time.Instant;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.UUID;

/**
 * A request to analyze one thought.
 * Immutable and thread-safe; the context map is passed through to adapters untouched.
 */
public record AnalysisRequest(
        String correlationId,
        String content,
        AnalysisType analysisType,
        Set<BackendId> availableBackends,
        Set<String> preferenceHints,
        Map<String, Object> context,
        Instant createdAt
) {
    public AnalysisRequest {
        if (correlationId == null || correlationId.isBlank()) {
            correlationId = UUID.randomUUID().toString();
        }
        if (content == null) {
            content = "";
        }
        if (analysisType == null) {
            analysisType = AnalysisType.STANDARD;
        }
        if (createdAt == null) {
            createdAt = Instant.now();
        }
        availableBackends = availableBackends == null || availableBackends.isEmpty()
                ? Collections.unmodifiableSet(EnumSet.noneOf(BackendId.class))
                : Collections.unmodifiableSet(EnumSet.copyOf(availableBackends));
        preferenceHints = preferenceHints != null
                ? Collections.unmodifiableSet(new TreeSet<>(preferenceHints))
                : Set.of();
        // LinkedHashMap keeps insertion order for prompt building and tolerates null values
        context = context != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(context))
                : Map.of();
    }

    public int contentLength() {
        return content.length();
    }

    public boolean isAvailable(BackendId backend) {
        return availableBackends.contains(backend);
    }

    /**
     * Returns a copy of this request restricted to the given backends.
     */
    public AnalysisRequest withAvailableBackends(Set<BackendId> backends) {
        return new AnalysisRequest(correlationId, content, analysisType, backends,
                preferenceHints, context, createdAt);
    }

    public static AnalysisRequest of(String content, Set<BackendId> availableBackends) {
        return builder().content(content).availableBackends(availableBackends).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String correlationId;
        private String content;
        private AnalysisType analysisType;
        private Set<BackendId> availableBackends;
        private Set<String> preferenceHints;
        private Map<String, Object> context;
        private Instant createdAt;

        public Builder correlationId(String correlationId) {
            this.correlationId = correlationId;
            return this;
        }

        public Builder content(String content) {
            this.content = content;
            return this;
        }

        public Builder analysisType(AnalysisType analysisType) {
            this.analysisType = analysisType;
            return this;
        }

        public Builder availableBackends(Set<BackendId> availableBackends) {
            this.availableBackends = availableBackends;
            return this;
        }

        public Builder preferenceHints(Set<String> preferenceHints) {
            this.preferenceHints = preferenceHints;
            return this;
        }

        public Builder context(Map<String, Object> context) {
            this.context = context;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public AnalysisRequest build() {
            return new AnalysisRequest(correlationId, content, analysisType, availableBackends,
                    preferenceHints, context, createdAt);
        }
    }
}

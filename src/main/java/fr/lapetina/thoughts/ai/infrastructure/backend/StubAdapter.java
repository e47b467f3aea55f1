package fr.lapetina.thoughts.ai.infrastructure.backend;

import fr.lapetina.thoughts.ai.domain.model.AnalysisCancelledException;
import fr.lapetina.thoughts.ai.domain.model.AnalysisRequest;
import fr.lapetina.thoughts.ai.domain.model.AnalysisResult;
import fr.lapetina.thoughts.ai.domain.model.BackendId;
import fr.lapetina.thoughts.ai.domain.model.ErrorKind;
import fr.lapetina.thoughts.ai.domain.model.ThoughtAnalysis;
import fr.lapetina.thoughts.ai.domain.model.TokenUsage;
import fr.lapetina.thoughts.ai.infrastructure.config.BackendConnection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Deterministic in-process backend for tests and as fallback of last resort.
 *
 * <p>Either always fails with the configured {@link ErrorKind}, or derives an analysis
 * from keywords in the content. An optional simulated latency honours the timeout.
 */
public class StubAdapter implements BackendAdapter {

    private static final Logger log = LoggerFactory.getLogger(StubAdapter.class);

    static final int SUMMARY_PREFIX_LENGTH = 50;
    static final TokenUsage STUB_USAGE = new TokenUsage(50, 50, 0.0);

    private final BackendConnection connection;
    private final RequestGuard guard;

    public StubAdapter(BackendConnection connection) {
        this.connection = connection;
        this.guard = new RequestGuard(BackendId.STUB, connection.maxContentLength(), connection.contextWindowTokens());
    }

    @Override
    public BackendId id() {
        return BackendId.STUB;
    }

    @Override
    public AnalysisResult analyze(AnalysisRequest request, Duration timeout) {
        long startNanos = System.nanoTime();

        Optional<AnalysisResult.Failure> rejected = guard.check(request, 0);
        if (rejected.isPresent()) {
            return rejected.get();
        }

        Duration latency = connection.stubLatency();
        if (!latency.isZero()) {
            boolean overrun = latency.compareTo(timeout) > 0;
            try {
                Thread.sleep((overrun ? timeout : latency).toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new AnalysisCancelledException(request.correlationId(), "Interrupted during simulated latency");
            }
            if (overrun) {
                log.debug("Stub timed out: correlationId={}, latencyMs={}, timeoutMs={}",
                        request.correlationId(), latency.toMillis(), timeout.toMillis());
                return new AnalysisResult.Failure(ErrorKind.TIMEOUT,
                        "Simulated latency " + latency.toMillis() + "ms exceeds timeout " + timeout.toMillis() + "ms",
                        BackendId.STUB);
            }
        }

        if (connection.stubFailure() != null) {
            log.debug("Stub returning configured failure: correlationId={}, errorKind={}",
                    request.correlationId(), connection.stubFailure());
            return new AnalysisResult.Failure(connection.stubFailure(),
                    "Simulated " + connection.stubFailure().name().toLowerCase(Locale.ROOT).replace('_', ' '),
                    BackendId.STUB);
        }

        return new AnalysisResult.Success(
                analyzeKeywords(request.content()),
                STUB_USAGE,
                BackendId.STUB,
                connection.model(),
                Duration.ofNanos(System.nanoTime() - startNanos));
    }

    static ThoughtAnalysis analyzeKeywords(String content) {
        String lower = content.toLowerCase(Locale.ROOT);

        List<ThoughtAnalysis.Theme> themes = new ArrayList<>();
        if (lower.contains("email")) {
            themes.add(new ThoughtAnalysis.Theme("email", 0.95));
        }
        if (lower.contains("optimize") || lower.contains("improve")) {
            themes.add(new ThoughtAnalysis.Theme("optimization", 0.90));
        }
        if (lower.contains("task")) {
            themes.add(new ThoughtAnalysis.Theme("task management", 0.85));
        }
        if (themes.isEmpty()) {
            themes.add(new ThoughtAnalysis.Theme("general", 0.70));
        }

        List<ThoughtAnalysis.SuggestedAction> actions = new ArrayList<>();
        if (lower.contains("should") || lower.contains("need to")) {
            actions.add(new ThoughtAnalysis.SuggestedAction("Create task for this thought", "medium", 0.80));
        }

        String prefix = content.length() > SUMMARY_PREFIX_LENGTH
                ? content.substring(0, SUMMARY_PREFIX_LENGTH)
                : content;

        return new ThoughtAnalysis(
                "Mock analysis: " + prefix + "...",
                themes,
                actions,
                List.of(),
                themes.stream().map(ThoughtAnalysis.Theme::theme).toList(),
                !actions.isEmpty(),
                actions.isEmpty() ? 0.0 : 0.80);
    }

    @Override
    public CompletableFuture<Boolean> healthCheck() {
        return CompletableFuture.completedFuture(true);
    }
}

package fr.lapetina.thoughts.ai.orchestrator;

import fr.lapetina.thoughts.ai.domain.classifier.ErrorClassifier;
import fr.lapetina.thoughts.ai.domain.model.AggregateFailure;
import fr.lapetina.thoughts.ai.domain.model.AnalysisCancelledException;
import fr.lapetina.thoughts.ai.domain.model.AnalysisRequest;
import fr.lapetina.thoughts.ai.domain.model.AnalysisResult;
import fr.lapetina.thoughts.ai.domain.model.ErrorKind;
import fr.lapetina.thoughts.ai.domain.model.ExecutionState;
import fr.lapetina.thoughts.ai.domain.selection.BackendChoice;
import fr.lapetina.thoughts.ai.domain.selection.BackendSelector;
import fr.lapetina.thoughts.ai.domain.selection.Plan;
import fr.lapetina.thoughts.ai.infrastructure.backend.BackendAdapter;
import fr.lapetina.thoughts.ai.infrastructure.backend.BackendRegistry;
import fr.lapetina.thoughts.ai.infrastructure.config.OrchestrationSettings;
import fr.lapetina.thoughts.ai.infrastructure.metrics.MetricsRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Executes a backend plan for one request at a time on the caller's thread.
 *
 * <p>State machine per request:
 * <pre>
 * NOT_STARTED -> TRYING -> SUCCESS
 *                       -> RETRY_SAME_ONCE -> TRYING   (rate limited, after the backoff window)
 *                       -> NEXT_CANDIDATE  -> TRYING   (recoverable failure)
 *                       -> ABORTED                     (non-recoverable failure)
 *                       -> ALL_FAILED                  (last candidate failed)
 * </pre>
 *
 * <p>Each adapter call runs on the adapter executor so that its deadline
 * ({@code timeout + grace}) can be enforced by cancellation even if the adapter
 * misbehaves. Every local (plan, trace, failure list) lives on the calling thread's
 * stack; the orchestrator itself holds no per-request state and is safe for
 * concurrent use.
 *
 * <p>Interrupting the calling thread cancels the in-flight call, or the backoff wait,
 * and ends the request with {@link AnalysisCancelledException}. No retry is attempted
 * after that.
 */
public final class BackendOrchestrator implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(BackendOrchestrator.class);

    static final String MDC_CORRELATION_ID = "correlationId";
    static final String MDC_BACKEND = "backend";

    private final BackendSelector selector;
    private final BackendRegistry registry;
    private final ErrorClassifier classifier;
    private final MetricsRegistry metrics;
    private final ExecutorService adapterExecutor;
    private final boolean ownsExecutor;
    private final Duration rateLimitBackoff;
    private final Duration grace;

    private BackendOrchestrator(Builder builder) {
        this.selector = builder.selector;
        this.registry = builder.registry;
        this.classifier = builder.classifier;
        this.metrics = builder.metrics;
        this.rateLimitBackoff = builder.rateLimitBackoff;
        this.grace = builder.grace;
        if (builder.adapterExecutor != null) {
            this.adapterExecutor = builder.adapterExecutor;
            this.ownsExecutor = false;
        } else {
            this.adapterExecutor = Executors.newFixedThreadPool(
                    builder.adapterThreads, new AdapterThreadFactory("backend-adapter"));
            this.ownsExecutor = true;
        }

        log.info("BackendOrchestrator created: selector={}, backends={}, rateLimitBackoffMs={}, graceMs={}",
                selector.getName(), registry.registeredBackends(), rateLimitBackoff.toMillis(), grace.toMillis());
    }

    /**
     * Analyzes one thought, walking the selector's plan until a backend succeeds or the
     * plan is exhausted.
     *
     * @param request the request
     * @return the first success, or an aggregate of every failed attempt, with plan and trace
     * @throws fr.lapetina.thoughts.ai.domain.selection.NoAvailableBackendException if no configured backend is available
     * @throws AnalysisCancelledException if the calling thread is interrupted
     */
    public OrchestrationOutcome analyze(AnalysisRequest request) {
        String previousCorrelationId = MDC.get(MDC_CORRELATION_ID);
        MDC.put(MDC_CORRELATION_ID, request.correlationId());
        try {
            return orchestrate(request);
        } finally {
            if (previousCorrelationId != null) {
                MDC.put(MDC_CORRELATION_ID, previousCorrelationId);
            } else {
                MDC.remove(MDC_CORRELATION_ID);
            }
        }
    }

    private OrchestrationOutcome orchestrate(AnalysisRequest request) {
        Plan plan = selector.select(request);
        log.info("Plan selected: correlationId={}, strategy={}, candidates={}, analysisType={}, contentLength={}, rationale={}",
                request.correlationId(), plan.decisionType(), plan.backends(), request.analysisType(),
                request.contentLength(), plan.rationale());

        DecisionTrace trace = new DecisionTrace(request.correlationId());
        List<AnalysisResult.Failure> failures = new ArrayList<>();
        Set<ErrorKind> onceOnlyKindsUsed = EnumSet.noneOf(ErrorKind.class);
        List<BackendChoice> candidates = plan.candidates();

        for (int index = 0; index < candidates.size(); index++) {
            BackendChoice choice = candidates.get(index);
            boolean lastCandidate = index == candidates.size() - 1;
            boolean retried = false;

            while (true) {
                ensureNotCancelled(request, trace, choice);

                trace.recordStart(choice);
                long startNanos = System.nanoTime();
                AnalysisResult result = invoke(request, choice, trace);
                Duration latency = Duration.ofNanos(System.nanoTime() - startNanos);

                if (result instanceof AnalysisResult.Success success) {
                    trace.recordAttempt(choice, ExecutionState.SUCCESS.name(), ExecutionState.SUCCESS, latency);
                    metrics.recordAttempt(choice.backend(), ExecutionState.SUCCESS.name(), latency);
                    metrics.incrementDecision(ExecutionState.SUCCESS);
                    log.info("Analysis succeeded: correlationId={}, backend={}, role={}, attempts={}, model={}, tokens={}",
                            request.correlationId(), choice.backend(), choice.role(), trace.attempts(),
                            success.model(), success.usage().totalTokens());
                    return new OrchestrationOutcome(success, plan, trace);
                }

                AnalysisResult.Failure failure = asFailure(result, choice);
                failures.add(failure);
                metrics.recordAttempt(choice.backend(), failure.errorKind().name(), latency);

                ExecutionState next = nextState(failure.errorKind(), retried, onceOnlyKindsUsed, lastCandidate);
                trace.recordAttempt(choice, failure.errorKind().name(), next, latency);

                if (next == ExecutionState.RETRY_SAME_ONCE) {
                    metrics.incrementRateLimitRetry(choice.backend());
                    awaitBackoff(request, trace, choice);
                    retried = true;
                    continue;
                }
                if (next == ExecutionState.NEXT_CANDIDATE) {
                    break;
                }

                metrics.incrementDecision(next);
                log.warn("Analysis failed: correlationId={}, finalState={}, attempts={}, lastErrorKind={}, lastError={}",
                        request.correlationId(), next, trace.attempts(), failure.errorKind(), failure.message());
                return new OrchestrationOutcome(
                        new AggregateFailure(failures, next == ExecutionState.ABORTED), plan, trace);
            }
        }

        // The last candidate always ends in a terminal state
        throw new IllegalStateException("Plan exhausted without a terminal state: " + trace);
    }

    /**
     * Transition after a failed attempt.
     *
     * <p>A repeated once-only kind stops the plan early; on the last candidate there is
     * nothing left to skip, so it ends as {@code ALL_FAILED} like any other exhausted plan.
     */
    ExecutionState nextState(ErrorKind kind, boolean retried, Set<ErrorKind> onceOnlyKindsUsed, boolean lastCandidate) {
        ExecutionState advance = lastCandidate ? ExecutionState.ALL_FAILED : ExecutionState.NEXT_CANDIDATE;
        return switch (classifier.recoveryFor(kind)) {
            case ABORT -> ExecutionState.ABORTED;
            case RETRY_SAME_AFTER_BACKOFF -> retried ? advance : ExecutionState.RETRY_SAME_ONCE;
            case TRY_NEXT -> advance;
            case TRY_NEXT_ONCE -> onceOnlyKindsUsed.add(kind) || lastCandidate ? advance : ExecutionState.ABORTED;
        };
    }

    private AnalysisResult invoke(AnalysisRequest request, BackendChoice choice, DecisionTrace trace) {
        BackendAdapter adapter = registry.get(choice.backend());
        Map<String, String> mdc = MDC.getCopyOfContextMap();

        Future<AnalysisResult> future;
        try {
            future = adapterExecutor.submit(() -> callAdapter(adapter, request, choice, mdc));
        } catch (RejectedExecutionException e) {
            throw cancelled(request, trace, choice, "Orchestrator is shut down");
        }

        Duration deadline = choice.timeout().plus(grace);
        try {
            return future.get(deadline.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("Attempt overran its deadline: correlationId={}, backend={}, deadlineMs={}",
                    request.correlationId(), choice.backend(), deadline.toMillis());
            return new AnalysisResult.Failure(ErrorKind.TIMEOUT,
                    "No result within " + deadline.toMillis() + "ms", choice.backend());
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw cancelled(request, trace, choice, "Cancelled while waiting for " + choice.backend());
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof AnalysisCancelledException) {
                throw cancelled(request, trace, choice, "Adapter call to " + choice.backend() + " was cancelled");
            }
            ErrorKind kind = ErrorClassifier.fromThrowable(cause);
            log.error("Adapter threw instead of returning a failure: correlationId={}, backend={}, errorKind={}",
                    request.correlationId(), choice.backend(), kind, cause);
            return new AnalysisResult.Failure(kind,
                    cause.getClass().getSimpleName() + ": " + cause.getMessage(), choice.backend());
        }
    }

    private static AnalysisResult callAdapter(
            BackendAdapter adapter,
            AnalysisRequest request,
            BackendChoice choice,
            Map<String, String> mdc
    ) {
        if (mdc != null) {
            MDC.setContextMap(mdc);
        }
        MDC.put(MDC_BACKEND, choice.backend().configName());
        try {
            AnalysisResult result = adapter.analyze(request, choice.timeout());
            return result != null
                    ? result
                    : new AnalysisResult.Failure(ErrorKind.INTERNAL_ERROR, "Adapter returned no result", choice.backend());
        } finally {
            MDC.clear();
        }
    }

    private static AnalysisResult.Failure asFailure(AnalysisResult result, BackendChoice choice) {
        if (result instanceof AnalysisResult.Failure failure) {
            return failure;
        }
        return new AnalysisResult.Failure(ErrorKind.INTERNAL_ERROR,
                "Adapter returned an unexpected result type: " + result.getClass().getSimpleName(),
                choice.backend());
    }

    private void awaitBackoff(AnalysisRequest request, DecisionTrace trace, BackendChoice choice) {
        log.info("Rate limited, backing off before retry: correlationId={}, backend={}, backoffMs={}",
                request.correlationId(), choice.backend(), rateLimitBackoff.toMillis());
        try {
            Thread.sleep(rateLimitBackoff.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw cancelled(request, trace, choice, "Cancelled during rate-limit backoff");
        }
    }

    private void ensureNotCancelled(AnalysisRequest request, DecisionTrace trace, BackendChoice choice) {
        if (Thread.currentThread().isInterrupted()) {
            throw cancelled(request, trace, choice, "Cancelled before attempting " + choice.backend());
        }
    }

    private AnalysisCancelledException cancelled(
            AnalysisRequest request,
            DecisionTrace trace,
            BackendChoice choice,
            String message
    ) {
        trace.recordCancellation(choice);
        metrics.incrementDecision(ExecutionState.CANCELLED);
        log.info("Analysis cancelled: correlationId={}, backend={}, attempts={}, reason={}",
                request.correlationId(), choice.backend(), trace.attempts(), message);
        return new AnalysisCancelledException(request.correlationId(), message);
    }

    public BackendSelector getSelector() {
        return selector;
    }

    public BackendRegistry getRegistry() {
        return registry;
    }

    @Override
    public void close() {
        if (!ownsExecutor) {
            return;
        }
        adapterExecutor.shutdown();
        try {
            if (!adapterExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Adapter executor did not terminate in time, interrupting adapter calls");
                adapterExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            adapterExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Thread factory for adapter calls.
     */
    private static class AdapterThreadFactory implements ThreadFactory {
        private final String namePrefix;
        private final AtomicInteger counter = new AtomicInteger(0);

        AdapterThreadFactory(String namePrefix) {
            this.namePrefix = namePrefix;
        }

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, namePrefix + "-" + counter.getAndIncrement());
            t.setDaemon(true);
            return t;
        }
    }

    /**
     * Builder for BackendOrchestrator.
     */
    public static final class Builder {
        private BackendSelector selector;
        private BackendRegistry registry;
        private ErrorClassifier classifier = new ErrorClassifier();
        private MetricsRegistry metrics;
        private ExecutorService adapterExecutor;
        private int adapterThreads = 16;
        private Duration rateLimitBackoff = Duration.ofSeconds(5);
        private Duration grace = Duration.ofMillis(200);

        public Builder selector(BackendSelector selector) {
            this.selector = selector;
            return this;
        }

        public Builder registry(BackendRegistry registry) {
            this.registry = registry;
            return this;
        }

        public Builder classifier(ErrorClassifier classifier) {
            this.classifier = classifier;
            return this;
        }

        public Builder metrics(MetricsRegistry metrics) {
            this.metrics = metrics;
            return this;
        }

        /**
         * Executor running adapter calls. When not set, the orchestrator creates and owns one.
         */
        public Builder adapterExecutor(ExecutorService executor) {
            this.adapterExecutor = executor;
            return this;
        }

        public Builder adapterThreads(int threads) {
            if (threads < 1) {
                throw new IllegalArgumentException("At least one adapter thread is required");
            }
            this.adapterThreads = threads;
            return this;
        }

        public Builder rateLimitBackoff(Duration backoff) {
            this.rateLimitBackoff = backoff;
            return this;
        }

        public Builder grace(Duration grace) {
            this.grace = grace;
            return this;
        }

        public Builder fromSettings(OrchestrationSettings settings) {
            this.rateLimitBackoff = settings.rateLimitBackoff();
            this.grace = settings.adapterGrace();
            this.adapterThreads = settings.adapterThreads();
            return this;
        }

        public BackendOrchestrator build() {
            if (selector == null) {
                throw new IllegalStateException("BackendSelector is required");
            }
            if (registry == null) {
                throw new IllegalStateException("BackendRegistry is required");
            }
            if (classifier == null) {
                throw new IllegalStateException("ErrorClassifier is required");
            }
            if (metrics == null) {
                throw new IllegalStateException("MetricsRegistry is required");
            }
            if (rateLimitBackoff == null || rateLimitBackoff.isNegative()) {
                throw new IllegalStateException("Rate limit backoff must not be negative");
            }
            if (grace == null || grace.isNegative()) {
                throw new IllegalStateException("Grace must not be negative");
            }
            return new BackendOrchestrator(this);
        }
    }
}

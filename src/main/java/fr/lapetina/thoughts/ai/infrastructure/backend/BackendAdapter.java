package fr.lapetina.thoughts.ai.infrastructure.backend;

import fr.lapetina.thoughts.ai.domain.model.AnalysisRequest;
import fr.lapetina.thoughts.ai.domain.model.AnalysisResult;
import fr.lapetina.thoughts.ai.domain.model.BackendId;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;

/**
 * Uniform view of one reasoning backend.
 *
 * Implementations hold no per-call mutable state and are called from many threads
 * concurrently.
 */
public interface BackendAdapter {

    BackendId id();

    /**
     * Analyzes a thought within the given timeout.
     *
     * <p>Provider faults are returned as {@link AnalysisResult.Failure}, never thrown.
     *
     * @param request the request to analyze
     * @param timeout attempt budget; the call returns no later than this plus a small grace
     * @return a {@link AnalysisResult.Success} or a {@link AnalysisResult.Failure}
     * @throws fr.lapetina.thoughts.ai.domain.model.AnalysisCancelledException if the calling thread is interrupted
     */
    AnalysisResult analyze(AnalysisRequest request, Duration timeout);

    /**
     * Checks whether the backend can currently serve requests. Never completes exceptionally.
     */
    CompletableFuture<Boolean> healthCheck();
}

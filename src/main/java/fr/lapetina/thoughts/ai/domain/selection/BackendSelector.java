package fr.lapetina.thoughts.ai.domain.selection;

import fr.lapetina.thoughts.ai.domain.model.AnalysisRequest;

/**
 * Decides which backends to try for a request, and in which order.
 *
 * Implementations must be pure functions of the request and their construction-time
 * configuration, and must be safe to call from many threads at once.
 */
public interface BackendSelector {

    /**
     * Returns the strategy name used in configuration and logs.
     */
    String getName();

    /**
     * Builds the plan for a request.
     *
     * @param request the request, carrying the set of available backends
     * @return a non-empty plan using only available backends
     * @throws NoAvailableBackendException if no configured backend is available
     */
    Plan select(AnalysisRequest request);
}

package fr.lapetina.thoughts.ai.orchestrator;

import fr.lapetina.thoughts.ai.domain.model.AggregateFailure;
import fr.lapetina.thoughts.ai.domain.model.AnalysisResult;
import fr.lapetina.thoughts.ai.domain.selection.Plan;

import java.util.Objects;
import java.util.Optional;

/**
 * What the orchestrator hands back: the result, the plan it followed and the trace of
 * every decision it took.
 */
public record OrchestrationOutcome(AnalysisResult result, Plan plan, DecisionTrace trace) {

    public OrchestrationOutcome {
        Objects.requireNonNull(result, "Result is required");
        Objects.requireNonNull(plan, "Plan is required");
        Objects.requireNonNull(trace, "Trace is required");
    }

    public boolean isSuccess() {
        return result.isSuccess();
    }

    public Optional<AnalysisResult.Success> success() {
        return result instanceof AnalysisResult.Success s ? Optional.of(s) : Optional.empty();
    }

    public Optional<AggregateFailure> failure() {
        return result instanceof AggregateFailure f ? Optional.of(f) : Optional.empty();
    }
}

package fr.lapetina.thoughts.ai.domain.model;

import java.util.List;

/**
 * Every failed attempt of one request, in the order the attempts were made.
 * {@code aborted} is set when a non-recoverable error cut the plan short.
 */
public record AggregateFailure(List<AnalysisResult.Failure> errors, boolean aborted) implements AnalysisResult {

    public AggregateFailure {
        if (errors == null || errors.isEmpty()) {
            throw new IllegalArgumentException("An aggregate failure needs at least one error");
        }
        errors = List.copyOf(errors);
    }

    /**
     * Kind of the last failure, the one that ended the request.
     */
    public ErrorKind errorKind() {
        return lastError().errorKind();
    }

    public AnalysisResult.Failure lastError() {
        return errors.get(errors.size() - 1);
    }

    public int attempts() {
        return errors.size();
    }

    @Override
    public boolean isSuccess() {
        return false;
    }
}

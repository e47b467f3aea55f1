package fr.lapetina.thoughts.ai.domain.model;

import java.time.Duration;
import java.util.Objects;

/**
 * Outcome of analyzing a thought: a success, a single failed attempt, or the
 * aggregate of every failed attempt made for one request.
 */
public sealed interface AnalysisResult
        permits AnalysisResult.Success, AnalysisResult.Failure, AggregateFailure {

    boolean isSuccess();

    /**
     * Backend produced a usable analysis.
     */
    record Success(
            ThoughtAnalysis analysis,
            TokenUsage usage,
            BackendId backend,
            String model,
            Duration processingTime
    ) implements AnalysisResult {
        public Success {
            Objects.requireNonNull(analysis, "Analysis is required");
            Objects.requireNonNull(backend, "Backend is required");
            if (usage == null) {
                usage = TokenUsage.NONE;
            }
            if (processingTime == null) {
                processingTime = Duration.ZERO;
            }
        }

        @Override
        public boolean isSuccess() {
            return true;
        }
    }

    /**
     * One attempt against one backend failed.
     */
    record Failure(ErrorKind errorKind, String message, BackendId backend) implements AnalysisResult {
        public Failure {
            Objects.requireNonNull(errorKind, "Error kind is required");
            Objects.requireNonNull(backend, "Backend is required");
            if (message == null) {
                message = errorKind.name();
            }
        }

        @Override
        public boolean isSuccess() {
            return false;
        }
    }
}

package fr.lapetina.thoughts.ai.infrastructure.backend;

import fr.lapetina.thoughts.ai.domain.model.AnalysisRequest;
import fr.lapetina.thoughts.ai.domain.model.AnalysisResult;
import fr.lapetina.thoughts.ai.domain.model.BackendId;
import fr.lapetina.thoughts.ai.domain.model.ErrorKind;

import java.util.Optional;

/**
 * Rejects requests a backend cannot accept, before anything is sent.
 */
public final class RequestGuard {

    /** Rough characters-per-token ratio used for the context window estimate */
    static final int CHARS_PER_TOKEN = 4;

    private final BackendId backend;
    private final int maxContentLength;
    private final int contextWindowTokens;

    public RequestGuard(BackendId backend, int maxContentLength, int contextWindowTokens) {
        this.backend = backend;
        this.maxContentLength = maxContentLength;
        this.contextWindowTokens = contextWindowTokens;
    }

    /**
     * @param promptOverheadChars characters the adapter adds around the content
     * @return the failure to report, or empty if the request may be sent
     */
    public Optional<AnalysisResult.Failure> check(AnalysisRequest request, int promptOverheadChars) {
        String content = request.content();
        if (content.isBlank()) {
            return Optional.of(new AnalysisResult.Failure(
                    ErrorKind.INVALID_INPUT, "Thought content is empty", backend));
        }
        if (content.strip().length() > maxContentLength) {
            return Optional.of(new AnalysisResult.Failure(
                    ErrorKind.INVALID_INPUT,
                    "Thought content has " + content.strip().length() + " characters, maximum is " + maxContentLength,
                    backend));
        }
        int estimatedTokens = estimateTokens(content.length() + promptOverheadChars);
        if (estimatedTokens > contextWindowTokens) {
            return Optional.of(new AnalysisResult.Failure(
                    ErrorKind.CONTEXT_OVERFLOW,
                    "Estimated " + estimatedTokens + " tokens exceed the context window of " + contextWindowTokens,
                    backend));
        }
        return Optional.empty();
    }

    static int estimateTokens(int chars) {
        return (chars + CHARS_PER_TOKEN - 1) / CHARS_PER_TOKEN;
    }
}

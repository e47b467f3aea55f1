package fr.lapetina.thoughts.ai.domain.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class AnalysisRequestTest {

    @Test
    @DisplayName("should fill in defaults")
    void defaults() {
        AnalysisRequest request = AnalysisRequest.builder().content("Plan the trip").build();

        assertThat(request.correlationId()).isNotBlank();
        assertThat(request.analysisType()).isEqualTo(AnalysisType.STANDARD);
        assertThat(request.availableBackends()).isEmpty();
        assertThat(request.preferenceHints()).isEmpty();
        assertThat(request.context()).isEmpty();
        assertThat(request.createdAt()).isNotNull();
        assertThat(request.contentLength()).isEqualTo(13);
    }

    @Test
    @DisplayName("should not be affected by later changes to its inputs")
    void defensiveCopies() {
        Set<BackendId> backends = EnumSet.of(BackendId.CLAUDE);
        Map<String, Object> context = new HashMap<>();
        context.put("mood", "focused");

        AnalysisRequest request = AnalysisRequest.builder()
                .content("x")
                .availableBackends(backends)
                .context(context)
                .build();
        backends.add(BackendId.OLLAMA);
        context.put("mood", "tired");

        assertThat(request.availableBackends()).containsExactly(BackendId.CLAUDE);
        assertThat(request.context()).containsEntry("mood", "focused");
        assertThatThrownBy(() -> request.availableBackends().add(BackendId.STUB))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    @DisplayName("should keep the correlation id when restricting backends")
    void withAvailableBackends() {
        AnalysisRequest request = AnalysisRequest.of("x", EnumSet.of(BackendId.CLAUDE, BackendId.OLLAMA));

        AnalysisRequest restricted = request.withAvailableBackends(EnumSet.of(BackendId.OLLAMA));

        assertThat(restricted.correlationId()).isEqualTo(request.correlationId());
        assertThat(restricted.isAvailable(BackendId.CLAUDE)).isFalse();
        assertThat(restricted.isAvailable(BackendId.OLLAMA)).isTrue();
    }

    @Test
    @DisplayName("should resolve backend names and the mock alias")
    void backendNames() {
        assertThat(BackendId.fromName("Claude")).isEqualTo(BackendId.CLAUDE);
        assertThat(BackendId.fromName(" ollama ")).isEqualTo(BackendId.OLLAMA);
        assertThat(BackendId.fromName("mock")).isEqualTo(BackendId.STUB);
        assertThatThrownBy(() -> BackendId.fromName("gpt"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("claude, ollama, openai, stub");
    }

    @Test
    @DisplayName("should require at least one error in an aggregate failure")
    void aggregateNeedsErrors() {
        assertThatThrownBy(() -> new AggregateFailure(List.of(), false))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("should clamp confidences and price token usage")
    void analysisValues() {
        ThoughtAnalysis.Theme theme = new ThoughtAnalysis.Theme("email", 1.4);
        TokenUsage usage = TokenUsage.priced(1_000, 500, 3.0, 15.0);

        assertThat(theme.confidence()).isEqualTo(1.0);
        assertThat(usage.totalTokens()).isEqualTo(1_500);
        assertThat(usage.costUsd()).isEqualTo(0.0105, within(1e-9));
    }
}

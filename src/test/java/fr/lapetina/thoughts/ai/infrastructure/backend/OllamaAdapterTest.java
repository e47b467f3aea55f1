package fr.lapetina.thoughts.ai.infrastructure.backend;

import fr.lapetina.thoughts.ai.domain.model.AnalysisRequest;
import fr.lapetina.thoughts.ai.domain.model.AnalysisResult;
import fr.lapetina.thoughts.ai.domain.model.BackendId;
import fr.lapetina.thoughts.ai.domain.model.ErrorKind;
import fr.lapetina.thoughts.ai.infrastructure.config.BackendConnection;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.net.http.HttpClient;
import java.time.Duration;
import java.util.EnumSet;

import static org.assertj.core.api.Assertions.assertThat;

class OllamaAdapterTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(2);

    private FakeProviderServer server;
    private OllamaAdapter adapter;

    @BeforeEach
    void setUp() throws Exception {
        server = new FakeProviderServer();
        BackendConnection connection = new BackendConnection(
                BackendId.OLLAMA, server.uri("/"), null, "gemma3:27b", TIMEOUT,
                512, 0.7, 8_192, 5_000, 0.0, 0.0, null, Duration.ZERO);
        adapter = new OllamaAdapter(connection, HttpClient.newBuilder().version(HttpClient.Version.HTTP_1_1).build(), Duration.ofMillis(100), Duration.ofSeconds(1));
    }

    @AfterEach
    void tearDown() {
        server.close();
    }

    @Test
    @DisplayName("should call the chat endpoint without streaming and read the message")
    void chat() {
        server.respond(200, """
                {"model": "gemma3:27b", "message": {"role": "assistant",
                 "content": "Sure! {\\"summary\\": \\"Plan groceries\\", \\"related_themes\\": [{\\"name\\": \\"shopping\\", \\"confidence\\": 0.8}]}"},
                 "done": true, "prompt_eval_count": 40, "eval_count": 12}""");

        AnalysisResult result = adapter.analyze(AnalysisRequest.of("Buy milk", EnumSet.of(BackendId.OLLAMA)), TIMEOUT);

        assertThat(server.lastPath()).isEqualTo("/api/chat");
        assertThat(server.lastBody())
                .contains("\"stream\":false")
                .contains("\"num_predict\":512");
        AnalysisResult.Success success = (AnalysisResult.Success) result;
        assertThat(success.analysis().summary()).isEqualTo("Plan groceries");
        assertThat(success.analysis().themes()).hasSize(1);
        assertThat(success.analysis().themes().get(0).confidence()).isEqualTo(0.8);
        assertThat(success.usage().inputTokens()).isEqualTo(40);
        assertThat(success.usage().outputTokens()).isEqualTo(12);
        assertThat(success.usage().costUsd()).isZero();
    }

    @Test
    @DisplayName("should report an exhausted context window before sending")
    void contextOverflow() {
        BackendConnection smallWindow = new BackendConnection(
                BackendId.OLLAMA, server.uri("/"), null, "tiny", TIMEOUT,
                512, 0.7, 100, 5_000, 0.0, 0.0, null, Duration.ZERO);
        OllamaAdapter tiny = new OllamaAdapter(smallWindow, HttpClient.newBuilder().version(HttpClient.Version.HTTP_1_1).build(),
                Duration.ofMillis(100), Duration.ofSeconds(1));

        AnalysisResult.Failure failure = (AnalysisResult.Failure) tiny.analyze(
                AnalysisRequest.of("word ".repeat(100), EnumSet.of(BackendId.OLLAMA)), TIMEOUT);

        assertThat(failure.errorKind()).isEqualTo(ErrorKind.CONTEXT_OVERFLOW);
        assertThat(server.requestCount()).isZero();
    }

    @Test
    @DisplayName("should report a missing model as unavailable")
    void missingModel() {
        server.respond(404, "{\"error\":\"model 'gemma3:27b' not found\"}");

        AnalysisResult.Failure failure = (AnalysisResult.Failure) adapter.analyze(
                AnalysisRequest.of("x", EnumSet.of(BackendId.OLLAMA)), TIMEOUT);

        assertThat(failure.errorKind()).isEqualTo(ErrorKind.UNAVAILABLE);
        assertThat(failure.message()).contains("not found");
    }

    @Test
    @DisplayName("should check health on the tags endpoint")
    void healthCheck() {
        server.respond(200, "{\"models\":[]}");
        assertThat(adapter.healthCheck().join()).isTrue();
        assertThat(server.lastPath()).isEqualTo("/api/tags");

        server.respond(503, "");
        assertThat(adapter.healthCheck().join()).isFalse();
    }
}

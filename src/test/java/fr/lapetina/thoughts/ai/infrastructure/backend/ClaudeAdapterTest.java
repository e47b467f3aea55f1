package fr.lapetina.thoughts.ai.infrastructure.backend;

import fr.lapetina.thoughts.ai.domain.model.AnalysisRequest;
import fr.lapetina.thoughts.ai.domain.model.AnalysisResult;
import fr.lapetina.thoughts.ai.domain.model.BackendId;
import fr.lapetina.thoughts.ai.domain.model.ErrorKind;
import fr.lapetina.thoughts.ai.domain.model.ThoughtAnalysis;
import fr.lapetina.thoughts.ai.infrastructure.config.BackendConnection;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.net.http.HttpClient;
import java.time.Duration;
import java.util.EnumSet;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class ClaudeAdapterTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(2);

    private FakeProviderServer server;
    private HttpClient httpClient;

    @BeforeEach
    void setUp() throws Exception {
        server = new FakeProviderServer();
        httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(1))
                .version(HttpClient.Version.HTTP_1_1)
                .build();
    }

    @AfterEach
    void tearDown() {
        server.close();
    }

    private ClaudeAdapter adapter(String apiKey) {
        return new ClaudeAdapter(new BackendConnection(
                BackendId.CLAUDE, server.uri("/v1/messages"), apiKey, "claude-test", TIMEOUT,
                256, 0.2, 200_000, 5_000, 3.0, 15.0, null, Duration.ZERO),
                httpClient, Duration.ofMillis(100), Duration.ofSeconds(1));
    }

    private static AnalysisRequest request(String content) {
        return AnalysisRequest.of(content, EnumSet.of(BackendId.CLAUDE));
    }

    @Nested
    @DisplayName("Successful replies")
    class SuccessfulReplies {

        @Test
        @DisplayName("should parse the text block and price the usage")
        void parsesReply() {
            server.respond(200, """
                    {
                      "id": "msg_01",
                      "model": "claude-test-20241022",
                      "content": [{"type": "text", "text": "{\\"summary\\": \\"Reply to Alice\\", \\"themes\\": [\\"email\\"], \\"is_actionable\\": true, \\"action_suggestion\\": \\"Reply today\\", \\"actionable_confidence\\": 0.9}"}],
                      "usage": {"input_tokens": 100, "output_tokens": 50}
                    }""");

            AnalysisResult result = adapter("secret").analyze(request("I should answer Alice"), TIMEOUT);

            assertThat(result).isInstanceOf(AnalysisResult.Success.class);
            AnalysisResult.Success success = (AnalysisResult.Success) result;
            assertThat(success.backend()).isEqualTo(BackendId.CLAUDE);
            assertThat(success.model()).isEqualTo("claude-test-20241022");
            assertThat(success.analysis().summary()).isEqualTo("Reply to Alice");
            assertThat(success.analysis().themes()).extracting(ThoughtAnalysis.Theme::theme).containsExactly("email");
            assertThat(success.analysis().suggestedActions())
                    .extracting(ThoughtAnalysis.SuggestedAction::action)
                    .containsExactly("Reply today");
            assertThat(success.analysis().actionableConfidence()).isEqualTo(0.9);
            assertThat(success.usage().totalTokens()).isEqualTo(150);
            assertThat(success.usage().costUsd()).isEqualTo(0.00105, within(1e-9));
        }

        @Test
        @DisplayName("should send credentials, version and correlation headers")
        void sendsHeaders() {
            server.respond(200, "{\"content\":[{\"type\":\"text\",\"text\":\"plain words\"}]}");
            AnalysisRequest request = request("Buy milk");

            adapter("secret").analyze(request, TIMEOUT);

            assertThat(server.lastPath()).isEqualTo("/v1/messages");
            assertThat(server.lastHeader("x-api-key")).isEqualTo("secret");
            assertThat(server.lastHeader("anthropic-version")).isEqualTo(ClaudeAdapter.API_VERSION);
            assertThat(server.lastHeader("X-Correlation-ID")).isEqualTo(request.correlationId());
            assertThat(server.lastBody())
                    .contains("\"model\":\"claude-test\"")
                    .contains("\"max_tokens\":256")
                    .contains("Buy milk");
        }
    }

    @Nested
    @DisplayName("Failures")
    class Failures {

        @Test
        @DisplayName("should report rate limiting")
        void rateLimited() {
            server.respond(429, "{\"type\":\"error\",\"error\":{\"type\":\"rate_limit_error\",\"message\":\"slow down\"}}");

            AnalysisResult result = adapter("secret").analyze(request("x"), TIMEOUT);

            assertThat(result).isEqualTo(new AnalysisResult.Failure(
                    ErrorKind.RATE_LIMITED, "HTTP 429: slow down", BackendId.CLAUDE));
        }

        @Test
        @DisplayName("should report a context window complaint as overflow")
        void contextOverflow() {
            server.respond(400, "{\"error\":{\"message\":\"prompt is too long: 250000 tokens > 200000 maximum\"}}");

            AnalysisResult.Failure failure = (AnalysisResult.Failure) adapter("secret").analyze(request("x"), TIMEOUT);

            assertThat(failure.errorKind()).isEqualTo(ErrorKind.CONTEXT_OVERFLOW);
        }

        @Test
        @DisplayName("should report a server error as internal")
        void serverError() {
            server.respond(500, "{\"error\":\"overloaded\"}");

            AnalysisResult.Failure failure = (AnalysisResult.Failure) adapter("secret").analyze(request("x"), TIMEOUT);

            assertThat(failure.errorKind()).isEqualTo(ErrorKind.INTERNAL_ERROR);
            assertThat(failure.message()).isEqualTo("HTTP 500: overloaded");
        }

        @Test
        @DisplayName("should report an unreadable envelope as malformed")
        void unreadableEnvelope() {
            server.respond(200, "<html>gateway</html>");

            AnalysisResult.Failure failure = (AnalysisResult.Failure) adapter("secret").analyze(request("x"), TIMEOUT);

            assertThat(failure.errorKind()).isEqualTo(ErrorKind.MALFORMED_RESPONSE);
        }

        @Test
        @DisplayName("should report an envelope without text as malformed")
        void envelopeWithoutText() {
            server.respond(200, "{\"content\":[{\"type\":\"tool_use\",\"id\":\"t1\"}]}");

            AnalysisResult.Failure failure = (AnalysisResult.Failure) adapter("secret").analyze(request("x"), TIMEOUT);

            assertThat(failure.errorKind()).isEqualTo(ErrorKind.MALFORMED_RESPONSE);
        }

        @Test
        @DisplayName("should report a slow backend as timed out")
        void timeout() {
            server.delay(Duration.ofSeconds(3));

            AnalysisResult.Failure failure = (AnalysisResult.Failure) adapter("secret")
                    .analyze(request("x"), Duration.ofMillis(300));

            assertThat(failure.errorKind()).isEqualTo(ErrorKind.TIMEOUT);
        }

        @Test
        @DisplayName("should report a refused connection as unavailable")
        void connectionRefused() {
            ClaudeAdapter adapter = adapter("secret");
            server.close();

            AnalysisResult.Failure failure = (AnalysisResult.Failure) adapter.analyze(request("x"), TIMEOUT);

            assertThat(failure.errorKind()).isIn(ErrorKind.UNAVAILABLE, ErrorKind.TIMEOUT);
        }
    }

    @Nested
    @DisplayName("Checks before sending")
    class LocalChecks {

        @Test
        @DisplayName("should be unavailable without an API key")
        void missingKey() {
            AnalysisResult.Failure failure = (AnalysisResult.Failure) adapter(null).analyze(request("x"), TIMEOUT);

            assertThat(failure.errorKind()).isEqualTo(ErrorKind.UNAVAILABLE);
            assertThat(server.requestCount()).isZero();
            assertThat(adapter(null).healthCheck().join()).isFalse();
        }

        @Test
        @DisplayName("should reject oversized content as invalid input")
        void oversizedContent() {
            AnalysisResult.Failure failure = (AnalysisResult.Failure) adapter("secret")
                    .analyze(request("a".repeat(5_001)), TIMEOUT);

            assertThat(failure.errorKind()).isEqualTo(ErrorKind.INVALID_INPUT);
            assertThat(server.requestCount()).isZero();
        }

        @Test
        @DisplayName("should reject empty content as invalid input")
        void emptyContent() {
            AnalysisResult.Failure failure = (AnalysisResult.Failure) adapter("secret").analyze(request("   "), TIMEOUT);

            assertThat(failure.errorKind()).isEqualTo(ErrorKind.INVALID_INPUT);
            assertThat(server.requestCount()).isZero();
        }
    }
}

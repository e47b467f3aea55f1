package fr.lapetina.thoughts.ai.infrastructure.config;

import fr.lapetina.thoughts.ai.domain.model.BackendId;
import fr.lapetina.thoughts.ai.domain.model.ErrorKind;
import fr.lapetina.thoughts.ai.domain.selection.SelectionStrategy;
import fr.lapetina.thoughts.ai.infrastructure.config.ConfigLoader.ConfigurationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConfigLoaderTest {

    private static final Map<String, String> NO_ENV = Map.of();

    private static InputStream yaml(String text) {
        return new ByteArrayInputStream(text.getBytes(StandardCharsets.UTF_8));
    }

    private static OrchestrationSettings parse(String text, Map<String, String> env) {
        return new ConfigLoader("unused.yaml", env).loadFromStream(yaml(text));
    }

    @Nested
    @DisplayName("Loading")
    class Loading {

        @Test
        @DisplayName("should load the test configuration from the classpath")
        void classpath() {
            OrchestrationSettings settings = new ConfigLoader("test-config.yaml", NO_ENV).load();

            assertThat(settings.availableBackends()).containsExactly(BackendId.CLAUDE, BackendId.OLLAMA);
            assertThat(settings.primaryBackend()).isEqualTo(BackendId.CLAUDE);
            assertThat(settings.secondaryBackend()).isEqualTo(BackendId.OLLAMA);
            assertThat(settings.strategy()).isEqualTo(SelectionStrategy.SEQUENTIAL);
            assertThat(settings.rateLimitBackoff()).isEqualTo(Duration.ofMillis(100));
            assertThat(settings.queue().ringBufferSize()).isEqualTo(8);
            assertThat(settings.queue().workers()).isEqualTo(2);
            assertThat(settings.connection(BackendId.CLAUDE).apiKey()).isEqualTo("test-key");
            assertThat(settings.timeouts()).containsEntry(BackendId.CLAUDE, Duration.ofSeconds(2));
            assertThat(settings.metricsPrefix()).isEqualTo("thought_ai_test");
        }

        @Test
        @DisplayName("should prefer a file on disk")
        void fileSystem(@TempDir Path dir) throws Exception {
            Path file = dir.resolve("orchestrator.yaml");
            Files.writeString(file, """
                    selection:
                      availableBackends: [ollama, openai]
                      primaryBackend: ollama
                      secondaryBackend: openai
                    """);

            OrchestrationSettings settings = new ConfigLoader(file.toString(), NO_ENV).load();

            assertThat(settings.primaryBackend()).isEqualTo(BackendId.OLLAMA);
            assertThat(settings.connection(BackendId.OPENAI).endpoint())
                    .isEqualTo(URI.create(BackendId.OPENAI.defaultEndpoint()));
        }

        @Test
        @DisplayName("should apply defaults to an empty document")
        void defaults() {
            OrchestrationSettings settings = parse("", NO_ENV);

            assertThat(settings.availableBackends()).containsExactly(BackendId.CLAUDE, BackendId.OLLAMA);
            assertThat(settings.rateLimitBackoff()).isEqualTo(Duration.ofSeconds(5));
            assertThat(settings.adapterGrace()).isEqualTo(Duration.ofMillis(200));
            assertThat(settings.queue().ringBufferSize()).isEqualTo(1024);
            assertThat(settings.connection(BackendId.CLAUDE).timeout()).isEqualTo(Duration.ofSeconds(30));
            assertThat(settings.connection(BackendId.OLLAMA).timeout()).isEqualTo(Duration.ofSeconds(120));
            assertThat(settings.connection(BackendId.CLAUDE).hasApiKey()).isFalse();
            assertThat(settings.metricsPrefix()).isEqualTo("thought_ai");
        }

        @Test
        @DisplayName("should accept the mock alias and a stub without failure")
        void stubAlias() {
            OrchestrationSettings settings = new ConfigLoader("stub-config.yaml", NO_ENV).load();

            assertThat(settings.primaryBackend()).isEqualTo(BackendId.STUB);
            assertThat(settings.connection(BackendId.STUB).stubFailure()).isNull();
            assertThat(settings.connection(BackendId.STUB).endpoint()).isNull();
        }
    }

    @Nested
    @DisplayName("Credentials")
    class Credentials {

        @Test
        @DisplayName("should read the Claude key from its default variable")
        void defaultVariable() {
            OrchestrationSettings settings = parse("", Map.of("ANTHROPIC_API_KEY", "from-env"));

            assertThat(settings.connection(BackendId.CLAUDE).apiKey()).isEqualTo("from-env");
        }

        @Test
        @DisplayName("should read a named variable and prefer a literal key")
        void namedVariable() {
            String text = """
                    backends:
                      - id: claude
                        apiKeyEnv: TEAM_CLAUDE_KEY
                      - id: ollama
                        apiKey: literal
                    """;

            OrchestrationSettings settings = parse(text, Map.of("TEAM_CLAUDE_KEY", "team", "ANTHROPIC_API_KEY", "other"));

            assertThat(settings.connection(BackendId.CLAUDE).apiKey()).isEqualTo("team");
            assertThat(settings.connection(BackendId.OLLAMA).apiKey()).isEqualTo("literal");
        }

        @Test
        @DisplayName("should never print the key")
        void redacted() {
            OrchestrationSettings settings = parse("", Map.of("ANTHROPIC_API_KEY", "sk-ant-secret"));

            assertThat(settings.connection(BackendId.CLAUDE).toString())
                    .doesNotContain("sk-ant-secret")
                    .contains("****");
        }
    }

    @Nested
    @DisplayName("Validation")
    class Validation {

        @Test
        @DisplayName("should reject unsupported strategies at startup")
        void unsupportedStrategy() {
            assertThatThrownBy(() -> new ConfigLoader("invalid-strategy.yaml", NO_ENV).load())
                    .isInstanceOf(ConfigurationException.class)
                    .hasMessageContaining("not supported");
        }

        @Test
        @DisplayName("should reject a primary outside the available backends")
        void primaryNotAvailable() {
            assertThatThrownBy(() -> new ConfigLoader("primary-not-available.yaml", NO_ENV).load())
                    .isInstanceOf(ConfigurationException.class)
                    .hasMessageContaining("Primary backend 'claude'");
        }

        @Test
        @DisplayName("should reject unknown backend names")
        void unknownBackend() {
            assertThatThrownBy(() -> parse("selection:\n  availableBackends: [claude, gemini]\n", NO_ENV))
                    .isInstanceOf(ConfigurationException.class)
                    .hasMessageContaining("gemini");
        }

        @Test
        @DisplayName("should reject simulated failures on real backends")
        void stubFailureOnRealBackend() {
            String text = """
                    backends:
                      - id: ollama
                        stubFailure: rate_limited
                    """;

            assertThatThrownBy(() -> parse(text, NO_ENV))
                    .isInstanceOf(ConfigurationException.class)
                    .hasMessageContaining("stubFailure");
        }

        @Test
        @DisplayName("should parse simulated failures on the stub")
        void stubFailure() {
            String text = """
                    selection:
                      availableBackends: [stub, ollama]
                      primaryBackend: stub
                    backends:
                      - id: stub
                        stubFailure: rate-limited
                        stubLatencyMs: 25
                    """;

            BackendConnection stub = parse(text, NO_ENV).connection(BackendId.STUB);

            assertThat(stub.stubFailure()).isEqualTo(ErrorKind.RATE_LIMITED);
            assertThat(stub.stubLatency()).isEqualTo(Duration.ofMillis(25));
        }

        @ParameterizedTest
        @CsvSource({
                "stub, stubLatencyMs, -5",
                "claude, inputCostPerMillion, -1.0",
                "ollama, outputCostPerMillion, -0.5",
                "ollama, maxTokens, 0",
                "claude, contextWindowTokens, -100",
                "stub, maxContentLength, 0"
        })
        @DisplayName("should reject negative latencies and costs and non-positive limits")
        void outOfRangeBackendValues(String backend, String field, String value) {
            String text = "backends:\n"
                    + "  - id: " + backend + "\n"
                    + "    " + field + ": " + value + "\n";

            assertThatThrownBy(() -> parse(text, NO_ENV))
                    .isInstanceOf(ConfigurationException.class)
                    .hasMessageContaining(field)
                    .hasMessageContaining(backend);
        }

        @Test
        @DisplayName("should reject a backend configured twice")
        void duplicateBackend() {
            String text = """
                    backends:
                      - id: claude
                      - id: claude
                    """;

            assertThatThrownBy(() -> parse(text, NO_ENV))
                    .isInstanceOf(ConfigurationException.class)
                    .hasMessageContaining("twice");
        }

        @Test
        @DisplayName("should reject a ring buffer size that is not a power of two")
        void ringBufferSize() {
            assertThatThrownBy(() -> parse("queue:\n  ringBufferSize: 1000\n", NO_ENV))
                    .isInstanceOf(ConfigurationException.class)
                    .hasMessageContaining("power of 2");
        }

        @Test
        @DisplayName("should report malformed YAML and missing files")
        void unreadable() {
            assertThatThrownBy(() -> parse("selection: [unclosed", NO_ENV))
                    .isInstanceOf(ConfigurationException.class)
                    .hasMessageContaining("Invalid YAML");
            assertThatThrownBy(() -> new ConfigLoader("does-not-exist.yaml", NO_ENV).load())
                    .isInstanceOf(ConfigurationException.class)
                    .hasMessageContaining("not found");
        }
    }
}

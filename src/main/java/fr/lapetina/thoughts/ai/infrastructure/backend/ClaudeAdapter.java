package fr.lapetina.thoughts.ai.infrastructure.backend;

import com.fasterxml.jackson.databind.JsonNode;
import fr.lapetina.thoughts.ai.domain.model.AnalysisRequest;
import fr.lapetina.thoughts.ai.domain.model.AnalysisResult;
import fr.lapetina.thoughts.ai.domain.model.ErrorKind;
import fr.lapetina.thoughts.ai.infrastructure.config.BackendConnection;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Remote primary backend: Anthropic Messages API.
 */
public class ClaudeAdapter extends HttpBackendAdapter {

    static final String API_VERSION = "2023-06-01";

    public ClaudeAdapter(BackendConnection connection, HttpClient httpClient, Duration grace, Duration healthCheckTimeout) {
        super(connection, httpClient, grace, healthCheckTimeout);
    }

    @Override
    protected URI analyzeUri() {
        return connection.endpoint();
    }

    @Override
    protected URI healthUri() {
        return connection.endpoint();
    }

    @Override
    protected void addHeaders(HttpRequest.Builder builder) {
        builder.header("x-api-key", connection.apiKey())
                .header("anthropic-version", API_VERSION);
    }

    @Override
    protected Optional<AnalysisResult.Failure> checkPreconditions() {
        if (!connection.hasApiKey()) {
            return Optional.of(failure(ErrorKind.UNAVAILABLE, "No API key configured for " + id()));
        }
        return Optional.empty();
    }

    @Override
    protected Map<String, Object> requestBody(AnalysisRequest request, String systemPrompt, String userPrompt) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model", connection.model());
        body.put("max_tokens", connection.maxTokens());
        body.put("temperature", connection.temperature());
        body.put("system", systemPrompt);
        body.put("messages", List.of(Map.of("role", "user", "content", userPrompt)));
        return body;
    }

    @Override
    protected ProviderReply readReply(JsonNode root) {
        String text = null;
        for (JsonNode block : root.path("content")) {
            if ("text".equals(block.path("type").asText()) && block.has("text")) {
                text = block.get("text").asText();
                break;
            }
        }
        if (text == null) {
            return null;
        }
        JsonNode usage = root.path("usage");
        return new ProviderReply(
                text,
                usage.path("input_tokens").asInt(0),
                usage.path("output_tokens").asInt(0),
                root.hasNonNull("model") ? root.get("model").asText() : null);
    }

    /**
     * The Messages API has no cheap health endpoint; a configured key is treated as healthy.
     */
    @Override
    public CompletableFuture<Boolean> healthCheck() {
        return CompletableFuture.completedFuture(connection.hasApiKey());
    }
}

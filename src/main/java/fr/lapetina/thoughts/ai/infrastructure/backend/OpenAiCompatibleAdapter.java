package fr.lapetina.thoughts.ai.infrastructure.backend;

import com.fasterxml.jackson.databind.JsonNode;
import fr.lapetina.thoughts.ai.domain.model.AnalysisRequest;
import fr.lapetina.thoughts.ai.infrastructure.config.BackendConnection;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Local servers exposing the OpenAI chat completions API (LM Studio, llama.cpp, vLLM).
 */
public class OpenAiCompatibleAdapter extends HttpBackendAdapter {

    public OpenAiCompatibleAdapter(BackendConnection connection, HttpClient httpClient,
                                   Duration grace, Duration healthCheckTimeout) {
        super(connection, httpClient, grace, healthCheckTimeout);
    }

    @Override
    protected URI analyzeUri() {
        return resolve(connection.endpoint(), "/chat/completions");
    }

    @Override
    protected URI healthUri() {
        return resolve(connection.endpoint(), "/models");
    }

    @Override
    protected void addHeaders(HttpRequest.Builder builder) {
        if (connection.hasApiKey()) {
            builder.header("Authorization", "Bearer " + connection.apiKey());
        }
    }

    @Override
    protected Map<String, Object> requestBody(AnalysisRequest request, String systemPrompt, String userPrompt) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model", connection.model());
        body.put("messages", List.of(
                Map.of("role", "system", "content", systemPrompt),
                Map.of("role", "user", "content", userPrompt)));
        body.put("temperature", connection.temperature());
        body.put("max_tokens", connection.maxTokens());
        body.put("stream", false);
        return body;
    }

    @Override
    protected ProviderReply readReply(JsonNode root) {
        JsonNode content = root.path("choices").path(0).path("message").path("content");
        if (!content.isTextual()) {
            return null;
        }
        JsonNode usage = root.path("usage");
        return new ProviderReply(
                content.asText(),
                usage.path("prompt_tokens").asInt(0),
                usage.path("completion_tokens").asInt(0),
                root.hasNonNull("model") ? root.get("model").asText() : null);
    }
}

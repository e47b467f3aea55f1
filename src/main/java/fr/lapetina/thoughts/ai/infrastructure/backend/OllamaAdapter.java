package fr.lapetina.thoughts.ai.infrastructure.backend;

import com.fasterxml.jackson.databind.JsonNode;
import fr.lapetina.thoughts.ai.domain.model.AnalysisRequest;
import fr.lapetina.thoughts.ai.infrastructure.config.BackendConnection;

import java.net.URI;
import java.net.http.HttpClient;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Local secondary backend: Ollama chat API.
 */
public class OllamaAdapter extends HttpBackendAdapter {

    static final double TOP_P = 0.9;

    public OllamaAdapter(BackendConnection connection, HttpClient httpClient, Duration grace, Duration healthCheckTimeout) {
        super(connection, httpClient, grace, healthCheckTimeout);
    }

    @Override
    protected URI analyzeUri() {
        return resolve(connection.endpoint(), "/api/chat");
    }

    @Override
    protected URI healthUri() {
        return resolve(connection.endpoint(), "/api/tags");
    }

    @Override
    protected Map<String, Object> requestBody(AnalysisRequest request, String systemPrompt, String userPrompt) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model", connection.model());
        body.put("messages", List.of(
                Map.of("role", "system", "content", systemPrompt),
                Map.of("role", "user", "content", userPrompt)));
        body.put("stream", false);
        body.put("options", Map.of(
                "temperature", connection.temperature(),
                "top_p", TOP_P,
                "num_predict", connection.maxTokens()));
        return body;
    }

    @Override
    protected ProviderReply readReply(JsonNode root) {
        JsonNode content = root.path("message").path("content");
        if (!content.isTextual()) {
            return null;
        }
        return new ProviderReply(
                content.asText(),
                root.path("prompt_eval_count").asInt(0),
                root.path("eval_count").asInt(0),
                root.hasNonNull("model") ? root.get("model").asText() : null);
    }
}

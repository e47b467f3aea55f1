package fr.lapetina.thoughts.ai.infrastructure.backend;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import fr.lapetina.thoughts.ai.domain.classifier.ErrorClassifier;
import fr.lapetina.thoughts.ai.domain.model.AnalysisCancelledException;
import fr.lapetina.thoughts.ai.domain.model.AnalysisRequest;
import fr.lapetina.thoughts.ai.domain.model.AnalysisResult;
import fr.lapetina.thoughts.ai.domain.model.BackendId;
import fr.lapetina.thoughts.ai.domain.model.ErrorKind;
import fr.lapetina.thoughts.ai.domain.model.ThoughtAnalysis;
import fr.lapetina.thoughts.ai.domain.model.TokenUsage;
import fr.lapetina.thoughts.ai.infrastructure.config.BackendConnection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Base class for adapters talking JSON over HTTP to a language-model provider.
 *
 * <p>Uses java.net.http.HttpClient. Subclasses describe the provider's wire format;
 * this class owns input checks, deadlines, status and exception classification.
 */
public abstract class HttpBackendAdapter implements BackendAdapter {

    private static final Logger log = LoggerFactory.getLogger(HttpBackendAdapter.class);

    protected final BackendConnection connection;
    protected final ObjectMapper objectMapper;

    private final HttpClient httpClient;
    private final Duration grace;
    private final Duration healthCheckTimeout;
    private final RequestGuard guard;
    private final AnalysisParser parser;

    protected HttpBackendAdapter(
            BackendConnection connection,
            HttpClient httpClient,
            Duration grace,
            Duration healthCheckTimeout
    ) {
        this.connection = connection;
        this.httpClient = httpClient;
        this.grace = grace;
        this.healthCheckTimeout = healthCheckTimeout;
        this.guard = new RequestGuard(connection.id(), connection.maxContentLength(), connection.contextWindowTokens());

        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .setSerializationInclusion(JsonInclude.Include.NON_NULL)
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        this.parser = new AnalysisParser(objectMapper);
    }

    /**
     * Text and token counts pulled out of a provider's reply envelope.
     */
    protected record ProviderReply(String text, int inputTokens, int outputTokens, String model) {
    }

    /** Endpoint receiving the analysis call */
    protected abstract URI analyzeUri();

    /** Provider-specific request body, serialized as JSON */
    protected abstract Map<String, Object> requestBody(AnalysisRequest request, String systemPrompt, String userPrompt);

    /**
     * Reads the provider envelope.
     *
     * @return the reply, or null if the envelope lacks the expected fields
     */
    protected abstract ProviderReply readReply(JsonNode root);

    /** Endpoint answering 200 when the backend is up */
    protected abstract URI healthUri();

    /** Adds authentication or versioning headers */
    protected void addHeaders(HttpRequest.Builder builder) {
        // No extra headers by default
    }

    /** Checks that must pass before any network call, e.g. credentials */
    protected Optional<AnalysisResult.Failure> checkPreconditions() {
        return Optional.empty();
    }

    @Override
    public BackendId id() {
        return connection.id();
    }

    @Override
    public final AnalysisResult analyze(AnalysisRequest request, Duration timeout) {
        Optional<AnalysisResult.Failure> rejected = guard.check(request, AnalysisPrompt.overheadChars(request))
                .or(this::checkPreconditions);
        if (rejected.isPresent()) {
            log.warn("Request rejected before sending: backend={}, correlationId={}, errorKind={}, reason={}",
                    id(), request.correlationId(), rejected.get().errorKind(), rejected.get().message());
            return rejected.get();
        }

        HttpRequest httpRequest;
        try {
            httpRequest = buildHttpRequest(request, timeout);
        } catch (JsonProcessingException e) {
            log.error("Failed to build request: backend={}, correlationId={}", id(), request.correlationId(), e);
            return failure(ErrorKind.INTERNAL_ERROR, "Failed to build request: " + e.getOriginalMessage());
        }

        log.info("Sending request: backend={}, correlationId={}, model={}, endpoint={}, timeoutMs={}",
                id(), request.correlationId(), connection.model(), httpRequest.uri(), timeout.toMillis());

        long startNanos = System.nanoTime();
        CompletableFuture<HttpResponse<String>> future =
                httpClient.sendAsync(httpRequest, HttpResponse.BodyHandlers.ofString());

        HttpResponse<String> response;
        try {
            response = future.get(timeout.plus(grace).toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new AnalysisCancelledException(request.correlationId(),
                    "Interrupted while waiting for " + id());
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("Request timeout: backend={}, correlationId={}, timeoutMs={}",
                    id(), request.correlationId(), timeout.toMillis());
            return failure(ErrorKind.TIMEOUT, "No response within " + timeout.toMillis() + "ms");
        } catch (ExecutionException e) {
            return handleException(request, e);
        }

        Duration elapsed = Duration.ofNanos(System.nanoTime() - startNanos);
        return handleResponse(request, response, elapsed);
    }

    private HttpRequest buildHttpRequest(AnalysisRequest request, Duration timeout) throws JsonProcessingException {
        String body = objectMapper.writeValueAsString(requestBody(
                request,
                AnalysisPrompt.system(request.analysisType()),
                AnalysisPrompt.user(request)));

        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(analyzeUri())
                .timeout(timeout)
                .header("Content-Type", "application/json")
                .header("X-Correlation-ID", request.correlationId())
                .POST(HttpRequest.BodyPublishers.ofString(body));
        addHeaders(builder);
        return builder.build();
    }

    private AnalysisResult handleResponse(AnalysisRequest request, HttpResponse<String> response, Duration elapsed) {
        int statusCode = response.statusCode();

        if (statusCode < 200 || statusCode >= 300) {
            ErrorKind kind = ErrorClassifier.fromHttpStatus(statusCode, response.body());
            String message = errorMessage(response.body(), statusCode);
            log.warn("Request failed with HTTP error: backend={}, correlationId={}, status={}, errorKind={}, latencyMs={}",
                    id(), request.correlationId(), statusCode, kind, elapsed.toMillis());
            return failure(kind, message);
        }

        ProviderReply reply;
        try {
            reply = readReply(objectMapper.readTree(response.body()));
        } catch (JsonProcessingException e) {
            log.warn("Unreadable reply envelope: backend={}, correlationId={}, error={}",
                    id(), request.correlationId(), e.getOriginalMessage());
            return failure(ErrorKind.MALFORMED_RESPONSE, "Unreadable reply: " + e.getOriginalMessage());
        }
        if (reply == null || reply.text() == null || reply.text().isBlank()) {
            log.warn("Reply without content: backend={}, correlationId={}", id(), request.correlationId());
            return failure(ErrorKind.MALFORMED_RESPONSE, "Reply has no text content");
        }

        ThoughtAnalysis analysis = parser.parse(reply.text());
        TokenUsage usage = TokenUsage.priced(
                Math.max(0, reply.inputTokens()),
                Math.max(0, reply.outputTokens()),
                connection.inputCostPerMillion(),
                connection.outputCostPerMillion());

        log.info("Request successful: backend={}, correlationId={}, status={}, latencyMs={}, tokens={}",
                id(), request.correlationId(), statusCode, elapsed.toMillis(), usage.totalTokens());

        return new AnalysisResult.Success(
                analysis,
                usage,
                id(),
                reply.model() != null ? reply.model() : connection.model(),
                elapsed);
    }

    private AnalysisResult handleException(AnalysisRequest request, ExecutionException ex) {
        Throwable cause = ex.getCause() != null ? ex.getCause() : ex;
        ErrorKind kind = ErrorClassifier.fromThrowable(cause);

        if (kind == ErrorKind.INTERNAL_ERROR) {
            log.error("Request failed unexpectedly: backend={}, correlationId={}, errorType={}, error={}",
                    id(), request.correlationId(), cause.getClass().getSimpleName(), cause.getMessage(), cause);
        } else {
            log.warn("Request failed: backend={}, correlationId={}, errorKind={}, errorType={}, error={}",
                    id(), request.correlationId(), kind, cause.getClass().getSimpleName(), cause.getMessage());
        }
        return failure(kind, cause.getClass().getSimpleName() + ": " + cause.getMessage());
    }

    /**
     * Reads {@code {"error": "..."}} or {@code {"error": {"message": "..."}}}.
     */
    private String errorMessage(String body, int statusCode) {
        String fallback = "HTTP " + statusCode;
        if (body == null || body.isBlank()) {
            return fallback;
        }
        try {
            JsonNode error = objectMapper.readTree(body).path("error");
            if (error.isTextual()) {
                return fallback + ": " + error.asText();
            }
            if (error.hasNonNull("message")) {
                return fallback + ": " + error.get("message").asText();
            }
        } catch (JsonProcessingException e) {
            log.debug("Error body is not JSON: backend={}, status={}", id(), statusCode);
        }
        return fallback;
    }

    protected AnalysisResult.Failure failure(ErrorKind kind, String message) {
        return new AnalysisResult.Failure(kind, message, id());
    }

    @Override
    public CompletableFuture<Boolean> healthCheck() {
        URI uri = healthUri();
        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(uri)
                .timeout(healthCheckTimeout)
                .GET();
        addHeaders(builder);

        log.debug("Health check started: backend={}, uri={}", id(), uri);

        return httpClient.sendAsync(builder.build(), HttpResponse.BodyHandlers.discarding())
                .thenApply(response -> {
                    boolean healthy = response.statusCode() == 200;
                    if (healthy) {
                        log.debug("Health check passed: backend={}, status={}", id(), response.statusCode());
                    } else {
                        log.warn("Health check failed: backend={}, status={}", id(), response.statusCode());
                    }
                    return healthy;
                })
                .exceptionally(ex -> {
                    log.warn("Health check error: backend={}, error={}", id(), ex.getMessage());
                    return false;
                });
    }

    /**
     * Joins a base endpoint and a path without doubling slashes.
     */
    protected static URI resolve(URI base, String path) {
        String basePath = base.toString();
        if (basePath.endsWith("/")) {
            basePath = basePath.substring(0, basePath.length() - 1);
        }
        return URI.create(basePath + path);
    }
}

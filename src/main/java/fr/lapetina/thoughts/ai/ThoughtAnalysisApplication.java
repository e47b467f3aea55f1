package fr.lapetina.thoughts.ai;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import fr.lapetina.thoughts.ai.domain.model.AnalysisRequest;
import fr.lapetina.thoughts.ai.orchestrator.OrchestrationOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Command-line entry point: analyzes one thought and prints the outcome as JSON.
 *
 * <pre>
 * java -jar thought-ai-orchestrator.jar config.yaml "I should clean up my inbox"
 * </pre>
 *
 * Exit codes: 0 on success, 2 when every backend failed, 1 on usage or startup errors.
 */
public class ThoughtAnalysisApplication implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ThoughtAnalysisApplication.class);

    static final int EXIT_OK = 0;
    static final int EXIT_STARTUP_ERROR = 1;
    static final int EXIT_ANALYSIS_FAILED = 2;

    private final OrchestratorFactory factory;
    private final ObjectMapper objectMapper;

    public ThoughtAnalysisApplication(OrchestratorFactory factory) {
        this.factory = factory;
        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .setSerializationInclusion(JsonInclude.Include.NON_NULL)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }

    /**
     * Runs one analysis through the queue and writes the JSON outcome.
     *
     * @return the process exit code
     */
    public int run(String content, long timeoutSeconds, PrintStream out) throws Exception {
        AnalysisRequest request = factory.newRequest(content);
        OrchestrationOutcome outcome = factory.getQueue()
                .submit(request)
                .get(timeoutSeconds, TimeUnit.SECONDS);
        out.println(toJson(outcome));
        return outcome.isSuccess() ? EXIT_OK : EXIT_ANALYSIS_FAILED;
    }

    String toJson(OrchestrationOutcome outcome) throws JsonProcessingException {
        Map<String, Object> document = new LinkedHashMap<>();
        document.put("correlationId", outcome.trace().correlationId());
        document.put("success", outcome.isSuccess());
        document.put("result", outcome.result());
        document.put("plan", outcome.plan());
        document.put("trace", outcome.trace().entries());
        return objectMapper.writeValueAsString(document);
    }

    @Override
    public void close() {
        factory.close();
    }

    public static void main(String[] args) {
        if (args.length < 2) {
            System.err.println("Usage: ThoughtAnalysisApplication <config.yaml> <thought text...>");
            System.exit(EXIT_STARTUP_ERROR);
        }
        String configPath = args[0];
        String content = String.join(" ", Arrays.copyOfRange(args, 1, args.length));

        int exitCode;
        try (ThoughtAnalysisApplication app =
                     new ThoughtAnalysisApplication(OrchestratorFactory.create(configPath).start())) {
            long timeoutSeconds = app.factory.getSettings().timeouts().values().stream()
                    .mapToLong(d -> d.toSeconds())
                    .sum() + app.factory.getSettings().rateLimitBackoff().toSeconds() + 5;
            exitCode = app.run(content, timeoutSeconds, System.out);
        } catch (Exception e) {
            log.error("Thought analysis failed", e);
            exitCode = EXIT_STARTUP_ERROR;
        }
        System.exit(exitCode);
    }
}

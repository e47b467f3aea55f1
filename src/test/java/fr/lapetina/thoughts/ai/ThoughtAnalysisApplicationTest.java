package fr.lapetina.thoughts.ai;

import fr.lapetina.thoughts.ai.domain.model.BackendId;
import fr.lapetina.thoughts.ai.domain.model.ErrorKind;
import fr.lapetina.thoughts.ai.integration.TestOrchestratorFactory;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;

class ThoughtAnalysisApplicationTest {

    @Test
    @DisplayName("should print the outcome and exit with success")
    void success() throws Exception {
        ByteArrayOutputStream output = new ByteArrayOutputStream();

        try (ThoughtAnalysisApplication app = new ThoughtAnalysisApplication(
                OrchestratorFactory.create("stub-config.yaml").start())) {
            int exitCode = app.run("I should tidy the garage", 5, new PrintStream(output, true, StandardCharsets.UTF_8));

            assertThat(exitCode).isEqualTo(ThoughtAnalysisApplication.EXIT_OK);
        }

        String json = output.toString(StandardCharsets.UTF_8);
        assertThat(json)
                .contains("\"success\" : true")
                .contains("Mock analysis: I should tidy the garage")
                .contains("\"decisionType\" : \"SEQUENTIAL\"")
                .contains("\"trace\"");
    }

    @Test
    @DisplayName("should exit with the failure code when every backend failed")
    void failure() throws Exception {
        TestOrchestratorFactory factory = TestOrchestratorFactory.create();
        factory.adapter(BackendId.CLAUDE).alwaysFail(ErrorKind.INVALID_INPUT);
        ByteArrayOutputStream output = new ByteArrayOutputStream();

        try (ThoughtAnalysisApplication app = new ThoughtAnalysisApplication(factory)) {
            int exitCode = app.run("x", 5, new PrintStream(output, true, StandardCharsets.UTF_8));

            assertThat(exitCode).isEqualTo(ThoughtAnalysisApplication.EXIT_ANALYSIS_FAILED);
        }

        assertThat(output.toString(StandardCharsets.UTF_8))
                .contains("\"aborted\" : true")
                .contains("INVALID_INPUT");
    }
}

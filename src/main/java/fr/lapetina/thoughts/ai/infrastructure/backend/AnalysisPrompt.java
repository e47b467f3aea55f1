package fr.lapetina.thoughts.ai.infrastructure.backend;

import fr.lapetina.thoughts.ai.domain.model.AnalysisRequest;
import fr.lapetina.thoughts.ai.domain.model.AnalysisType;

import java.util.Map;

/**
 * Prompts sent to language-model backends. All of them ask for one JSON object.
 */
public final class AnalysisPrompt {

    private static final String BASE_SYSTEM_PROMPT = """
            You are a personal knowledge assistant. You analyze short thoughts a person \
            captured during the day and help them see themes and next steps.

            Respond with a single JSON object and nothing else, using these keys:
            {
              "summary": "one or two sentences",
              "themes": ["short theme", "..."],
              "insights": ["observation", "..."],
              "suggested_tags": ["tag", "..."],
              "is_actionable": true,
              "action_suggestion": "concrete next step, only if actionable",
              "actionable_confidence": 0.0
            }
            actionable_confidence is a number between 0.0 and 1.0.""";

    private AnalysisPrompt() {
        // Utility class
    }

    public static String system(AnalysisType type) {
        return BASE_SYSTEM_PROMPT + "\n" + switch (type) {
            case QUICK -> "Be brief: a one-sentence summary, at most two themes, no insights.";
            case DEEP -> "Be thorough: look for underlying motivations, patterns and at least three insights.";
            case STANDARD -> "Keep the analysis focused and practical.";
        };
    }

    public static String user(AnalysisRequest request) {
        StringBuilder prompt = new StringBuilder();
        if (!request.context().isEmpty()) {
            prompt.append("Context about the user:\n");
            for (Map.Entry<String, Object> entry : request.context().entrySet()) {
                prompt.append("- ").append(entry.getKey()).append(": ").append(entry.getValue()).append('\n');
            }
            prompt.append('\n');
        }
        prompt.append("Thought:\n").append(request.content().strip()).append("\n\nAnalysis:");
        return prompt.toString();
    }

    /**
     * Characters both prompts add around the thought content.
     */
    public static int overheadChars(AnalysisRequest request) {
        return system(request.analysisType()).length() + user(request).length() - request.content().strip().length();
    }
}

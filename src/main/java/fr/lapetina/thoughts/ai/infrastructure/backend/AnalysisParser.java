package fr.lapetina.thoughts.ai.infrastructure.backend;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import fr.lapetina.thoughts.ai.domain.model.ThoughtAnalysis;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns the text a language model produced into a {@link ThoughtAnalysis}.
 *
 * <p>The first {@code {...}} block of the text is read as JSON. When there is none, or it
 * does not parse, the text itself becomes the summary.
 */
public final class AnalysisParser {

    private static final Logger log = LoggerFactory.getLogger(AnalysisParser.class);

    static final int FALLBACK_SUMMARY_LENGTH = 200;
    static final double DEFAULT_THEME_CONFIDENCE = 0.7;
    static final double DEFAULT_ACTION_CONFIDENCE = 0.6;

    private final ObjectMapper objectMapper;

    public AnalysisParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public ThoughtAnalysis parse(String text) {
        int start = text.indexOf('{');
        int end = text.lastIndexOf('}');
        if (start < 0 || end <= start) {
            return fallback(text);
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(text.substring(start, end + 1));
        } catch (JsonProcessingException e) {
            log.debug("Reply contains no valid JSON object, using plain text: error={}", e.getOriginalMessage());
            return fallback(text);
        }
        if (!root.isObject()) {
            return fallback(text);
        }

        String summary = root.path("summary").asText("");
        if (summary.isBlank()) {
            summary = "Analysis completed";
        }

        List<ThoughtAnalysis.Theme> themes = new ArrayList<>();
        JsonNode themesNode = root.has("themes") ? root.get("themes") : root.path("related_themes");
        for (JsonNode theme : themesNode) {
            if (theme.isTextual() && !theme.asText().isBlank()) {
                themes.add(new ThoughtAnalysis.Theme(theme.asText(), DEFAULT_THEME_CONFIDENCE));
            } else if (theme.isObject()) {
                String name = theme.has("theme") ? theme.path("theme").asText("") : theme.path("name").asText("");
                if (!name.isBlank()) {
                    themes.add(new ThoughtAnalysis.Theme(name,
                            theme.path("confidence").asDouble(DEFAULT_THEME_CONFIDENCE)));
                }
            }
        }

        boolean actionable = root.path("is_actionable").asBoolean(false);
        List<ThoughtAnalysis.SuggestedAction> actions = new ArrayList<>();
        if (actionable) {
            actions.add(new ThoughtAnalysis.SuggestedAction(
                    root.path("action_suggestion").asText("Create task"),
                    "medium",
                    DEFAULT_ACTION_CONFIDENCE));
        }

        double confidence = root.has("actionable_confidence")
                ? root.path("actionable_confidence").asDouble(0.0)
                : root.path("confidence").asDouble(0.0);

        return new ThoughtAnalysis(
                summary,
                themes,
                actions,
                texts(root.path("insights"), "insight"),
                texts(root.path("suggested_tags"), "tag"),
                actionable,
                confidence
        );
    }

    private static List<String> texts(JsonNode array, String objectField) {
        List<String> values = new ArrayList<>();
        for (JsonNode item : array) {
            String value = item.isObject() ? item.path(objectField).asText("") : item.asText("");
            if (!value.isBlank()) {
                values.add(value);
            }
        }
        return values;
    }

    private static ThoughtAnalysis fallback(String text) {
        String trimmed = text.strip();
        if (trimmed.isEmpty()) {
            return ThoughtAnalysis.summaryOnly("Analysis completed");
        }
        return ThoughtAnalysis.summaryOnly(trimmed.length() > FALLBACK_SUMMARY_LENGTH
                ? trimmed.substring(0, FALLBACK_SUMMARY_LENGTH)
                : trimmed);
    }
}

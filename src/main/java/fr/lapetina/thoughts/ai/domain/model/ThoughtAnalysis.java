package fr.lapetina.thoughts.ai.domain.model;

import java.util.List;
import java.util.Objects;

/**
 * Structured analysis of a thought as returned by a backend.
 */
public record ThoughtAnalysis(
        String summary,
        List<Theme> themes,
        List<SuggestedAction> suggestedActions,
        List<String> insights,
        List<String> suggestedTags,
        boolean actionable,
        double actionableConfidence
) {
    public ThoughtAnalysis {
        Objects.requireNonNull(summary, "Summary is required");
        themes = themes != null ? List.copyOf(themes) : List.of();
        suggestedActions = suggestedActions != null ? List.copyOf(suggestedActions) : List.of();
        insights = insights != null ? List.copyOf(insights) : List.of();
        suggestedTags = suggestedTags != null ? List.copyOf(suggestedTags) : List.of();
        actionableConfidence = clamp(actionableConfidence);
    }

    /**
     * Minimal analysis carrying only a summary, used when a reply has no structure.
     */
    public static ThoughtAnalysis summaryOnly(String summary) {
        return new ThoughtAnalysis(summary, null, null, null, null, false, 0.0);
    }

    public record Theme(String theme, double confidence) {
        public Theme {
            Objects.requireNonNull(theme, "Theme is required");
            confidence = clamp(confidence);
        }
    }

    public record SuggestedAction(String action, String priority, double confidence) {
        public SuggestedAction {
            Objects.requireNonNull(action, "Action is required");
            if (priority == null) {
                priority = "medium";
            }
            confidence = clamp(confidence);
        }
    }

    static double clamp(double value) {
        if (Double.isNaN(value)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, value));
    }
}

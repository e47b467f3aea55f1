package fr.lapetina.thoughts.ai.domain.model;

/**
 * Depth of analysis requested for a thought.
 */
public enum AnalysisType {
    STANDARD,
    DEEP,
    QUICK
}

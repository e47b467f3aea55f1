package fr.lapetina.thoughts.ai.domain.selection;

/**
 * How the candidates of a plan are meant to be executed.
 */
public enum DecisionType {
    /** One candidate at a time, in plan order */
    SEQUENTIAL
}

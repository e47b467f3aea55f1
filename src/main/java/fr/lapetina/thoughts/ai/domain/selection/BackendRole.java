package fr.lapetina.thoughts.ai.domain.selection;

/**
 * Role of a backend inside a plan.
 */
public enum BackendRole {
    PRIMARY,
    FALLBACK,
    /** Reserved for a future parallel strategy; never produced today */
    PARALLEL
}

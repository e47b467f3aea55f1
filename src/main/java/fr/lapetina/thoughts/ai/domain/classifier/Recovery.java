package fr.lapetina.thoughts.ai.domain.classifier;

/**
 * What the orchestrator does after a failed attempt.
 */
public enum Recovery {
    /** Wait the rate-limit backoff window, then try the same backend once more */
    RETRY_SAME_AFTER_BACKOFF,

    /** Move on to the next backend of the plan */
    TRY_NEXT,

    /** Move on to the next backend, but only the first time this kind occurs in a request */
    TRY_NEXT_ONCE,

    /** Stop; no other backend can succeed */
    ABORT
}

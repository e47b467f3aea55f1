package fr.lapetina.thoughts.ai.domain.model;

/**
 * States of a single request walking through its backend plan.
 */
public enum ExecutionState {
    /** Plan obtained, no attempt made yet */
    NOT_STARTED,

    /** An adapter call is in flight; logged when the call starts, never the action of a trace entry */
    TRYING,

    /** An attempt produced a result; terminal */
    SUCCESS,

    /** Rate limited; the same candidate is tried again after the backoff window */
    RETRY_SAME_ONCE,

    /** Recoverable failure; moving to the next candidate of the plan */
    NEXT_CANDIDATE,

    /** Non-recoverable failure; remaining candidates are skipped; terminal */
    ABORTED,

    /** Every candidate failed; terminal */
    ALL_FAILED,

    /** The caller cancelled the request; terminal */
    CANCELLED;

    public boolean isTerminal() {
        return this == SUCCESS || this == ABORTED || this == ALL_FAILED || this == CANCELLED;
    }
}

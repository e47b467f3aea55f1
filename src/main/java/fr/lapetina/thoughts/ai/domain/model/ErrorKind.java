package fr.lapetina.thoughts.ai.domain.model;

/**
 * Error taxonomy for backend analysis attempts.
 * Every provider fault is mapped to exactly one of these kinds.
 */
public enum ErrorKind {
    /** The backend did not answer within the attempt timeout */
    TIMEOUT(true),

    /** The provider asked us to slow down (HTTP 429 or equivalent) */
    RATE_LIMITED(true),

    /** Backend unreachable, misconfigured, or refusing service */
    UNAVAILABLE(true),

    /** The request itself is unacceptable; no backend will accept it */
    INVALID_INPUT(false),

    /** The content does not fit the backend's context window */
    CONTEXT_OVERFLOW(false),

    /** Unexpected failure on the provider side or inside the adapter */
    INTERNAL_ERROR(true),

    /** The provider answered but the reply could not be read */
    MALFORMED_RESPONSE(true);

    private final boolean recoverable;

    ErrorKind(boolean recoverable) {
        this.recoverable = recoverable;
    }

    /**
     * Returns whether trying again (same or another backend) can possibly succeed.
     * INTERNAL_ERROR and MALFORMED_RESPONSE are recoverable at most once per request.
     */
    public boolean isRecoverable() {
        return recoverable;
    }
}

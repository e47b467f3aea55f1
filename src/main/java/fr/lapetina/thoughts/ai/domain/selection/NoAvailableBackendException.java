package fr.lapetina.thoughts.ai.domain.selection;

/**
 * Thrown when none of the configured backends is available for a request.
 */
public final class NoAvailableBackendException extends RuntimeException {

    public NoAvailableBackendException(String message) {
        super(message);
    }
}

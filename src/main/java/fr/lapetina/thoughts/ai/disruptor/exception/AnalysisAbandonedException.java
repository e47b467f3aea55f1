package fr.lapetina.thoughts.ai.disruptor.exception;

/**
 * Completes the future of a queued analysis that was still pending when the queue
 * stopped. Abandoned analyses are not retried or persisted.
 */
public final class AnalysisAbandonedException extends RuntimeException {

    private final String correlationId;

    public AnalysisAbandonedException(String correlationId, String message) {
        super(message);
        this.correlationId = correlationId;
    }

    public String getCorrelationId() {
        return correlationId;
    }
}

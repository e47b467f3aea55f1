package fr.lapetina.thoughts.ai.domain.model;

import java.util.concurrent.CancellationException;

/**
 * Thrown when the thread running an analysis is interrupted.
 * The interrupt flag is restored before this is thrown.
 */
public final class AnalysisCancelledException extends CancellationException {

    private final String correlationId;

    public AnalysisCancelledException(String correlationId, String message) {
        super(message);
        this.correlationId = correlationId;
    }

    public String getCorrelationId() {
        return correlationId;
    }
}

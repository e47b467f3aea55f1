package fr.lapetina.thoughts.ai.disruptor.exception;

/**
 * Thrown by the analysis queue when its ring buffer has no free slot.
 * The request was never enqueued and may be resubmitted later.
 */
public final class BackpressureException extends RuntimeException {

    private final String correlationId;
    private final int capacity;

    public BackpressureException(String correlationId, int capacity) {
        super("Analysis queue full (capacity " + capacity + "), rejected correlationId=" + correlationId);
        this.correlationId = correlationId;
        this.capacity = capacity;
    }

    public String getCorrelationId() {
        return correlationId;
    }

    public int getCapacity() {
        return capacity;
    }
}

package fr.lapetina.thoughts.ai.domain.event;

/**
 * Event object for the LMAX Disruptor ring buffer.
 *
 * This is a mutable holder that gets reused across the ring buffer. It carries a
 * reference to the task only between publication and the worker picking it up.
 */
public final class AnalysisTaskEvent {

    private AnalysisTask task;
    private long sequence = -1;

    /**
     * Clears the event for reuse.
     */
    public void clear() {
        this.task = null;
        this.sequence = -1;
    }

    public void initialize(AnalysisTask task, long sequence) {
        clear();
        this.task = task;
        this.sequence = sequence;
    }

    public AnalysisTask getTask() {
        return task;
    }

    public long getSequence() {
        return sequence;
    }

    @Override
    public String toString() {
        return "AnalysisTaskEvent{task=" + task + ", seq=" + sequence + '}';
    }
}

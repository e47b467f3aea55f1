package fr.lapetina.thoughts.ai.domain.event;

import com.lmax.disruptor.EventFactory;

/**
 * Pre-allocates ring buffer slots.
 */
public final class AnalysisTaskEventFactory implements EventFactory<AnalysisTaskEvent> {

    @Override
    public AnalysisTaskEvent newInstance() {
        return new AnalysisTaskEvent();
    }
}

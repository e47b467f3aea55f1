package fr.lapetina.thoughts.ai.disruptor;

import com.lmax.disruptor.WorkHandler;
import fr.lapetina.thoughts.ai.domain.event.AnalysisTask;
import fr.lapetina.thoughts.ai.domain.event.AnalysisTaskEvent;
import fr.lapetina.thoughts.ai.domain.model.AnalysisCancelledException;
import fr.lapetina.thoughts.ai.orchestrator.BackendOrchestrator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.time.Duration;
import java.time.Instant;

/**
 * Worker of the analysis queue. Each event is taken by exactly one worker, which runs
 * the whole orchestration for it on its own thread.
 */
public final class AnalysisWorkHandler implements WorkHandler<AnalysisTaskEvent> {

    private static final Logger log = LoggerFactory.getLogger(AnalysisWorkHandler.class);

    private final BackendOrchestrator orchestrator;

    public AnalysisWorkHandler(BackendOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    @Override
    public void onEvent(AnalysisTaskEvent event) {
        AnalysisTask task = event.getTask();
        long sequence = event.getSequence();
        event.clear();

        if (task == null) {
            return;
        }
        if (!task.start()) {
            log.debug("Skipping completed task: correlationId={}, sequence={}",
                    task.getRequest().correlationId(), sequence);
            return;
        }

        MDC.put("correlationId", task.getRequest().correlationId());
        try {
            log.debug("Task picked up: correlationId={}, sequence={}, queuedMs={}",
                    task.getRequest().correlationId(), sequence,
                    Duration.between(task.getAcceptedAt(), Instant.now()).toMillis());
            task.getFuture().complete(orchestrator.analyze(task.getRequest()));
        } catch (AnalysisCancelledException e) {
            task.getFuture().completeExceptionally(e);
        } catch (RuntimeException e) {
            log.error("Analysis failed with an exception: correlationId={}, sequence={}",
                    task.getRequest().correlationId(), sequence, e);
            task.getFuture().completeExceptionally(e);
        } finally {
            task.finish();
            MDC.remove("correlationId");
        }
    }
}

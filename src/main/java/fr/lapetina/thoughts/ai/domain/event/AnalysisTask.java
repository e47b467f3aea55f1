package fr.lapetina.thoughts.ai.domain.event;

import fr.lapetina.thoughts.ai.domain.model.AnalysisRequest;
import fr.lapetina.thoughts.ai.orchestrator.OrchestrationOutcome;

import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * A request accepted by the analysis queue, together with the future handed to its caller.
 *
 * <p>Tracks which worker thread is running it so that cancelling the future interrupts
 * exactly that run and nothing else.
 */
public final class AnalysisTask {

    private final AnalysisRequest request;
    private final CompletableFuture<OrchestrationOutcome> future;
    private final Instant acceptedAt;

    // Guarded by this
    private Thread runner;

    public AnalysisTask(AnalysisRequest request, CompletableFuture<OrchestrationOutcome> future) {
        this.request = Objects.requireNonNull(request, "Request is required");
        this.future = Objects.requireNonNull(future, "Future is required");
        this.acceptedAt = Instant.now();
    }

    public AnalysisRequest getRequest() {
        return request;
    }

    public CompletableFuture<OrchestrationOutcome> getFuture() {
        return future;
    }

    public Instant getAcceptedAt() {
        return acceptedAt;
    }

    /**
     * Binds the task to the current thread.
     *
     * @return false if the task was already completed (cancelled or abandoned) and must not run
     */
    public synchronized boolean start() {
        if (future.isDone()) {
            return false;
        }
        runner = Thread.currentThread();
        return true;
    }

    /**
     * Unbinds the task from the current thread and clears any interrupt aimed at it.
     */
    public synchronized void finish() {
        if (runner == Thread.currentThread()) {
            runner = null;
            // A cancel that raced with completion must not leak into the next task
            Thread.interrupted();
        }
    }

    /**
     * Interrupts the thread currently running this task, if any.
     */
    public synchronized void interruptRunner() {
        if (runner != null) {
            runner.interrupt();
        }
    }

    @Override
    public String toString() {
        return "AnalysisTask{correlationId=" + request.correlationId() + ", acceptedAt=" + acceptedAt
                + ", done=" + future.isDone() + '}';
    }
}

package fr.lapetina.thoughts.ai.disruptor;

import com.lmax.disruptor.BlockingWaitStrategy;
import com.lmax.disruptor.BusySpinWaitStrategy;
import com.lmax.disruptor.ExceptionHandler;
import com.lmax.disruptor.InsufficientCapacityException;
import com.lmax.disruptor.RingBuffer;
import com.lmax.disruptor.SleepingWaitStrategy;
import com.lmax.disruptor.TimeoutException;
import com.lmax.disruptor.WaitStrategy;
import com.lmax.disruptor.YieldingWaitStrategy;
import com.lmax.disruptor.dsl.Disruptor;
import com.lmax.disruptor.dsl.ProducerType;
import fr.lapetina.thoughts.ai.disruptor.exception.AnalysisAbandonedException;
import fr.lapetina.thoughts.ai.disruptor.exception.BackpressureException;
import fr.lapetina.thoughts.ai.domain.event.AnalysisTask;
import fr.lapetina.thoughts.ai.domain.event.AnalysisTaskEvent;
import fr.lapetina.thoughts.ai.domain.event.AnalysisTaskEventFactory;
import fr.lapetina.thoughts.ai.domain.model.AnalysisRequest;
import fr.lapetina.thoughts.ai.infrastructure.config.OrchestrationSettings;
import fr.lapetina.thoughts.ai.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.thoughts.ai.orchestrator.BackendOrchestrator;
import fr.lapetina.thoughts.ai.orchestrator.OrchestrationOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Bounded queue of analyses backed by an LMAX Disruptor ring buffer.
 *
 * <p>Producers publish and return at once with a future; a fixed pool of workers takes
 * events off the ring buffer, each running one orchestration at a time.
 *
 * <p>PRODUCER TYPE: MULTI, any caller thread may submit.
 *
 * <p>BACKPRESSURE: the ring buffer never grows. When it is full, {@link #submit} throws
 * {@link BackpressureException} instead of blocking the caller.
 *
 * <p>SHUTDOWN POLICY: {@link #close()} stops accepting work, then lets the workers drain
 * the ring buffer for at most the configured timeout. If the drain does not finish, every
 * future still pending completes with {@link AnalysisAbandonedException}, the workers are
 * halted, and those still running an orchestration are interrupted. Each abandoned
 * analysis is logged. Nothing is retried or persisted across restarts.
 *
 * <p>CANCELLATION: cancelling a returned future interrupts the worker running it, which
 * cancels the in-flight adapter call or backoff and prevents further retries.
 */
public final class AnalysisQueue implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(AnalysisQueue.class);

    private final Disruptor<AnalysisTaskEvent> disruptor;
    private final RingBuffer<AnalysisTaskEvent> ringBuffer;
    private final MetricsRegistry metrics;
    private final Duration shutdownTimeout;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final Set<AnalysisTask> pending = ConcurrentHashMap.newKeySet();

    private AnalysisQueue(Builder builder) {
        this.metrics = builder.metrics;
        this.shutdownTimeout = builder.shutdownTimeout;

        this.disruptor = new Disruptor<>(
                new AnalysisTaskEventFactory(),
                builder.ringBufferSize,
                new WorkerThreadFactory("analysis-worker"),
                ProducerType.MULTI,
                createWaitStrategy(builder.waitStrategy)
        );

        AnalysisWorkHandler[] workers = new AnalysisWorkHandler[builder.workers];
        for (int i = 0; i < workers.length; i++) {
            workers[i] = new AnalysisWorkHandler(builder.orchestrator);
        }
        disruptor.handleEventsWithWorkerPool(workers);
        disruptor.setDefaultExceptionHandler(new QueueExceptionHandler());

        this.ringBuffer = disruptor.getRingBuffer();

        log.info("AnalysisQueue created: ringBufferSize={}, workers={}, waitStrategy={}, shutdownTimeoutMs={}",
                builder.ringBufferSize, builder.workers, builder.waitStrategy, shutdownTimeout.toMillis());
    }

    /**
     * Starts the workers. Has no effect once the queue was closed.
     */
    public AnalysisQueue start() {
        if (!closed.get() && running.compareAndSet(false, true)) {
            disruptor.start();
            updateGauges();
            log.info("AnalysisQueue started");
        }
        return this;
    }

    /**
     * Enqueues an analysis.
     *
     * @param request the request
     * @return future completing with the outcome; completes exceptionally with
     *         {@link IllegalStateException} if the queue is not running
     * @throws BackpressureException if the ring buffer is full
     */
    public CompletableFuture<OrchestrationOutcome> submit(AnalysisRequest request) {
        if (!running.get()) {
            return CompletableFuture.failedFuture(new IllegalStateException("Analysis queue not running"));
        }

        long sequence;
        try {
            sequence = ringBuffer.tryNext();
        } catch (InsufficientCapacityException e) {
            log.warn("Analysis rejected, queue full: correlationId={}, capacity={}",
                    request.correlationId(), ringBuffer.getBufferSize());
            throw new BackpressureException(request.correlationId(), ringBuffer.getBufferSize());
        }

        CompletableFuture<OrchestrationOutcome> future = new CompletableFuture<>();
        AnalysisTask task = new AnalysisTask(request, future);
        pending.add(task);
        future.whenComplete((outcome, ex) -> {
            if (future.isCancelled()) {
                log.info("Analysis cancelled by caller: correlationId={}", request.correlationId());
                task.interruptRunner();
            }
            pending.remove(task);
            updateGauges();
        });

        try {
            ringBuffer.get(sequence).initialize(task, sequence);
        } finally {
            ringBuffer.publish(sequence);
        }

        // Lost the race with close(): the task will not run
        if (!running.get()) {
            abandon(task, "Analysis queue closed while submitting");
        }

        log.debug("Analysis submitted: correlationId={}, sequence={}", request.correlationId(), sequence);
        updateGauges();
        return future;
    }

    public long getRemainingCapacity() {
        return ringBuffer.remainingCapacity();
    }

    public int getPendingCount() {
        return pending.size();
    }

    public boolean isRunning() {
        return running.get();
    }

    /**
     * Stops accepting work, drains for at most the shutdown timeout, then halts and
     * abandons whatever is left.
     */
    @Override
    public void close() {
        closed.set(true);
        if (!running.compareAndSet(true, false)) {
            return;
        }
        log.info("Shutting down AnalysisQueue: pending={}", pending.size());
        try {
            disruptor.shutdown(shutdownTimeout.toMillis(), TimeUnit.MILLISECONDS);
            log.info("AnalysisQueue drained and shut down");
        } catch (TimeoutException e) {
            log.warn("AnalysisQueue drain timed out after {}ms, halting: pending={}",
                    shutdownTimeout.toMillis(), pending.size());
            // Complete every future before any worker is freed, so none starts another task
            List<AnalysisTask> unfinished = new ArrayList<>(pending);
            unfinished.forEach(task -> abandon(task, "Analysis queue shut down before the analysis completed"));
            disruptor.halt();
            unfinished.forEach(AnalysisTask::interruptRunner);
        }
        for (AnalysisTask task : pending) {
            abandon(task, "Analysis queue shut down before the analysis completed");
        }
    }

    private void abandon(AnalysisTask task, String reason) {
        String correlationId = task.getRequest().correlationId();
        if (task.getFuture().completeExceptionally(new AnalysisAbandonedException(correlationId, reason))) {
            log.warn("Analysis abandoned: correlationId={}, acceptedAt={}, reason={}",
                    correlationId, task.getAcceptedAt(), reason);
        }
    }

    private void updateGauges() {
        metrics.setQueueRemaining(ringBuffer.remainingCapacity());
        metrics.setQueueInFlight(pending.size());
    }

    private WaitStrategy createWaitStrategy(String name) {
        return switch (name.toLowerCase()) {
            case "blocking" -> new BlockingWaitStrategy();
            case "yielding" -> new YieldingWaitStrategy();
            case "busy-spin" -> new BusySpinWaitStrategy();
            case "sleeping" -> new SleepingWaitStrategy();
            default -> {
                log.warn("Unknown wait strategy '{}', using BlockingWaitStrategy", name);
                yield new BlockingWaitStrategy();
            }
        };
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Thread factory for queue workers.
     */
    private static class WorkerThreadFactory implements ThreadFactory {
        private final String namePrefix;
        private final AtomicInteger counter = new AtomicInteger(0);

        WorkerThreadFactory(String namePrefix) {
            this.namePrefix = namePrefix;
        }

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, namePrefix + "-" + counter.getAndIncrement());
            t.setDaemon(false);
            return t;
        }
    }

    /**
     * Exception handler for the Disruptor.
     */
    private static class QueueExceptionHandler implements ExceptionHandler<AnalysisTaskEvent> {

        private static final Logger log = LoggerFactory.getLogger(QueueExceptionHandler.class);

        @Override
        public void handleEventException(Throwable ex, long sequence, AnalysisTaskEvent event) {
            log.error("Exception in analysis worker: sequence={}, event={}", sequence, event, ex);

            AnalysisTask task = event != null ? event.getTask() : null;
            if (task != null && !task.getFuture().isDone()) {
                task.getFuture().completeExceptionally(ex);
            }
        }

        @Override
        public void handleOnStartException(Throwable ex) {
            log.error("Exception during Disruptor start", ex);
        }

        @Override
        public void handleOnShutdownException(Throwable ex) {
            log.error("Exception during Disruptor shutdown", ex);
        }
    }

    /**
     * Builder for AnalysisQueue.
     */
    public static final class Builder {
        private int ringBufferSize = 1024;
        private int workers = 4;
        private String waitStrategy = "blocking";
        private Duration shutdownTimeout = Duration.ofSeconds(10);
        private BackendOrchestrator orchestrator;
        private MetricsRegistry metrics;

        public Builder ringBufferSize(int size) {
            // Must be power of 2
            if (Integer.bitCount(size) != 1) {
                throw new IllegalArgumentException("Ring buffer size must be power of 2");
            }
            this.ringBufferSize = size;
            return this;
        }

        public Builder workers(int workers) {
            if (workers < 1) {
                throw new IllegalArgumentException("At least one worker is required");
            }
            this.workers = workers;
            return this;
        }

        public Builder waitStrategy(String strategy) {
            this.waitStrategy = strategy;
            return this;
        }

        public Builder shutdownTimeout(Duration timeout) {
            this.shutdownTimeout = timeout;
            return this;
        }

        public Builder orchestrator(BackendOrchestrator orchestrator) {
            this.orchestrator = orchestrator;
            return this;
        }

        public Builder metrics(MetricsRegistry metrics) {
            this.metrics = metrics;
            return this;
        }

        public Builder fromSettings(OrchestrationSettings settings) {
            OrchestrationSettings.QueueSettings queue = settings.queue();
            this.ringBufferSize = queue.ringBufferSize();
            this.workers = queue.workers();
            this.waitStrategy = queue.waitStrategy();
            this.shutdownTimeout = queue.shutdownTimeout();
            return this;
        }

        public AnalysisQueue build() {
            if (orchestrator == null) {
                throw new IllegalStateException("BackendOrchestrator is required");
            }
            if (metrics == null) {
                throw new IllegalStateException("MetricsRegistry is required");
            }
            return new AnalysisQueue(this);
        }
    }
}

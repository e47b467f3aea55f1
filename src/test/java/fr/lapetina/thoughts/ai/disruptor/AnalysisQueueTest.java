package fr.lapetina.thoughts.ai.disruptor;

import fr.lapetina.thoughts.ai.disruptor.exception.AnalysisAbandonedException;
import fr.lapetina.thoughts.ai.disruptor.exception.BackpressureException;
import fr.lapetina.thoughts.ai.domain.model.AnalysisRequest;
import fr.lapetina.thoughts.ai.domain.model.BackendId;
import fr.lapetina.thoughts.ai.domain.model.ErrorKind;
import fr.lapetina.thoughts.ai.domain.selection.SequentialSelector;
import fr.lapetina.thoughts.ai.infrastructure.backend.BackendRegistry;
import fr.lapetina.thoughts.ai.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.thoughts.ai.orchestrator.BackendOrchestrator;
import fr.lapetina.thoughts.ai.orchestrator.OrchestrationOutcome;
import fr.lapetina.thoughts.ai.orchestrator.ScriptedAdapter;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AnalysisQueueTest {

    private ScriptedAdapter claude;
    private ScriptedAdapter ollama;
    private MetricsRegistry metrics;
    private BackendOrchestrator orchestrator;
    private AnalysisQueue queue;

    @BeforeEach
    void setUp() {
        claude = new ScriptedAdapter(BackendId.CLAUDE);
        ollama = new ScriptedAdapter(BackendId.OLLAMA);
        metrics = new MetricsRegistry("queue_test");
        orchestrator = BackendOrchestrator.builder()
                .selector(new SequentialSelector(BackendId.CLAUDE, BackendId.OLLAMA, Map.of(
                        BackendId.CLAUDE, Duration.ofSeconds(30),
                        BackendId.OLLAMA, Duration.ofSeconds(30))))
                .registry(new BackendRegistry(List.of(claude, ollama)))
                .metrics(metrics)
                .rateLimitBackoff(Duration.ofMillis(50))
                .adapterThreads(4)
                .build();
    }

    @AfterEach
    void tearDown() {
        if (queue != null) {
            queue.close();
        }
        orchestrator.close();
        metrics.close();
    }

    private AnalysisQueue queue(int ringBufferSize, int workers, Duration shutdownTimeout) {
        queue = AnalysisQueue.builder()
                .ringBufferSize(ringBufferSize)
                .workers(workers)
                .shutdownTimeout(shutdownTimeout)
                .orchestrator(orchestrator)
                .metrics(metrics)
                .build()
                .start();
        return queue;
    }

    private static AnalysisRequest request(String content) {
        return AnalysisRequest.of(content, EnumSet.of(BackendId.CLAUDE, BackendId.OLLAMA));
    }

    @Test
    @DisplayName("should complete every submitted analysis")
    void processesRequests() throws Exception {
        queue(8, 2, Duration.ofSeconds(5));
        claude.thenFail(ErrorKind.UNAVAILABLE);

        List<CompletableFuture<OrchestrationOutcome>> futures = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            futures.add(queue.submit(request("thought " + i)));
        }

        for (CompletableFuture<OrchestrationOutcome> future : futures) {
            assertThat(future.get(5, TimeUnit.SECONDS).isSuccess()).isTrue();
        }
        assertThat(claude.invocations()).isEqualTo(5);
        assertThat(ollama.invocations()).isEqualTo(1);
        assertThat(queue.getPendingCount()).isZero();
    }

    @Test
    @DisplayName("should reject work when the ring buffer is full")
    void backpressure() throws Exception {
        queue(2, 1, Duration.ofMillis(200));
        claude.alwaysBlock(Duration.ofSeconds(10));

        queue.submit(request("first"));
        queue.submit(request("second"));

        assertThat(queue.getRemainingCapacity()).isZero();
        assertThatThrownBy(() -> queue.submit(request("third")))
                .isInstanceOf(BackpressureException.class)
                .extracting(e -> ((BackpressureException) e).getCapacity())
                .isEqualTo(2);
    }

    @Test
    @DisplayName("should fail submissions when not running")
    void notRunning() {
        queue = AnalysisQueue.builder().orchestrator(orchestrator).metrics(metrics).build();

        CompletableFuture<OrchestrationOutcome> future = queue.submit(request("x"));

        assertThat(future).isCompletedExceptionally();
        assertThatThrownBy(future::join).hasCauseInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("should interrupt the worker when the caller cancels")
    void callerCancellation() throws Exception {
        queue(4, 1, Duration.ofSeconds(5));
        claude.thenBlock(Duration.ofSeconds(10));

        CompletableFuture<OrchestrationOutcome> slow = queue.submit(request("slow"));
        assertThat(claude.awaitFirstCall(2, TimeUnit.SECONDS)).isTrue();
        slow.cancel(true);

        // The single worker is free again once the cancelled run has stopped
        OrchestrationOutcome next = queue.submit(request("next")).get(3, TimeUnit.SECONDS);

        assertThat(next.isSuccess()).isTrue();
        assertThatThrownBy(slow::join).isInstanceOf(CancellationException.class);
        assertThat(ollama.invocations()).isZero();
    }

    @Test
    @DisplayName("should drain queued work on close")
    void drainsOnClose() throws Exception {
        queue(4, 1, Duration.ofSeconds(5));
        claude.thenBlock(Duration.ofMillis(200));

        CompletableFuture<OrchestrationOutcome> first = queue.submit(request("first"));
        CompletableFuture<OrchestrationOutcome> second = queue.submit(request("second"));
        queue.close();

        assertThat(first.get(1, TimeUnit.SECONDS).isSuccess()).isTrue();
        assertThat(second.get(1, TimeUnit.SECONDS).isSuccess()).isTrue();
        assertThat(queue.isRunning()).isFalse();
    }

    @Test
    @DisplayName("should abandon what is left when the drain times out")
    void abandonsOnTimeout() throws Exception {
        queue(4, 1, Duration.ofMillis(200));
        claude.alwaysBlock(Duration.ofSeconds(10));

        CompletableFuture<OrchestrationOutcome> running = queue.submit(request("running"));
        CompletableFuture<OrchestrationOutcome> queued = queue.submit(request("queued"));
        assertThat(claude.awaitFirstCall(2, TimeUnit.SECONDS)).isTrue();

        long start = System.nanoTime();
        queue.close();
        assertThat(Duration.ofNanos(System.nanoTime() - start)).isLessThan(Duration.ofSeconds(3));

        assertThatThrownBy(() -> queued.get(1, TimeUnit.SECONDS))
                .isInstanceOf(ExecutionException.class)
                .hasCauseInstanceOf(AnalysisAbandonedException.class);
        assertThatThrownBy(() -> running.get(1, TimeUnit.SECONDS))
                .isInstanceOf(ExecutionException.class)
                .hasCauseInstanceOf(AnalysisAbandonedException.class);
        assertThat(claude.invocations()).isEqualTo(1);
    }

    @Test
    @DisplayName("should refuse work after close and not restart")
    void closedQueue() {
        queue(4, 1, Duration.ofSeconds(1));
        queue.close();
        queue.start();

        assertThat(queue.isRunning()).isFalse();
        assertThat(queue.submit(request("late"))).isCompletedExceptionally();
    }
}

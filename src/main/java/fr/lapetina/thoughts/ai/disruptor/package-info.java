/**
 * Bounded asynchronous execution of analyses on an LMAX Disruptor ring buffer.
 *
 * <p>{@link fr.lapetina.thoughts.ai.disruptor.AnalysisQueue} replaces fire-and-forget
 * background work: capacity is fixed, rejection is explicit
 * ({@link fr.lapetina.thoughts.ai.disruptor.exception.BackpressureException}) and so is
 * the fate of work left at shutdown
 * ({@link fr.lapetina.thoughts.ai.disruptor.exception.AnalysisAbandonedException}).
 *
 * <h2>Example</h2>
 * <pre>{@code
 * CompletableFuture<OrchestrationOutcome> future = queue.submit(request);
 * OrchestrationOutcome outcome = future.get(30, TimeUnit.SECONDS);
 * }</pre>
 */
package fr.lapetina.thoughts.ai.disruptor;

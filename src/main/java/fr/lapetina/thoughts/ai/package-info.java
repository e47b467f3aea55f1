/**
 * Thought AI Orchestrator - decides which reasoning backend analyzes a captured thought,
 * and recovers when one fails.
 *
 * <h2>Key Components</h2>
 * <ul>
 *   <li>{@link fr.lapetina.thoughts.ai.OrchestratorFactory} - wires settings, adapters, selector,
 *       orchestrator and queue from one YAML file</li>
 *   <li>{@link fr.lapetina.thoughts.ai.orchestrator.BackendOrchestrator} - runs a plan with timeout,
 *       rate-limit retry and fast-fail semantics</li>
 *   <li>{@link fr.lapetina.thoughts.ai.disruptor.AnalysisQueue} - bounded asynchronous execution</li>
 *   <li>{@link fr.lapetina.thoughts.ai.ThoughtAnalysisApplication} - command-line entry point</li>
 * </ul>
 *
 * <h2>Quick Start</h2>
 * <pre>{@code
 * try (OrchestratorFactory factory = OrchestratorFactory.create("config.yaml").start()) {
 *     AnalysisRequest request = factory.newRequest("I need to optimize my email workflow");
 *     OrchestrationOutcome outcome = factory.getQueue().submit(request).get();
 *     outcome.success().ifPresent(s -> System.out.println(s.analysis().summary()));
 * }
 * }</pre>
 *
 * @see fr.lapetina.thoughts.ai.OrchestratorFactory
 * @see fr.lapetina.thoughts.ai.orchestrator.BackendOrchestrator
 */
package fr.lapetina.thoughts.ai;

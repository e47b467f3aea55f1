/**
 * Value types exchanged between the selector, the orchestrator and the backend adapters.
 *
 * <p>Everything here is created per request and discarded once the caller has consumed
 * the result. Requests, results and analyses are records holding defensive copies.
 *
 * <h2>Key Classes</h2>
 * <ul>
 *   <li>{@link fr.lapetina.thoughts.ai.domain.model.AnalysisRequest} - one thought to analyze</li>
 *   <li>{@link fr.lapetina.thoughts.ai.domain.model.AnalysisResult} - success or failure of an attempt</li>
 *   <li>{@link fr.lapetina.thoughts.ai.domain.model.AggregateFailure} - all failed attempts of a request</li>
 *   <li>{@link fr.lapetina.thoughts.ai.domain.model.ErrorKind} - fixed error taxonomy</li>
 *   <li>{@link fr.lapetina.thoughts.ai.domain.model.BackendId} - closed set of backends</li>
 * </ul>
 */
package fr.lapetina.thoughts.ai.domain.model;

/**
 * Backend orchestration: runs a selector's plan with fallback, one rate-limit retry and
 * fast-fail on non-recoverable errors.
 *
 * <h2>Recovery per error kind</h2>
 * <table>
 *   <caption>Orchestrator reaction</caption>
 *   <tr><th>Error kind</th><th>Reaction</th></tr>
 *   <tr><td>TIMEOUT, UNAVAILABLE</td><td>next candidate</td></tr>
 *   <tr><td>RATE_LIMITED</td><td>wait the backoff window, retry the same backend once</td></tr>
 *   <tr><td>INTERNAL_ERROR, MALFORMED_RESPONSE</td><td>next candidate, at most once per request; a repeat on the last candidate is all failed</td></tr>
 *   <tr><td>INVALID_INPUT, CONTEXT_OVERFLOW</td><td>abort</td></tr>
 * </table>
 *
 * <p>Every transition is appended to a {@link fr.lapetina.thoughts.ai.orchestrator.DecisionTrace}
 * and logged with the request's correlation id.
 */
package fr.lapetina.thoughts.ai.orchestrator;

/**
 * Backend selection: turns a request into an ordered {@link fr.lapetina.thoughts.ai.domain.selection.Plan}.
 *
 * <p>Selectors are pure and thread-safe. The only strategy today is {@code sequential}
 * (configured primary, then configured secondary); other names are rejected when the
 * configuration is loaded.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * BackendSelector selector = SelectorFactory.create(
 *         SelectionStrategy.SEQUENTIAL, BackendId.CLAUDE, BackendId.OLLAMA, Map.of());
 * Plan plan = selector.select(request);
 * }</pre>
 */
package fr.lapetina.thoughts.ai.domain.selection;

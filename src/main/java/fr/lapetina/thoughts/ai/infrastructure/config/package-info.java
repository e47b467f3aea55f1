/**
 * Startup configuration.
 *
 * <p>{@link fr.lapetina.thoughts.ai.infrastructure.config.ConfigLoader} binds the YAML file to
 * {@link fr.lapetina.thoughts.ai.infrastructure.config.OrchestratorConfig} with SnakeYAML, then
 * {@link fr.lapetina.thoughts.ai.infrastructure.config.OrchestrationSettings#from} validates it
 * and produces the immutable settings passed to every component constructor.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * selection:
 *   availableBackends: [claude, ollama]
 *   primaryBackend: claude
 *   secondaryBackend: ollama
 *   strategy: sequential
 * backends:
 *   - id: claude
 *     apiKeyEnv: ANTHROPIC_API_KEY
 *   - id: ollama
 *     endpoint: http://localhost:11434
 *     model: gemma3:27b
 * }</pre>
 */
package fr.lapetina.thoughts.ai.infrastructure.config;

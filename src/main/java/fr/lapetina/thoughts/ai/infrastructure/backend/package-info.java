/**
 * Backend adapters: one per {@link fr.lapetina.thoughts.ai.domain.model.BackendId}.
 *
 * <p>HTTP adapters share {@link fr.lapetina.thoughts.ai.infrastructure.backend.HttpBackendAdapter},
 * which enforces the attempt deadline and maps HTTP statuses and transport exceptions to
 * error kinds. {@link fr.lapetina.thoughts.ai.infrastructure.backend.StubAdapter} performs no I/O.
 *
 * <table border="1">
 *   <tr><th>Backend</th><th>Adapter</th><th>Endpoint</th></tr>
 *   <tr><td>{@code claude}</td><td>ClaudeAdapter</td><td>Anthropic Messages API</td></tr>
 *   <tr><td>{@code ollama}</td><td>OllamaAdapter</td><td>{@code /api/chat}</td></tr>
 *   <tr><td>{@code openai}</td><td>OpenAiCompatibleAdapter</td><td>{@code /chat/completions}</td></tr>
 *   <tr><td>{@code stub}</td><td>StubAdapter</td><td>none</td></tr>
 * </table>
 */
package fr.lapetina.thoughts.ai.infrastructure.backend;

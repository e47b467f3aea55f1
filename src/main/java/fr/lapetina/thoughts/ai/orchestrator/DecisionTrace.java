package fr.lapetina.thoughts.ai.orchestrator;

import fr.lapetina.thoughts.ai.domain.model.BackendId;
import fr.lapetina.thoughts.ai.domain.model.ExecutionState;
import fr.lapetina.thoughts.ai.domain.selection.BackendChoice;
import fr.lapetina.thoughts.ai.domain.selection.BackendRole;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Ordered record of every decision taken for one request.
 *
 * <p>Owned by the single thread orchestrating the request; each entry is logged as it
 * is appended.
 */
public final class DecisionTrace {

    private static final Logger log = LoggerFactory.getLogger(DecisionTrace.class);

    private final String correlationId;
    private final List<Entry> entries = new ArrayList<>();
    private int attempts;
    private ExecutionState state = ExecutionState.NOT_STARTED;

    public DecisionTrace(String correlationId) {
        this.correlationId = correlationId;
    }

    /**
     * One line of the trace.
     *
     * @param attempt 1-based attempt number the entry refers to
     * @param outcome {@code SUCCESS}, an error kind name, or {@code CANCELLED}
     * @param action  state the request moved to
     */
    public record Entry(int attempt, BackendId backend, BackendRole role, String outcome,
                        ExecutionState action, Duration latency) {
    }

    /**
     * Marks an adapter call as started. Logged but not kept as an entry; the entry is
     * appended once the attempt completes.
     */
    void recordStart(BackendChoice choice) {
        state = ExecutionState.TRYING;
        log.info("Decision: correlationId={}, attempt={}, backend={}, role={}, action={}, timeoutMs={}",
                correlationId, attempts + 1, choice.backend(), choice.role(), state, choice.timeout().toMillis());
    }

    /**
     * Records a completed adapter attempt.
     */
    Entry recordAttempt(BackendChoice choice, String outcome, ExecutionState action, Duration latency) {
        attempts++;
        return append(new Entry(attempts, choice.backend(), choice.role(), outcome, action, latency));
    }

    /**
     * Records a cancellation that happened outside an adapter call, e.g. during a backoff.
     */
    Entry recordCancellation(BackendChoice choice) {
        return append(new Entry(attempts, choice.backend(), choice.role(), "CANCELLED",
                ExecutionState.CANCELLED, Duration.ZERO));
    }

    private Entry append(Entry entry) {
        entries.add(entry);
        state = entry.action();
        log.info("Decision: correlationId={}, attempt={}, backend={}, role={}, outcome={}, action={}, latencyMs={}",
                correlationId, entry.attempt(), entry.backend(), entry.role(), entry.outcome(),
                entry.action(), entry.latency().toMillis());
        return entry;
    }

    public String correlationId() {
        return correlationId;
    }

    public List<Entry> entries() {
        return List.copyOf(entries);
    }

    /**
     * Number of adapter invocations made, retries included.
     */
    public int attempts() {
        return attempts;
    }

    /**
     * Current state of the request: {@code TRYING} while an adapter call is in flight,
     * otherwise the action of the last entry.
     */
    public ExecutionState state() {
        return state;
    }

    /**
     * Action of the last entry, or {@link ExecutionState#NOT_STARTED} if there is none.
     */
    public ExecutionState finalState() {
        return entries.isEmpty() ? ExecutionState.NOT_STARTED : entries.get(entries.size() - 1).action();
    }

    public long countOf(ExecutionState action) {
        return entries.stream().filter(e -> e.action() == action).count();
    }

    @Override
    public String toString() {
        return "DecisionTrace{correlationId=" + correlationId + ", attempts=" + attempts + ", entries=" + entries + '}';
    }
}

package fr.lapetina.thoughts.ai.domain.selection;

import fr.lapetina.thoughts.ai.domain.model.AnalysisRequest;
import fr.lapetina.thoughts.ai.domain.model.BackendId;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Configured primary first, configured secondary as fallback.
 *
 * <p>When the primary is not available for a request the secondary is promoted to the
 * primary role and the plan has no fallback. Preference hints are echoed in the
 * rationale but never reorder the candidates.
 *
 * <p>Thread-safe: all state is fixed at construction.
 */
public final class SequentialSelector implements BackendSelector {

    private final BackendId primary;
    private final BackendId secondary;
    private final Map<BackendId, Duration> timeouts;

    public SequentialSelector(BackendId primary, BackendId secondary, Map<BackendId, Duration> timeouts) {
        this.primary = Objects.requireNonNull(primary, "Primary backend is required");
        this.secondary = Objects.requireNonNull(secondary, "Secondary backend is required");
        this.timeouts = timeouts != null ? Map.copyOf(timeouts) : Map.of();
    }

    @Override
    public String getName() {
        return SelectionStrategy.SEQUENTIAL.configName();
    }

    @Override
    public Plan select(AnalysisRequest request) {
        boolean primaryAvailable = request.isAvailable(primary);
        boolean secondaryAvailable = !secondary.equals(primary) && request.isAvailable(secondary);

        List<BackendChoice> candidates = new ArrayList<>(2);
        String rationale;

        if (primaryAvailable) {
            candidates.add(new BackendChoice(primary, BackendRole.PRIMARY, timeoutFor(primary)));
            if (secondaryAvailable) {
                candidates.add(new BackendChoice(secondary, BackendRole.FALLBACK, timeoutFor(secondary)));
                rationale = String.format(
                        "SEQUENTIAL strategy: %s primary (configured), %s fallback (configured). "
                                + "Will try %s first, fall back to %s on recoverable errors.",
                        primary, secondary, primary, secondary);
            } else {
                rationale = String.format(
                        "SEQUENTIAL strategy: %s primary (configured), no fallback available. "
                                + "Will fail if %s encounters errors.",
                        primary, primary);
            }
        } else if (secondaryAvailable) {
            candidates.add(new BackendChoice(secondary, BackendRole.PRIMARY, timeoutFor(secondary)));
            rationale = String.format(
                    "SEQUENTIAL strategy: %s unavailable, %s promoted to primary, no fallback available. "
                            + "Will fail if %s encounters errors.",
                    primary, secondary, secondary);
        } else {
            throw new NoAvailableBackendException(String.format(
                    "No configured backend is available: primary=%s, secondary=%s, available=%s",
                    primary, secondary, request.availableBackends()));
        }

        if (!request.preferenceHints().isEmpty()) {
            rationale += " Preference hints noted: " + String.join(", ", request.preferenceHints()) + ".";
        }

        return new Plan(DecisionType.SEQUENTIAL, candidates, rationale);
    }

    private Duration timeoutFor(BackendId backend) {
        return timeouts.getOrDefault(backend, backend.defaultTimeout());
    }

    public BackendId getPrimary() {
        return primary;
    }

    public BackendId getSecondary() {
        return secondary;
    }
}

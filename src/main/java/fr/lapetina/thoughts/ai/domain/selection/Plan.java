package fr.lapetina.thoughts.ai.domain.selection;

import fr.lapetina.thoughts.ai.domain.model.BackendId;

import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Ordered list of backends to try for one request.
 *
 * <p>Never empty and never lists a backend twice. Holds no timestamp or request id,
 * so two plans built from the same inputs are equal.
 */
public record Plan(DecisionType decisionType, List<BackendChoice> candidates, String rationale) {

    public Plan {
        Objects.requireNonNull(decisionType, "Decision type is required");
        if (candidates == null || candidates.isEmpty()) {
            throw new IllegalArgumentException("A plan needs at least one candidate");
        }
        candidates = List.copyOf(candidates);
        Set<BackendId> seen = new HashSet<>();
        for (BackendChoice choice : candidates) {
            if (!seen.add(choice.backend())) {
                throw new IllegalArgumentException("Backend listed twice in plan: " + choice.backend());
            }
        }
        if (rationale == null) {
            rationale = "";
        }
    }

    public BackendChoice primary() {
        return candidates.get(0);
    }

    public List<BackendId> backends() {
        return candidates.stream().map(BackendChoice::backend).toList();
    }

    public int size() {
        return candidates.size();
    }
}

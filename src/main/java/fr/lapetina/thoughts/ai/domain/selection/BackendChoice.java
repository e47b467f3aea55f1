package fr.lapetina.thoughts.ai.domain.selection;

import fr.lapetina.thoughts.ai.domain.model.BackendId;

import java.time.Duration;
import java.util.Objects;

/**
 * One candidate of a plan: which backend, in which role, with which attempt timeout.
 */
public record BackendChoice(BackendId backend, BackendRole role, Duration timeout) {
    public BackendChoice {
        Objects.requireNonNull(backend, "Backend is required");
        Objects.requireNonNull(role, "Role is required");
        Objects.requireNonNull(timeout, "Timeout is required");
        if (timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("Timeout must be positive: " + timeout);
        }
    }
}

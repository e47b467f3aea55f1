package fr.lapetina.thoughts.ai.domain.selection;

import fr.lapetina.thoughts.ai.domain.model.BackendId;

import java.time.Duration;
import java.util.Map;

/**
 * Creates the selector for a configured strategy.
 */
public final class SelectorFactory {

    private SelectorFactory() {
        // Utility class
    }

    public static BackendSelector create(
            SelectionStrategy strategy,
            BackendId primary,
            BackendId secondary,
            Map<BackendId, Duration> timeouts
    ) {
        return switch (strategy) {
            case SEQUENTIAL -> new SequentialSelector(primary, secondary, timeouts);
        };
    }
}

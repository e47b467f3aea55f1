package fr.lapetina.thoughts.ai.domain.selection;

import java.util.Locale;

/**
 * Selection strategies accepted in configuration.
 */
public enum SelectionStrategy {
    SEQUENTIAL("sequential");

    private final String configName;

    SelectionStrategy(String configName) {
        this.configName = configName;
    }

    public String configName() {
        return configName;
    }

    /**
     * Resolves a configuration name.
     *
     * @throws IllegalArgumentException for unknown or unsupported strategies
     */
    public static SelectionStrategy fromName(String name) {
        String normalized = name == null ? "" : name.trim().toLowerCase(Locale.ROOT);
        for (SelectionStrategy strategy : values()) {
            if (strategy.configName.equals(normalized)) {
                return strategy;
            }
        }
        if (normalized.equals("primary_only") || normalized.equals("parallel")) {
            throw new IllegalArgumentException("Selection strategy '" + name + "' is not supported yet, use 'sequential'");
        }
        throw new IllegalArgumentException("Unknown selection strategy '" + name + "', expected 'sequential'");
    }
}

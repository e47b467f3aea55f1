package fr.lapetina.thoughts.ai.domain.model;

/**
 * Tokens consumed by one successful attempt and the estimated cost in USD.
 */
public record TokenUsage(int inputTokens, int outputTokens, double costUsd) {

    public static final TokenUsage NONE = new TokenUsage(0, 0, 0.0);

    public TokenUsage {
        if (inputTokens < 0 || outputTokens < 0) {
            throw new IllegalArgumentException("Token counts must not be negative");
        }
        if (costUsd < 0) {
            throw new IllegalArgumentException("Cost must not be negative");
        }
    }

    public int totalTokens() {
        return inputTokens + outputTokens;
    }

    /**
     * Builds a usage record priced per million tokens.
     */
    public static TokenUsage priced(int inputTokens, int outputTokens,
                                    double inputCostPerMillion, double outputCostPerMillion) {
        double cost = (inputTokens * inputCostPerMillion + outputTokens * outputCostPerMillion) / 1_000_000d;
        return new TokenUsage(inputTokens, outputTokens, cost);
    }
}

package io.github.drompincen.vibehub.protocol.api;

/**
 * Context window usage reported after the latest agent query.
 *
 * @param tokensUsed    input plus cache-read tokens of the most recent model call
 * @param contextWindow the model's advertised context window
 * @param costUsd       total cost reported by the agent runtime
 */
public record ContextUsage(
        long tokensUsed,
        long contextWindow,
        double costUsd
) {
    public int percentUsed() {
        if (contextWindow <= 0) return 0;
        return (int) Math.round(tokensUsed * 100.0 / contextWindow);
    }
}

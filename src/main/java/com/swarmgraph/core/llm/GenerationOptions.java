package com.swarmgraph.core.llm;

/**
 * Per-call sampling options. A {@code null} component means "use the backend default".
 */
public record GenerationOptions(Double temperature, Integer maxTokens) {

    private static final GenerationOptions DEFAULTS = new GenerationOptions(0.7, 4096);
    private static final GenerationOptions PROBE = new GenerationOptions(null, 5);

    public static GenerationOptions defaults() {
        return DEFAULTS;
    }

    public static GenerationOptions of(double temperature, int maxTokens) {
        return new GenerationOptions(temperature, maxTokens);
    }

    /** Options for the one-token liveness probe issued during provider resolution. */
    public static GenerationOptions probe() {
        return PROBE;
    }

    public boolean isEmpty() {
        return temperature == null && maxTokens == null;
    }
}

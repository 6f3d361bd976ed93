package com.swarmgraph.core.engine;

/**
 * Caller options for a single run.
 *
 * @param maxIterations ceiling on graph passes, at least 1
 * @param cancellation  token the caller may cancel to tear the run down between rounds
 */
public record RunOptions(int maxIterations, CancellationToken cancellation) {

    public static final int DEFAULT_MAX_ITERATIONS = 2;

    public RunOptions {
        if (maxIterations < 1) {
            throw new IllegalArgumentException("maxIterations must be at least 1, got " + maxIterations);
        }
        cancellation = cancellation == null ? CancellationToken.NONE : cancellation;
    }

    public static RunOptions defaults() {
        return new RunOptions(DEFAULT_MAX_ITERATIONS, CancellationToken.NONE);
    }

    public static RunOptions withMaxIterations(int maxIterations) {
        return new RunOptions(maxIterations, CancellationToken.NONE);
    }
}

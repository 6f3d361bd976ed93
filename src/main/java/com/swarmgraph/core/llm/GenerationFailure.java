package com.swarmgraph.core.llm;

import com.swarmgraph.core.SwarmException;

/**
 * A generation call exhausted its retry budget. The cause is the error of the last attempt.
 */
public class GenerationFailure extends SwarmException {

    private final int attempts;

    public GenerationFailure(String message, Throwable cause, int attempts) {
        super(message, cause);
        this.attempts = attempts;
    }

    public int getAttempts() {
        return attempts;
    }
}

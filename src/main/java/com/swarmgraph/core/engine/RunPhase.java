package com.swarmgraph.core.engine;

/**
 * Phases of a single run.
 */
public enum RunPhase {
    INIT,
    RESOLVING_PROVIDER,
    RUNNING,
    DECISION,
    COMPLETE,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETE || this == FAILED;
    }
}

package com.swarmgraph.core.scheduler;

import java.util.List;

/**
 * Result of one full traversal of the graph.
 *
 * @param pass   1-based pass number
 * @param rounds rounds executed in this pass
 * @param loop   whether the conditional edge asked for another pass
 */
public record PassOutcome(int pass, List<RoundRecord> rounds, boolean loop) {

    public PassOutcome {
        rounds = List.copyOf(rounds);
    }
}

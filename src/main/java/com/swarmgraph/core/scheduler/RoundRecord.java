package com.swarmgraph.core.scheduler;

import java.util.List;

/**
 * One executed scheduler round.
 *
 * @param pass    1-based pass number
 * @param round   1-based round number within the pass
 * @param nodeIds nodes that ran concurrently in the round
 */
public record RoundRecord(int pass, int round, List<String> nodeIds) {

    public RoundRecord {
        nodeIds = List.copyOf(nodeIds);
    }
}

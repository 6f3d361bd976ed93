package com.swarmgraph.core.engine;

import com.swarmgraph.core.scheduler.RoundRecord;
import com.swarmgraph.core.state.AgentMessage;
import com.swarmgraph.core.state.SwarmStatus;

import java.util.List;

/**
 * What a completed run hands back to its caller.
 *
 * @param runId      generated run id
 * @param swarm      swarm that ran
 * @param report     the assembler's report from the final pass
 * @param messages   message log of every pass, in completion order
 * @param iterations passes executed
 * @param provider   name of the backend pinned for the run
 * @param status     final status, always {@link SwarmStatus#COMPLETE} for a returned result
 * @param rounds     scheduler rounds executed
 * @param phases     lifecycle phases the run went through
 */
public record SwarmResult(
    String runId,
    String swarm,
    Object report,
    List<AgentMessage> messages,
    int iterations,
    String provider,
    SwarmStatus status,
    List<RoundRecord> rounds,
    List<RunPhase> phases
) {

    public SwarmResult {
        messages = List.copyOf(messages);
        rounds = List.copyOf(rounds);
        phases = List.copyOf(phases);
    }
}

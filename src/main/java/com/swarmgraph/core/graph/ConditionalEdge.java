package com.swarmgraph.core.graph;

import com.swarmgraph.core.state.SwarmState;
import com.swarmgraph.core.state.Verdict;

import java.util.List;
import java.util.function.Predicate;

/**
 * The iterate-or-finalize edge leaving the assembler.
 *
 * @param from           the assembler id
 * @param predicate      whether another pass is wanted
 * @param loopTargets    entry nodes the next pass restarts from
 * @param finalizeTarget where the run goes when it does not loop
 */
public record ConditionalEdge(
    String from,
    Predicate<SwarmState> predicate,
    List<String> loopTargets,
    String finalizeTarget
) {

    public static final String END = "__end__";

    /** Loop when the supervisor asked for another pass. */
    public static final Predicate<SwarmState> VERDICT_REQUESTS_ITERATION =
            state -> state.mergedVerdict().map(Verdict::needsIteration).orElse(false);

    public ConditionalEdge {
        loopTargets = loopTargets == null ? List.of() : List.copyOf(loopTargets);
        finalizeTarget = finalizeTarget == null ? END : finalizeTarget;
    }

    public static ConditionalEdge iterateOrFinalize(String from, List<String> loopTargets) {
        return new ConditionalEdge(from, VERDICT_REQUESTS_ITERATION, loopTargets, END);
    }

    /**
     * Evaluates the edge after the assembler ran. The {@code maxIterations} ceiling wins over
     * the predicate.
     */
    public boolean shouldLoop(SwarmState state) {
        return state.iteration() < state.maxIterations() && predicate.test(state);
    }
}

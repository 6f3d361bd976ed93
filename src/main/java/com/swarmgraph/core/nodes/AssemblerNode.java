package com.swarmgraph.core.nodes;

import com.swarmgraph.core.llm.Extraction;
import com.swarmgraph.core.state.AgentMessage;
import com.swarmgraph.core.state.SwarmState;
import com.swarmgraph.core.state.Verdict;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Terminal node of a pass. Makes no external call: it reduces the recorded outputs into a
 * report and advances {@code iteration}.
 */
public class AssemblerNode implements SwarmNode {

    private static final Logger log = LoggerFactory.getLogger(AssemblerNode.class);

    private final NodeDescriptor descriptor;
    private final ReportReducer reducer;

    public AssemblerNode(String id, ReportReducer reducer, String... upstream) {
        this.descriptor = NodeDescriptor.of(id, NodeKind.ASSEMBLER, upstream);
        this.reducer = reducer;
    }

    @Override
    public NodeDescriptor descriptor() {
        return descriptor;
    }

    @Override
    public Map<String, Object> execute(SwarmState state, RunContext context) {
        var sections = new LinkedHashMap<String, Extraction>();
        state.specialistResults().forEach((nodeId, raw) -> sections.put(nodeId, context.extract(raw)));
        Verdict verdict = state.mergedVerdict().orElseGet(() -> Verdict.unparsed(Map.of()));

        var inputs = new AssemblyInputs(state.payload(), state.iteration(), sections, verdict);
        Object report = Objects.requireNonNull(reducer.reduce(inputs), "Report reducer returned null for " + id());
        int nextIteration = state.iteration() + 1;

        long failed = sections.values().stream().filter(e -> !e.ok()).count();
        log.info("Assembled report for pass {} ({} section(s), {} with defaults)",
                nextIteration, sections.size(), failed);

        return Map.of(
                SwarmState.REPORT, report,
                SwarmState.ITERATION, nextIteration,
                SwarmState.AGENT_MESSAGES, List.of(AgentMessage.of(id(),
                        "Report assembled for pass " + nextIteration))
        );
    }
}

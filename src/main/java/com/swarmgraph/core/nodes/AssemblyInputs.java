package com.swarmgraph.core.nodes;

import com.swarmgraph.core.llm.Extraction;
import com.swarmgraph.core.state.Verdict;

import java.util.Map;

/**
 * Everything the assembler folds into a report.
 *
 * @param payload   the run payload
 * @param iteration completed passes before this one
 * @param sections  extraction of every node output recorded this pass, keyed by node id
 * @param verdict   the supervisor's verdict, or an unparsed verdict if none was recorded
 */
public record AssemblyInputs(
    String payload,
    int iteration,
    Map<String, Extraction> sections,
    Verdict verdict
) {

    public AssemblyInputs {
        sections = sections == null ? Map.of() : Map.copyOf(sections);
    }

    /**
     * Extraction for {@code nodeId}; a node that produced no output reads as a failed extraction.
     */
    public Extraction section(String nodeId) {
        return sections.getOrDefault(nodeId, Extraction.missing());
    }
}

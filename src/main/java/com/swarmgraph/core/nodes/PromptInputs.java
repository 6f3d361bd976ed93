package com.swarmgraph.core.nodes;

import com.swarmgraph.core.state.SwarmState;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * The slice of state a node is allowed to build its prompt from: the run payload, the
 * pass number and the outputs of its declared upstream nodes.
 */
public final class PromptInputs {

    private final String payload;
    private final int iteration;
    private final Set<String> declared;
    private final Map<String, String> results;

    private PromptInputs(String payload, int iteration, Set<String> declared, Map<String, String> results) {
        this.payload = payload;
        this.iteration = iteration;
        this.declared = declared;
        this.results = results;
    }

    public static PromptInputs of(SwarmState state, NodeDescriptor descriptor) {
        var results = new LinkedHashMap<String, String>();
        for (String id : descriptor.upstream()) {
            state.specialistResult(id).ifPresent(raw -> results.put(id, raw));
        }
        return new PromptInputs(state.payload(), state.iteration(), descriptor.upstream(),
                Collections.unmodifiableMap(results));
    }

    public String payload() {
        return payload;
    }

    /** Completed passes so far; 0 on the first pass. */
    public int iteration() {
        return iteration;
    }

    /**
     * Raw output of a declared upstream node, or an empty string if it produced none.
     *
     * @throws IllegalArgumentException if {@code nodeId} is not a declared upstream dependency
     */
    public String result(String nodeId) {
        if (!declared.contains(nodeId)) {
            throw new IllegalArgumentException("'" + nodeId + "' is not a declared upstream dependency");
        }
        return results.getOrDefault(nodeId, "");
    }

    /** Outputs of every declared upstream node that produced one, in declaration order. */
    public Map<String, String> results() {
        return results;
    }
}

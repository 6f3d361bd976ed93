package com.swarmgraph.core.nodes;

import com.swarmgraph.core.state.SwarmState;

import java.util.Map;

/**
 * Unit of graph work.
 * <p>
 * A node reads a consistent snapshot of the state and returns a partial update; it never
 * mutates shared state itself. Every external call goes through the {@link RunContext}.
 */
public interface SwarmNode {

    NodeDescriptor descriptor();

    /**
     * @return the fields this node contributes, keyed by {@link SwarmState} field name
     */
    Map<String, Object> execute(SwarmState state, RunContext context);

    default String id() {
        return descriptor().id();
    }

    default NodeKind kind() {
        return descriptor().kind();
    }
}

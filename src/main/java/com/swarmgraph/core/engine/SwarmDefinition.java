package com.swarmgraph.core.engine;

import com.swarmgraph.core.graph.SwarmGraph;

/**
 * A named, declaratively configured swarm. Implementations are Spring components picked up
 * by {@link SwarmRegistry}.
 */
public interface SwarmDefinition {

    String name();

    String description();

    /** The swarm's topology; built once and reused by every run. */
    SwarmGraph graph();
}

package com.swarmgraph.core.graph;

import com.swarmgraph.core.SwarmException;

/**
 * A swarm topology failed validation when it was built.
 */
public class GraphDefinitionException extends SwarmException {

    public GraphDefinitionException(String message) {
        super(message);
    }
}

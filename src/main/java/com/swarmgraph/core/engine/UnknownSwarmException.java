package com.swarmgraph.core.engine;

import com.swarmgraph.core.SwarmException;

public class UnknownSwarmException extends SwarmException {

    private final String swarmName;

    public UnknownSwarmException(String swarmName) {
        super("Unknown swarm: " + swarmName);
        this.swarmName = swarmName;
    }

    public String getSwarmName() {
        return swarmName;
    }
}

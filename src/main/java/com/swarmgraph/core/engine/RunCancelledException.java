package com.swarmgraph.core.engine;

import com.swarmgraph.core.SwarmException;

public class RunCancelledException extends SwarmException {

    public RunCancelledException(String message) {
        super(message);
    }
}

package com.swarmgraph.core.state;

public enum SwarmStatus {
    RUNNING,
    COMPLETE
}

package com.swarmgraph.core.graph;

public enum EdgeKind {
    SEQUENTIAL,
    CONDITIONAL
}

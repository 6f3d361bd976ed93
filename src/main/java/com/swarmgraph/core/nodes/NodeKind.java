package com.swarmgraph.core.nodes;

public enum NodeKind {
    SPECIALIST,
    SUPERVISOR,
    ASSEMBLER
}

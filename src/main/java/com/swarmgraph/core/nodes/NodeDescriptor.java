package com.swarmgraph.core.nodes;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Identity and declared dependencies of a graph node.
 *
 * @param id       unique node id within its graph
 * @param kind     what the node does
 * @param upstream ids of the nodes whose output this node reads, in declaration order
 */
public record NodeDescriptor(String id, NodeKind kind, Set<String> upstream) {

    public NodeDescriptor {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Node id must not be blank");
        }
        if (kind == null) {
            throw new IllegalArgumentException("Node kind must be set for " + id);
        }
        upstream = upstream == null ? Set.of() : Collections.unmodifiableSet(new LinkedHashSet<>(upstream));
    }

    public static NodeDescriptor of(String id, NodeKind kind, String... upstream) {
        return new NodeDescriptor(id, kind, new LinkedHashSet<>(List.of(upstream)));
    }

    public boolean isEntry() {
        return upstream.isEmpty();
    }
}

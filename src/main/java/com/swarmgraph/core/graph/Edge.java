package com.swarmgraph.core.graph;

/**
 * Directed edge between two nodes of a {@link SwarmGraph}.
 */
public record Edge(String from, String to, EdgeKind kind) {}

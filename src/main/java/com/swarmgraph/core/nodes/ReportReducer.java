package com.swarmgraph.core.nodes;

/**
 * Swarm-specific fold of a pass's outputs into the caller-facing report.
 * <p>
 * Implementations must be deterministic and must substitute defaults for any section whose
 * extraction failed instead of throwing.
 */
@FunctionalInterface
public interface ReportReducer {

    Object reduce(AssemblyInputs inputs);
}

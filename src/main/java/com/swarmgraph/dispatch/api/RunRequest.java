package com.swarmgraph.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Inbound JSON body for POST /api/v1/swarms/{name}/runs.
 *
 * @param payload       request passed to every node of the swarm
 * @param maxIterations refinement pass ceiling; nullable, defaults to 2
 */
public record RunRequest(
    String payload,
    @JsonProperty("max_iterations") Integer maxIterations
) {}

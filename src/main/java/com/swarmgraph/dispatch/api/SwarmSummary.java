package com.swarmgraph.dispatch.api;

import com.swarmgraph.core.engine.SwarmDefinition;

import java.util.List;

/**
 * Outbound description of a registered swarm.
 */
public record SwarmSummary(String name, String description, List<List<String>> rounds) {

    static SwarmSummary of(SwarmDefinition definition) {
        return new SwarmSummary(definition.name(), definition.description(), definition.graph().rounds());
    }
}

package com.swarmgraph.core.engine;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Looks swarms up by name.
 */
@Component
public class SwarmRegistry {

    private static final Logger log = LoggerFactory.getLogger(SwarmRegistry.class);

    private final Map<String, SwarmDefinition> swarms;

    public SwarmRegistry(List<SwarmDefinition> definitions) {
        var byName = new TreeMap<String, SwarmDefinition>();
        for (var definition : definitions) {
            if (byName.putIfAbsent(definition.name(), definition) != null) {
                throw new IllegalStateException("Duplicate swarm name: " + definition.name());
            }
        }
        this.swarms = Collections.unmodifiableMap(byName);
        log.info("Registered swarms: {}", swarms.keySet());
    }

    /**
     * @throws UnknownSwarmException if no swarm has that name
     */
    public SwarmDefinition get(String name) {
        var definition = swarms.get(name);
        if (definition == null) {
            throw new UnknownSwarmException(name);
        }
        return definition;
    }

    /** Swarms sorted by name. */
    public List<SwarmDefinition> list() {
        return List.copyOf(swarms.values());
    }
}

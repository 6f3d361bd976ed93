package com.swarmgraph.core.state;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * One entry of the run's message log.
 *
 * @param agent         id of the node that produced the message
 * @param content       raw generated text, or a short note for nodes that make no call
 * @param timestamp     completion time of the node
 * @param parsedPayload structured payload; {@code null} unless extraction succeeded
 */
public record AgentMessage(
    String agent,
    String content,
    Instant timestamp,
    Map<String, Object> parsedPayload
) {

    public AgentMessage {
        parsedPayload = parsedPayload == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(parsedPayload));
    }

    public static AgentMessage of(String agent, String content) {
        return new AgentMessage(agent, content, Instant.now(), null);
    }

    public static AgentMessage withPayload(String agent, String content, Map<String, Object> payload) {
        return new AgentMessage(agent, content, Instant.now(), payload);
    }

    public Optional<Map<String, Object>> payload() {
        return Optional.ofNullable(parsedPayload);
    }
}

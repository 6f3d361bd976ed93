package com.swarmgraph.core.events;

import java.time.Instant;
import java.util.Map;

/**
 * An event emitted while a swarm run executes.
 *
 * @param eventType event type (e.g. "run.started", "round.started", "node.completed")
 * @param runId     the run this event belongs to
 * @param nodeId    the node this event relates to (nullable for run-level events)
 * @param payload   arbitrary key-value data associated with the event
 * @param timestamp when the event occurred
 */
public record SwarmEvent(
    String eventType,
    String runId,
    String nodeId,
    Map<String, Object> payload,
    Instant timestamp
) {

    public static final String RUN_COMPLETED = "run.completed";
    public static final String RUN_FAILED = "run.failed";

    public static SwarmEvent of(String eventType, String runId, Map<String, Object> payload) {
        return new SwarmEvent(eventType, runId, null, payload, Instant.now());
    }

    public static SwarmEvent forNode(String eventType, String runId, String nodeId, Map<String, Object> payload) {
        return new SwarmEvent(eventType, runId, nodeId, payload, Instant.now());
    }

    /** Whether this is the last event the run will publish. */
    public boolean terminal() {
        return RUN_COMPLETED.equals(eventType) || RUN_FAILED.equals(eventType);
    }
}

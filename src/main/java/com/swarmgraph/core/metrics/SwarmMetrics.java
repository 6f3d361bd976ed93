package com.swarmgraph.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for swarm runs.
 */
@Service
public class SwarmMetrics {

    private final MeterRegistry registry;

    public SwarmMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordNodeDuration(String nodeId, long ms) {
        Timer.builder("swarm.node.duration")
                .tag("node", nodeId)
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordGenerationRetry() {
        Counter.builder("swarm.generation.retries")
                .description("Generation attempts that failed and were retried")
                .register(registry)
                .increment();
    }

    /**
     * Counts agent outputs that did not parse as structured data and fell back to a raw capture.
     */
    public void recordParseFailure(String agent) {
        Counter.builder("swarm.parse.failures")
                .tag("agent", agent)
                .register(registry)
                .increment();
    }

    public void recordRunResult(String status) {
        Counter.builder("swarm.runs.total")
                .tag("status", status)
                .register(registry)
                .increment();
    }

    public void recordIterationDepth(int depth) {
        DistributionSummary.builder("swarm.iteration.depth")
                .register(registry)
                .record(depth);
    }
}

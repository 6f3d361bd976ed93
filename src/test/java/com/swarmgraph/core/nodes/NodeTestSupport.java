package com.swarmgraph.core.nodes;

import com.swarmgraph.core.context.ContextInjector;
import com.swarmgraph.core.engine.CancellationToken;
import com.swarmgraph.core.llm.GenerationProvider;
import com.swarmgraph.core.llm.GenerationService;
import com.swarmgraph.core.llm.ResultExtractor;
import com.swarmgraph.core.llm.RetryingCaller;
import com.swarmgraph.core.metrics.SwarmMetrics;
import com.swarmgraph.core.state.StateStore;
import com.swarmgraph.core.state.SwarmState;

import java.time.Duration;
import java.util.Map;

/**
 * Builds run contexts and states for node tests without any real backend.
 */
final class NodeTestSupport {

    private NodeTestSupport() {}

    static RunContext context(GenerationService service) {
        return context(service, ContextInjector.NONE, null);
    }

    static RunContext context(GenerationService service, ContextInjector injector, SwarmMetrics metrics) {
        return new RunContext("test-swarm", GenerationProvider.of("fake", service),
                new RetryingCaller(1, Duration.ZERO, d -> { }), new ResultExtractor(),
                injector, CancellationToken.NONE, metrics);
    }

    static SwarmState state(String payload) {
        return SwarmState.initial("RUN-1", payload, 2);
    }

    static SwarmState withResults(String payload, Map<String, String> results) {
        return StateStore.merge(state(payload), Map.of(SwarmState.SPECIALIST_RESULTS, results));
    }
}

package com.swarmgraph.core.engine;

import com.swarmgraph.core.context.ContextInjector;
import com.swarmgraph.core.context.SafeContextInjector;
import com.swarmgraph.core.events.EventBus;
import com.swarmgraph.core.events.SwarmEvent;
import com.swarmgraph.core.llm.GenerationProvider;
import com.swarmgraph.core.llm.ProviderRegistry;
import com.swarmgraph.core.llm.ProviderResolver;
import com.swarmgraph.core.llm.ResultExtractor;
import com.swarmgraph.core.llm.RetryingCaller;
import com.swarmgraph.core.logging.MdcContext;
import com.swarmgraph.core.metrics.SwarmMetrics;
import com.swarmgraph.core.nodes.RunContext;
import com.swarmgraph.core.scheduler.SwarmScheduler;
import com.swarmgraph.core.state.StateStore;
import com.swarmgraph.core.state.SwarmState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Entry point for running a swarm.
 * <p>
 * Resolves and pins a provider, creates the run's state, and hands the swarm's graph to the
 * {@link SwarmScheduler}. A run either returns a complete {@link SwarmResult} or throws a
 * single exception naming the stage that failed; no partial report is returned.
 */
@Service
public class SwarmEngine {

    private static final Logger log = LoggerFactory.getLogger(SwarmEngine.class);
    private static final AtomicInteger RUN_COUNTER = new AtomicInteger(0);

    private final SwarmRegistry registry;
    private final ProviderRegistry providers;
    private final ProviderResolver resolver;
    private final SwarmScheduler scheduler;
    private final RetryingCaller retry;
    private final ResultExtractor extractor;
    private final ContextInjector injector;
    private final EventBus eventBus;
    private final SwarmMetrics metrics;

    public SwarmEngine(SwarmRegistry registry,
                       ProviderRegistry providers,
                       ProviderResolver resolver,
                       SwarmScheduler scheduler,
                       RetryingCaller retry,
                       ResultExtractor extractor,
                       ContextInjector injector,
                       EventBus eventBus,
                       @Autowired(required = false) SwarmMetrics metrics) {
        this.registry = registry;
        this.providers = providers;
        this.resolver = resolver;
        this.scheduler = scheduler;
        this.retry = retry;
        this.extractor = extractor;
        this.injector = new SafeContextInjector(injector);
        this.eventBus = eventBus;
        this.metrics = metrics;
    }

    public SwarmResult run(String swarmName, String payload, RunOptions options) {
        return run(swarmName, payload, options, new RunLifecycle());
    }

    /**
     * Runs a swarm to completion.
     *
     * @param swarmName registered swarm name
     * @param payload   the caller's request, passed to every node
     * @param options   iteration ceiling and cancellation token
     * @param lifecycle phase tracker for this run; left in COMPLETE or FAILED on return
     * @throws UnknownSwarmException                                  if no swarm has that name
     * @throws com.swarmgraph.core.llm.ProviderUnavailableException   if no provider answers its probe
     * @throws NodeExecutionException                                 if a node fails
     * @throws RunCancelledException                                  if the token is cancelled
     */
    public SwarmResult run(String swarmName, String payload, RunOptions options, RunLifecycle lifecycle) {
        SwarmDefinition definition = registry.get(swarmName);
        if (payload == null || payload.isBlank()) {
            throw new IllegalArgumentException("payload must not be blank");
        }
        RunOptions effective = options != null ? options : RunOptions.defaults();
        String runId = generateRunId();

        MdcContext.setRun(runId, swarmName);
        try {
            log.info("Starting run {} of swarm {} (maxIterations={})", runId, swarmName, effective.maxIterations());
            eventBus.publish(SwarmEvent.of("run.started", runId,
                    Map.of("swarm", swarmName, "maxIterations", effective.maxIterations())));

            lifecycle.transitionTo(RunPhase.RESOLVING_PROVIDER);
            effective.cancellation().throwIfCancelled();
            GenerationProvider provider = resolver.resolve(providers.candidates());
            eventBus.publish(SwarmEvent.of("provider.resolved", runId, Map.of("provider", provider.name())));

            var context = new RunContext(swarmName, provider, retry, extractor, injector,
                    effective.cancellation(), metrics);
            var store = new StateStore(SwarmState.initial(runId, payload, effective.maxIterations()));
            var rounds = scheduler.run(definition.graph(), store, context, lifecycle);

            var state = store.snapshot();
            var result = new SwarmResult(runId, swarmName, state.report().orElse(null), state.agentMessages(),
                    state.iteration(), provider.name(), state.status(), rounds, lifecycle.history());

            log.info("Run {} complete after {} pass(es) using {}", runId, result.iterations(), provider.name());
            recordResult("COMPLETE");
            eventBus.publish(SwarmEvent.of(SwarmEvent.RUN_COMPLETED, runId,
                    Map.of("iterations", result.iterations(), "provider", provider.name())));
            return result;
        } catch (RuntimeException e) {
            RunPhase failedIn = lifecycle.current();
            lifecycle.failIfActive();
            log.error("Run {} failed during {}: {}", runId, failedIn, e.getMessage());
            recordResult(e instanceof RunCancelledException ? "CANCELLED" : "FAILED");
            eventBus.publish(SwarmEvent.of(SwarmEvent.RUN_FAILED, runId,
                    Map.of("phase", failedIn.name(), "error", String.valueOf(e.getMessage()))));
            throw e;
        } finally {
            MdcContext.clear();
        }
    }

    /**
     * Generates a run id in the format RUN-YYYY-NNNN.
     */
    public String generateRunId() {
        int count = RUN_COUNTER.incrementAndGet();
        int year = Instant.now().atZone(ZoneOffset.UTC).getYear();
        return String.format("RUN-%d-%04d", year, count);
    }

    private void recordResult(String status) {
        if (metrics != null) {
            metrics.recordRunResult(status);
        }
    }
}

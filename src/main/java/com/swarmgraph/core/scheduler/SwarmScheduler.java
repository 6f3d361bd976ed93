package com.swarmgraph.core.scheduler;

import com.swarmgraph.core.engine.NodeExecutionException;
import com.swarmgraph.core.engine.RunCancelledException;
import com.swarmgraph.core.engine.RunLifecycle;
import com.swarmgraph.core.engine.RunPhase;
import com.swarmgraph.core.events.EventBus;
import com.swarmgraph.core.events.SwarmEvent;
import com.swarmgraph.core.graph.SwarmGraph;
import com.swarmgraph.core.logging.MdcContext;
import com.swarmgraph.core.metrics.SwarmMetrics;
import com.swarmgraph.core.nodes.RunContext;
import com.swarmgraph.core.nodes.SwarmNode;
import com.swarmgraph.core.state.StateStore;
import com.swarmgraph.core.state.SwarmState;
import com.swarmgraph.core.state.SwarmStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Executes a {@link SwarmGraph} pass by pass until the conditional edge finalizes.
 * <p>
 * Each round submits all of its nodes to a bounded worker pool against the same state
 * snapshot. The calling thread is the only writer: it takes results in completion order and
 * merges each one into the {@link StateStore} before taking the next. The first node that
 * fails cancels the rest of its round and aborts the run.
 */
@Service
public class SwarmScheduler {

    private static final Logger log = LoggerFactory.getLogger(SwarmScheduler.class);

    private final int maxParallel;
    private final EventBus eventBus;
    private final SwarmMetrics metrics;

    @Autowired
    public SwarmScheduler(SchedulerProperties properties, EventBus eventBus,
                          @Autowired(required = false) SwarmMetrics metrics) {
        this(properties.getMaxParallel(), eventBus, metrics);
    }

    public SwarmScheduler(int maxParallel, EventBus eventBus, SwarmMetrics metrics) {
        if (maxParallel < 1) {
            throw new IllegalArgumentException("maxParallel must be at least 1");
        }
        this.maxParallel = maxParallel;
        this.eventBus = eventBus;
        this.metrics = metrics;
    }

    /**
     * Runs passes until the graph finalizes, driving {@code lifecycle} through
     * RUNNING and DECISION for every pass and into COMPLETE at the end.
     *
     * @return every round executed, in order
     * @throws NodeExecutionException if a node fails
     * @throws RunCancelledException  if the run's token is cancelled between rounds
     */
    public List<RoundRecord> run(SwarmGraph graph, StateStore store, RunContext context, RunLifecycle lifecycle) {
        ExecutorService executor = newExecutor(graph);
        try {
            var records = new ArrayList<RoundRecord>();
            while (true) {
                lifecycle.transitionTo(RunPhase.RUNNING);
                var outcome = runPass(graph, store, context, executor);
                records.addAll(outcome.rounds());
                lifecycle.transitionTo(RunPhase.DECISION);
                if (!outcome.loop()) {
                    store.apply(Map.of(SwarmState.STATUS, SwarmStatus.COMPLETE.name()));
                    lifecycle.transitionTo(RunPhase.COMPLETE);
                    return records;
                }
                store.resetForNextPass();
            }
        } finally {
            executor.shutdownNow();
        }
    }

    PassOutcome runPass(SwarmGraph graph, StateStore store, RunContext context, ExecutorService executor) {
        int pass = store.snapshot().iteration() + 1;
        var records = new ArrayList<RoundRecord>();
        var rounds = graph.rounds();
        for (int i = 0; i < rounds.size(); i++) {
            context.cancellation().throwIfCancelled();
            var record = new RoundRecord(pass, i + 1, rounds.get(i));
            log.info("Pass {} round {}: {}", pass, record.round(), record.nodeIds());
            eventBus.publish(SwarmEvent.of("round.started", store.snapshot().runId(),
                    Map.of("pass", pass, "round", record.round(), "nodes", record.nodeIds())));
            runRound(graph, record, store, context, executor);
            records.add(record);
        }

        var state = store.snapshot();
        boolean loop = graph.conditionalEdge().shouldLoop(state);
        log.info("Pass {} complete, {}", pass, loop ? "iterating" : "finalizing");
        eventBus.publish(SwarmEvent.of("pass.completed", state.runId(),
                Map.of("pass", pass, "loop", loop)));
        if (metrics != null && !loop) {
            metrics.recordIterationDepth(state.iteration());
        }
        return new PassOutcome(pass, records, loop);
    }

    private void runRound(SwarmGraph graph, RoundRecord record, StateStore store,
                          RunContext context, ExecutorService executor) {
        SwarmState snapshot = store.snapshot();
        var completion = new ExecutorCompletionService<NodeOutcome>(executor);
        var pending = new HashMap<Future<NodeOutcome>, String>();
        for (String nodeId : record.nodeIds()) {
            SwarmNode node = graph.node(nodeId);
            pending.put(completion.submit(() -> executeNode(node, snapshot, context)), nodeId);
        }

        try {
            for (int i = 0; i < record.nodeIds().size(); i++) {
                Future<NodeOutcome> done = completion.take();
                String nodeId = pending.remove(done);
                NodeOutcome outcome;
                try {
                    outcome = done.get();
                } catch (ExecutionException e) {
                    cancelAll(pending);
                    if (e.getCause() instanceof RunCancelledException cancelled) {
                        throw cancelled;
                    }
                    log.error("Node {} failed: {}", nodeId, e.getCause().getMessage());
                    throw new NodeExecutionException(nodeId, snapshot.iteration(), e.getCause());
                }
                merge(store, outcome, snapshot.iteration());
                eventBus.publish(SwarmEvent.forNode("node.completed", snapshot.runId(), nodeId,
                        Map.of("pass", record.pass(), "round", record.round(), "durationMs", outcome.durationMs())));
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            cancelAll(pending);
            throw new RunCancelledException("Interrupted while waiting for round " + record.round());
        }
    }

    private NodeOutcome executeNode(SwarmNode node, SwarmState snapshot, RunContext context) {
        MdcContext.setNode(snapshot.runId(), context.swarm(), node.id(), snapshot.iteration() + 1);
        long start = System.currentTimeMillis();
        try {
            log.debug("Executing {} node {}", node.kind(), node.id());
            var update = node.execute(snapshot, context);
            long elapsed = System.currentTimeMillis() - start;
            if (metrics != null) {
                metrics.recordNodeDuration(node.id(), elapsed);
            }
            log.debug("Node {} finished in {} ms", node.id(), elapsed);
            return new NodeOutcome(node.id(), update, elapsed);
        } finally {
            MdcContext.clear();
        }
    }

    private static void merge(StateStore store, NodeOutcome outcome, int iteration) {
        try {
            store.apply(outcome.update());
        } catch (IllegalArgumentException | IllegalStateException e) {
            throw new NodeExecutionException(outcome.nodeId(), iteration, e);
        }
    }

    private static void cancelAll(Map<Future<NodeOutcome>, String> pending) {
        pending.keySet().forEach(f -> f.cancel(true));
    }

    private ExecutorService newExecutor(SwarmGraph graph) {
        int widest = graph.rounds().stream().mapToInt(List::size).max().orElse(1);
        int threads = Math.min(maxParallel, widest);
        var counter = new AtomicInteger();
        ThreadFactory factory = r -> {
            Thread t = new Thread(r, "swarm-" + graph.name() + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
        return Executors.newFixedThreadPool(threads, factory);
    }

    private record NodeOutcome(String nodeId, Map<String, Object> update, long durationMs) {}
}

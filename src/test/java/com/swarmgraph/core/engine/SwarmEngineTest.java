package com.swarmgraph.core.engine;

import com.swarmgraph.core.context.ContextInjector;
import com.swarmgraph.core.events.EventBus;
import com.swarmgraph.core.events.SwarmEvent;
import com.swarmgraph.core.llm.GenerationFailure;
import com.swarmgraph.core.llm.GenerationProvider;
import com.swarmgraph.core.llm.GenerationService;
import com.swarmgraph.core.llm.ProviderRegistry;
import com.swarmgraph.core.llm.ProviderResolver;
import com.swarmgraph.core.llm.ProviderUnavailableException;
import com.swarmgraph.core.llm.ResultExtractor;
import com.swarmgraph.core.llm.RetryingCaller;
import com.swarmgraph.core.metrics.SwarmMetrics;
import com.swarmgraph.core.scheduler.SwarmScheduler;
import com.swarmgraph.core.state.SwarmStatus;
import com.swarmgraph.swarms.cardgame.CardGameReport;
import com.swarmgraph.swarms.cardgame.CardGameSwarm;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Runs the card game swarm end to end against a scripted backend.
 */
class SwarmEngineTest {

    private static final String RULES = "{\"title\": \"Dragon Duel\", \"players\": 2, \"rules\": [\"Draw a card\"]}";
    private static final String BALANCE = "{\"balance_score\": 7, \"risks\": [\"snowballing\"], \"recommendations\": []}";
    private static final String DONE = "{\"needs_iteration\": false, \"summary\": \"Ready\", \"issues\": []}";
    private static final String AGAIN = "{\"needs_iteration\": true, \"summary\": \"Tighten scoring\", \"issues\": [\"scoring\"]}";

    private EventBus eventBus;
    private SimpleMeterRegistry meterRegistry;
    private List<SwarmEvent> events;
    private AtomicInteger nodeCalls;

    @BeforeEach
    void setUp() {
        eventBus = new EventBus();
        meterRegistry = new SimpleMeterRegistry();
        events = new ArrayList<>();
        eventBus.subscribeAll(events::add);
        nodeCalls = new AtomicInteger();
    }

    private GenerationService scripted(String supervisorReply) {
        return (system, user, options) -> {
            if (system.equals("Reply with OK")) {
                return "OK";
            }
            nodeCalls.incrementAndGet();
            if (system.contains("lead designer")) {
                return supervisorReply;
            }
            if (system.contains("balance analyst")) {
                return BALANCE;
            }
            return RULES;
        };
    }

    private SwarmEngine engine(ContextInjector injector, GenerationProvider... providers) {
        var metrics = new SwarmMetrics(meterRegistry);
        return new SwarmEngine(
                new SwarmRegistry(List.of(new CardGameSwarm())),
                new ProviderRegistry(List.of(providers)),
                new ProviderResolver(),
                new SwarmScheduler(4, eventBus, metrics),
                new RetryingCaller(3, Duration.ZERO, d -> { }),
                new ResultExtractor(),
                injector,
                eventBus,
                metrics);
    }

    private SwarmEngine engine(GenerationProvider... providers) {
        return engine(ContextInjector.NONE, providers);
    }

    // ── Successful runs ─────────────────────────────────────────────

    @Nested
    @DisplayName("successful runs")
    class Successful {

        @Test
        @DisplayName("single pass produces the assembled report")
        void singlePass() {
            var result = engine(GenerationProvider.of("primary", scripted(DONE)))
                    .run(CardGameSwarm.NAME, "A dragon-themed duel card game", RunOptions.defaults());

            var report = assertInstanceOf(CardGameReport.class, result.report());
            assertEquals("Dragon Duel", report.title());
            assertEquals(7.0, report.balanceScore());
            assertEquals("Ready", report.reviewSummary());
            assertEquals(1, result.iterations());
            assertEquals("primary", result.provider());
            assertEquals(SwarmStatus.COMPLETE, result.status());
            assertEquals(3, result.rounds().size());
            assertEquals(3, nodeCalls.get());
            assertTrue(result.runId().matches("RUN-\\d{4}-\\d{4}"));
            assertEquals(List.of(RunPhase.INIT, RunPhase.RESOLVING_PROVIDER, RunPhase.RUNNING,
                    RunPhase.DECISION, RunPhase.COMPLETE), result.phases());
        }

        @Test
        @DisplayName("a supervisor that keeps asking for work is capped by maxIterations")
        void iteratesToCeiling() {
            var result = engine(GenerationProvider.of("primary", scripted(AGAIN)))
                    .run(CardGameSwarm.NAME, "A dragon-themed duel card game", RunOptions.withMaxIterations(2));

            assertEquals(2, result.iterations());
            assertEquals(6, nodeCalls.get());
            // two specialists, supervisor and assembler per pass
            assertEquals(8, result.messages().size());
            assertEquals(6, result.rounds().size());
        }

        @Test
        @DisplayName("falls back to the next provider when the first fails its probe")
        void providerFallback() {
            GenerationService down = (s, u, o) -> {
                throw new IllegalStateException("401 Unauthorized");
            };

            var result = engine(GenerationProvider.of("down", down), GenerationProvider.of("backup", scripted(DONE)))
                    .run(CardGameSwarm.NAME, "idea", RunOptions.defaults());

            assertEquals("backup", result.provider());
        }

        @Test
        @DisplayName("transient generation errors are retried")
        void transientErrorsRetried() {
            var failedOnce = new AtomicBoolean();
            GenerationService flaky = (system, user, options) -> {
                if (system.contains("card game designer") && failedOnce.compareAndSet(false, true)) {
                    throw new IllegalStateException("429 Too Many Requests");
                }
                return scripted(DONE).generate(system, user, options);
            };

            var result = engine(GenerationProvider.of("flaky", flaky))
                    .run(CardGameSwarm.NAME, "idea", RunOptions.defaults());

            assertEquals(SwarmStatus.COMPLETE, result.status());
            assertTrue(failedOnce.get());
        }

        @Test
        @DisplayName("a failing context injector does not fail the run")
        void injectorFailureIgnored() {
            ContextInjector broken = (base, query) -> {
                throw new IllegalStateException("notes store unavailable");
            };

            var result = engine(broken, GenerationProvider.of("primary", scripted(DONE)))
                    .run(CardGameSwarm.NAME, "idea", RunOptions.defaults());

            assertEquals(SwarmStatus.COMPLETE, result.status());
        }

        @Test
        @DisplayName("publishes run lifecycle events and records the result metric")
        void eventsAndMetrics() {
            var result = engine(GenerationProvider.of("primary", scripted(DONE)))
                    .run(CardGameSwarm.NAME, "idea", RunOptions.defaults());

            var types = events.stream().map(SwarmEvent::eventType).toList();
            assertEquals("run.started", types.get(0));
            assertEquals("provider.resolved", types.get(1));
            assertEquals("run.completed", types.get(types.size() - 1));
            assertTrue(events.stream().allMatch(e -> e.runId().equals(result.runId())));
            assertEquals(1.0, meterRegistry.find("swarm.runs.total").tag("status", "COMPLETE").counter().count());
        }
    }

    // ── Failed runs ─────────────────────────────────────────────────

    @Nested
    @DisplayName("failed runs")
    class Failed {

        @Test
        @DisplayName("no reachable provider fails before any node runs")
        void providerUnavailable() {
            GenerationService down = (s, u, o) -> {
                throw new IllegalStateException("connection refused");
            };
            var lifecycle = new RunLifecycle();

            var ex = assertThrows(ProviderUnavailableException.class,
                    () -> engine(GenerationProvider.of("a", down), GenerationProvider.of("b", down))
                            .run(CardGameSwarm.NAME, "idea", RunOptions.defaults(), lifecycle));

            assertEquals(2, ex.getProbeFailures().size());
            assertEquals(0, nodeCalls.get());
            assertEquals(List.of(RunPhase.INIT, RunPhase.RESOLVING_PROVIDER, RunPhase.FAILED), lifecycle.history());
            assertEquals(1.0, meterRegistry.find("swarm.runs.total").tag("status", "FAILED").counter().count());
            assertEquals("run.failed", events.get(events.size() - 1).eventType());
        }

        @Test
        @DisplayName("no configured provider at all is unavailable")
        void noProviders() {
            assertThrows(ProviderUnavailableException.class,
                    () -> engine().run(CardGameSwarm.NAME, "idea", RunOptions.defaults()));
        }

        @Test
        @DisplayName("unknown swarm is rejected before probing")
        void unknownSwarm() {
            var probes = new AtomicInteger();
            GenerationService counting = (s, u, o) -> {
                probes.incrementAndGet();
                return "OK";
            };

            var ex = assertThrows(UnknownSwarmException.class,
                    () -> engine(GenerationProvider.of("p", counting)).run("chess", "idea", RunOptions.defaults()));

            assertEquals("chess", ex.getSwarmName());
            assertEquals(0, probes.get());
        }

        @Test
        @DisplayName("blank payload is rejected")
        void blankPayload() {
            var engine = engine(GenerationProvider.of("p", scripted(DONE)));
            assertThrows(IllegalArgumentException.class, () -> engine.run(CardGameSwarm.NAME, "  ", RunOptions.defaults()));
            assertThrows(IllegalArgumentException.class, () -> engine.run(CardGameSwarm.NAME, null, RunOptions.defaults()));
        }

        @Test
        @DisplayName("a node that exhausts its retries aborts the whole run")
        void generationFailureAborts() {
            GenerationService brokenSupervisor = (system, user, options) -> {
                if (system.contains("lead designer")) {
                    throw new IllegalStateException("500 Internal Server Error");
                }
                return scripted(DONE).generate(system, user, options);
            };
            var lifecycle = new RunLifecycle();

            var ex = assertThrows(NodeExecutionException.class,
                    () -> engine(GenerationProvider.of("p", brokenSupervisor))
                            .run(CardGameSwarm.NAME, "idea", RunOptions.defaults(), lifecycle));

            assertEquals("supervisor", ex.getNodeId());
            var failure = assertInstanceOf(GenerationFailure.class, ex.getCause());
            assertEquals(3, failure.getAttempts());
            assertEquals(RunPhase.FAILED, lifecycle.current());
        }

        @Test
        @DisplayName("a token cancelled up front stops the run before probing")
        void cancelledUpFront() {
            var token = new CancellationToken();
            token.cancel();

            assertThrows(RunCancelledException.class,
                    () -> engine(GenerationProvider.of("p", scripted(DONE)))
                            .run(CardGameSwarm.NAME, "idea", new RunOptions(2, token)));

            assertEquals(0, nodeCalls.get());
            assertEquals(1.0, meterRegistry.find("swarm.runs.total").tag("status", "CANCELLED").counter().count());
        }
    }
}

package com.swarmgraph.swarms.gameengine;

import com.swarmgraph.core.llm.Extraction;
import com.swarmgraph.core.llm.GenerationProvider;
import com.swarmgraph.core.llm.ResultExtractor;
import com.swarmgraph.core.llm.RetryingCaller;
import com.swarmgraph.core.nodes.AssemblyInputs;
import com.swarmgraph.core.nodes.RunContext;
import com.swarmgraph.core.state.StateStore;
import com.swarmgraph.core.state.SwarmState;
import com.swarmgraph.core.state.Verdict;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class GameEngineSwarmTest {

    private final ResultExtractor extractor = new ResultExtractor();

    @Test
    @DisplayName("reads engine choice, files, mechanics, deployment and monetization")
    void assemblesParsedSections() {
        var sections = Map.of(
                GameEngineSwarm.ENGINE_DETECTOR, extractor.extract("""
                        {"selected_engine": "godot", "reasoning": "2D pixel art",
                         "alternatives": [{"engine": "unity", "pros": ["ecosystem"], "cons": ["licensing"]}]}"""),
                GameEngineSwarm.ENGINE_ADAPTER, extractor.extract(
                        "{\"project_files\": [{\"path\": \"main.gd\", \"language\": \"gdscript\", \"content\": \"extends Node\"}]}"),
                GameEngineSwarm.MECHANICS_BUILDER, extractor.extract(
                        "{\"mechanics\": [{\"name\": \"jump\", \"description\": \"double jump\", \"code\": \"...\"}]}"),
                GameEngineSwarm.PLATFORM_EXPORTER, extractor.extract(
                        "{\"deploy_guides\": [{\"platform\": \"web\", \"steps\": [\"export\", \"upload\"]}]}"),
                GameEngineSwarm.MONETIZATION_ADVISOR, extractor.extract(
                        "{\"strategy\": \"freemium\", \"pricing\": {\"base_price\": \"0\"}, \"store_requirements\": [\"age rating\"]}"));
        var verdict = new Verdict(false, "Consistent plan", List.of(), Map.of(), true);

        var report = GameEngineSwarm.assemble(new AssemblyInputs("platformer", 0, sections, verdict));

        assertEquals("godot", report.selectedEngine());
        assertEquals("unity", report.alternatives().get(0).engine());
        assertEquals("main.gd", report.projectFiles().get(0).path());
        assertEquals("jump", report.mechanics().get(0).name());
        assertEquals(List.of("export", "upload"), report.deployGuides().get(0).steps());
        assertEquals(new GameEngineReport.Monetization("freemium", "0", List.of("age rating")), report.monetization());
        assertEquals("Consistent plan", report.validationSummary());
        assertEquals(GameEngineSwarm.NEUTRAL_PLAYTEST_SCORE, report.playtestScore());
        assertTrue(report.defaultedSections().isEmpty());
    }

    @Test
    @DisplayName("defaults to unity and premium pricing when sections fail")
    void defaults() {
        var report = GameEngineSwarm.assemble(new AssemblyInputs("platformer", 0,
                Map.<String, Extraction>of(), Verdict.unparsed(Map.of())));

        assertEquals(GameEngineSwarm.DEFAULT_ENGINE, report.selectedEngine());
        assertEquals(GameEngineReport.Monetization.premiumDefault(), report.monetization());
        assertEquals("Validation unavailable.", report.validationSummary());
        assertEquals(GameEngineSwarm.NEUTRAL_PLAYTEST_SCORE, report.playtestScore());
        assertEquals(6, report.defaultedSections().size());
    }

    // ── playtest score and looping ──────────────────────────────────

    private static Verdict scored(boolean needsIteration, Object overall) {
        return new Verdict(needsIteration, "", List.of(),
                Map.<String, Object>of("playtest_score", Map.of("overall", overall)), true);
    }

    private static SwarmState afterPass(Verdict verdict, int iteration, int maxIterations) {
        var report = GameEngineSwarm.assemble(new AssemblyInputs("platformer", iteration - 1,
                Map.<String, Extraction>of(), verdict));
        return StateStore.merge(SwarmState.initial("RUN-1", "platformer", maxIterations), Map.of(
                SwarmState.MERGED_VERDICT, verdict,
                SwarmState.REPORT, report,
                SwarmState.ITERATION, iteration));
    }

    @Test
    @DisplayName("reads the supervisor's playtest score and clamps it to 0-10")
    void playtestScore() {
        assertEquals(7.5, GameEngineSwarm.playtestScore(scored(false, 7.5)));
        assertEquals(3.0, GameEngineSwarm.playtestScore(scored(false, "3")));
        assertEquals(10.0, GameEngineSwarm.playtestScore(scored(false, 42)));
        assertEquals(0.0, GameEngineSwarm.playtestScore(scored(false, -1)));
    }

    @Test
    @DisplayName("a low playtest score loops even when the supervisor is satisfied")
    void lowScoreLoops() {
        var edge = new GameEngineSwarm().graph().conditionalEdge();

        assertTrue(edge.shouldLoop(afterPass(scored(false, 2), 1, 2)));
        assertFalse(edge.shouldLoop(afterPass(scored(false, 6), 1, 2)));
        assertTrue(edge.shouldLoop(afterPass(scored(true, 6), 1, 2)));
    }

    @Test
    @DisplayName("a low playtest score cannot push past the iteration ceiling")
    void lowScoreStopsAtCeiling() {
        var edge = new GameEngineSwarm().graph().conditionalEdge();

        assertFalse(edge.shouldLoop(afterPass(scored(false, 1), 2, 2)));
    }

    @Test
    @DisplayName("an unparsed verdict scores neutral and finalizes")
    void unparsedVerdictFinalizes() {
        var edge = new GameEngineSwarm().graph().conditionalEdge();

        assertFalse(edge.shouldLoop(afterPass(Verdict.unparsed(Map.of("raw", "oops")), 1, 2)));
    }

    @Test
    @DisplayName("downstream prompts quote a truncated upstream excerpt")
    void upstreamExcerpt() {
        var adapter = new GameEngineSwarm().graph().node(GameEngineSwarm.ENGINE_ADAPTER);
        var userMessages = new ArrayList<String>();
        var context = new RunContext("game-engine", GenerationProvider.of("fake", (s, u, o) -> {
            userMessages.add(u);
            return "{}";
        }), new RetryingCaller(1, Duration.ZERO, d -> { }), extractor, null, null, null);
        var state = StateStore.merge(SwarmState.initial("RUN-1", "platformer", 2),
                Map.of(SwarmState.SPECIALIST_RESULTS, Map.of(GameEngineSwarm.ENGINE_DETECTOR, "d".repeat(5000))));

        adapter.execute(state, context);

        assertEquals("Game Idea:\nplatformer\n\nEngine Detection Analysis:\n" + "d".repeat(2000),
                userMessages.get(0));
    }

    @Test
    @DisplayName("a missing upstream output is quoted as N/A")
    void missingUpstream() {
        var exporter = new GameEngineSwarm().graph().node(GameEngineSwarm.PLATFORM_EXPORTER);
        var userMessages = new ArrayList<String>();
        var context = new RunContext("game-engine", GenerationProvider.of("fake", (s, u, o) -> {
            userMessages.add(u);
            return "{}";
        }), new RetryingCaller(1, Duration.ZERO, d -> { }), extractor, null, null, null);

        exporter.execute(SwarmState.initial("RUN-1", "platformer", 2), context);

        assertTrue(userMessages.get(0).endsWith("Supervisor Validation:\nN/A"));
    }

    @Test
    void describesItself() {
        var swarm = new GameEngineSwarm();
        assertEquals("game-engine", swarm.name());
        assertEquals(List.of(
                List.of("engine-detector"),
                List.of("engine-adapter", "mechanics-builder"),
                List.of("supervisor"),
                List.of("platform-exporter", "monetization-advisor"),
                List.of("assembler")), swarm.graph().rounds());
    }
}

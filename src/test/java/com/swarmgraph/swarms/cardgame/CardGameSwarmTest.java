package com.swarmgraph.swarms.cardgame;

import com.swarmgraph.core.llm.Extraction;
import com.swarmgraph.core.llm.ResultExtractor;
import com.swarmgraph.core.nodes.AssemblyInputs;
import com.swarmgraph.core.state.Verdict;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CardGameSwarmTest {

    private final ResultExtractor extractor = new ResultExtractor();

    @Test
    @DisplayName("folds parsed sections into the design document")
    void assemblesParsedSections() {
        var sections = Map.of(
                CardGameSwarm.RULES_DESIGNER, extractor.extract("""
                        ```json
                        {"title": "Dragon Duel", "players": 2, "components": ["40-card deck"],
                         "rules": ["Draw two", "Play one"], "win_condition": "Reduce opponent to 0 life"}
                        ```"""),
                CardGameSwarm.BALANCE_ANALYST, extractor.extract(
                        "{\"balance_score\": 8, \"risks\": [\"first-player advantage\"], \"recommendations\": [\"mulligan\"]}"));
        var verdict = new Verdict(false, "Balanced and playable", List.of(), Map.of(), true);

        var report = CardGameSwarm.assemble(new AssemblyInputs("dragons", 0, sections, verdict));

        assertEquals("Dragon Duel", report.title());
        assertEquals(2, report.players());
        assertEquals(List.of("Draw two", "Play one"), report.rules());
        assertEquals("Reduce opponent to 0 life", report.winCondition());
        assertEquals(8.0, report.balanceScore());
        assertEquals(List.of("mulligan"), report.recommendations());
        assertEquals("Balanced and playable", report.reviewSummary());
        assertTrue(report.defaultedSections().isEmpty());
    }

    @Test
    @DisplayName("player counts outside a playable range are clamped")
    void playerCountClamped() {
        var huge = Map.of(CardGameSwarm.RULES_DESIGNER, extractor.extract("{\"players\": 1e12}"));
        var negative = Map.of(CardGameSwarm.RULES_DESIGNER, extractor.extract("{\"players\": -3}"));
        var verdict = new Verdict(false, "", List.of(), Map.of(), true);

        assertEquals(CardGameSwarm.MAX_PLAYERS,
                CardGameSwarm.assemble(new AssemblyInputs("dragons", 0, huge, verdict)).players());
        assertEquals(1, CardGameSwarm.assemble(new AssemblyInputs("dragons", 0, negative, verdict)).players());
    }

    @Test
    @DisplayName("unparseable sections fall back to defaults instead of failing")
    void defaultsForFailedSections() {
        var sections = Map.<String, Extraction>of(
                CardGameSwarm.RULES_DESIGNER, extractor.extract("Sorry, I cannot help with that."));
        var verdict = Verdict.unparsed(Map.of("raw", "hmm"));

        var report = CardGameSwarm.assemble(new AssemblyInputs("dragons", 0, sections, verdict));

        assertEquals("Untitled card game", report.title());
        assertEquals(2, report.players());
        assertEquals(5.0, report.balanceScore());
        assertEquals("Review unavailable.", report.reviewSummary());
        assertEquals(List.of(CardGameSwarm.RULES_DESIGNER, CardGameSwarm.BALANCE_ANALYST, CardGameSwarm.SUPERVISOR),
                report.defaultedSections());
    }

    @Test
    void describesItself() {
        var swarm = new CardGameSwarm();
        assertEquals("card-game", swarm.name());
        assertFalse(swarm.description().isBlank());
        assertEquals(List.of(CardGameSwarm.RULES_DESIGNER, CardGameSwarm.BALANCE_ANALYST),
                swarm.graph().entryNodeIds());
    }
}

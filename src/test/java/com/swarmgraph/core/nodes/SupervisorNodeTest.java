package com.swarmgraph.core.nodes;

import com.swarmgraph.core.llm.Extraction;
import com.swarmgraph.core.llm.GenerationOptions;
import com.swarmgraph.core.state.SwarmState;
import com.swarmgraph.core.state.Verdict;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static com.swarmgraph.core.nodes.NodeTestSupport.*;
import static org.junit.jupiter.api.Assertions.*;

class SupervisorNodeTest {

    private final SupervisorNode supervisor = new SupervisorNode("supervisor", "Review.",
            GenerationOptions.of(0.2, 2048), "rules", "balance");

    @Test
    @DisplayName("review prompt lists upstream outputs under upper-cased headings")
    void reviewPrompt() {
        var state = withResults("dragon duel", Map.of("rules", "{\"title\":\"Dragons\"}"));

        String prompt = supervisor.reviewPrompt(PromptInputs.of(state, supervisor.descriptor()));

        assertEquals("""
                Request: dragon duel

                === RULES ===
                {"title":"Dragons"}

                === BALANCE ===
                (no output)""", prompt);
    }

    @Test
    @DisplayName("a parsed review becomes the merged verdict and is stored for downstream nodes")
    void parsedVerdict() {
        var prompts = new ArrayList<String>();
        String review = "{\"needs_iteration\": true, \"summary\": \"Needs work\", \"issues\": [\"unclear scoring\"]}";

        var update = supervisor.execute(withResults("idea", Map.of("rules", "{}", "balance", "{}")),
                context((s, u, o) -> {
                    prompts.add(s);
                    return review;
                }));

        var verdict = (Verdict) update.get(SwarmState.MERGED_VERDICT);
        assertTrue(verdict.parsed());
        assertTrue(verdict.needsIteration());
        assertEquals("Needs work", verdict.summary());
        assertEquals(List.of("unclear scoring"), verdict.issues());
        assertEquals(Map.of("supervisor", review), update.get(SwarmState.SPECIALIST_RESULTS));
        assertEquals(List.of("Review."), prompts);
    }

    @Test
    @DisplayName("an unparseable review never asks for another pass")
    void unparsedVerdict() {
        var update = supervisor.execute(state("idea"), context((s, u, o) -> "Looks good to me!"));

        var verdict = (Verdict) update.get(SwarmState.MERGED_VERDICT);
        assertFalse(verdict.parsed());
        assertFalse(verdict.needsIteration());
        assertEquals("Looks good to me!", verdict.payload().get("raw"));
    }

    @Test
    @DisplayName("accepts the camel-case iteration flag")
    void camelCaseFlag() {
        var verdict = SupervisorNode.toVerdict(Extraction.parsed(Map.of("needsIteration", true)));
        assertTrue(verdict.needsIteration());
    }
}

package com.swarmgraph.swarms.cardgame;

import com.swarmgraph.core.engine.SwarmDefinition;
import com.swarmgraph.core.graph.SwarmGraph;
import com.swarmgraph.core.llm.GenerationOptions;
import com.swarmgraph.core.nodes.AssemblerNode;
import com.swarmgraph.core.nodes.AssemblyInputs;
import com.swarmgraph.core.nodes.PromptTemplate;
import com.swarmgraph.core.nodes.SpecialistNode;
import com.swarmgraph.core.nodes.SupervisorNode;
import org.springframework.stereotype.Component;

import java.util.ArrayList;

/**
 * Designs a tabletop card game.
 * <pre>
 *   [rules-designer, balance-analyst] -> supervisor -> assembler -> (iterate | finalize)
 * </pre>
 */
@Component
public class CardGameSwarm implements SwarmDefinition {

    public static final String NAME = "card-game";

    static final String RULES_DESIGNER = "rules-designer";
    static final String BALANCE_ANALYST = "balance-analyst";
    static final String SUPERVISOR = "supervisor";
    static final String ASSEMBLER = "assembler";

    static final int MAX_PLAYERS = 12;

    private static final String RULES_PROMPT = """
            You are a card game designer. Turn the user's idea into a complete, playable rule set.

            Return JSON only:
            {
              "title": "<game title>",
              "players": <player count>,
              "components": ["<deck, tokens, ...>"],
              "rules": ["<one rule per entry, in play order>"],
              "win_condition": "<how the game ends and who wins>"
            }""";

    private static final String BALANCE_PROMPT = """
            You are a game balance analyst. Assess the idea for dominant strategies, first-player
            advantage, runaway leaders and dead turns.

            Return JSON only:
            {
              "balance_score": <1-10>,
              "risks": ["<balance risk>"],
              "recommendations": ["<concrete fix>"]
            }""";

    private static final String SUPERVISOR_PROMPT = """
            You are the lead designer reviewing your team's work. Check that the rules and the
            balance analysis agree, that every recommendation is addressed, and that the game can
            be played start to finish from the rules alone.

            Return JSON only:
            {
              "needs_iteration": <true if another design pass is required>,
              "summary": "<2-3 sentence assessment>",
              "issues": ["<problem that still needs work>"]
            }""";

    private final SwarmGraph graph;

    public CardGameSwarm() {
        this.graph = SwarmGraph.builder(NAME)
                .node(new SpecialistNode(RULES_DESIGNER, RULES_PROMPT,
                        PromptTemplate.payloadOnly(), GenerationOptions.of(0.7, 4096)))
                .node(new SpecialistNode(BALANCE_ANALYST, BALANCE_PROMPT,
                        PromptTemplate.payloadOnly(), GenerationOptions.of(0.3, 2048)))
                .node(new SupervisorNode(SUPERVISOR, SUPERVISOR_PROMPT,
                        GenerationOptions.of(0.2, 2048), RULES_DESIGNER, BALANCE_ANALYST))
                .node(new AssemblerNode(ASSEMBLER, CardGameSwarm::assemble, SUPERVISOR))
                .build();
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public String description() {
        return "Designs a tabletop card game: rules, balance review and a final design document";
    }

    @Override
    public SwarmGraph graph() {
        return graph;
    }

    static CardGameReport assemble(AssemblyInputs inputs) {
        var rules = inputs.section(RULES_DESIGNER);
        var balance = inputs.section(BALANCE_ANALYST);
        var verdict = inputs.verdict();

        var defaulted = new ArrayList<String>();
        if (!rules.ok()) {
            defaulted.add(RULES_DESIGNER);
        }
        if (!balance.ok()) {
            defaulted.add(BALANCE_ANALYST);
        }
        if (!verdict.parsed()) {
            defaulted.add(SUPERVISOR);
        }

        return new CardGameReport(
                rules.string("title", "Untitled card game"),
                rules.integer("players", 2, 1, MAX_PLAYERS),
                rules.strings("components"),
                rules.strings("rules"),
                rules.string("win_condition", ""),
                balance.number("balance_score", 5),
                balance.strings("risks"),
                balance.strings("recommendations"),
                verdict.parsed() ? verdict.summary() : "Review unavailable.",
                verdict.issues(),
                defaulted);
    }
}

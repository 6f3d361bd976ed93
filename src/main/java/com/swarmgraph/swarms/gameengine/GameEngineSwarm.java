package com.swarmgraph.swarms.gameengine;

import com.swarmgraph.core.engine.SwarmDefinition;
import com.swarmgraph.core.graph.ConditionalEdge;
import com.swarmgraph.core.graph.SwarmGraph;
import com.swarmgraph.core.llm.Extraction;
import com.swarmgraph.core.llm.GenerationOptions;
import com.swarmgraph.core.nodes.AssemblerNode;
import com.swarmgraph.core.nodes.AssemblyInputs;
import com.swarmgraph.core.nodes.PromptTemplate;
import com.swarmgraph.core.nodes.SpecialistNode;
import com.swarmgraph.core.nodes.SupervisorNode;
import com.swarmgraph.core.state.SwarmState;
import com.swarmgraph.core.state.Verdict;
import com.swarmgraph.swarms.gameengine.GameEngineReport.DeployGuide;
import com.swarmgraph.swarms.gameengine.GameEngineReport.EngineAlternative;
import com.swarmgraph.swarms.gameengine.GameEngineReport.Mechanic;
import com.swarmgraph.swarms.gameengine.GameEngineReport.Monetization;
import com.swarmgraph.swarms.gameengine.GameEngineReport.ProjectFile;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Selects a game engine for an idea and plans the project around it.
 * <pre>
 *   engine-detector -> [engine-adapter, mechanics-builder]
 *       -> supervisor -> [platform-exporter, monetization-advisor]
 *       -> assembler -> (iterate | finalize)
 * </pre>
 * Loops when the supervisor asks for it or the playtest score is below 4.
 */
@Component
public class GameEngineSwarm implements SwarmDefinition {

    public static final String NAME = "game-engine";

    static final String ENGINE_DETECTOR = "engine-detector";
    static final String ENGINE_ADAPTER = "engine-adapter";
    static final String MECHANICS_BUILDER = "mechanics-builder";
    static final String SUPERVISOR = "supervisor";
    static final String PLATFORM_EXPORTER = "platform-exporter";
    static final String MONETIZATION_ADVISOR = "monetization-advisor";
    static final String ASSEMBLER = "assembler";

    static final String DEFAULT_ENGINE = "unity";

    /** Plans scoring below this are sent back for another pass. */
    static final double PLAYTEST_THRESHOLD = 4.0;
    static final double NEUTRAL_PLAYTEST_SCORE = 5.0;

    private static final int UPSTREAM_EXCERPT = 2000;

    private static final String DETECTOR_PROMPT = """
            You are a game engine selection specialist. Weigh 2D versus 3D needs, target
            platforms, team experience, performance and asset pipeline, then pick the best engine
            among Unity, GameMaker, Bevy, Defold, Godot and Unreal. If the user already chose an
            engine, validate the choice and still list alternatives.

            Return JSON only:
            {
              "selected_engine": "<unity|gamemaker|bevy|defold|godot|unreal>",
              "reasoning": "<2-3 sentences>",
              "alternatives": [{ "engine": "<name>", "pros": ["<pro>"], "cons": ["<con>"] }]
            }""";

    private static final String ADAPTER_PROMPT = """
            You are an engine adapter. Lay out the project structure for the selected engine and
            write the starter source files in its native language.

            Return JSON only:
            {
              "project_files": [{ "path": "<relative path>", "language": "<language>", "content": "<file content>" }]
            }""";

    private static final String MECHANICS_PROMPT = """
            You are a gameplay programmer. Implement the core loop, scoring, AI and physics the
            idea needs, targeting the selected engine.

            Return JSON only:
            {
              "mechanics": [{ "name": "<mechanic>", "description": "<what it does>", "code": "<engine code>" }]
            }""";

    private static final String SUPERVISOR_PROMPT = """
            You are the technical director. Check that the generated code matches the selected
            engine, that mechanics and project files fit together, and that nothing essential is
            missing. Score the plan as a playtester would, 0 to 10 overall.

            Return JSON only:
            {
              "needs_iteration": <true if another pass is required>,
              "playtest_score": { "overall": <0-10> },
              "summary": "<2-3 sentence assessment>",
              "issues": ["<problem that still needs work>"]
            }""";

    private static final String EXPORTER_PROMPT = """
            You are a platform export specialist. Give step-by-step deployment guides for the
            platforms this game should ship on.

            Return JSON only:
            {
              "deploy_guides": [{ "platform": "<platform>", "steps": ["<step>"] }]
            }""";

    private static final String MONETIZATION_PROMPT = """
            You are a game monetization advisor. Recommend a strategy (premium, ads, in-app
            purchases or a mix), a price point and the store requirements to meet.

            Return JSON only:
            {
              "strategy": "<premium|freemium|ads|hybrid>",
              "pricing": { "base_price": "<price>" },
              "store_requirements": ["<requirement>"]
            }""";

    private final SwarmGraph graph;

    public GameEngineSwarm() {
        this.graph = SwarmGraph.builder(NAME)
                .node(new SpecialistNode(ENGINE_DETECTOR, DETECTOR_PROMPT,
                        PromptTemplate.payloadOnly(), GenerationOptions.of(0.3, 4096)))
                .node(new SpecialistNode(ENGINE_ADAPTER, ADAPTER_PROMPT,
                        fromUpstream(ENGINE_DETECTOR, "Engine Detection Analysis"),
                        GenerationOptions.of(0.3, 8192), ENGINE_DETECTOR))
                .node(new SpecialistNode(MECHANICS_BUILDER, MECHANICS_PROMPT,
                        fromUpstream(ENGINE_DETECTOR, "Engine Detection Analysis"),
                        GenerationOptions.of(0.4, 8192), ENGINE_DETECTOR))
                .node(new SupervisorNode(SUPERVISOR, SUPERVISOR_PROMPT,
                        GenerationOptions.of(0.2, 4096), ENGINE_DETECTOR, ENGINE_ADAPTER, MECHANICS_BUILDER))
                .node(new SpecialistNode(PLATFORM_EXPORTER, EXPORTER_PROMPT,
                        fromUpstream(SUPERVISOR, "Supervisor Validation"),
                        GenerationOptions.of(0.2, 4096), SUPERVISOR))
                .node(new SpecialistNode(MONETIZATION_ADVISOR, MONETIZATION_PROMPT,
                        fromUpstream(SUPERVISOR, "Supervisor Validation"),
                        GenerationOptions.of(0.3, 4096), SUPERVISOR))
                .node(new AssemblerNode(ASSEMBLER, GameEngineSwarm::assemble,
                        PLATFORM_EXPORTER, MONETIZATION_ADVISOR))
                .loopWhen(ConditionalEdge.VERDICT_REQUESTS_ITERATION.or(GameEngineSwarm::scoredTooLow))
                .build();
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public String description() {
        return "Selects a game engine for an idea and plans code, mechanics, deployment and monetization";
    }

    @Override
    public SwarmGraph graph() {
        return graph;
    }

    private static PromptTemplate fromUpstream(String upstreamId, String heading) {
        return inputs -> {
            String upstream = inputs.result(upstreamId);
            if (upstream.length() > UPSTREAM_EXCERPT) {
                upstream = upstream.substring(0, UPSTREAM_EXCERPT);
            }
            return "Game Idea:\n" + inputs.payload() + "\n\n" + heading + ":\n"
                    + (upstream.isBlank() ? "N/A" : upstream);
        };
    }

    static boolean scoredTooLow(SwarmState state) {
        return state.report()
                .filter(GameEngineReport.class::isInstance)
                .map(GameEngineReport.class::cast)
                .map(r -> r.playtestScore() < PLAYTEST_THRESHOLD)
                .orElse(false);
    }

    static double playtestScore(Verdict verdict) {
        double overall = new Extraction(verdict.payload(), verdict.parsed())
                .section("playtest_score")
                .number("overall", NEUTRAL_PLAYTEST_SCORE);
        return Math.max(0.0, Math.min(10.0, overall));
    }

    static GameEngineReport assemble(AssemblyInputs inputs) {
        var detector = inputs.section(ENGINE_DETECTOR);
        var adapter = inputs.section(ENGINE_ADAPTER);
        var mechanics = inputs.section(MECHANICS_BUILDER);
        var exporter = inputs.section(PLATFORM_EXPORTER);
        var monetization = inputs.section(MONETIZATION_ADVISOR);
        var verdict = inputs.verdict();

        var defaulted = new ArrayList<String>();
        for (var id : List.of(ENGINE_DETECTOR, ENGINE_ADAPTER, MECHANICS_BUILDER, PLATFORM_EXPORTER, MONETIZATION_ADVISOR)) {
            if (!inputs.section(id).ok()) {
                defaulted.add(id);
            }
        }
        if (!verdict.parsed()) {
            defaulted.add(SUPERVISOR);
        }

        return new GameEngineReport(
                detector.string("selected_engine", DEFAULT_ENGINE),
                detector.string("reasoning", ""),
                detector.objects("alternatives").stream()
                        .map(a -> new EngineAlternative(a.string("engine", ""), a.strings("pros"), a.strings("cons")))
                        .toList(),
                adapter.objects("project_files").stream()
                        .map(f -> new ProjectFile(f.string("path", ""), f.string("language", ""), f.string("content", "")))
                        .toList(),
                mechanics.objects("mechanics").stream()
                        .map(m -> new Mechanic(m.string("name", ""), m.string("description", ""), m.string("code", "")))
                        .toList(),
                exporter.objects("deploy_guides").stream()
                        .map(d -> new DeployGuide(d.string("platform", ""), d.strings("steps")))
                        .toList(),
                monetization(monetization),
                playtestScore(verdict),
                verdict.parsed() ? verdict.summary() : "Validation unavailable.",
                verdict.issues(),
                defaulted);
    }

    private static Monetization monetization(Extraction section) {
        if (!section.ok()) {
            return Monetization.premiumDefault();
        }
        return new Monetization(
                section.string("strategy", "premium"),
                section.section("pricing").string("base_price", "TBD"),
                section.strings("store_requirements"));
    }
}

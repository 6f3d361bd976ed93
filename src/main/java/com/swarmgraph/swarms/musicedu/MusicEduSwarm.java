package com.swarmgraph.swarms.musicedu;

import com.swarmgraph.core.engine.SwarmDefinition;
import com.swarmgraph.core.graph.SwarmGraph;
import com.swarmgraph.core.llm.Extraction;
import com.swarmgraph.core.llm.GenerationOptions;
import com.swarmgraph.core.nodes.AssemblerNode;
import com.swarmgraph.core.nodes.AssemblyInputs;
import com.swarmgraph.core.nodes.PromptInputs;
import com.swarmgraph.core.nodes.PromptTemplate;
import com.swarmgraph.core.nodes.SpecialistNode;
import com.swarmgraph.core.nodes.SupervisorNode;
import com.swarmgraph.swarms.musicedu.MusicEduReport.Calculation;
import com.swarmgraph.swarms.musicedu.MusicEduReport.Composition;
import com.swarmgraph.swarms.musicedu.MusicEduReport.Concept;
import com.swarmgraph.swarms.musicedu.MusicEduReport.EducationScore;
import com.swarmgraph.swarms.musicedu.MusicEduReport.FrequencyEntry;
import com.swarmgraph.swarms.musicedu.MusicEduReport.Instrument;
import com.swarmgraph.swarms.musicedu.MusicEduReport.Lesson;
import com.swarmgraph.swarms.musicedu.MusicEduReport.Monetization;
import com.swarmgraph.swarms.musicedu.MusicEduReport.Tier;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Plans an interactive music education app.
 * <pre>
 *   [theory-analyzer, instrument-simulator]
 *   theory-analyzer -> composition-generator
 *   instrument-simulator -> lesson-builder
 *   both -> supervisor -> [math-harmonics, monetization-advisor] -> assembler -> (iterate | finalize)
 * </pre>
 */
@Component
public class MusicEduSwarm implements SwarmDefinition {

    public static final String NAME = "music-edu";

    static final String THEORY_ANALYZER = "theory-analyzer";
    static final String INSTRUMENT_SIMULATOR = "instrument-simulator";
    static final String COMPOSITION_GENERATOR = "composition-generator";
    static final String LESSON_BUILDER = "lesson-builder";
    static final String SUPERVISOR = "supervisor";
    static final String MATH_HARMONICS = "math-harmonics";
    static final String MONETIZATION_ADVISOR = "monetization-advisor";
    static final String ASSEMBLER = "assembler";

    private static final String[] NOTE_NAMES =
            {"C", "C#", "D", "D#", "E", "F", "F#", "G", "G#", "A", "A#", "B"};

    private static final String THEORY_PROMPT = """
            You are a music theory educator. Identify the scales, chords, progressions and
            intervals the idea should teach, and order them into a learning path.

            Return JSON only:
            {
              "concepts": [{ "name": "<concept>", "category": "<scale|chord|progression|rhythm|interval|key>",
                             "description": "<explanation>", "difficulty": "<beginner|intermediate|advanced>" }],
              "learning_path": ["<concept name, in teaching order>"]
            }""";

    private static final String INSTRUMENT_PROMPT = """
            You are a virtual instrument designer. Specify the on-screen instruments the app needs
            and their playable range.

            Return JSON only:
            {
              "instruments": [{ "type": "<piano|guitar|drums|staff>", "range": "<e.g. C3-C6>" }]
            }""";

    private static final String COMPOSITION_PROMPT = """
            You are an algorithmic composer. Write short pieces that demonstrate the identified
            theory concepts.

            Return JSON only:
            {
              "compositions": [{ "name": "<piece>", "tempo_bpm": <bpm>, "time_signature": "<4/4>", "key": "<key>" }]
            }""";

    private static final String LESSON_PROMPT = """
            You are a music pedagogy expert. Build progressive lessons whose exercises use the
            available instruments.

            Return JSON only:
            {
              "lessons": [{ "title": "<title>", "level": "<beginner|intermediate|advanced>",
                            "objectives": ["<goal>"], "exercise_count": <n>, "estimated_minutes": <minutes> }]
            }""";

    private static final String SUPERVISOR_PROMPT = """
            You are the curriculum lead. Check that compositions demonstrate the theory concepts,
            that lessons use the configured instruments, and that difficulty progresses sensibly.

            Return JSON only:
            {
              "needs_iteration": <true if another pass is required>,
              "summary": "<2-3 sentence assessment>",
              "issues": ["<problem that still needs work>"]
            }""";

    private static final String MATH_PROMPT = """
            You are an acoustics mathematician. Validate the frequency math and interval ratios
            the app relies on.

            Return JSON only:
            {
              "calculations": [{ "name": "<formula name>", "formula": "<expression>", "verified": <true|false> }],
              "frequency_table": [{ "note": "<e.g. A4>", "frequency_hz": <hz>, "midi_number": <n> }]
            }""";

    private static final String MONETIZATION_PROMPT = """
            You are an ed-tech monetization advisor. Recommend a business model, pricing tiers and
            a content strategy.

            Return JSON only:
            {
              "model": "<freemium|subscription|course-marketplace>",
              "tiers": [{ "name": "<tier>", "price": "<price>", "features": ["<feature>"] }],
              "content_strategy": "<strategy>"
            }""";

    private final SwarmGraph graph;

    public MusicEduSwarm() {
        this.graph = SwarmGraph.builder(NAME)
                .node(new SpecialistNode(THEORY_ANALYZER, THEORY_PROMPT,
                        PromptTemplate.payloadOnly(), GenerationOptions.of(0.4, 4096)))
                .node(new SpecialistNode(INSTRUMENT_SIMULATOR, INSTRUMENT_PROMPT,
                        PromptTemplate.payloadOnly(), GenerationOptions.of(0.4, 4096)))
                .node(new SpecialistNode(COMPOSITION_GENERATOR, COMPOSITION_PROMPT,
                        sections("Generate compositions that teach and demonstrate the identified theory concepts.",
                                THEORY_ANALYZER, "Theory Analysis"),
                        GenerationOptions.of(0.7, 8192), THEORY_ANALYZER))
                .node(new SpecialistNode(LESSON_BUILDER, LESSON_PROMPT,
                        sections("Create lessons that use the available instruments for interactive exercises.",
                                INSTRUMENT_SIMULATOR, "Instrument Configurations"),
                        GenerationOptions.of(0.5, 8192), INSTRUMENT_SIMULATOR))
                .node(new SupervisorNode(SUPERVISOR, SUPERVISOR_PROMPT, GenerationOptions.of(0.2, 4096),
                        THEORY_ANALYZER, INSTRUMENT_SIMULATOR, COMPOSITION_GENERATOR, LESSON_BUILDER))
                .node(new SpecialistNode(MATH_HARMONICS, MATH_PROMPT,
                        sections("Validate all frequency math and interval ratios.",
                                THEORY_ANALYZER, "Theory Concepts", SUPERVISOR, "Supervisor Notes"),
                        GenerationOptions.of(0.2, 4096), SUPERVISOR, THEORY_ANALYZER))
                .node(new SpecialistNode(MONETIZATION_ADVISOR, MONETIZATION_PROMPT,
                        sections("Recommend how to fund ongoing content creation.",
                                LESSON_BUILDER, "Lessons", SUPERVISOR, "Supervisor Notes"),
                        GenerationOptions.of(0.4, 4096), SUPERVISOR, LESSON_BUILDER))
                .node(new AssemblerNode(ASSEMBLER, MusicEduSwarm::assemble, MATH_HARMONICS, MONETIZATION_ADVISOR))
                .build();
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public String description() {
        return "Plans a music education app: theory, instruments, compositions, lessons and pricing";
    }

    @Override
    public SwarmGraph graph() {
        return graph;
    }

    /**
     * Template rendering the idea, then one headed section per (node id, heading) pair, then
     * the closing instruction.
     */
    private static PromptTemplate sections(String instruction, String... idHeadingPairs) {
        return (PromptInputs inputs) -> {
            var sb = new StringBuilder("Music Education Idea: ").append(inputs.payload()).append("\n\n");
            for (int i = 0; i < idHeadingPairs.length; i += 2) {
                String upstream = inputs.result(idHeadingPairs[i]);
                sb.append(idHeadingPairs[i + 1]).append(":\n")
                        .append(upstream.isBlank() ? "N/A" : upstream)
                        .append("\n\n");
            }
            return sb.append(instruction).toString();
        };
    }

    static MusicEduReport assemble(AssemblyInputs inputs) {
        var theory = inputs.section(THEORY_ANALYZER);
        var instrumentsSection = inputs.section(INSTRUMENT_SIMULATOR);
        var compositionSection = inputs.section(COMPOSITION_GENERATOR);
        var lessonSection = inputs.section(LESSON_BUILDER);
        var math = inputs.section(MATH_HARMONICS);
        var verdict = inputs.verdict();

        var concepts = theory.objects("concepts").stream()
                .map(c -> new Concept(c.string("name", ""), c.string("category", ""),
                        c.string("description", ""), c.string("difficulty", "beginner")))
                .toList();
        var instruments = instrumentsSection.objects("instruments").stream()
                .map(i -> new Instrument(i.string("type", "piano"), i.string("range", "")))
                .toList();
        var compositions = compositionSection.objects("compositions").stream()
                .map(c -> new Composition(c.string("name", ""), c.integer("tempo_bpm", 120, 20, 300),
                        c.string("time_signature", "4/4"), c.string("key", "C major")))
                .toList();
        var lessons = lessonSection.objects("lessons").stream()
                .map(l -> new Lesson(l.string("title", ""), l.string("level", "beginner"), l.strings("objectives"),
                        l.integer("exercise_count", 0, 0, 100), l.integer("estimated_minutes", 15, 1, 240)))
                .toList();
        var calculations = math.objects("calculations").stream()
                .map(c -> new Calculation(c.string("name", ""), c.string("formula", ""), c.bool("verified", false)))
                .toList();
        var frequencyTable = math.ok() && !math.objects("frequency_table").isEmpty()
                ? math.objects("frequency_table").stream()
                        .map(f -> new FrequencyEntry(f.string("note", ""), f.number("frequency_hz", 0),
                                f.integer("midi_number", 0, 0, 127)))
                        .toList()
                : equalTemperedOctave(4);

        var defaulted = new ArrayList<String>();
        for (var id : List.of(THEORY_ANALYZER, INSTRUMENT_SIMULATOR, COMPOSITION_GENERATOR, LESSON_BUILDER,
                MATH_HARMONICS, MONETIZATION_ADVISOR)) {
            if (!inputs.section(id).ok()) {
                defaulted.add(id);
            }
        }
        if (!verdict.parsed()) {
            defaulted.add(SUPERVISOR);
        }

        return new MusicEduReport(
                concepts,
                theory.strings("learning_path"),
                compositions,
                lessons,
                instruments,
                calculations,
                frequencyTable,
                monetization(inputs.section(MONETIZATION_ADVISOR)),
                score(concepts, lessons, instruments, compositions),
                verdict.parsed() && !verdict.summary().isBlank()
                        ? verdict.summary() : "Music education app generated successfully.",
                verdict.issues(),
                defaulted);
    }

    private static Monetization monetization(Extraction section) {
        var tiers = section.objects("tiers").stream()
                .map(t -> new Tier(t.string("name", ""), t.string("price", ""), t.strings("features")))
                .toList();
        return new Monetization(section.string("model", "freemium"), tiers, section.string("content_strategy", ""));
    }

    static EducationScore score(List<Concept> concepts, List<Lesson> lessons,
                                List<Instrument> instruments, List<Composition> compositions) {
        long exercises = lessons.stream().mapToLong(Lesson::exerciseCount).sum();
        int theoryDepth = clamp(concepts.size() * 2L);
        int interactivity = clamp(exercises * 2);
        int audio = clamp(instruments.size() * 2L + (compositions.isEmpty() ? 0 : 2));
        int pedagogy = clamp(lessons.size() * 2L);
        double overall = Math.round((theoryDepth + interactivity + audio + pedagogy) / 4.0 * 10) / 10.0;
        return new EducationScore(theoryDepth, interactivity, audio, pedagogy, overall);
    }

    private static int clamp(long value) {
        return (int) Math.min(10, Math.max(1, value));
    }

    /**
     * Twelve-tone equal temperament table for one octave, A4 = 440 Hz.
     */
    static List<FrequencyEntry> equalTemperedOctave(int octave) {
        var table = new ArrayList<FrequencyEntry>();
        for (int i = 0; i < NOTE_NAMES.length; i++) {
            int midi = (octave + 1) * 12 + i;
            double hz = 440.0 * Math.pow(2, (midi - 69) / 12.0);
            table.add(new FrequencyEntry(NOTE_NAMES[i] + octave, Math.round(hz * 100) / 100.0, midi));
        }
        return List.copyOf(table);
    }
}

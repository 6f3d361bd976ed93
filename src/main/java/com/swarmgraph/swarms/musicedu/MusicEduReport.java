package com.swarmgraph.swarms.musicedu;

import java.util.List;

/**
 * Music education app plan produced by the music-edu swarm.
 */
public record MusicEduReport(
    List<Concept> concepts,
    List<String> learningPath,
    List<Composition> compositions,
    List<Lesson> lessons,
    List<Instrument> instruments,
    List<Calculation> calculations,
    List<FrequencyEntry> frequencyTable,
    Monetization monetization,
    EducationScore score,
    String verdict,
    List<String> openIssues,
    List<String> defaultedSections
) {

    public record Concept(String name, String category, String description, String difficulty) {}

    public record Composition(String name, int tempoBpm, String timeSignature, String key) {}

    public record Lesson(String title, String level, List<String> objectives, int exerciseCount, int estimatedMinutes) {}

    public record Instrument(String type, String range) {}

    public record Calculation(String name, String formula, boolean verified) {}

    public record FrequencyEntry(String note, double frequencyHz, int midiNumber) {}

    public record Tier(String name, String price, List<String> features) {}

    public record Monetization(String model, List<Tier> tiers, String contentStrategy) {}

    /**
     * Scores on a 1-10 scale derived from the report's contents.
     */
    public record EducationScore(int theoryDepth, int interactivity, int audio, int pedagogy, double overall) {}
}

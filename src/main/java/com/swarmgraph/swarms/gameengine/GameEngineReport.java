package com.swarmgraph.swarms.gameengine;

import java.util.List;

/**
 * Game project plan produced by the game-engine swarm.
 */
public record GameEngineReport(
    String selectedEngine,
    String engineReasoning,
    List<EngineAlternative> alternatives,
    List<ProjectFile> projectFiles,
    List<Mechanic> mechanics,
    List<DeployGuide> deployGuides,
    Monetization monetization,
    double playtestScore,
    String validationSummary,
    List<String> openIssues,
    List<String> defaultedSections
) {

    public record EngineAlternative(String engine, List<String> pros, List<String> cons) {}

    public record ProjectFile(String path, String language, String content) {}

    public record Mechanic(String name, String description, String code) {}

    public record DeployGuide(String platform, List<String> steps) {}

    public record Monetization(String strategy, String basePrice, List<String> storeRequirements) {

        static Monetization premiumDefault() {
            return new Monetization("premium", "TBD", List.of());
        }
    }
}

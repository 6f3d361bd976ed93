package com.swarmgraph.swarms.cardgame;

import java.util.List;

/**
 * Final design document produced by the card-game swarm.
 */
public record CardGameReport(
    String title,
    int players,
    List<String> components,
    List<String> rules,
    String winCondition,
    double balanceScore,
    List<String> risks,
    List<String> recommendations,
    String reviewSummary,
    List<String> openIssues,
    List<String> defaultedSections
) {

    public CardGameReport {
        components = List.copyOf(components);
        rules = List.copyOf(rules);
        risks = List.copyOf(risks);
        recommendations = List.copyOf(recommendations);
        openIssues = List.copyOf(openIssues);
        defaultedSections = List.copyOf(defaultedSections);
    }
}

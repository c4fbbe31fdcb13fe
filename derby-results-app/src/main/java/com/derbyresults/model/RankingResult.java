package com.derbyresults.model;

import java.util.List;

/**
 * Output of the ranking engine: ordered class lists and the award identity lists.
 */
public record RankingResult(
    RankingPolicy policy,
    List<ClassRanking> classes,
    List<RacerKey> finalists,
    List<RacerKey> wildcards,
    List<RacerKey> excludedFinalsWinners
) {
    public RankingResult {
        classes = List.copyOf(classes);
        finalists = List.copyOf(finalists);
        wildcards = List.copyOf(wildcards);
        excludedFinalsWinners = List.copyOf(excludedFinalsWinners);
    }
}

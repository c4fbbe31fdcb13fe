package com.derbyresults.model;

/**
 * Scoring and award options for one ranking run.
 *
 * @param scoringMethod         average used to order racers
 * @param finalsFieldSize       target size of the finals field (finalists plus wildcards)
 * @param excludeFinalsWinners  whether top finals racers lose their den place labels
 * @param finalsWinnerCount     how many top finals racers are excluded
 */
public record RankingPolicy(
    ScoringMethod scoringMethod,
    int finalsFieldSize,
    boolean excludeFinalsWinners,
    int finalsWinnerCount
) {
    public static final int DEFAULT_FINALS_FIELD_SIZE = 12;
    public static final int DEFAULT_FINALS_WINNER_COUNT = 3;

    public RankingPolicy {
        if (scoringMethod == null) scoringMethod = ScoringMethod.DROP_SLOWEST;
        if (finalsFieldSize < 0) {
            throw new IllegalArgumentException("finalsFieldSize must be >= 0, was " + finalsFieldSize);
        }
        if (finalsWinnerCount < 0) {
            throw new IllegalArgumentException("finalsWinnerCount must be >= 0, was " + finalsWinnerCount);
        }
    }

    public static RankingPolicy defaults() {
        return new RankingPolicy(ScoringMethod.DROP_SLOWEST, DEFAULT_FINALS_FIELD_SIZE,
                                 true, DEFAULT_FINALS_WINNER_COUNT);
    }
}

package com.derbyresults.model;

/**
 * Per-request scoring options; null fields keep the configured default.
 */
public record PolicyOverrides(
    ScoringMethod scoringMethod,
    Integer finalsFieldSize,
    Boolean excludeFinalsWinners,
    Integer finalsWinnerCount
) {
    public RankingPolicy applyTo(RankingPolicy defaults) {
        return new RankingPolicy(
            scoringMethod != null ? scoringMethod : defaults.scoringMethod(),
            finalsFieldSize != null ? finalsFieldSize : defaults.finalsFieldSize(),
            excludeFinalsWinners != null ? excludeFinalsWinners : defaults.excludeFinalsWinners(),
            finalsWinnerCount != null ? finalsWinnerCount : defaults.finalsWinnerCount()
        );
    }
}

package com.derbyresults.model;

/**
 * Which per-racer average orders a class.
 */
public enum ScoringMethod {
    /** Mean of every finished heat. */
    ALL_HEATS,
    /** Mean with the single slowest heat discarded, as in official scoring. */
    DROP_SLOWEST;

    public double score(RacerClassStats stats) {
        return this == ALL_HEATS ? stats.avgTime() : stats.avgExceptSlowest();
    }
}

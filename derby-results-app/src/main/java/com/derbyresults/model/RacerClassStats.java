package com.derbyresults.model;

import java.util.List;

/**
 * Summary statistics for one racer in one standard class.
 * A racer with no finished heats has {@code raceCount == 0} and every numeric field zeroed.
 */
public record RacerClassStats(
    RacerKey racerKey,
    String carName,
    String className,
    List<Double> times,
    int raceCount,
    double avgTime,
    double avgExceptSlowest,
    double bestTime,
    double worstTime,
    double median,
    double stdDev
) {
    public RacerClassStats {
        times = times == null ? List.of() : List.copyOf(times);
    }

    public boolean hasFinished() {
        return raceCount > 0;
    }

    public String firstName() { return racerKey.firstName(); }
    public String lastName() { return racerKey.lastName(); }
    public String carNumber() { return racerKey.carNumber(); }
}

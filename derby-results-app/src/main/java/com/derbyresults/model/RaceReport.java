package com.derbyresults.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Everything one merge run produces. Built fresh on every run, never patched.
 */
public record RaceReport(
    List<CanonicalRecord> canonicalRecords,
    SanityReport sanityReport,
    Map<String, List<RacerClassStats>> classStats,
    RankingResult ranking,
    List<RacerSummary> racers,
    RaceTotals totals,
    List<FinalsComparison> finalsComparison,
    Map<String, Integer> mappingSummary
) {
    public RaceReport {
        canonicalRecords = List.copyOf(canonicalRecords);
        racers = List.copyOf(racers);
        finalsComparison = List.copyOf(finalsComparison);
        // copies keep display order
        classStats = Collections.unmodifiableMap(new LinkedHashMap<>(classStats));
        mappingSummary = Collections.unmodifiableMap(new LinkedHashMap<>(mappingSummary));
    }
}

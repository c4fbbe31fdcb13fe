package com.derbyresults.model;

/**
 * A finals entrant's den result next to their finals result. Den fields are null for finals-only racers.
 */
public record FinalsComparison(
    RacerKey racerKey,
    String denClass,
    Double denScore,
    double finalsScore
) {}

package com.derbyresults.model;

public record RacerSummary(
    RacerKey racerKey,
    String fullName,
    String carName,
    Integer year
) {}

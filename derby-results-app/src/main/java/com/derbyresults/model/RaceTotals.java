package com.derbyresults.model;

public record RaceTotals(
    int totalRaces,     // finished heat rows
    int totalHeats,     // distinct class/round/heat with a finished row
    int racerCount
) {}

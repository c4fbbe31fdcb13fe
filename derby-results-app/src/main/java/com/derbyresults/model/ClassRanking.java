package com.derbyresults.model;

import java.util.List;

public record ClassRanking(
    String className,
    boolean finals,
    List<RankedEntry> entries
) {
    public ClassRanking {
        entries = entries == null ? List.of() : List.copyOf(entries);
    }
}

package com.derbyresults.model;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Rows extracted from one race database file, tagged with the season year.
 */
public record SourceBundle(
    String sourceName,
    Integer year,
    List<RawRecord> rawRecords
) {
    public SourceBundle {
        rawRecords = rawRecords == null ? List.of() : List.copyOf(rawRecords);
    }

    /** Distinct class labels in first-seen order. */
    public Set<String> classLabels() {
        Set<String> labels = new LinkedHashSet<>();
        for (RawRecord r : rawRecords) {
            labels.add(r.classLabelOrEmpty());
        }
        return labels;
    }
}

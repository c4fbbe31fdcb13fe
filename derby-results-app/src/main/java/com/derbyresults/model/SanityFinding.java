package com.derbyresults.model;

import java.util.List;

/**
 * One validation observation about the merged table.
 */
public record SanityFinding(
    Severity severity,
    String message,
    List<Detail> details
) {
    public SanityFinding {
        details = details == null ? List.of() : List.copyOf(details);
    }

    /** A racer (or class) the finding is about, with the classes involved. */
    public record Detail(String subject, List<String> classes) {
        public Detail {
            classes = classes == null ? List.of() : List.copyOf(classes);
        }
    }
}

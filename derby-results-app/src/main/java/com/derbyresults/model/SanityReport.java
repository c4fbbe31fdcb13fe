package com.derbyresults.model;

import java.util.ArrayList;
import java.util.List;

public record SanityReport(List<SanityFinding> findings) {

    public SanityReport {
        findings = findings == null ? List.of() : List.copyOf(findings);
    }

    /** True iff there is no error-severity finding. */
    public boolean isValid() {
        return findings.stream().noneMatch(f -> f.severity() == Severity.ERROR);
    }

    public List<SanityFinding> bySeverity(Severity severity) {
        return findings.stream().filter(f -> f.severity() == severity).toList();
    }

    public SanityReport with(List<SanityFinding> more) {
        List<SanityFinding> all = new ArrayList<>(findings);
        all.addAll(more);
        return new SanityReport(all);
    }
}

package com.derbyresults.service;

import com.derbyresults.model.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.*;

/**
 * Checks that every racer key belongs to exactly one den class.
 * Findings are reported, never thrown: downstream computation always continues.
 */
@Service
public class SanityChecker {

    private static final Logger log = LoggerFactory.getLogger(SanityChecker.class);

    private final StandardClassSet classes;

    public SanityChecker(StandardClassSet classes) {
        this.classes = classes;
    }

    public SanityReport check(List<CanonicalRecord> records) {
        return check(records, classes.finalsClass());
    }

    public SanityReport check(List<CanonicalRecord> records, String finalsClass) {
        Map<RacerKey, Set<String>> denClassesByRacer = new LinkedHashMap<>();
        Set<RacerKey> inFinals = new LinkedHashSet<>();
        Set<RacerKey> finished = new HashSet<>();

        for (CanonicalRecord r : records) {
            Set<String> dens = denClassesByRacer.computeIfAbsent(r.racerKey(), k -> new TreeSet<>(classes.displayOrder()));
            if (Objects.equals(finalsClass, r.standardClassName())) {
                inFinals.add(r.racerKey());
            } else {
                dens.add(r.standardClassName());
            }
            if (r.hasFinishTime()) {
                finished.add(r.racerKey());
            }
        }

        List<SanityFinding.Detail> multiClass = new ArrayList<>();
        List<SanityFinding.Detail> finalsOnly = new ArrayList<>();
        List<SanityFinding.Detail> neverFinished = new ArrayList<>();

        denClassesByRacer.forEach((key, dens) -> {
            if (dens.size() > 1) {
                multiClass.add(new SanityFinding.Detail(key.toString(), List.copyOf(dens)));
            } else if (dens.isEmpty() && inFinals.contains(key)) {
                finalsOnly.add(new SanityFinding.Detail(key.toString(), List.of(finalsClass)));
            }
            if (!finished.contains(key)) {
                List<String> seenIn = new ArrayList<>(dens);
                if (inFinals.contains(key)) seenIn.add(finalsClass);
                neverFinished.add(new SanityFinding.Detail(key.toString(), seenIn));
            }
        });

        List<SanityFinding> findings = new ArrayList<>();
        if (!multiClass.isEmpty()) {
            findings.add(new SanityFinding(Severity.ERROR,
                multiClass.size() + " racer(s) appear in more than one den class; their times are split across classes",
                multiClass));
            log.warn("{} racer(s) span multiple den classes: {}", multiClass.size(),
                     multiClass.stream().map(SanityFinding.Detail::subject).toList());
        }
        if (!finalsOnly.isEmpty()) {
            findings.add(new SanityFinding(Severity.WARNING,
                finalsOnly.size() + " racer(s) appear only in " + finalsClass + " with no den record",
                finalsOnly));
            log.warn("{} finals-only racer(s)", finalsOnly.size());
        }
        if (!neverFinished.isEmpty()) {
            findings.add(new SanityFinding(Severity.INFO,
                neverFinished.size() + " racer(s) have no finished heat",
                neverFinished));
        }
        return new SanityReport(findings);
    }
}

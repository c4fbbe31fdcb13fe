package com.derbyresults.service;

import com.derbyresults.config.DerbyResultsConfig;
import com.derbyresults.model.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.*;

/**
 * Runs the whole reconciliation: mapping check, merge, sanity check, aggregation, ranking.
 * Each call recomputes everything from the sources it is given.
 */
@Service
public class RaceResultsService {

    private static final Logger log = LoggerFactory.getLogger(RaceResultsService.class);

    private final StandardClassSet classes;
    private final ClassNameMapper classNameMapper;
    private final RecordMerger recordMerger;
    private final SanityChecker sanityChecker;
    private final StatisticsAggregator statisticsAggregator;
    private final RankingEngine rankingEngine;
    private final RankingPolicy defaultPolicy;

    public RaceResultsService(StandardClassSet classes,
                              ClassNameMapper classNameMapper,
                              RecordMerger recordMerger,
                              SanityChecker sanityChecker,
                              StatisticsAggregator statisticsAggregator,
                              RankingEngine rankingEngine,
                              DerbyResultsConfig config) {
        this.classes = classes;
        this.classNameMapper = classNameMapper;
        this.recordMerger = recordMerger;
        this.sanityChecker = sanityChecker;
        this.statisticsAggregator = statisticsAggregator;
        this.rankingEngine = rankingEngine;
        this.defaultPolicy = config.toDefaultPolicy();
    }

    public RankingPolicy getDefaultPolicy() {
        return defaultPolicy;
    }

    /** Mapping guesses for every label observed across the sources. */
    public Map<String, String> suggestMapping(List<SourceBundle> sources) {
        return classNameMapper.suggestAll(RecordMerger.observedLabels(sources));
    }

    public RaceReport process(List<SourceBundle> sources, ClassMapping mapping) {
        return process(sources, mapping, defaultPolicy);
    }

    /**
     * @throws IncompleteClassMappingException if a label has no mapping entry; nothing is computed
     */
    public RaceReport process(List<SourceBundle> sources, ClassMapping mapping, RankingPolicy policy) {
        RankingPolicy effective = policy != null ? policy : defaultPolicy;

        List<CanonicalRecord> records = recordMerger.merge(sources, mapping);

        SanityReport sanity = sanityChecker.check(records).with(mappingFindings(mapping));
        if (!sanity.isValid()) {
            log.warn("Results are not authoritative until sanity errors are resolved");
        }

        List<RacerClassStats> stats = statisticsAggregator.aggregate(records);
        RankingResult ranking = rankingEngine.rank(stats, effective);

        Map<String, List<RacerClassStats>> classStats = new LinkedHashMap<>();
        for (ClassRanking cr : ranking.classes()) {
            classStats.put(cr.className(), cr.entries().stream().map(RankedEntry::stats).toList());
        }

        return new RaceReport(
            records,
            sanity,
            classStats,
            ranking,
            racers(records),
            totals(records),
            finalsComparison(ranking, effective.scoringMethod()),
            classNameMapper.mappingCounts(mapping)
        );
    }

    // ========== DERIVED VIEWS ==========

    private List<SanityFinding> mappingFindings(ClassMapping mapping) {
        Map<String, List<String>> shared = classNameMapper.sharedTargets(mapping);
        if (shared.isEmpty()) {
            return List.of();
        }
        List<SanityFinding.Detail> details = new ArrayList<>();
        shared.forEach((target, labels) -> details.add(new SanityFinding.Detail(target, labels)));
        return List.of(new SanityFinding(Severity.INFO,
            "Multiple class labels mapped to the same standard class", details));
    }

    private static List<RacerSummary> racers(List<CanonicalRecord> records) {
        Map<RacerKey, RacerSummary> racers = new LinkedHashMap<>();
        for (CanonicalRecord r : records) {
            RacerSummary existing = racers.get(r.racerKey());
            if (existing == null) {
                racers.put(r.racerKey(), new RacerSummary(r.racerKey(), r.fullName(), r.carName(), r.year()));
            } else if (isBlank(existing.carName()) && !isBlank(r.carName())) {
                racers.put(r.racerKey(), new RacerSummary(r.racerKey(), existing.fullName(), r.carName(), existing.year()));
            }
        }
        return new ArrayList<>(racers.values());
    }

    private static RaceTotals totals(List<CanonicalRecord> records) {
        int races = 0;
        Set<String> heats = new HashSet<>();
        Set<RacerKey> racers = new HashSet<>();
        for (CanonicalRecord r : records) {
            racers.add(r.racerKey());
            if (r.hasFinishTime()) {
                races++;
                heats.add(r.standardClassName() + "|" + r.roundId() + "|" + r.heat());
            }
        }
        return new RaceTotals(races, heats.size(), racers.size());
    }

    /** Finals entrants next to their den result; the first den in display order wins if there are several. */
    private List<FinalsComparison> finalsComparison(RankingResult ranking, ScoringMethod method) {
        Map<RacerKey, RacerClassStats> denResults = new HashMap<>();
        List<RacerClassStats> finalsResults = List.of();
        for (ClassRanking cr : ranking.classes()) {
            if (cr.finals()) {
                finalsResults = cr.entries().stream().map(RankedEntry::stats).toList();
                continue;
            }
            for (RankedEntry e : cr.entries()) {
                if (e.stats().hasFinished()) {
                    denResults.putIfAbsent(e.racerKey(), e.stats());
                }
            }
        }

        List<FinalsComparison> comparison = new ArrayList<>();
        for (RacerClassStats f : finalsResults) {
            if (!f.hasFinished()) continue;
            RacerClassStats den = denResults.get(f.racerKey());
            comparison.add(new FinalsComparison(
                f.racerKey(),
                den != null ? den.className() : null,
                den != null ? method.score(den) : null,
                method.score(f)
            ));
        }
        return comparison;
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}

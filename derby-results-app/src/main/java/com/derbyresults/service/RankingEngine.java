package com.derbyresults.service;

import com.derbyresults.model.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.*;

/**
 * Orders each class by the selected average and derives finalists, wildcards and den places.
 * <p>
 * Ties keep their incoming (merge) order: every sort here is stable. Racers with no finished heat
 * are listed after all finishers and are never finalists, wildcards or placed.
 */
@Service
public class RankingEngine {

    private static final Logger log = LoggerFactory.getLogger(RankingEngine.class);

    private final StandardClassSet classes;

    public RankingEngine(StandardClassSet classes) {
        this.classes = classes;
    }

    public RankingResult rank(List<RacerClassStats> stats, RankingPolicy policy) {
        ScoringMethod method = policy.scoringMethod();
        Map<String, List<RacerClassStats>> ordered = orderByClass(stats, method);

        List<RacerKey> finalists = selectFinalists(ordered);
        List<RacerKey> wildcards = selectWildcards(ordered, finalists, method, policy.finalsFieldSize());
        List<RacerKey> excluded = policy.excludeFinalsWinners()
            ? topFinishers(ordered.getOrDefault(classes.finalsClass(), List.of()), policy.finalsWinnerCount())
            : List.of();

        Set<RacerKey> finalistSet = new HashSet<>(finalists);
        Set<RacerKey> wildcardSet = new HashSet<>(wildcards);
        Set<RacerKey> excludedSet = new HashSet<>(excluded);

        List<ClassRanking> rankings = new ArrayList<>();
        ordered.forEach((className, list) -> {
            boolean finals = classes.isFinals(className);
            rankings.add(new ClassRanking(className, finals,
                buildEntries(list, method, finals, finalistSet, wildcardSet, excludedSet)));
        });

        log.info("Ranked {} class(es) by {}: {} finalist(s), {} wildcard(s), {} excluded finals winner(s)",
                 rankings.size(), method, finalists.size(), wildcards.size(), excluded.size());
        return new RankingResult(policy, rankings, finalists, wildcards, excluded);
    }

    // ========== ORDERING ==========

    /** Classes in display order, each list sorted ascending by score with non-finishers last. */
    Map<String, List<RacerClassStats>> orderByClass(List<RacerClassStats> stats, ScoringMethod method) {
        Map<String, List<RacerClassStats>> byClass = new TreeMap<>(classes.displayOrder());
        for (RacerClassStats s : stats) {
            byClass.computeIfAbsent(s.className(), k -> new ArrayList<>()).add(s);
        }

        Map<String, List<RacerClassStats>> ordered = new LinkedHashMap<>();
        byClass.forEach((className, list) -> ordered.put(className, sortByScore(list, method)));
        return ordered;
    }

    static List<RacerClassStats> sortByScore(List<RacerClassStats> list, ScoringMethod method) {
        List<RacerClassStats> sorted = new ArrayList<>(list);
        // List.sort is a stable merge sort
        sorted.sort(Comparator
            .comparing((RacerClassStats s) -> !s.hasFinished())
            .thenComparingDouble(method::score));
        return sorted;
    }

    // ========== AWARDS ==========

    private List<RacerKey> selectFinalists(Map<String, List<RacerClassStats>> ordered) {
        List<RacerKey> finalists = new ArrayList<>();
        for (String den : classes.denClasses()) {
            List<RacerClassStats> list = ordered.get(den);
            if (list != null && !list.isEmpty() && list.get(0).hasFinished()
                    && !finalists.contains(list.get(0).racerKey())) {
                finalists.add(list.get(0).racerKey());
            }
        }
        return finalists;
    }

    private List<RacerKey> selectWildcards(Map<String, List<RacerClassStats>> ordered, List<RacerKey> finalists,
                                           ScoringMethod method, int finalsFieldSize) {
        int slots = Math.max(0, finalsFieldSize - finalists.size());
        if (slots == 0) {
            return List.of();
        }

        List<RacerClassStats> pool = new ArrayList<>();
        for (String den : classes.denClasses()) {
            for (RacerClassStats s : ordered.getOrDefault(den, List.of())) {
                if (s.hasFinished() && !finalists.contains(s.racerKey())) {
                    pool.add(s);
                }
            }
        }
        pool.sort(Comparator.comparingDouble(method::score));

        // A racer listed in two dens (a sanity error) still takes one slot
        Set<RacerKey> picked = new LinkedHashSet<>();
        for (RacerClassStats s : pool) {
            if (picked.size() == slots) break;
            picked.add(s.racerKey());
        }
        return new ArrayList<>(picked);
    }

    private static List<RacerKey> topFinishers(List<RacerClassStats> finalsList, int count) {
        return finalsList.stream()
            .filter(RacerClassStats::hasFinished)
            .limit(count)
            .map(RacerClassStats::racerKey)
            .toList();
    }

    // ========== PLACES ==========

    /**
     * In a den class, a finals winner keeps their row but takes no place and does not advance the counter,
     * so the place at index i is (i - excluded rows before i) + 1. The finals class is placed plainly.
     */
    private static List<RankedEntry> buildEntries(List<RacerClassStats> list, ScoringMethod method, boolean finals,
                                                  Set<RacerKey> finalists, Set<RacerKey> wildcards,
                                                  Set<RacerKey> excluded) {
        List<RankedEntry> entries = new ArrayList<>(list.size());
        int nextPlace = 1;
        for (int i = 0; i < list.size(); i++) {
            RacerClassStats s = list.get(i);
            RacerKey key = s.racerKey();
            boolean winner = excluded.contains(key);

            Integer place = null;
            if (s.hasFinished() && (finals || !winner)) {
                place = nextPlace++;
            }

            entries.add(new RankedEntry(
                s,
                s.hasFinished() ? method.score(s) : 0,
                i,
                place,
                !finals && finalists.contains(key),
                !finals && wildcards.contains(key),
                winner
            ));
        }
        return entries;
    }
}

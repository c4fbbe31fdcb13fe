package com.derbyresults.service;

import com.derbyresults.model.CanonicalRecord;
import com.derbyresults.model.RacerClassStats;
import com.derbyresults.model.RacerKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.*;

/**
 * Groups canonical rows by (racer key, standard class) and summarizes each group's finish times.
 */
@Service
public class StatisticsAggregator {

    private static final Logger log = LoggerFactory.getLogger(StatisticsAggregator.class);

    /**
     * One stats record per group, in first-seen group order.
     * Rows without a positive finish time count towards group membership only, so a racer who never
     * finished still gets a zeroed record.
     */
    public List<RacerClassStats> aggregate(List<CanonicalRecord> records) {
        Map<GroupKey, Group> groups = new LinkedHashMap<>();
        for (CanonicalRecord r : records) {
            Group group = groups.computeIfAbsent(
                new GroupKey(r.racerKey(), r.standardClassName()), k -> new Group());
            if (group.carName == null && r.carName() != null && !r.carName().isBlank()) {
                group.carName = r.carName();
            }
            if (r.hasFinishTime()) {
                group.times.add(r.finishTime());
            }
        }

        List<RacerClassStats> stats = new ArrayList<>(groups.size());
        groups.forEach((key, group) -> stats.add(summarize(key.racerKey(), group.carName, key.className(), group.times)));

        log.info("Aggregated {} racer/class group(s) from {} row(s)", stats.size(), records.size());
        return stats;
    }

    /**
     * Statistics over positive finish times. Drop-slowest discards exactly one worst time and falls back
     * to the plain mean when there is a single time. Standard deviation is the population form.
     */
    public static RacerClassStats summarize(RacerKey racerKey, String carName, String className, List<Double> times) {
        int n = times.size();
        if (n == 0) {
            return new RacerClassStats(racerKey, carName, className, List.of(), 0, 0, 0, 0, 0, 0, 0);
        }

        double sum = 0;
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        for (double t : times) {
            sum += t;
            min = Math.min(min, t);
            max = Math.max(max, t);
        }
        double avg = sum / n;
        double avgExceptSlowest = n > 1 ? (sum - max) / (n - 1) : avg;

        List<Double> sorted = new ArrayList<>(times);
        Collections.sort(sorted);
        double median = n % 2 == 0
            ? (sorted.get(n / 2 - 1) + sorted.get(n / 2)) / 2
            : sorted.get(n / 2);

        double squaredDiffs = 0;
        for (double t : times) {
            squaredDiffs += (t - avg) * (t - avg);
        }
        double stdDev = Math.sqrt(squaredDiffs / n);

        return new RacerClassStats(racerKey, carName, className, times, n,
                                   avg, avgExceptSlowest, min, max, median, stdDev);
    }

    private record GroupKey(RacerKey racerKey, String className) {}

    private static final class Group {
        private String carName;
        private final List<Double> times = new ArrayList<>();
    }
}

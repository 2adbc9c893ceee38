package com.storefront.anomaly.engine.group;

import com.storefront.anomaly.config.AnalysisConfig;
import com.storefront.anomaly.engine.DimensionPriority;
import com.storefront.anomaly.engine.FunnelOrder;
import com.storefront.anomaly.model.AnomalyGroup;
import com.storefront.anomaly.model.AnomalyRecord;
import com.storefront.anomaly.model.DimensionValue;
import com.storefront.anomaly.model.Direction;
import com.storefront.anomaly.model.MetricGroupSummary;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Clusters anomalous hours into groups in two steps.
 *
 * 1. Per metric, anomalous hours in order are cut into runs: a new run starts when the gap to the
 *    previous anomalous hour exceeds maxGapHours or when the direction flips.
 * 2. Runs of all metrics, sorted by start, are merged while they overlap or are at most
 *    maxGapHours apart. A group holds at most one run per metric, so a second run of a metric
 *    already in the group starts a new group. Directions may differ across metrics.
 *
 * Groups are returned unclassified, ordered by start hour.
 */
@Component
public class AnomalyGrouper {

    private final AnalysisConfig config;

    public AnomalyGrouper(AnalysisConfig config) {
        this.config = config;
    }

    public List<AnomalyGroup> group(List<AnomalyRecord> records) {
        long maxGap = config.getGrouping().getMaxGapHours();

        Map<String, List<AnomalyRecord>> anomaliesByMetric = new TreeMap<>();
        for (AnomalyRecord r : records) {
            if (r.isAnomaly()) {
                anomaliesByMetric.computeIfAbsent(r.getMetric(), m -> new ArrayList<>()).add(r);
            }
        }

        List<MetricRun> runs = new ArrayList<>();
        for (List<AnomalyRecord> metricRecords : anomaliesByMetric.values()) {
            metricRecords.sort(Comparator.comparing(AnomalyRecord::getHour));
            runs.addAll(splitIntoRuns(metricRecords, maxGap));
        }
        runs.sort(Comparator.comparing(MetricRun::start).thenComparing(MetricRun::metric));

        List<List<MetricRun>> clusters = new ArrayList<>();
        List<MetricRun> current = null;
        Set<String> currentMetrics = new HashSet<>();
        Instant currentEnd = null;
        for (MetricRun run : runs) {
            boolean startsNew = current == null
                    || hoursBetween(currentEnd, run.start()) > maxGap
                    || currentMetrics.contains(run.metric());
            if (startsNew) {
                current = new ArrayList<>();
                clusters.add(current);
                currentMetrics.clear();
                currentEnd = run.end();
            } else if (run.end().isAfter(currentEnd)) {
                currentEnd = run.end();
            }
            current.add(run);
            currentMetrics.add(run.metric());
        }

        List<AnomalyGroup> groups = new ArrayList<>(clusters.size());
        for (int i = 0; i < clusters.size(); i++) {
            groups.add(buildGroup(String.format("G-%04d", i + 1), clusters.get(i)));
        }
        return List.copyOf(groups);
    }

    List<MetricRun> splitIntoRuns(List<AnomalyRecord> metricRecords, long maxGap) {
        List<MetricRun> runs = new ArrayList<>();
        List<AnomalyRecord> current = new ArrayList<>();
        for (AnomalyRecord r : metricRecords) {
            if (!current.isEmpty()) {
                AnomalyRecord previous = current.get(current.size() - 1);
                boolean gapExceeded = hoursBetween(previous.getHour(), r.getHour()) > maxGap;
                boolean directionFlipped = previous.getDirection() != r.getDirection();
                if (gapExceeded || directionFlipped) {
                    runs.add(new MetricRun(r.getMetric(), previous.getDirection(), current));
                    current = new ArrayList<>();
                }
            }
            current.add(r);
        }
        if (!current.isEmpty()) {
            runs.add(new MetricRun(current.get(0).getMetric(), current.get(0).getDirection(), current));
        }
        return runs;
    }

    private AnomalyGroup buildGroup(String groupId, List<MetricRun> cluster) {
        DimensionPriority priority = new DimensionPriority(config.getDetection().getDimensionPriority());
        FunnelOrder funnel = new FunnelOrder(config.getReporting().getFunnelOrder());

        Instant start = cluster.get(0).start();
        Instant end = start;
        SortedSet<Instant> hours = new TreeSet<>();
        Map<String, List<MetricRun>> runsByMetric = new TreeMap<>(funnel);
        for (MetricRun run : cluster) {
            if (run.start().isBefore(start)) start = run.start();
            if (run.end().isAfter(end)) end = run.end();
            run.records().forEach(r -> hours.add(r.getHour()));
            runsByMetric.computeIfAbsent(run.metric(), m -> new ArrayList<>()).add(run);
        }

        List<MetricGroupSummary> summaries = new ArrayList<>();
        List<AnomalyRecord> allRecords = new ArrayList<>();
        runsByMetric.forEach((metric, metricRuns) -> {
            List<AnomalyRecord> metricRecords = new ArrayList<>();
            metricRuns.forEach(run -> metricRecords.addAll(run.records()));
            allRecords.addAll(metricRecords);
            summaries.add(summarize(metric, metricRuns.size(), metricRecords, priority));
        });

        return AnomalyGroup.builder()
                .groupId(groupId)
                .startHour(start)
                .endHour(end)
                .anomalousHours(hours)
                .metrics(List.copyOf(summaries))
                .direction(dominantDirection(allRecords))
                .build();
    }

    private MetricGroupSummary summarize(String metric, int runCount, List<AnomalyRecord> records,
                                         DimensionPriority priority) {
        double meanPercentDiff = records.stream().mapToDouble(AnomalyRecord::getPercentDiff).average().orElse(0.0);
        return MetricGroupSummary.builder()
                .metric(metric)
                .anomalousHours(records.size())
                .runCount(runCount)
                .direction(dominantDirection(records))
                .meanPercentDiff(meanPercentDiff)
                .primaryContributor(modeContributor(records, priority))
                .build();
    }

    /**
     * Most frequent hourly primary contributor. Ties go to dimension priority order. Hours without
     * a contributor count as "none", which wins only when strictly more frequent than every value.
     */
    DimensionValue modeContributor(List<AnomalyRecord> records, DimensionPriority priority) {
        Map<DimensionValue, Integer> counts = new HashMap<>();
        int none = 0;
        for (AnomalyRecord r : records) {
            if (r.hasPrimaryContributor()) {
                counts.merge(r.getPrimaryContributor(), 1, Integer::sum);
            } else {
                none++;
            }
        }

        DimensionValue best = null;
        int bestCount = 0;
        List<DimensionValue> candidates = new ArrayList<>(counts.keySet());
        candidates.sort(priority);
        for (DimensionValue candidate : candidates) {
            int count = counts.get(candidate);
            if (count > bestCount) {
                best = candidate;
                bestCount = count;
            }
        }
        if (best == null || none > bestCount) {
            return null;
        }
        return best;
    }

    /**
     * Direction of the majority of anomalous hours; NONE when evenly split.
     */
    private Direction dominantDirection(List<AnomalyRecord> records) {
        Map<Direction, Integer> counts = new LinkedHashMap<>();
        for (AnomalyRecord r : records) {
            counts.merge(r.getDirection(), 1, Integer::sum);
        }
        int positive = counts.getOrDefault(Direction.POSITIVE, 0);
        int negative = counts.getOrDefault(Direction.NEGATIVE, 0);
        if (positive > negative) return Direction.POSITIVE;
        if (negative > positive) return Direction.NEGATIVE;
        return Direction.NONE;
    }

    private static long hoursBetween(Instant from, Instant to) {
        return Duration.between(from, to).toHours();
    }
}

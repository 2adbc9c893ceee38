package com.storefront.anomaly.engine.group;

import com.storefront.anomaly.config.AnalysisConfig;
import com.storefront.anomaly.engine.DimensionPriority;
import com.storefront.anomaly.model.AnomalyGroup;
import com.storefront.anomaly.model.AnomalyRecord;
import com.storefront.anomaly.model.DimensionValue;
import com.storefront.anomaly.model.Direction;
import com.storefront.anomaly.model.MetricGroupSummary;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static com.storefront.anomaly.testutil.TestDataFactory.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class AnomalyGrouperTest {

    private AnomalyGrouper grouper;
    private DimensionPriority priority;

    @BeforeEach
    void setUp() {
        AnalysisConfig config = new AnalysisConfig();
        grouper = new AnomalyGrouper(config);
        priority = new DimensionPriority(config.getDetection().getDimensionPriority());
    }

    @Test
    void group_noAnomalies_noGroups() {
        assertThat(grouper.group(List.of(normal("visitors", 0), normal("visitors", 1)))).isEmpty();
        assertThat(grouper.group(List.of())).isEmpty();
    }

    @Test
    void group_gapWithinLimit_staysInOneRun() {
        List<AnomalyGroup> groups = grouper.group(List.of(
                anomaly("visitors", 10, Direction.POSITIVE, IOS),
                anomaly("visitors", 11, Direction.POSITIVE, IOS),
                normal("visitors", 12),
                anomaly("visitors", 14, Direction.POSITIVE, IOS)));

        assertThat(groups).hasSize(1);
        AnomalyGroup group = groups.get(0);
        assertThat(group.getStartHour()).isEqualTo(hour(10));
        assertThat(group.getEndHour()).isEqualTo(hour(14));
        assertThat(group.getAnomalousHours()).containsExactly(hour(10), hour(11), hour(14));
        assertThat(group.getMetrics()).hasSize(1);
        assertThat(group.getMetrics().get(0).getRunCount()).isEqualTo(1);
        assertThat(group.getMetrics().get(0).getAnomalousHours()).isEqualTo(3);
    }

    @Test
    void group_gapAboveLimit_splitsGroups() {
        List<AnomalyGroup> groups = grouper.group(List.of(
                anomaly("visitors", 10, Direction.POSITIVE, IOS),
                anomaly("visitors", 15, Direction.POSITIVE, IOS)));

        assertThat(groups).hasSize(2);
        assertThat(groups).extracting(AnomalyGroup::getGroupId).containsExactly("G-0001", "G-0002");
        assertThat(groups.get(0).isSingleHour()).isTrue();
    }

    @Test
    void group_directionFlip_startsNewGroup() {
        List<AnomalyRecord> records = List.of(
                anomaly("visitors", 2, Direction.POSITIVE, IOS),
                anomaly("visitors", 3, Direction.POSITIVE, IOS),
                anomaly("visitors", 4, Direction.NEGATIVE, IOS),
                anomaly("visitors", 5, Direction.NEGATIVE, IOS));

        List<MetricRun> runs = grouper.splitIntoRuns(new ArrayList<>(records), 3);
        List<AnomalyGroup> groups = grouper.group(records);

        assertThat(runs).extracting(MetricRun::direction).containsExactly(Direction.POSITIVE, Direction.NEGATIVE);
        assertThat(groups).hasSize(2);
        assertThat(groups.get(0).getStartHour()).isEqualTo(hour(2));
        assertThat(groups.get(0).getEndHour()).isEqualTo(hour(3));
        assertThat(groups.get(0).getDirection()).isEqualTo(Direction.POSITIVE);
        assertThat(groups.get(1).getStartHour()).isEqualTo(hour(4));
        assertThat(groups.get(1).getEndHour()).isEqualTo(hour(5));
        assertThat(groups.get(1).getDirection()).isEqualTo(Direction.NEGATIVE);
        assertThat(groups).allSatisfy(g -> assertThat(g.getMetrics().get(0).getRunCount()).isEqualTo(1));
    }

    @Test
    void group_metricRunsBridgedByAnotherMetric_stayInSeparateGroups() {
        List<AnomalyRecord> records = new ArrayList<>();
        records.add(anomaly("visitors", 0, Direction.POSITIVE, IOS));
        for (int i = 1; i <= 6; i++) {
            records.add(anomaly("orders", i, Direction.POSITIVE, IOS));
        }
        records.add(anomaly("visitors", 7, Direction.POSITIVE, IOS));

        List<AnomalyGroup> groups = grouper.group(records);

        assertThat(groups).hasSize(2);
        assertThat(groups.get(0).getMetricNames()).containsExactly("visitors", "orders");
        assertThat(groups.get(0).summaryFor("visitors").orElseThrow().getAnomalousHours()).isEqualTo(1);
        assertThat(groups.get(1).getMetricNames()).containsExactly("visitors");
        assertThat(groups.get(1).getStartHour()).isEqualTo(hour(7));
        assertPerMetricGapBounded(records, groups, 3);
    }

    @Test
    void group_everyMetricPartOfEveryGroup_isGapBoundedAndSingleDirection() {
        List<AnomalyRecord> records = new ArrayList<>();
        Direction[] pattern = {Direction.POSITIVE, Direction.POSITIVE, Direction.NEGATIVE};
        String[] metrics = {"visitors", "product_viewers", "orders"};
        for (int m = 0; m < metrics.length; m++) {
            for (int i = 0; i < 60; i++) {
                if ((i * (m + 3) + m) % 7 < 3) {
                    records.add(anomaly(metrics[m], i, pattern[(i / 5 + m) % pattern.length], IOS));
                }
            }
        }

        List<AnomalyGroup> groups = grouper.group(records);

        assertThat(groups).isNotEmpty();
        assertPerMetricGapBounded(records, groups, 3);
        long grouped = groups.stream()
                .flatMap(g -> g.getMetrics().stream())
                .mapToLong(MetricGroupSummary::getAnomalousHours)
                .sum();
        assertThat(grouped).isEqualTo(records.size());
    }

    @Test
    void group_largerGapLimit_neverSplitsMore() {
        List<AnomalyRecord> records = List.of(
                anomaly("visitors", 0, Direction.POSITIVE, IOS),
                anomaly("visitors", 3, Direction.POSITIVE, IOS),
                anomaly("visitors", 8, Direction.POSITIVE, IOS),
                anomaly("visitors", 14, Direction.POSITIVE, IOS),
                anomaly("visitors", 30, Direction.POSITIVE, IOS));

        int previous = Integer.MAX_VALUE;
        for (int gap = 1; gap <= 20; gap++) {
            int runs = grouper.splitIntoRuns(new ArrayList<>(records), gap).size();
            assertThat(runs).isLessThanOrEqualTo(previous);
            previous = runs;
        }
    }

    @Test
    void group_overlappingMetrics_mergedInFunnelOrder() {
        List<AnomalyGroup> groups = grouper.group(List.of(
                anomaly("orders", 14, Direction.NEGATIVE, IOS),
                anomaly("orders", 15, Direction.NEGATIVE, IOS),
                anomaly("visitors", 10, Direction.NEGATIVE, IOS),
                anomaly("visitors", 11, Direction.NEGATIVE, IOS),
                anomaly("visitors", 12, Direction.NEGATIVE, IOS),
                anomaly("buyers", 30, Direction.NEGATIVE, null)));

        assertThat(groups).hasSize(2);
        AnomalyGroup first = groups.get(0);
        assertThat(first.getMetricNames()).containsExactly("visitors", "orders");
        assertThat(first.getStartHour()).isEqualTo(hour(10));
        assertThat(first.getEndHour()).isEqualTo(hour(15));
        assertThat(first.getDirection()).isEqualTo(Direction.NEGATIVE);
        assertThat(first.summaryFor("orders").orElseThrow().getMeanPercentDiff()).isCloseTo(-50.0, within(1e-9));
        assertThat(groups.get(1).getMetricNames()).containsExactly("buyers");
    }

    @Test
    void group_mixedDirectionsAcrossMetrics_stayTogether() {
        List<AnomalyGroup> groups = grouper.group(List.of(
                anomaly("visitors", 10, Direction.POSITIVE, IOS),
                anomaly("orders", 11, Direction.NEGATIVE, US)));

        assertThat(groups).hasSize(1);
        assertThat(groups.get(0).getDirection()).isEqualTo(Direction.NONE);
        assertThat(groups.get(0).summaryFor("visitors").orElseThrow().getDirection()).isEqualTo(Direction.POSITIVE);
        assertThat(groups.get(0).summaryFor("orders").orElseThrow().getDirection()).isEqualTo(Direction.NEGATIVE);
    }

    @Test
    void group_chainedRuns_extendGroupEnd() {
        List<AnomalyGroup> groups = grouper.group(List.of(
                anomaly("visitors", 10, Direction.POSITIVE, IOS),
                anomaly("orders", 13, Direction.POSITIVE, IOS),
                anomaly("buyers", 16, Direction.POSITIVE, IOS)));

        assertThat(groups).hasSize(1);
        assertThat(groups.get(0).getEndHour()).isEqualTo(hour(16));
        assertThat(groups.get(0).longestConsecutiveRun()).isEqualTo(1);
    }

    @Test
    void modeContributor_mostFrequentWins() {
        assertThat(grouper.modeContributor(records(IOS, IOS, null), priority)).isEqualTo(IOS);
    }

    @Test
    void modeContributor_noneMoreFrequent_returnsNull() {
        assertThat(grouper.modeContributor(records(IOS, null, null), priority)).isNull();
        assertThat(grouper.modeContributor(records(IOS, US, null, null), priority)).isNull();
        assertThat(grouper.modeContributor(records((DimensionValue) null), priority)).isNull();
    }

    @Test
    void modeContributor_noneTiedWithValue_valueWins() {
        assertThat(grouper.modeContributor(records(IOS, IOS, null, null), priority)).isEqualTo(IOS);
    }

    @Test
    void modeContributor_tie_brokenByDimensionPriority() {
        // location comes before device in the default priority order
        assertThat(grouper.modeContributor(records(IOS, US), priority)).isEqualTo(US);
        assertThat(grouper.modeContributor(records(IOS, ANDROID), priority)).isEqualTo(ANDROID);
    }

    @Test
    void group_percentDiffAveragedPerMetric() {
        List<AnomalyGroup> groups = grouper.group(List.of(
                anomaly("visitors", 10, Direction.POSITIVE, IOS),
                anomaly("visitors", 11, Direction.POSITIVE, IOS)));

        assertThat(groups.get(0).getMetrics().get(0).getMeanPercentDiff()).isCloseTo(50.0, within(1e-9));
    }

    // Each metric's anomalies, in hour order, are consumed group by group in start order.
    private static void assertPerMetricGapBounded(List<AnomalyRecord> records, List<AnomalyGroup> groups, int maxGap) {
        Map<String, List<AnomalyRecord>> byMetric = records.stream()
                .sorted(Comparator.comparing(AnomalyRecord::getHour))
                .collect(Collectors.groupingBy(AnomalyRecord::getMetric));
        Map<String, Integer> consumed = new HashMap<>();
        for (AnomalyGroup group : groups) {
            for (MetricGroupSummary summary : group.getMetrics()) {
                int from = consumed.getOrDefault(summary.getMetric(), 0);
                int to = from + summary.getAnomalousHours();
                List<AnomalyRecord> part = byMetric.get(summary.getMetric()).subList(from, to);
                consumed.put(summary.getMetric(), to);

                assertThat(summary.getRunCount()).isEqualTo(1);
                assertThat(part).extracting(AnomalyRecord::getDirection).containsOnly(summary.getDirection());
                assertThat(part.get(0).getHour()).isAfterOrEqualTo(group.getStartHour());
                assertThat(part.get(part.size() - 1).getHour()).isBeforeOrEqualTo(group.getEndHour());
                for (int i = 1; i < part.size(); i++) {
                    long gap = Duration.between(part.get(i - 1).getHour(), part.get(i).getHour()).toHours();
                    assertThat(gap).isLessThanOrEqualTo(maxGap);
                }
            }
        }
        byMetric.forEach((metric, metricRecords) ->
                assertThat(consumed.get(metric)).isEqualTo(metricRecords.size()));
    }

    private static List<AnomalyRecord> records(DimensionValue... contributors) {
        List<AnomalyRecord> records = new ArrayList<>();
        int index = 0;
        for (DimensionValue contributor : Arrays.asList(contributors)) {
            records.add(anomaly("visitors", index++, Direction.POSITIVE, contributor));
        }
        return records;
    }
}

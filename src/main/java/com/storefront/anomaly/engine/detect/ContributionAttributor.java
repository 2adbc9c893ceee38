package com.storefront.anomaly.engine.detect;

import com.storefront.anomaly.engine.DimensionPriority;
import com.storefront.anomaly.engine.forecast.SeriesKey;
import com.storefront.anomaly.model.DimensionContribution;
import com.storefront.anomaly.model.DimensionValue;
import com.storefront.anomaly.model.Expectation;
import com.storefront.anomaly.model.MetricHourObservation;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.SortedMap;
import java.util.SortedSet;

/**
 * Splits an hour's deviation across dimension values: contribution = actual[value] - expected[value].
 * Subclasses decide how expected[value] is obtained.
 *
 * Every value ever seen for the metric is considered, so a value that vanished from an hour's
 * breakdown shows up with actual 0. A dimension missing from the hour's breakdown is skipped,
 * and an hour without any breakdown gets no contributions.
 */
public abstract class ContributionAttributor {

    private final Map<String, SortedMap<String, SortedSet<String>>> vocabulary;

    protected ContributionAttributor(Map<String, SortedMap<String, SortedSet<String>>> vocabulary) {
        this.vocabulary = Collections.unmodifiableMap(vocabulary);
    }

    /**
     * Contributions for the hour, ordered by dimension priority and then value name.
     */
    public List<DimensionContribution> attribute(MetricHourObservation observation,
                                                 Expectation metricExpectation,
                                                 DimensionPriority priority) {
        if (!observation.hasBreakdown()) {
            return List.of();
        }

        String metric = observation.getMetric();
        SortedMap<String, SortedSet<String>> dimensions = vocabulary.getOrDefault(metric, Collections.emptySortedMap());
        List<String> orderedDimensions = new ArrayList<>(dimensions.keySet());
        orderedDimensions.sort(priority.dimensionOrder());

        List<DimensionContribution> contributions = new ArrayList<>();
        for (String dimension : orderedDimensions) {
            Map<String, Long> recorded = observation.getBreakdown().get(dimension);
            if (recorded == null || recorded.isEmpty()) continue;

            for (String value : dimensions.get(dimension)) {
                SeriesKey key = SeriesKey.of(metric, new DimensionValue(dimension, value));
                OptionalDouble expected = expectedFor(key, observation.getHour(), metricExpectation);
                if (expected.isEmpty()) continue;

                long actual = observation.countFor(dimension, value);
                double exp = expected.getAsDouble();
                contributions.add(DimensionContribution.builder()
                        .dimension(dimension)
                        .value(value)
                        .actual(actual)
                        .expected(exp)
                        .contribution(actual - exp)
                        .percentDiff(Deviations.percentDiff(actual, exp))
                        .build());
            }
        }
        return contributions;
    }

    /**
     * Expected count of one dimension value at the hour, empty when no verdict is possible.
     */
    protected abstract OptionalDouble expectedFor(SeriesKey key, Instant hour, Expectation metricExpectation);
}

package com.storefront.anomaly.engine.detect;

import com.storefront.anomaly.engine.forecast.HourlySeries;
import com.storefront.anomaly.engine.forecast.SeriesKey;
import com.storefront.anomaly.model.Expectation;

import java.time.Instant;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.SortedMap;
import java.util.SortedSet;

/**
 * Splits the metric-level expected total by each value's share of the metric over the
 * history window preceding the hour (no look-ahead).
 */
public class ProportionalShareAttributor extends ContributionAttributor {

    private final Map<SeriesKey, HourlySeries> series;
    private final int historyHours;

    /**
     * @param series       total and dimension-value series of every metric
     * @param historyHours how far back shares are measured
     */
    public ProportionalShareAttributor(Map<String, SortedMap<String, SortedSet<String>>> vocabulary,
                                       Map<SeriesKey, HourlySeries> series,
                                       int historyHours) {
        super(vocabulary);
        this.series = series;
        this.historyHours = historyHours;
    }

    @Override
    protected OptionalDouble expectedFor(SeriesKey key, Instant hour, Expectation metricExpectation) {
        HourlySeries valueSeries = series.get(key);
        HourlySeries totalSeries = series.get(SeriesKey.total(key.metric()));
        if (valueSeries == null || totalSeries == null) {
            return OptionalDouble.empty();
        }

        int index = totalSeries.indexOf(hour);
        int from = index - historyHours;
        double total = totalSeries.sum(from, index);
        if (total <= 0) {
            return OptionalDouble.empty();
        }
        double share = valueSeries.sum(from, index) / total;
        return OptionalDouble.of(metricExpectation.getExpected() * share);
    }
}

package com.storefront.anomaly.engine.ingest;

import com.storefront.anomaly.engine.forecast.HourlySeries;
import com.storefront.anomaly.engine.forecast.SeriesKey;
import com.storefront.anomaly.model.DimensionValue;
import com.storefront.anomaly.model.MetricHourObservation;
import com.storefront.anomaly.model.MetricRejection;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Validated observation table. Every accepted metric is laid out over the same hour range
 * [firstHour, lastHour]; hours a metric has no observation for are true zeros.
 */
public final class IngestedTable {

    private final Instant firstHour;
    private final Instant lastHour;
    private final SortedMap<String, Map<Instant, MetricHourObservation>> byMetric;
    private final List<MetricRejection> rejections;

    IngestedTable(Instant firstHour, Instant lastHour,
                  SortedMap<String, Map<Instant, MetricHourObservation>> byMetric,
                  List<MetricRejection> rejections) {
        this.firstHour = firstHour;
        this.lastHour = lastHour;
        this.byMetric = Collections.unmodifiableSortedMap(byMetric);
        this.rejections = List.copyOf(rejections);
    }

    public Instant getFirstHour() {
        return firstHour;
    }

    public Instant getLastHour() {
        return lastHour;
    }

    public boolean isEmpty() {
        return byMetric.isEmpty();
    }

    public int hourCount() {
        if (isEmpty()) return 0;
        return (int) Duration.between(firstHour, lastHour).toHours() + 1;
    }

    public List<Instant> hours() {
        List<Instant> hours = new ArrayList<>(hourCount());
        for (int i = 0; i < hourCount(); i++) {
            hours.add(firstHour.plus(Duration.ofHours(i)));
        }
        return hours;
    }

    public Set<String> metrics() {
        return byMetric.keySet();
    }

    public List<MetricRejection> getRejections() {
        return rejections;
    }

    /**
     * Observation for the metric at the hour, or a zero observation when the KPI layer emitted none.
     */
    public MetricHourObservation observation(String metric, Instant hour) {
        MetricHourObservation obs = byMetric.getOrDefault(metric, Map.of()).get(hour);
        return obs != null ? obs : MetricHourObservation.zero(metric, hour);
    }

    /**
     * Every dimension value seen for the metric anywhere in the table, dimensions and values sorted by name.
     */
    public SortedMap<String, SortedSet<String>> dimensionValues(String metric) {
        SortedMap<String, SortedSet<String>> vocabulary = new TreeMap<>();
        for (MetricHourObservation obs : byMetric.getOrDefault(metric, Map.of()).values()) {
            obs.getBreakdown().forEach((dimension, values) -> {
                if (values != null) {
                    vocabulary.computeIfAbsent(dimension, d -> new TreeSet<>()).addAll(values.keySet());
                }
            });
        }
        return vocabulary;
    }

    public HourlySeries totalSeries(String metric) {
        double[] values = new double[hourCount()];
        for (MetricHourObservation obs : byMetric.get(metric).values()) {
            values[index(obs.getHour())] = obs.getCount();
        }
        return new HourlySeries(firstHour, values);
    }

    public HourlySeries dimensionSeries(String metric, DimensionValue dimensionValue) {
        double[] values = new double[hourCount()];
        for (MetricHourObservation obs : byMetric.get(metric).values()) {
            values[index(obs.getHour())] = obs.countFor(dimensionValue.dimension(), dimensionValue.value());
        }
        return new HourlySeries(firstHour, values);
    }

    /**
     * Total series of every metric, followed (when requested) by one series per dimension value.
     */
    public Map<SeriesKey, HourlySeries> series(boolean includeDimensionValues) {
        Map<SeriesKey, HourlySeries> series = new LinkedHashMap<>();
        for (String metric : byMetric.keySet()) {
            series.put(SeriesKey.total(metric), totalSeries(metric));
            if (!includeDimensionValues) continue;
            dimensionValues(metric).forEach((dimension, values) -> {
                for (String value : values) {
                    DimensionValue dv = new DimensionValue(dimension, value);
                    series.put(SeriesKey.of(metric, dv), dimensionSeries(metric, dv));
                }
            });
        }
        return series;
    }

    private int index(Instant hour) {
        return (int) Duration.between(firstHour, hour).toHours();
    }
}

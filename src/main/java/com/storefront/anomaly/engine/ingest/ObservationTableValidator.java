package com.storefront.anomaly.engine.ingest;

import com.storefront.anomaly.model.MetricHourObservation;
import com.storefront.anomaly.model.MetricRejection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Checks the hourly table against the KPI layer's contract before anything is fitted.
 *
 * Request-level problems (empty table, observation without a metric name) throw
 * {@link MalformedInputException}. Problems inside one metric's sequence reject that metric
 * only: hour missing or not aligned to the hour, hours out of chronological order,
 * duplicate (metric, hour), negative totals or breakdown counts. Nothing is corrected.
 */
@Component
public class ObservationTableValidator {

    private static final Logger log = LoggerFactory.getLogger(ObservationTableValidator.class);

    public IngestedTable validate(List<MetricHourObservation> observations) {
        if (observations == null || observations.isEmpty()) {
            throw new MalformedInputException("Observation table is empty");
        }

        Map<String, List<MetricHourObservation>> byMetric = new LinkedHashMap<>();
        for (int i = 0; i < observations.size(); i++) {
            MetricHourObservation obs = observations.get(i);
            if (obs == null) {
                throw new MalformedInputException("Observation #" + i + " is null");
            }
            if (obs.getMetric() == null || obs.getMetric().isBlank()) {
                throw new MalformedInputException("Observation #" + i + " has no metric name");
            }
            byMetric.computeIfAbsent(obs.getMetric(), m -> new ArrayList<>()).add(obs);
        }

        SortedMap<String, Map<Instant, MetricHourObservation>> accepted = new TreeMap<>();
        List<MetricRejection> rejections = new ArrayList<>();
        Instant first = null;
        Instant last = null;

        for (Map.Entry<String, List<MetricHourObservation>> entry : byMetric.entrySet()) {
            String metric = entry.getKey();
            String violation = findViolation(metric, entry.getValue());
            if (violation != null) {
                log.warn("Rejecting metric {}: {}", metric, violation);
                rejections.add(new MetricRejection(metric, violation));
                continue;
            }

            Map<Instant, MetricHourObservation> hours = new LinkedHashMap<>();
            for (MetricHourObservation obs : entry.getValue()) {
                hours.put(obs.getHour(), obs);
            }
            accepted.put(metric, hours);

            List<MetricHourObservation> sequence = entry.getValue();
            Instant metricFirst = sequence.get(0).getHour();
            Instant metricLast = sequence.get(sequence.size() - 1).getHour();
            if (first == null || metricFirst.isBefore(first)) first = metricFirst;
            if (last == null || metricLast.isAfter(last)) last = metricLast;
        }

        log.info("Ingested {} metrics ({} rejected), hours {} to {}",
                accepted.size(), rejections.size(), first, last);
        return new IngestedTable(first, last, accepted, rejections);
    }

    private String findViolation(String metric, List<MetricHourObservation> sequence) {
        Instant previous = null;
        for (MetricHourObservation obs : sequence) {
            Instant hour = obs.getHour();
            if (hour == null) {
                return "Observation for " + metric + " has no hour";
            }
            if (hour.getEpochSecond() % 3600 != 0 || hour.getNano() != 0) {
                return "Hour " + hour + " of " + metric + " is not aligned to the start of an hour";
            }
            if (previous != null) {
                if (hour.equals(previous)) {
                    return "Duplicate observation for " + metric + " at " + hour;
                }
                if (hour.isBefore(previous)) {
                    return "Observations for " + metric + " are not chronological: " + hour + " follows " + previous;
                }
            }
            if (obs.getCount() < 0) {
                return "Negative count " + obs.getCount() + " for " + metric + " at " + hour;
            }
            String breakdownViolation = findBreakdownViolation(metric, obs);
            if (breakdownViolation != null) {
                return breakdownViolation;
            }
            previous = hour;
        }
        return null;
    }

    private String findBreakdownViolation(String metric, MetricHourObservation obs) {
        for (Map.Entry<String, Map<String, Long>> dimension : obs.getBreakdown().entrySet()) {
            if (dimension.getValue() == null) continue;
            for (Map.Entry<String, Long> value : dimension.getValue().entrySet()) {
                if (value.getValue() == null || value.getValue() < 0) {
                    return "Invalid count " + value.getValue() + " for " + metric + " "
                            + dimension.getKey() + "=" + value.getKey() + " at " + obs.getHour();
                }
            }
        }
        return null;
    }
}

package com.storefront.anomaly.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.Map;

@Value
@Builder(toBuilder = true)
@Jacksonized
@Schema(description = "Hourly count of one metric with its per-dimension breakdown, as produced by the KPI layer")
public class MetricHourObservation {

    @Schema(description = "Metric name", example = "visitors")
    String metric;

    @Schema(description = "Start of the hour (UTC, aligned to the hour)", example = "2025-02-24T02:00:00Z")
    Instant hour;

    @Schema(description = "Total count for the metric in this hour", example = "1250")
    long count;

    @Singular("dimension")
    @Schema(description = "Breakdown: dimension name -> dimension value -> count",
            example = "{\"device\": {\"iOS\": 700, \"Android\": 550}}")
    Map<String, Map<String, Long>> breakdown;

    /**
     * Count recorded for a dimension value in this hour, 0 when the value is not listed.
     */
    public long countFor(String dimension, String value) {
        Map<String, Long> values = breakdown.get(dimension);
        if (values == null) return 0L;
        Long c = values.get(value);
        return c != null ? c : 0L;
    }

    public boolean hasBreakdown() {
        return breakdown.values().stream().anyMatch(v -> v != null && !v.isEmpty());
    }

    /**
     * A true-zero hour: the KPI layer emitted no row for this metric and hour.
     */
    public static MetricHourObservation zero(String metric, Instant hour) {
        return MetricHourObservation.builder()
                .metric(metric)
                .hour(hour)
                .count(0L)
                .build();
    }
}

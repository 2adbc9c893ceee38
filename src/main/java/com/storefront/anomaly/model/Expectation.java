package com.storefront.anomaly.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
@Schema(description = "Forecasted value and uncertainty interval for a metric (or one dimension value) at an hour")
public class Expectation {

    @Schema(description = "Metric name", example = "visitors")
    String metric;

    @Schema(description = "Dimension name, null for the metric total", example = "device", nullable = true)
    String dimension;

    @Schema(description = "Dimension value, null for the metric total", example = "iOS", nullable = true)
    String value;

    Instant hour;

    @Schema(description = "Expected count", example = "1180.4")
    double expected;

    @Schema(description = "Lower bound of the interval", example = "1040.0")
    double lower;

    @Schema(description = "Upper bound of the interval", example = "1320.8")
    double upper;

    @Schema(description = "Hours of history the forecast was fitted on", example = "336")
    int historyHours;

    @Schema(description = "True when history was too short to produce a verdict")
    boolean insufficientHistory;

    public boolean isValid() {
        return !insufficientHistory;
    }

    public boolean contains(double actual) {
        return actual >= lower && actual <= upper;
    }

    public static Expectation insufficient(String metric, String dimension, String value,
                                           Instant hour, int historyHours) {
        return Expectation.builder()
                .metric(metric)
                .dimension(dimension)
                .value(value)
                .hour(hour)
                .historyHours(historyHours)
                .insufficientHistory(true)
                .build();
    }
}

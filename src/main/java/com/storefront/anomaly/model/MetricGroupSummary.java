package com.storefront.anomaly.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
@Schema(description = "One metric's share of an anomaly group")
public class MetricGroupSummary {

    @Schema(example = "orders")
    String metric;

    @Schema(description = "Anomalous hours of this metric inside the group", example = "3")
    int anomalousHours;

    @Schema(description = "Direction-consistent runs of this metric in the group, at most one per group", example = "1")
    int runCount;

    @Schema(description = "Direction covering most of this metric's anomalous hours", example = "NEGATIVE")
    Direction direction;

    @Schema(description = "Mean percent diff over this metric's anomalous hours", example = "-42.7")
    double meanPercentDiff;

    @Schema(description = "Most frequent hourly primary contributor, null when none prevails", nullable = true)
    DimensionValue primaryContributor;

    public boolean hasPrimaryContributor() {
        return primaryContributor != null;
    }
}

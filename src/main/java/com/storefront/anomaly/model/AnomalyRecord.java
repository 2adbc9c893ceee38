package com.storefront.anomaly.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.List;

@Value
@Builder
@Schema(description = "Detection verdict for one metric at one hour")
public class AnomalyRecord {

    @Schema(example = "visitors")
    String metric;

    @Schema(example = "2025-02-24T02:00:00Z")
    Instant hour;

    @Schema(description = "Observed count", example = "1620")
    long actual;

    @Schema(description = "Expected count", example = "1180.4")
    double expected;

    @Schema(example = "1040.0")
    double lower;

    @Schema(example = "1320.8")
    double upper;

    @Schema(description = "(actual - expected) / expected * 100, with a fixed sentinel when expected is 0", example = "37.2")
    double percentDiff;

    @Schema(description = "Whether the actual count fell outside [lower, upper]")
    boolean anomaly;

    @Schema(description = "Sign of actual - expected for anomalous hours, NONE otherwise", example = "POSITIVE")
    Direction direction;

    @Schema(description = "Distance of the actual count from the nearest interval bound, 0 inside the interval", example = "299.2")
    double anomalyWeight;

    @Singular
    @Schema(description = "Per dimension value deviation, in dimension priority order")
    List<DimensionContribution> contributions;

    @Schema(description = "Dimension value judged most responsible for the deviation", nullable = true)
    DimensionValue primaryContributor;

    public boolean hasPrimaryContributor() {
        return primaryContributor != null;
    }
}

package com.storefront.anomaly.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
@Schema(description = "How much one dimension value moved the metric away from its expectation in an hour")
public class DimensionContribution {

    @Schema(example = "device")
    String dimension;

    @Schema(example = "iOS")
    String value;

    @Schema(description = "Observed count for the value", example = "900")
    long actual;

    @Schema(description = "Expected count for the value", example = "610.5")
    double expected;

    @Schema(description = "actual - expected", example = "289.5")
    double contribution;

    @Schema(description = "(actual - expected) / expected * 100", example = "47.4")
    double percentDiff;

    public DimensionValue toDimensionValue() {
        return new DimensionValue(dimension, value);
    }
}

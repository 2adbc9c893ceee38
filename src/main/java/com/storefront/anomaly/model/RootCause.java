package com.storefront.anomaly.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
@Schema(description = "Most likely origin of an anomaly group along the metric funnel")
public class RootCause {

    public enum Type {
        DIRECT,
        FUNNEL_EFFECT
    }

    @Schema(example = "FUNNEL_EFFECT")
    Type type;

    @Schema(description = "Metric the anomaly is attributed to", example = "visitors")
    String metric;

    @Schema(description = "That metric's primary contributor in the group", nullable = true)
    DimensionValue contributor;

    @Schema(example = "Funnel effect from visitors (device=iOS)")
    String description;
}

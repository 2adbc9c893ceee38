package com.storefront.anomaly.model;

import io.swagger.v3.oas.annotations.media.Schema;

@Schema(description = "A single value of a dimension, e.g. device=iOS")
public record DimensionValue(
        @Schema(description = "Dimension name", example = "device") String dimension,
        @Schema(description = "Dimension value", example = "iOS") String value) {

    @Override
    public String toString() {
        return dimension + "=" + value;
    }
}

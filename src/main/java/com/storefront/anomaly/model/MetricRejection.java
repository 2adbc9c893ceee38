package com.storefront.anomaly.model;

import io.swagger.v3.oas.annotations.media.Schema;

@Schema(description = "A metric left out of the run because its input broke the ingestion contract")
public record MetricRejection(
        @Schema(example = "orders") String metric,
        @Schema(example = "Duplicate observation for orders at 2025-02-24T02:00:00Z") String reason) {
}

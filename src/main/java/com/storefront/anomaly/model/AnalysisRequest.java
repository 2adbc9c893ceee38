package com.storefront.anomaly.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Hourly metric-dimension count table to analyse")
public class AnalysisRequest {

    @Schema(description = "One observation per (metric, hour), chronological within each metric")
    private List<MetricHourObservation> observations;
}

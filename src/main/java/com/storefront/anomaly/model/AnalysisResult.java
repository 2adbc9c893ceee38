package com.storefront.anomaly.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;
import lombok.With;

import java.time.Instant;
import java.util.List;
import java.util.Map;

@Value
@Builder
@Schema(description = "Output of one analysis run: hourly verdicts, anomaly groups and their scenarios")
public class AnalysisResult {

    @Schema(example = "2f7a1c9e-5b0d-4c43-9d3e-8e1a6b0c2d11")
    String runId;

    @Schema(description = "Completion timestamp in epoch milliseconds", example = "1740700800000")
    long generatedAt;

    @Schema(description = "First hour of the analysed table", nullable = true)
    Instant firstHour;

    @Schema(description = "Last hour of the analysed table", nullable = true)
    Instant lastHour;

    @Schema(description = "Metrics analysed")
    List<String> metrics;

    @Schema(description = "Verdict per (metric, hour) with enough history")
    List<AnomalyRecord> records;

    @With
    @Schema(description = "Anomaly groups ordered by start hour")
    List<AnomalyGroup> groups;

    @With
    @Schema(description = "Number of groups per scenario")
    Map<Scenario, Long> scenarioCounts;

    @Schema(description = "Metrics rejected at ingestion")
    List<MetricRejection> rejections;

    @Schema(description = "(metric, hour) pairs skipped for lack of history", example = "2352")
    long insufficientHistoryHours;

    public long getAnomalyCount() {
        return records.stream().filter(AnomalyRecord::isAnomaly).count();
    }
}

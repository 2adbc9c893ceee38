package com.storefront.anomaly.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;
import lombok.With;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.SortedSet;

@Value
@Builder(toBuilder = true)
@Schema(description = "Temporally clustered anomalous hours, possibly spanning several metrics")
public class AnomalyGroup {

    @Schema(example = "G-0003")
    String groupId;

    @Schema(example = "2025-02-24T02:00:00Z")
    Instant startHour;

    @Schema(example = "2025-02-24T04:00:00Z")
    Instant endHour;

    @Schema(description = "Hours anomalous for at least one metric of the group")
    SortedSet<Instant> anomalousHours;

    @Schema(description = "Per-metric summaries, in funnel order")
    List<MetricGroupSummary> metrics;

    @Schema(description = "Direction covering most anomalous metric-hours of the group", example = "POSITIVE")
    Direction direction;

    @With
    @Schema(description = "Causal-pattern classification", example = "A", nullable = true)
    Scenario scenario;

    @With
    @Schema(description = "Why the scenario was chosen", nullable = true)
    String scenarioReason;

    @With
    @Schema(nullable = true)
    RootCause rootCause;

    public List<String> getMetricNames() {
        return metrics.stream().map(MetricGroupSummary::getMetric).toList();
    }

    public Optional<MetricGroupSummary> summaryFor(String metric) {
        return metrics.stream().filter(m -> m.getMetric().equals(metric)).findFirst();
    }

    @JsonIgnore
    public boolean isSingleHour() {
        return startHour.equals(endHour);
    }

    /**
     * Longest stretch of back-to-back anomalous hours inside the group.
     */
    public int longestConsecutiveRun() {
        int longest = 0;
        int current = 0;
        Instant previous = null;
        for (Instant hour : anomalousHours) {
            if (previous != null && Duration.between(previous, hour).toHours() == 1) {
                current++;
            } else {
                current = 1;
            }
            longest = Math.max(longest, current);
            previous = hour;
        }
        return longest;
    }
}

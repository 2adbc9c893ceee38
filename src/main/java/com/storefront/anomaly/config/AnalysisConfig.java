package com.storefront.anomaly.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

@Data
@Configuration
@ConfigurationProperties(prefix = "analysis")
public class AnalysisConfig {

    private Forecast forecast = new Forecast();

    private Detection detection = new Detection();

    private Grouping grouping = new Grouping();

    private Reporting reporting = new Reporting();

    public enum AttributionPolicy {
        // Forecast every dimension value as its own series
        INDEPENDENT,
        // Split the metric-level expectation by each value's historical share
        PROPORTIONAL
    }

    @Data
    public static class Forecast {
        // Below this many hours of history no verdict is given (two weekly cycles).
        private int minHistoryHours = 336;

        // Older history is ignored; bounds the cost of refitting per hour.
        private int maxHistoryHours = 672;

        // History needed before the daily / weekly cycle is fitted at all.
        private int dailyMinHistoryHours = 48;
        private int weeklyMinHistoryHours = 336;

        private boolean trendEnabled = true;

        // Fraction of historical residuals the interval should cover.
        private double confidenceLevel = 0.95;

        private double intervalScale = 1.0;

        // Poisson-style floor on the half-width: z * sqrt(expected).
        private double countNoiseZ = 2.0;

        private double minIntervalHalfWidth = 1.0;

        // Worker threads used to fit series in parallel.
        private int parallelism = 4;
    }

    @Data
    public static class Detection {
        private AttributionPolicy attributionPolicy = AttributionPolicy.INDEPENDENT;

        // A primary contributor must explain at least this fraction of the hour's deviation.
        private double significanceFraction = 0.5;

        // Tie-break order for contributors; unlisted dimensions follow alphabetically.
        private List<String> dimensionPriority = new ArrayList<>(
                List.of("location", "device", "traffic_source", "traffic_medium"));
    }

    @Data
    public static class Grouping {
        // Anomalous hours further apart than this start a new run / group.
        private int maxGapHours = 3;
    }

    @Data
    public static class Reporting {
        // Presentation filter: groups with at least this many consecutive anomalous hours.
        private int sustainedMinHours = 3;

        // Metric funnel, top first. Used for ordering and root-cause attribution.
        private List<String> funnelOrder = new ArrayList<>(List.of(
                "visitors", "landing_page_viewers", "product_viewers",
                "added_to_cart", "checkout_started", "orders", "buyers"));

        // Upstream anomalies must reach this share of the lead metric's count to call a funnel effect.
        private double funnelUpstreamShare = 0.5;
    }
}

package com.storefront.anomaly.config;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
public class MetricsConfig {

    static final String OTHER_METRIC = "other";

    private final MeterRegistry registry;
    private final AnalysisConfig config;

    public MetricsConfig(MeterRegistry registry, AnalysisConfig config) {
        this.registry = registry;
        this.config = config;
    }

    public void recordRun(String outcome, Duration duration) {
        Counter.builder("analysis.run.count")
                .tag("outcome", outcome)
                .register(registry)
                .increment();

        Timer.builder("analysis.run.duration")
                .tag("outcome", outcome)
                .register(registry)
                .record(duration);
    }

    public void recordSeriesFitted(int seriesCount) {
        DistributionSummary.builder("analysis.forecast.series")
                .register(registry)
                .record(seriesCount);
    }

    public void recordAnomalousHours(String metric, long count) {
        Counter.builder("analysis.anomalous_hours.count")
                .tag("metric", metricTag(metric))
                .register(registry)
                .increment(count);
    }

    public void recordInsufficientHistory(String metric, long count) {
        Counter.builder("analysis.insufficient_history.count")
                .tag("metric", metricTag(metric))
                .register(registry)
                .increment(count);
    }

    public void recordGroupClassified(String scenario) {
        Counter.builder("analysis.group.count")
                .tag("scenario", scenario)
                .register(registry)
                .increment();
    }

    public void recordMetricRejected(String metric) {
        Counter.builder("analysis.metric.rejected.count")
                .tag("metric", metricTag(metric))
                .register(registry)
                .increment();
    }

    /**
     * Metric names come from the request body. Only funnel metrics get their own tag value so the
     * number of series stays bounded.
     */
    String metricTag(String metric) {
        return config.getReporting().getFunnelOrder().contains(metric) ? metric : OTHER_METRIC;
    }
}

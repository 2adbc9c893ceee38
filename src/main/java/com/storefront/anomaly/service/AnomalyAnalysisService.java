package com.storefront.anomaly.service;

import com.storefront.anomaly.config.AnalysisConfig;
import com.storefront.anomaly.config.MetricsConfig;
import com.storefront.anomaly.engine.classify.RootCauseAnalyzer;
import com.storefront.anomaly.engine.classify.ScenarioClassifier;
import com.storefront.anomaly.engine.detect.ContributionAttributor;
import com.storefront.anomaly.engine.detect.HourlyAnomalyDetector;
import com.storefront.anomaly.engine.detect.IndependentForecastAttributor;
import com.storefront.anomaly.engine.detect.ProportionalShareAttributor;
import com.storefront.anomaly.engine.forecast.ExpectationTable;
import com.storefront.anomaly.engine.forecast.ForecastRunner;
import com.storefront.anomaly.engine.forecast.HourlySeries;
import com.storefront.anomaly.engine.forecast.SeriesKey;
import com.storefront.anomaly.engine.group.AnomalyGrouper;
import com.storefront.anomaly.engine.ingest.IngestedTable;
import com.storefront.anomaly.engine.ingest.ObservationTableValidator;
import com.storefront.anomaly.model.AnalysisResult;
import com.storefront.anomaly.model.AnomalyGroup;
import com.storefront.anomaly.model.AnomalyRecord;
import com.storefront.anomaly.model.Expectation;
import com.storefront.anomaly.model.MetricHourObservation;
import com.storefront.anomaly.model.MetricRejection;
import com.storefront.anomaly.model.Scenario;
import io.micrometer.observation.annotation.Observed;
import io.micrometer.tracing.Span;
import io.micrometer.tracing.Tracer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Main orchestrator of an analysis run.
 *
 * Flow:
 * 1. Validate the observation table (malformed metrics are rejected, the rest continue)
 * 2. Fit a baseline for every series on the forecast executor
 * 3. Detect anomalous hours and attribute them to dimension values
 * 4. Group anomalous hours across metrics
 * 5. Classify each group into a scenario and annotate its root cause
 *
 * Stages hand immutable collections to each other. Nothing is kept after the run.
 */
@Service
public class AnomalyAnalysisService {

    private static final Logger log = LoggerFactory.getLogger(AnomalyAnalysisService.class);

    private final ObservationTableValidator validator;
    private final ForecastRunner forecastRunner;
    private final HourlyAnomalyDetector detector;
    private final AnomalyGrouper grouper;
    private final ScenarioClassifier classifier;
    private final RootCauseAnalyzer rootCauseAnalyzer;
    private final AnalysisConfig config;
    private final Tracer tracer;
    private final MetricsConfig metricsConfig;

    public AnomalyAnalysisService(ObservationTableValidator validator,
                                  ForecastRunner forecastRunner,
                                  HourlyAnomalyDetector detector,
                                  AnomalyGrouper grouper,
                                  ScenarioClassifier classifier,
                                  RootCauseAnalyzer rootCauseAnalyzer,
                                  AnalysisConfig config,
                                  Tracer tracer,
                                  MetricsConfig metricsConfig) {
        this.validator = validator;
        this.forecastRunner = forecastRunner;
        this.detector = detector;
        this.grouper = grouper;
        this.classifier = classifier;
        this.rootCauseAnalyzer = rootCauseAnalyzer;
        this.config = config;
        this.tracer = tracer;
        this.metricsConfig = metricsConfig;
    }

    @Observed(name = "analysis.run", contextualName = "analyze-observation-table")
    public AnalysisResult analyze(List<MetricHourObservation> observations) {
        long startedAt = System.nanoTime();
        String runId = UUID.randomUUID().toString();
        try {
            AnalysisResult result = runPipeline(runId, observations);
            metricsConfig.recordRun("success", Duration.ofNanos(System.nanoTime() - startedAt));
            return result;
        } catch (RuntimeException e) {
            metricsConfig.recordRun("failure", Duration.ofNanos(System.nanoTime() - startedAt));
            throw e;
        }
    }

    /**
     * Groups whose longest stretch of consecutive anomalous hours reaches minHours.
     */
    public List<AnomalyGroup> sustainedGroups(List<AnomalyGroup> groups, int minHours) {
        return groups.stream()
                .filter(g -> g.longestConsecutiveRun() >= minHours)
                .toList();
    }

    private AnalysisResult runPipeline(String runId, List<MetricHourObservation> observations) {
        IngestedTable table = inStage("analysis.validate", () -> validator.validate(observations));
        for (MetricRejection rejection : table.getRejections()) {
            metricsConfig.recordMetricRejected(rejection.metric());
        }

        if (table.isEmpty()) {
            log.warn("Run {}: every metric was rejected, nothing to analyse", runId);
            return AnalysisResult.builder()
                    .runId(runId)
                    .generatedAt(System.currentTimeMillis())
                    .metrics(List.of())
                    .records(List.of())
                    .groups(List.of())
                    .scenarioCounts(Map.of())
                    .rejections(table.getRejections())
                    .insufficientHistoryHours(0)
                    .build();
        }

        boolean independent = config.getDetection().getAttributionPolicy()
                == AnalysisConfig.AttributionPolicy.INDEPENDENT;
        Map<SeriesKey, HourlySeries> series = table.series(true);
        Map<SeriesKey, HourlySeries> toFit = independent ? series : totalsOnly(series);

        ExpectationTable expectations = inStage("analysis.forecast",
                () -> forecastRunner.run(table.getFirstHour(), toFit));
        metricsConfig.recordSeriesFitted(expectations.seriesCount());

        Map<String, SortedMap<String, SortedSet<String>>> vocabulary = new HashMap<>();
        for (String metric : table.metrics()) {
            vocabulary.put(metric, table.dimensionValues(metric));
        }
        ContributionAttributor attributor = independent
                ? new IndependentForecastAttributor(vocabulary, expectations)
                : new ProportionalShareAttributor(vocabulary, series, config.getForecast().getMaxHistoryHours());

        List<AnomalyRecord> records = new ArrayList<>();
        long[] insufficient = {0};
        inStage("analysis.detect", () -> {
            for (String metric : table.metrics()) {
                long metricInsufficient = 0;
                long metricAnomalies = 0;
                for (Instant hour : table.hours()) {
                    Expectation expectation = expectations.find(SeriesKey.total(metric), hour)
                            .orElseGet(() -> Expectation.insufficient(metric, null, null, hour, 0));
                    Optional<AnomalyRecord> record = detector.detect(
                            table.observation(metric, hour), expectation, attributor);
                    if (record.isEmpty()) {
                        metricInsufficient++;
                        continue;
                    }
                    records.add(record.get());
                    if (record.get().isAnomaly()) metricAnomalies++;
                }
                insufficient[0] += metricInsufficient;
                metricsConfig.recordInsufficientHistory(metric, metricInsufficient);
                metricsConfig.recordAnomalousHours(metric, metricAnomalies);
            }
            return records;
        });

        List<AnomalyGroup> groups = inStage("analysis.group", () -> grouper.group(records));

        List<AnomalyGroup> classified = inStage("analysis.classify", () -> {
            List<AnomalyGroup> out = new ArrayList<>(groups.size());
            for (AnomalyGroup group : groups) {
                AnomalyGroup result = rootCauseAnalyzer.annotate(classifier.classify(group));
                metricsConfig.recordGroupClassified(result.getScenario().name());
                out.add(result);
            }
            return out;
        });

        Map<Scenario, Long> scenarioCounts = new EnumMap<>(Scenario.class);
        for (AnomalyGroup group : classified) {
            scenarioCounts.merge(group.getScenario(), 1L, Long::sum);
        }

        AnalysisResult result = AnalysisResult.builder()
                .runId(runId)
                .generatedAt(System.currentTimeMillis())
                .firstHour(table.getFirstHour())
                .lastHour(table.getLastHour())
                .metrics(List.copyOf(table.metrics()))
                .records(List.copyOf(records))
                .groups(List.copyOf(classified))
                .scenarioCounts(scenarioCounts)
                .rejections(table.getRejections())
                .insufficientHistoryHours(insufficient[0])
                .build();

        log.info("Run {}: {} metrics x {} hours, {} series fitted, {} records ({} anomalous), "
                        + "{} groups {}, {} hours without enough history, {} metrics rejected",
                runId, result.getMetrics().size(), table.hourCount(), expectations.seriesCount(),
                records.size(), result.getAnomalyCount(), classified.size(), scenarioCounts,
                insufficient[0], table.getRejections().size());
        return result;
    }

    private static Map<SeriesKey, HourlySeries> totalsOnly(Map<SeriesKey, HourlySeries> series) {
        Map<SeriesKey, HourlySeries> totals = new LinkedHashMap<>();
        series.forEach((key, s) -> {
            if (key.isTotal()) totals.put(key, s);
        });
        return totals;
    }

    private <T> T inStage(String name, Supplier<T> work) {
        Span span = tracer.nextSpan().name(name).start();
        try (Tracer.SpanInScope ws = tracer.withSpan(span)) {
            return work.get();
        } catch (RuntimeException e) {
            span.error(e);
            throw e;
        } finally {
            span.end();
        }
    }
}

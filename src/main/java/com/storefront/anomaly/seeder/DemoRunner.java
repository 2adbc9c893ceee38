package com.storefront.anomaly.seeder;

import com.storefront.anomaly.config.AnalysisConfig;
import com.storefront.anomaly.model.AnalysisResult;
import com.storefront.anomaly.model.AnomalyGroup;
import com.storefront.anomaly.model.MetricGroupSummary;
import com.storefront.anomaly.service.AnomalyAnalysisService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

/**
 * Analyses a generated storefront table at startup and logs the sustained anomaly groups.
 * Only runs when the "demo" Spring profile is active.
 *
 * Run with:  mvn spring-boot:run -Dspring-boot.run.profiles=demo
 */
@Component
@Profile("demo")
public class DemoRunner implements CommandLineRunner {

    private static final Logger log = LoggerFactory.getLogger(DemoRunner.class);

    private final SyntheticTableGenerator generator;
    private final AnomalyAnalysisService analysisService;
    private final AnalysisConfig config;

    public DemoRunner(SyntheticTableGenerator generator,
                      AnomalyAnalysisService analysisService,
                      AnalysisConfig config) {
        this.generator = generator;
        this.analysisService = analysisService;
        this.config = config;
    }

    @Override
    public void run(String... args) {
        log.info("=== Analysing {} days of generated storefront data ===", SyntheticTableGenerator.DEFAULT_DAYS);

        AnalysisResult result = analysisService.analyze(generator.generate(SyntheticTableGenerator.DEFAULT_DAYS));
        int minHours = config.getReporting().getSustainedMinHours();

        log.info("{} anomalous hours in {} groups, scenarios {}",
                result.getAnomalyCount(), result.getGroups().size(), result.getScenarioCounts());
        for (AnomalyGroup group : analysisService.sustainedGroups(result.getGroups(), minHours)) {
            log.info("{} [{} .. {}] scenario {} ({}): {}",
                    group.getGroupId(), group.getStartHour(), group.getEndHour(),
                    group.getScenario(), group.getScenario().getLabel(), group.getScenarioReason());
            for (MetricGroupSummary metric : group.getMetrics()) {
                log.info("    {} {} hours, {} mean {}%, contributor {}",
                        metric.getMetric(), metric.getAnomalousHours(), metric.getDirection(),
                        String.format("%.1f", metric.getMeanPercentDiff()),
                        metric.hasPrimaryContributor() ? metric.getPrimaryContributor() : "none");
            }
            log.info("    root cause: {}", group.getRootCause().getDescription());
        }

        log.info("=== Demo analysis complete ===");
    }
}

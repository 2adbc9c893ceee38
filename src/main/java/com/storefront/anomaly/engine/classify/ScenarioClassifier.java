package com.storefront.anomaly.engine.classify;

import com.storefront.anomaly.model.AnomalyGroup;
import com.storefront.anomaly.model.DimensionValue;
import com.storefront.anomaly.model.MetricGroupSummary;
import com.storefront.anomaly.model.Scenario;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Assigns a scenario to an anomaly group. Rules are checked in the order D, A, B, C:
 *
 * D: the group covers a single metric or a single hour.
 * A: two or more metrics carry a primary contributor and they all agree.
 * B: two or more metrics carry a primary contributor and they disagree.
 * C: fewer than two metrics carry a primary contributor.
 *
 * Metrics without a contributor are left out of the A/B comparison. Once D is excluded the number
 * of defined contributors is either below two (C) or not, and then it has one distinct value (A)
 * or several (B), so every group gets exactly one scenario.
 */
@Component
public class ScenarioClassifier {

    private static final Logger log = LoggerFactory.getLogger(ScenarioClassifier.class);

    public AnomalyGroup classify(AnomalyGroup group) {
        Scenario scenario;
        String reason;

        List<MetricGroupSummary> withContributor = group.getMetrics().stream()
                .filter(MetricGroupSummary::hasPrimaryContributor)
                .toList();
        Set<DimensionValue> distinct = withContributor.stream()
                .map(MetricGroupSummary::getPrimaryContributor)
                .collect(Collectors.toCollection(LinkedHashSet::new));

        if (group.getMetrics().size() == 1) {
            scenario = Scenario.D;
            reason = "Only " + group.getMetrics().get(0).getMetric() + " is anomalous";
        } else if (group.isSingleHour()) {
            scenario = Scenario.D;
            reason = "All anomalies fall in the single hour " + group.getStartHour();
        } else if (withContributor.size() >= 2 && distinct.size() == 1) {
            scenario = Scenario.A;
            reason = String.format("%d metrics share the primary contributor %s",
                    withContributor.size(), distinct.iterator().next());
        } else if (withContributor.size() >= 2) {
            scenario = Scenario.B;
            reason = "Metrics point to different contributors: " + describe(withContributor);
        } else {
            scenario = Scenario.C;
            reason = withContributor.isEmpty()
                    ? "No metric has a dominant dimension value"
                    : "Only " + describe(withContributor) + " has a dominant dimension value";
        }

        log.debug("Group {} [{} .. {}] metrics={} -> scenario {} ({})",
                group.getGroupId(), group.getStartHour(), group.getEndHour(),
                group.getMetricNames(), scenario, reason);

        return group.withScenario(scenario).withScenarioReason(reason);
    }

    private static String describe(List<MetricGroupSummary> summaries) {
        return summaries.stream()
                .map(s -> s.getMetric() + " (" + Objects.toString(s.getPrimaryContributor()) + ")")
                .collect(Collectors.joining(", "));
    }
}

package com.storefront.anomaly.engine.classify;

import com.storefront.anomaly.model.AnomalyGroup;
import com.storefront.anomaly.model.DimensionValue;
import com.storefront.anomaly.model.MetricGroupSummary;
import com.storefront.anomaly.model.Scenario;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static com.storefront.anomaly.testutil.TestDataFactory.*;
import static org.assertj.core.api.Assertions.assertThat;

class ScenarioClassifierTest {

    private ScenarioClassifier classifier;

    @BeforeEach
    void setUp() {
        classifier = new ScenarioClassifier();
    }

    @Test
    void classify_sharedContributor_isA() {
        AnomalyGroup group = group(2, 4,
                summary("visitors", 3, IOS),
                summary("orders", 3, IOS));

        AnomalyGroup classified = classifier.classify(group);

        assertThat(classified.getScenario()).isEqualTo(Scenario.A);
        assertThat(classified.getScenarioReason()).contains("device=iOS");
        assertThat(group.getScenario()).isNull();
    }

    @Test
    void classify_differentContributors_isB() {
        AnomalyGroup classified = classifier.classify(group(2, 4,
                summary("visitors", 3, IOS),
                summary("orders", 3, US)));

        assertThat(classified.getScenario()).isEqualTo(Scenario.B);
        assertThat(classified.getScenarioReason()).contains("visitors (device=iOS)", "orders (location=US)");
    }

    @Test
    void classify_noContributors_isC() {
        AnomalyGroup classified = classifier.classify(group(2, 4,
                summary("visitors", 3, null),
                summary("orders", 3, null)));

        assertThat(classified.getScenario()).isEqualTo(Scenario.C);
    }

    @Test
    void classify_singleDefinedContributor_isC() {
        AnomalyGroup classified = classifier.classify(group(2, 4,
                summary("visitors", 3, IOS),
                summary("orders", 3, null)));

        assertThat(classified.getScenario()).isEqualTo(Scenario.C);
    }

    @Test
    void classify_sharedContributorPlusMetricWithout_isA() {
        AnomalyGroup classified = classifier.classify(group(2, 4,
                summary("visitors", 3, IOS),
                summary("added_to_cart", 2, null),
                summary("orders", 3, IOS)));

        assertThat(classified.getScenario()).isEqualTo(Scenario.A);
    }

    @Test
    void classify_singleMetric_isD() {
        AnomalyGroup classified = classifier.classify(group(2, 6, summary("visitors", 5, IOS)));

        assertThat(classified.getScenario()).isEqualTo(Scenario.D);
    }

    @Test
    void classify_singleHourSeveralMetrics_isD() {
        AnomalyGroup classified = classifier.classify(group(2, 2,
                summary("visitors", 1, IOS),
                summary("orders", 1, IOS)));

        assertThat(classified.getScenario()).isEqualTo(Scenario.D);
    }

    @Test
    void classify_everyCombination_getsExactlyOneScenario() {
        List<DimensionValue> options = Arrays.asList(null, IOS, US);
        String[] metrics = {"visitors", "added_to_cart", "orders"};

        for (int metricCount = 1; metricCount <= 3; metricCount++) {
            for (int combo = 0; combo < Math.pow(3, metricCount); combo++) {
                List<MetricGroupSummary> summaries = new ArrayList<>();
                int code = combo;
                for (int m = 0; m < metricCount; m++) {
                    summaries.add(summary(metrics[m], 2, options.get(code % 3)));
                    code /= 3;
                }
                for (int end : new int[]{2, 5}) {
                    AnomalyGroup classified = classifier.classify(
                            group(2, end, summaries.toArray(new MetricGroupSummary[0])));

                    assertThat(classified.getScenario()).isNotNull();
                    assertThat(classified.getScenarioReason()).isNotBlank();
                    if (metricCount == 1 || end == 2) {
                        assertThat(classified.getScenario()).isEqualTo(Scenario.D);
                    }
                }
            }
        }
    }
}

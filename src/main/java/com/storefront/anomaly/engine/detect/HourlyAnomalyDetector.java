package com.storefront.anomaly.engine.detect;

import com.storefront.anomaly.config.AnalysisConfig;
import com.storefront.anomaly.engine.DimensionPriority;
import com.storefront.anomaly.model.AnomalyRecord;
import com.storefront.anomaly.model.DimensionContribution;
import com.storefront.anomaly.model.DimensionValue;
import com.storefront.anomaly.model.Direction;
import com.storefront.anomaly.model.Expectation;
import com.storefront.anomaly.model.MetricHourObservation;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Turns an Expectation and the matching observation into an AnomalyRecord.
 *
 * Logic: anomalous if actual < lower or actual > upper. The primary contributor is the dimension
 * value with the largest contribution pointing the same way as the hour's deviation, provided it
 * explains at least significanceFraction of that deviation. Ties keep the value that comes first
 * in dimension priority order.
 *
 * Example: expected=100 in [90, 110], actual=115 -> anomalous, POSITIVE, percentDiff=15.0.
 * If device=iOS contributes +12 and location=US +9, iOS (12 >= 0.5 * 15) is the primary contributor.
 */
@Component
public class HourlyAnomalyDetector {

    private final AnalysisConfig config;

    public HourlyAnomalyDetector(AnalysisConfig config) {
        this.config = config;
    }

    /**
     * @return empty when the expectation carries no verdict (insufficient history)
     */
    public Optional<AnomalyRecord> detect(MetricHourObservation observation,
                                          Expectation expectation,
                                          ContributionAttributor attributor) {
        if (!expectation.isValid()) {
            return Optional.empty();
        }

        long actual = observation.getCount();
        double expected = expectation.getExpected();
        boolean anomaly = !expectation.contains(actual);
        Direction direction = anomaly ? Direction.of(actual - expected) : Direction.NONE;

        DimensionPriority priority = new DimensionPriority(config.getDetection().getDimensionPriority());
        List<DimensionContribution> contributions = attributor.attribute(observation, expectation, priority);

        DimensionValue primary = anomaly
                ? selectPrimaryContributor(contributions, actual - expected, direction)
                : null;

        return Optional.of(AnomalyRecord.builder()
                .metric(observation.getMetric())
                .hour(observation.getHour())
                .actual(actual)
                .expected(expected)
                .lower(expectation.getLower())
                .upper(expectation.getUpper())
                .percentDiff(Deviations.percentDiff(actual, expected))
                .anomaly(anomaly)
                .direction(direction)
                .anomalyWeight(Deviations.distanceOutside(actual, expectation.getLower(), expectation.getUpper()))
                .contributions(contributions)
                .primaryContributor(primary)
                .build());
    }

    /**
     * Contributions arrive in priority order, so the first strictly-largest candidate wins ties.
     */
    DimensionValue selectPrimaryContributor(List<DimensionContribution> contributions,
                                            double totalDeviation,
                                            Direction direction) {
        double threshold = config.getDetection().getSignificanceFraction() * Math.abs(totalDeviation);

        DimensionContribution best = null;
        for (DimensionContribution c : contributions) {
            if (!direction.matches(c.getContribution())) continue;
            double magnitude = Math.abs(c.getContribution());
            if (magnitude < threshold) continue;
            if (best == null || magnitude > Math.abs(best.getContribution())) {
                best = c;
            }
        }
        return best != null ? best.toDimensionValue() : null;
    }
}

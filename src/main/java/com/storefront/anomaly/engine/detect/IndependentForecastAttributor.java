package com.storefront.anomaly.engine.detect;

import com.storefront.anomaly.engine.forecast.ExpectationTable;
import com.storefront.anomaly.engine.forecast.SeriesKey;
import com.storefront.anomaly.model.Expectation;

import java.time.Instant;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.SortedMap;
import java.util.SortedSet;

/**
 * Each dimension value has been forecast as its own series; its expectation is read from the table.
 */
public class IndependentForecastAttributor extends ContributionAttributor {

    private final ExpectationTable expectations;

    public IndependentForecastAttributor(Map<String, SortedMap<String, SortedSet<String>>> vocabulary,
                                         ExpectationTable expectations) {
        super(vocabulary);
        this.expectations = expectations;
    }

    @Override
    protected OptionalDouble expectedFor(SeriesKey key, Instant hour, Expectation metricExpectation) {
        return expectations.find(key, hour)
                .filter(Expectation::isValid)
                .map(e -> OptionalDouble.of(e.getExpected()))
                .orElse(OptionalDouble.empty());
    }
}

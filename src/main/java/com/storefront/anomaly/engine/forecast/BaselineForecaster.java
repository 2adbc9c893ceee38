package com.storefront.anomaly.engine.forecast;

import com.storefront.anomaly.model.Expectation;

/**
 * Derives the expected value and uncertainty interval of a series at a target hour
 * from the hours that precede it.
 */
public interface BaselineForecaster {

    /**
     * Forecast {@code series} at {@code targetIndex}, using only values strictly before it.
     *
     * @param key         which series is being forecast (copied onto the Expectation)
     * @param series      dense hourly series; gaps are zeros
     * @param targetIndex index of the hour under test
     * @return the expectation, flagged as insufficient history when no verdict is possible
     */
    Expectation forecast(SeriesKey key, HourlySeries series, int targetIndex);
}

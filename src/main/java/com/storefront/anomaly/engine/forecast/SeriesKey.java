package com.storefront.anomaly.engine.forecast;

import com.storefront.anomaly.model.DimensionValue;

/**
 * Identifies one independently forecast series: a metric total, or a metric restricted to one dimension value.
 */
public record SeriesKey(String metric, String dimension, String value) {

    public static SeriesKey total(String metric) {
        return new SeriesKey(metric, null, null);
    }

    public static SeriesKey of(String metric, DimensionValue dimensionValue) {
        return new SeriesKey(metric, dimensionValue.dimension(), dimensionValue.value());
    }

    public boolean isTotal() {
        return dimension == null;
    }

    public DimensionValue dimensionValue() {
        return isTotal() ? null : new DimensionValue(dimension, value);
    }

    @Override
    public String toString() {
        return isTotal() ? metric : metric + "[" + dimension + "=" + value + "]";
    }
}

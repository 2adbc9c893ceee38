package com.storefront.anomaly.engine.ingest;

/**
 * The observation table broke the contract of the KPI layer (ordering, duplicates, negative counts,
 * missing fields). Raised for request-level violations; per-metric violations are reported as rejections.
 */
public class MalformedInputException extends RuntimeException {

    private final String metric;

    public MalformedInputException(String message) {
        this(null, message);
    }

    public MalformedInputException(String metric, String message) {
        super(message);
        this.metric = metric;
    }

    public String getMetric() {
        return metric;
    }
}

package com.storefront.anomaly.model;

/**
 * Causal pattern of an anomaly group, judged from the primary contributors of its metrics.
 */
public enum Scenario {
    /** Several metrics, all explained by the same dimension value. */
    A("Shared dimensional cause across metrics"),
    /** Several metrics, explained by different dimension values. */
    B("Different dimensional causes per metric"),
    /** Several metrics, no comparable dimensional explanation. */
    C("No dimensional explanation"),
    /** A single metric or a single hour. */
    D("Isolated anomaly");

    private final String label;

    Scenario(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}

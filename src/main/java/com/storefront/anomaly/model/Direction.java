package com.storefront.anomaly.model;

public enum Direction {
    POSITIVE,
    NEGATIVE,
    NONE;

    public static Direction of(double delta) {
        if (delta > 0) return POSITIVE;
        if (delta < 0) return NEGATIVE;
        return NONE;
    }

    /**
     * Whether a signed quantity points the same way as this direction.
     */
    public boolean matches(double delta) {
        return this != NONE && of(delta) == this;
    }
}

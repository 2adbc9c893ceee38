package com.storefront.anomaly.engine;

/**
 * A run could not complete; no partial result is returned.
 */
public class AnalysisException extends RuntimeException {

    public AnalysisException(String message, Throwable cause) {
        super(message, cause);
    }
}

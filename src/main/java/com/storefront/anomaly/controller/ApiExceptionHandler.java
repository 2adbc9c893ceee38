package com.storefront.anomaly.controller;

import com.storefront.anomaly.engine.AnalysisException;
import com.storefront.anomaly.engine.ingest.MalformedInputException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.LinkedHashMap;
import java.util.Map;

@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(MalformedInputException.class)
    public ResponseEntity<Map<String, Object>> handleMalformedInput(MalformedInputException ex) {
        Map<String, Object> details = new LinkedHashMap<>();
        if (ex.getMetric() != null) {
            details.put("metric", ex.getMetric());
        }
        return build(HttpStatus.BAD_REQUEST, "MALFORMED_INPUT", ex.getMessage(), details);
    }

    @ExceptionHandler({IllegalArgumentException.class, HttpMessageNotReadableException.class})
    public ResponseEntity<Map<String, Object>> handleIllegalArgument(Exception ex) {
        return build(HttpStatus.BAD_REQUEST, "INVALID_ARGUMENT", ex.getMessage(), Map.of());
    }

    @ExceptionHandler(AnalysisException.class)
    public ResponseEntity<Map<String, Object>> handleAnalysisFailure(AnalysisException ex) {
        log.error("Analysis run failed: {}", ex.getMessage(), ex);
        return build(HttpStatus.INTERNAL_SERVER_ERROR, "ANALYSIS_FAILED", ex.getMessage(), Map.of());
    }

    private ResponseEntity<Map<String, Object>> build(HttpStatus status, String code, String message,
                                                      Map<String, Object> details) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("code", code);
        body.put("error", message != null ? message : status.getReasonPhrase());
        if (!details.isEmpty()) {
            body.put("details", details);
        }
        return ResponseEntity.status(status).body(body);
    }
}

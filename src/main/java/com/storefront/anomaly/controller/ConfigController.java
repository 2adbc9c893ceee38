package com.storefront.anomaly.controller;

import com.storefront.anomaly.config.AnalysisConfig;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.*;

@RestController
@RequestMapping("/api/v1/config")
@Tag(name = "Config", description = "View and modify the analysis thresholds")
public class ConfigController {

    private final AnalysisConfig analysisConfig;

    public ConfigController(AnalysisConfig analysisConfig) {
        this.analysisConfig = analysisConfig;
    }

    @Operation(summary = "Get analysis thresholds")
    @GetMapping("/analysis")
    public ResponseEntity<Map<String, Object>> getAnalysisConfig() {
        AnalysisConfig.Forecast forecast = analysisConfig.getForecast();
        AnalysisConfig.Detection detection = analysisConfig.getDetection();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("minHistoryHours", forecast.getMinHistoryHours());
        body.put("maxHistoryHours", forecast.getMaxHistoryHours());
        body.put("trendEnabled", forecast.isTrendEnabled());
        body.put("confidenceLevel", forecast.getConfidenceLevel());
        body.put("intervalScale", forecast.getIntervalScale());
        body.put("countNoiseZ", forecast.getCountNoiseZ());
        body.put("attributionPolicy", detection.getAttributionPolicy().name());
        body.put("significanceFraction", detection.getSignificanceFraction());
        body.put("dimensionPriority", detection.getDimensionPriority());
        body.put("maxGapHours", analysisConfig.getGrouping().getMaxGapHours());
        body.put("sustainedMinHours", analysisConfig.getReporting().getSustainedMinHours());
        body.put("funnelUpstreamShare", analysisConfig.getReporting().getFunnelUpstreamShare());
        return ResponseEntity.ok(body);
    }

    @Operation(summary = "Update analysis thresholds",
            description = "Omitted fields keep their value. Changes apply to the next run but reset on restart.")
    @PutMapping("/analysis")
    public ResponseEntity<?> updateAnalysisConfig(@RequestBody Map<String, Object> body) {
        AnalysisConfig.Forecast forecast = analysisConfig.getForecast();
        AnalysisConfig.Detection detection = analysisConfig.getDetection();

        int minHistory = toInt(body, "minHistoryHours", forecast.getMinHistoryHours());
        int maxHistory = toInt(body, "maxHistoryHours", forecast.getMaxHistoryHours());
        boolean trend = toBoolean(body, "trendEnabled", forecast.isTrendEnabled());
        double confidence = toDouble(body, "confidenceLevel", forecast.getConfidenceLevel());
        double scale = toDouble(body, "intervalScale", forecast.getIntervalScale());
        double noiseZ = toDouble(body, "countNoiseZ", forecast.getCountNoiseZ());
        double significance = toDouble(body, "significanceFraction", detection.getSignificanceFraction());
        int maxGap = toInt(body, "maxGapHours", analysisConfig.getGrouping().getMaxGapHours());
        int sustained = toInt(body, "sustainedMinHours", analysisConfig.getReporting().getSustainedMinHours());
        double upstreamShare = toDouble(body, "funnelUpstreamShare", analysisConfig.getReporting().getFunnelUpstreamShare());

        AnalysisConfig.AttributionPolicy policy = detection.getAttributionPolicy();
        Object rawPolicy = body.get("attributionPolicy");
        if (rawPolicy != null) {
            try {
                policy = AnalysisConfig.AttributionPolicy.valueOf(rawPolicy.toString().toUpperCase());
            } catch (IllegalArgumentException e) {
                return badRequest("attributionPolicy must be one of " +
                        Arrays.toString(AnalysisConfig.AttributionPolicy.values()), "attributionPolicy");
            }
        }

        List<String> priority = detection.getDimensionPriority();
        Object rawPriority = body.get("dimensionPriority");
        if (rawPriority != null) {
            if (!(rawPriority instanceof List<?> rawList)) {
                return badRequest("dimensionPriority must be a list", "dimensionPriority");
            }
            priority = rawList.stream().map(Object::toString).distinct().toList();
        }

        if (minHistory < 1) return badRequest("minHistoryHours must be >= 1", "minHistoryHours");
        if (maxHistory < minHistory) return badRequest("maxHistoryHours must be >= minHistoryHours", "maxHistoryHours");
        if (confidence <= 0 || confidence >= 1) return badRequest("confidenceLevel must be in (0, 1)", "confidenceLevel");
        if (scale <= 0) return badRequest("intervalScale must be > 0", "intervalScale");
        if (noiseZ < 0) return badRequest("countNoiseZ must be >= 0", "countNoiseZ");
        if (significance <= 0 || significance > 1) return badRequest("significanceFraction must be in (0, 1]", "significanceFraction");
        if (maxGap < 1) return badRequest("maxGapHours must be >= 1", "maxGapHours");
        if (sustained < 1) return badRequest("sustainedMinHours must be >= 1", "sustainedMinHours");
        if (upstreamShare < 0) return badRequest("funnelUpstreamShare must be >= 0", "funnelUpstreamShare");

        forecast.setMinHistoryHours(minHistory);
        forecast.setMaxHistoryHours(maxHistory);
        forecast.setTrendEnabled(trend);
        forecast.setConfidenceLevel(confidence);
        forecast.setIntervalScale(scale);
        forecast.setCountNoiseZ(noiseZ);
        detection.setAttributionPolicy(policy);
        detection.setSignificanceFraction(significance);
        detection.setDimensionPriority(new ArrayList<>(priority));
        analysisConfig.getGrouping().setMaxGapHours(maxGap);
        analysisConfig.getReporting().setSustainedMinHours(sustained);
        analysisConfig.getReporting().setFunnelUpstreamShare(upstreamShare);

        return getAnalysisConfig();
    }

    // ── Helpers ──

    private ResponseEntity<Map<String, String>> badRequest(String error, String field) {
        return ResponseEntity.badRequest().body(Map.of("error", error, "field", field));
    }

    private double toDouble(Map<String, Object> body, String key, double defaultVal) {
        Object v = body.get(key);
        if (v == null) return defaultVal;
        if (v instanceof Number n) return n.doubleValue();
        try { return Double.parseDouble(v.toString()); } catch (NumberFormatException e) { return defaultVal; }
    }

    private int toInt(Map<String, Object> body, String key, int defaultVal) {
        Object v = body.get(key);
        if (v == null) return defaultVal;
        if (v instanceof Number n) return n.intValue();
        try { return Integer.parseInt(v.toString()); } catch (NumberFormatException e) { return defaultVal; }
    }

    private boolean toBoolean(Map<String, Object> body, String key, boolean defaultVal) {
        Object v = body.get(key);
        if (v == null) return defaultVal;
        if (v instanceof Boolean b) return b;
        return Boolean.parseBoolean(v.toString());
    }
}

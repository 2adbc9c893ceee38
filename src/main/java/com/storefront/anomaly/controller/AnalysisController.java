package com.storefront.anomaly.controller;

import com.storefront.anomaly.model.AnalysisRequest;
import com.storefront.anomaly.model.AnalysisResult;
import com.storefront.anomaly.seeder.SyntheticTableGenerator;
import com.storefront.anomaly.service.AnomalyAnalysisService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@RestController
@RequestMapping("/api/v1/analysis")
@Tag(name = "Analysis", description = "Run the anomaly pipeline over an hourly metric table")
public class AnalysisController {

    private final AnomalyAnalysisService analysisService;
    private final SyntheticTableGenerator tableGenerator;

    public AnalysisController(AnomalyAnalysisService analysisService,
                              SyntheticTableGenerator tableGenerator) {
        this.analysisService = analysisService;
        this.tableGenerator = tableGenerator;
    }

    @Operation(summary = "Analyse an hourly metric table",
            description = "Forecasts a baseline for every metric and dimension value, flags hours outside the " +
                    "expected interval, groups anomalous hours across metrics and classifies each group " +
                    "into scenario A/B/C/D. Metrics that break the input contract are reported as rejections.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Analysis result",
                    content = @Content(mediaType = "application/json",
                            schema = @Schema(implementation = AnalysisResult.class))),
            @ApiResponse(responseCode = "400", description = "Malformed table or invalid minSustainedHours"),
            @ApiResponse(responseCode = "500", description = "A forecast task failed, no partial result is returned")
    })
    @PostMapping("/runs")
    public ResponseEntity<?> analyze(
            @RequestBody AnalysisRequest request,
            @Parameter(description = "Only return groups with at least this many consecutive anomalous hours")
            @RequestParam(required = false) Integer minSustainedHours) {
        if (minSustainedHours != null && minSustainedHours < 1) {
            return ResponseEntity.badRequest().body(Map.of(
                    "error", "minSustainedHours must be >= 1",
                    "field", "minSustainedHours"));
        }

        AnalysisResult result = analysisService.analyze(request.getObservations());
        return ResponseEntity.ok(filter(result, minSustainedHours));
    }

    @Operation(summary = "Analyse a generated demo table",
            description = "Generates a seeded synthetic storefront table with injected anomalies and analyses it.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Analysis result",
                    content = @Content(mediaType = "application/json",
                            schema = @Schema(implementation = AnalysisResult.class))),
            @ApiResponse(responseCode = "400", description = "days outside [1, 90] or invalid minSustainedHours"),
            @ApiResponse(responseCode = "500", description = "A forecast task failed, no partial result is returned")
    })
    @PostMapping("/runs/demo")
    public ResponseEntity<?> analyzeDemo(
            @Parameter(description = "Days of hourly data to generate", example = "28")
            @RequestParam(defaultValue = "28") int days,
            @Parameter(description = "Only return groups with at least this many consecutive anomalous hours")
            @RequestParam(required = false) Integer minSustainedHours) {
        if (days < 1 || days > 90) {
            return ResponseEntity.badRequest().body(Map.of("error", "days must be in [1, 90]", "field", "days"));
        }
        if (minSustainedHours != null && minSustainedHours < 1) {
            return ResponseEntity.badRequest().body(Map.of(
                    "error", "minSustainedHours must be >= 1",
                    "field", "minSustainedHours"));
        }

        AnalysisResult result = analysisService.analyze(tableGenerator.generate(days));
        return ResponseEntity.ok(filter(result, minSustainedHours));
    }

    // Scenario counts keep covering every group of the run.
    private AnalysisResult filter(AnalysisResult result, Integer minSustainedHours) {
        if (minSustainedHours == null) return result;
        return result.withGroups(analysisService.sustainedGroups(result.getGroups(), minSustainedHours));
    }
}

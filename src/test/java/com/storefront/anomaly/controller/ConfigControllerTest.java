package com.storefront.anomaly.controller;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.storefront.anomaly.config.AnalysisConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(ConfigController.class)
class ConfigControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @MockBean
    private AnalysisConfig analysisConfig;

    private AnalysisConfig.Forecast forecast;
    private AnalysisConfig.Detection detection;
    private AnalysisConfig.Grouping grouping;
    private AnalysisConfig.Reporting reporting;

    @BeforeEach
    void setUp() {
        forecast = new AnalysisConfig.Forecast();
        detection = new AnalysisConfig.Detection();
        grouping = new AnalysisConfig.Grouping();
        reporting = new AnalysisConfig.Reporting();
        when(analysisConfig.getForecast()).thenReturn(forecast);
        when(analysisConfig.getDetection()).thenReturn(detection);
        when(analysisConfig.getGrouping()).thenReturn(grouping);
        when(analysisConfig.getReporting()).thenReturn(reporting);
    }

    @Test
    void getAnalysisConfig_success() throws Exception {
        mockMvc.perform(get("/api/v1/config/analysis"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.minHistoryHours").value(336))
                .andExpect(jsonPath("$.confidenceLevel").value(0.95))
                .andExpect(jsonPath("$.attributionPolicy").value("INDEPENDENT"))
                .andExpect(jsonPath("$.maxGapHours").value(3))
                .andExpect(jsonPath("$.dimensionPriority[0]").value("location"));
    }

    @Test
    void updateAnalysisConfig_success() throws Exception {
        mockMvc.perform(put("/api/v1/config/analysis")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(Map.of(
                                "maxGapHours", 5,
                                "confidenceLevel", 0.9,
                                "attributionPolicy", "proportional",
                                "dimensionPriority", List.of("device", "location")
                        ))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.maxGapHours").value(5))
                .andExpect(jsonPath("$.attributionPolicy").value("PROPORTIONAL"));

        assertThat(grouping.getMaxGapHours()).isEqualTo(5);
        assertThat(forecast.getConfidenceLevel()).isEqualTo(0.9);
        assertThat(detection.getAttributionPolicy()).isEqualTo(AnalysisConfig.AttributionPolicy.PROPORTIONAL);
        assertThat(detection.getDimensionPriority()).containsExactly("device", "location");
        // untouched fields keep their values
        assertThat(forecast.getMinHistoryHours()).isEqualTo(336);
    }

    @Test
    void updateAnalysisConfig_confidenceOutOfRange_returns400() throws Exception {
        mockMvc.perform(put("/api/v1/config/analysis")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(Map.of("confidenceLevel", 1.5))))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.field").value("confidenceLevel"));

        assertThat(forecast.getConfidenceLevel()).isEqualTo(0.95);
    }

    @Test
    void updateAnalysisConfig_maxHistoryBelowMin_returns400() throws Exception {
        mockMvc.perform(put("/api/v1/config/analysis")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(Map.of("maxHistoryHours", 100))))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.field").value("maxHistoryHours"));
    }

    @Test
    void updateAnalysisConfig_unknownPolicy_returns400() throws Exception {
        mockMvc.perform(put("/api/v1/config/analysis")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(Map.of("attributionPolicy", "RANDOM"))))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.field").value("attributionPolicy"));
    }

    @Test
    void updateAnalysisConfig_zeroGap_returns400() throws Exception {
        mockMvc.perform(put("/api/v1/config/analysis")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(Map.of("maxGapHours", 0))))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.field").value("maxGapHours"));

        assertThat(grouping.getMaxGapHours()).isEqualTo(3);
    }
}

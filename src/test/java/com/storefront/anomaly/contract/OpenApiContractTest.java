package com.storefront.anomaly.contract;

import com.jayway.jsonpath.DocumentContext;
import com.jayway.jsonpath.JsonPath;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Contract test that validates the OpenAPI document structure,
 * protecting consumers from accidental schema drift.
 */
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
class OpenApiContractTest {

    @Autowired
    private TestRestTemplate restTemplate;

    @Test
    void openApiSpec_isAccessible() {
        ResponseEntity<String> response = restTemplate.getForEntity("/v3/api-docs", String.class);
        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(response.getBody()).isNotEmpty();
    }

    @Test
    void openApiSpec_containsAllEndpointPaths() {
        DocumentContext json = JsonPath.parse(restTemplate.getForEntity("/v3/api-docs", String.class).getBody());
        Map<String, Object> paths = json.read("$.paths");

        assertThat(paths).containsKey("/api/v1/analysis/runs");
        assertThat(paths).containsKey("/api/v1/analysis/runs/demo");
        assertThat(paths).containsKey("/api/v1/config/analysis");
    }

    @Test
    void openApiSpec_resultSchemas_haveRequiredFields() {
        DocumentContext json = JsonPath.parse(restTemplate.getForEntity("/v3/api-docs", String.class).getBody());
        Map<String, Object> schemas = json.read("$.components.schemas");

        assertThat(schemas).containsKeys("AnalysisRequest", "AnalysisResult", "AnomalyGroup",
                "AnomalyRecord", "MetricHourObservation");

        Map<String, Object> groupProps = json.read("$.components.schemas.AnomalyGroup.properties");
        assertThat(groupProps).containsKeys("groupId", "startHour", "endHour", "scenario", "metrics");

        Map<String, Object> recordProps = json.read("$.components.schemas.AnomalyRecord.properties");
        assertThat(recordProps).containsKeys("metric", "hour", "actual", "expected", "lower", "upper",
                "percentDiff", "anomaly", "direction");
    }

    @Test
    void openApiSpec_runEndpoints_returnAnalysisResult() {
        DocumentContext json = JsonPath.parse(restTemplate.getForEntity("/v3/api-docs", String.class).getBody());

        for (String path : List.of("/api/v1/analysis/runs", "/api/v1/analysis/runs/demo")) {
            String ref = json.read("$.paths['" + path + "'].post.responses['200'].content['application/json'].schema['$ref']");
            assertThat(ref).isEqualTo("#/components/schemas/AnalysisResult");
            Map<String, Object> responses = json.read("$.paths['" + path + "'].post.responses");
            assertThat(responses).containsKeys("200", "400");
        }

        Map<String, Object> resultProps = json.read("$.components.schemas.AnalysisResult.properties");
        assertThat(resultProps).containsKeys("runId", "records", "groups", "scenarioCounts", "rejections");
    }
}

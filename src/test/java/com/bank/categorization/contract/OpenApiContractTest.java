package com.bank.categorization.contract;

import com.bank.categorization.config.TestAerospikeConfig;
import com.jayway.jsonpath.DocumentContext;
import com.jayway.jsonpath.JsonPath;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.context.annotation.Import;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.test.context.ActiveProfiles;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Contract test that validates the published OpenAPI document.
 * Ensures all endpoints and critical schemas are present,
 * protecting consumers from accidental schema drift.
 */
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@Import(TestAerospikeConfig.class)
@ActiveProfiles("test")
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
        ResponseEntity<String> response = restTemplate.getForEntity("/v3/api-docs", String.class);
        DocumentContext json = JsonPath.parse(response.getBody());
        Map<String, Object> paths = json.read("$.paths");

        // Decision endpoints
        assertThat(paths).containsKey("/api/v1/tenants/{tenantId}/decisions/route");
        assertThat(paths).containsKey("/api/v1/tenants/{tenantId}/decisions");
        assertThat(paths).containsKey("/api/v1/tenants/{tenantId}/decisions/{decisionId}");
        assertThat(paths).containsKey("/api/v1/tenants/{tenantId}/decisions/{decisionId}/rationale");
        assertThat(paths).containsKey("/api/v1/tenants/{tenantId}/decisions/rationale/similar");
        assertThat(paths).containsKey("/api/v1/tenants/{tenantId}/decisions/{decisionId}/confirmation");

        // Correction endpoints
        assertThat(paths).containsKey("/api/v1/tenants/{tenantId}/decisions/{decisionId}/correction");
        assertThat(paths).containsKey("/api/v1/tenants/{tenantId}/corrections");

        // Learned rule endpoints
        assertThat(paths).containsKey("/api/v1/tenants/{tenantId}/rules");
        assertThat(paths).containsKey("/api/v1/tenants/{tenantId}/rules/{ruleId}");

        // Analytics, tenants, config
        assertThat(paths).containsKey("/api/v1/tenants/{tenantId}/analytics/accuracy");
        assertThat(paths).containsKey("/api/v1/tenants");
        assertThat(paths).containsKey("/api/v1/tenants/{tenantId}");
        assertThat(paths).containsKey("/api/v1/config/routing");
    }

    @Test
    void openApiSpec_containsCriticalSchemas() {
        ResponseEntity<String> response = restTemplate.getForEntity("/v3/api-docs", String.class);
        DocumentContext json = JsonPath.parse(response.getBody());
        Map<String, Object> schemas = json.read("$.components.schemas");

        assertThat(schemas).containsKey("TransactionInput");
        assertThat(schemas).containsKey("RoutingResponse");
        assertThat(schemas).containsKey("ItemResult");
        assertThat(schemas).containsKey("Decision");
        assertThat(schemas).containsKey("CorrectionResult");
        assertThat(schemas).containsKey("LearnedRule");
    }

    @Test
    void openApiSpec_routingSchemas_haveRequiredFields() {
        ResponseEntity<String> response = restTemplate.getForEntity("/v3/api-docs", String.class);
        DocumentContext json = JsonPath.parse(response.getBody());

        Map<String, Object> itemProps = json.read("$.components.schemas.ItemResult.properties");
        assertThat(itemProps).containsKey("status");
        assertThat(itemProps).containsKey("confidence");
        assertThat(itemProps).containsKey("source");
        assertThat(itemProps).containsKey("failureReason");

        Map<String, Object> statsProps = json.read("$.components.schemas.BatchStats.properties");
        assertThat(statsProps).containsKey("autoApplied");
        assertThat(statsProps).containsKey("reviewRequired");
        assertThat(statsProps).containsKey("failed");
        assertThat(statsProps).containsKey("averageConfidence");
    }
}

package com.bank.categorization.integration;

import com.bank.categorization.model.TenantContext;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.net.SocketTimeoutException;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Calls a remote categorization model over HTTP ({@code POST /infer}).
 */
public class RestInferenceClient implements InferenceClient {

    private final RestTemplate restTemplate;

    public RestInferenceClient(RestTemplate restTemplate) {
        this.restTemplate = restTemplate;
    }

    @Override
    public InferenceResult infer(InferenceRequest request, TenantContext tenant, Duration timeout) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("tenantId", tenant.tenantId());
        body.put("agentType", request.agentType().name());
        body.put("transactionId", request.transactionId());
        body.put("inputText", request.inputText());
        body.put("amountCents", request.amountCents());
        body.put("credit", request.credit());
        body.put("timeoutMs", timeout.toMillis());

        InferenceResult result;
        try {
            result = restTemplate.postForObject("/infer", body, InferenceResult.class);
        } catch (ResourceAccessException e) {
            if (e.getCause() instanceof SocketTimeoutException) {
                throw new InferenceTimeoutException("Inference call timed out for " + request.transactionId(), e);
            }
            throw new InferenceException("Inference service unreachable: " + e.getMessage(), e);
        } catch (RestClientException e) {
            throw new InferenceException("Inference call failed: " + e.getMessage(), e);
        }

        if (result == null || result.getOutputValue() == null) {
            throw new InferenceException("Inference service returned no output for " + request.transactionId());
        }
        if (result.getConfidence() < 0 || result.getConfidence() > 100) {
            throw new InferenceException("Inference confidence out of range: " + result.getConfidence());
        }
        return result;
    }
}

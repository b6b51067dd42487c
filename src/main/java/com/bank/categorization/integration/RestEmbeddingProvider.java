package com.bank.categorization.integration;

import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.List;
import java.util.Map;

/**
 * Remote embedding model ({@code POST /embed}, response {@code {"embedding": [...]}}).
 */
public class RestEmbeddingProvider implements EmbeddingProvider {

    private final RestTemplate restTemplate;

    public RestEmbeddingProvider(RestTemplate restTemplate) {
        this.restTemplate = restTemplate;
    }

    @Override
    public float[] embed(String text) {
        EmbeddingResponse response;
        try {
            response = restTemplate.postForObject("/embed", Map.of("text", text), EmbeddingResponse.class);
        } catch (RestClientException e) {
            throw new EmbeddingException("Embedding call failed: " + e.getMessage(), e);
        }
        if (response == null || response.embedding() == null || response.embedding().isEmpty()) {
            throw new EmbeddingException("Embedding service returned an empty vector");
        }
        List<Double> values = response.embedding();
        float[] vector = new float[values.size()];
        for (int i = 0; i < vector.length; i++) {
            vector[i] = values.get(i).floatValue();
        }
        return vector;
    }

    record EmbeddingResponse(List<Double> embedding) {
    }
}

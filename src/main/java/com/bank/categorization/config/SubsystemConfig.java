package com.bank.categorization.config;

import com.bank.categorization.integration.DefaultAccountInferenceClient;
import com.bank.categorization.integration.EmbeddingProvider;
import com.bank.categorization.integration.HashingEmbeddingProvider;
import com.bank.categorization.integration.InferenceClient;
import com.bank.categorization.integration.RestEmbeddingProvider;
import com.bank.categorization.integration.RestInferenceClient;
import lombok.Data;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;

/**
 * Wires the inference and embedding subsystems. A configured base URL selects the
 * HTTP implementation; a blank one selects the local default.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "categorization")
public class SubsystemConfig {

    private static final Logger log = LoggerFactory.getLogger(SubsystemConfig.class);

    private Endpoint inference = new Endpoint();
    private Endpoint embedding = new Endpoint();

    @Bean
    public InferenceClient inferenceClient(RestTemplateBuilder builder, RoutingConfig routingConfig) {
        if (!inference.isConfigured()) {
            log.info("No inference endpoint configured, using default account assignment");
            return new DefaultAccountInferenceClient();
        }
        RestTemplate restTemplate = builder
                .rootUri(inference.getBaseUrl())
                .setConnectTimeout(Duration.ofMillis(inference.getConnectTimeoutMs()))
                .setReadTimeout(Duration.ofMillis(routingConfig.getInferenceTimeoutMs()))
                .build();
        log.info("Inference endpoint configured at {}", inference.getBaseUrl());
        return new RestInferenceClient(restTemplate);
    }

    @Bean
    public EmbeddingProvider embeddingProvider(RestTemplateBuilder builder, MemoryConfig memoryConfig) {
        if (!embedding.isConfigured()) {
            log.info("No embedding endpoint configured, using {}-dimensional feature hashing",
                    memoryConfig.getEmbeddingDimensions());
            return new HashingEmbeddingProvider(memoryConfig.getEmbeddingDimensions());
        }
        RestTemplate restTemplate = builder
                .rootUri(embedding.getBaseUrl())
                .setConnectTimeout(Duration.ofMillis(embedding.getConnectTimeoutMs()))
                .setReadTimeout(Duration.ofSeconds(10))
                .build();
        log.info("Embedding endpoint configured at {}", embedding.getBaseUrl());
        return new RestEmbeddingProvider(restTemplate);
    }

    @Data
    public static class Endpoint {
        private String baseUrl = "";
        private int connectTimeoutMs = 2000;

        public boolean isConfigured() {
            return baseUrl != null && !baseUrl.isBlank();
        }
    }
}

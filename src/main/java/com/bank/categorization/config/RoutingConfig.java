package com.bank.categorization.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Data
@Configuration
@ConfigurationProperties(prefix = "categorization.routing")
public class RoutingConfig {

    // Confidence at or above which a decision is applied without review.
    private int autoApplyThreshold = 80;

    // Hard ceiling on a single inference call.
    private long inferenceTimeoutMs = 30000;

    // Items of one batch routed concurrently.
    private int maxParallelism = 8;

    // Allowed difference between split line total and the transaction amount.
    private long splitToleranceCents = 1;

    private int ruleCacheRefreshSeconds = 60;

    // Resolve straight from a learned rule when its support is high enough.
    private boolean patternShortCircuitEnabled = false;
    private int patternShortCircuitMinSupport = 5;
    private int patternShortCircuitBaseConfidence = 70;
}

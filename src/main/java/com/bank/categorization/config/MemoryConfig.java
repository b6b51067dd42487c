package com.bank.categorization.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Data
@Configuration
@ConfigurationProperties(prefix = "categorization.memory")
public class MemoryConfig {
    private int defaultSimilarLimit = 5;
    private int maxSimilarLimit = 50;
    private int embeddingDimensions = 384;
    private int writePoolSize = 2;
}

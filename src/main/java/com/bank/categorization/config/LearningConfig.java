package com.bank.categorization.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Data
@Configuration
@ConfigurationProperties(prefix = "categorization.learning")
public class LearningConfig {

    // Agreeing corrections needed before a rule is created.
    private int minCorrectionsForRule = 3;

    // Boost for a rule whose every correction agrees.
    private int baseRuleBoost = 15;

    // Leading characters of an account code that identify its category.
    private int categoryPrefixLength = 2;

    private double standardPenalty = -0.5;
    private double partialPenalty = -0.3;

    private double trajectoryStepReward = -1.0;
    private double trajectoryQuality = 0.0;
    private int trajectoryEmbeddingDimensions = 384;

    private int dispatchPoolSize = 4;
}

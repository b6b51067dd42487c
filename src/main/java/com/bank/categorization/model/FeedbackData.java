package com.bank.categorization.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Input to the feedback loop, assembled from a correction and the decision it overrides.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FeedbackData {
    private String tenantId;
    private String decisionId;
    private Object originalValue;
    private Object correctedValue;
    private String correctedBy;
    private String reason;
    private DecisionSource originalSource;
    private Integer originalConfidence;
    private String agentType;
    private PatternResult patternResult;
}

package com.bank.categorization.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Graded outcome of a correction. Built per correction, dispatched, then discarded.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FeedbackSignal {
    private String tenantId;
    private String decisionId;
    private AgentType agentType;
    private String action;
    private CorrectionSeverity severity;
    private double reward;
}

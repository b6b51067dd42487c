package com.bank.categorization.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Correction {
    private String tenantId;
    private String correctionId;
    private String decisionId;
    private CategoryValue originalValue;
    private CategoryValue correctedValue;
    private String correctedBy;
    private String reason;              // optional
    private PatternOutcome patternOutcome;
    private boolean feedbackDispatched;
    private Instant createdAt;
}

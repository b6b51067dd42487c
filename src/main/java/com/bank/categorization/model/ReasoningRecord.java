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
public class ReasoningRecord {
    private String tenantId;
    private String decisionId;
    private String chain;
    private float[] embedding;
    private Instant storedAt;
}

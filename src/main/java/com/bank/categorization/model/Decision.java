package com.bank.categorization.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Audit record of one categorization attempt")
public class Decision {

    @Schema(description = "Owning tenant", example = "tenant-001")
    private String tenantId;

    @Schema(description = "Unique decision identifier", example = "6f1c2b8e-0d0a-3c9e-9f57-1d2a4b6c8e01")
    private String decisionId;

    @Schema(description = "External transaction identifier", example = "TXN-2024-000123")
    private String transactionId;

    private AgentType agentType;

    @Schema(description = "SHA-256 fingerprint of the normalized input")
    private String inputHash;

    @Schema(description = "Normalized counterparty signature used for rule matching", example = "ACME SUPPLY")
    private String signature;

    @Builder.Default
    private List<String> keywords = new ArrayList<>();

    private long amountCents;

    private CategoryValue outputValue;

    @Schema(description = "Final confidence score (0-100)", example = "85")
    private int confidence;

    private DecisionSource source;

    private DecisionStatus status;

    @Schema(description = "Signature of the learned rule that boosted this decision, if any")
    private String matchedRuleId;

    @Schema(description = "Reasoning chain, immutable once written")
    private String rationale;

    private Instant createdAt;

    @Schema(description = "Null until reviewed; false once corrected, true once confirmed")
    private Boolean wasCorrect;

    private CategoryValue correctedTo;

    private Instant reviewedAt;
}

package com.bank.categorization.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Per-item outcome of a routing batch")
public class ItemResult {

    private String transactionId;

    @Schema(description = "Null for FAILED items, which are never persisted")
    private String decisionId;

    private DecisionStatus status;

    private int confidence;

    private DecisionSource source;

    private CategoryValue outputValue;

    private String matchedRuleId;

    private String rationale;

    @Schema(description = "Failure category for FAILED items", example = "INFERENCE_TIMEOUT")
    private FailureReason failureReason;

    private String failureDetail;

    @Schema(description = "True when the decision already existed for this transaction")
    private boolean replayed;
}

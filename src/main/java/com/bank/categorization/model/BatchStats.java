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
@Schema(description = "Aggregate statistics for a routing batch")
public class BatchStats {
    private int total;
    private int autoApplied;
    private int reviewRequired;
    private int failed;

    @Schema(description = "Average confidence over non-failed items", example = "83.5")
    private double averageConfidence;

    @Schema(description = "Fraction of non-failed items resolved with a learned rule", example = "0.25")
    private double ruleResolvedFraction;

    @Schema(description = "Fraction of non-failed items resolved by inference alone", example = "0.75")
    private double inferenceOnlyFraction;
}

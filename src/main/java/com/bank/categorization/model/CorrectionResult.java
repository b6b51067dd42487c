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
@Schema(description = "Outcome of recording a correction")
public class CorrectionResult {

    private String correctionId;

    private String decisionId;

    @Schema(description = "True when this correction created a new learned rule")
    private boolean patternCreated;

    private PatternOutcome patternOutcome;

    @Schema(description = "Existing rule whose target disagrees with the correction; needs manual review")
    private LearnedRule conflictingRule;

    @Schema(description = "True when the same correction had already been recorded")
    private boolean replayed;
}

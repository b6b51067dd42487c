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
@Schema(description = "Deterministic signature-to-category shortcut learned from repeated corrections")
public class LearnedRule {

    @Schema(description = "Owning tenant", example = "tenant-001")
    private String tenantId;

    @Schema(description = "Rule identifier, derived from tenant and signature")
    private String ruleId;

    @Schema(description = "Normalized counterparty signature", example = "ACME SUPPLY")
    private String signature;

    @Schema(description = "Description keywords observed on the corrected transactions")
    @Builder.Default
    private List<String> keywords = new ArrayList<>();

    private CategoryValue target;

    @Schema(description = "Confidence added when inference agrees with the target", example = "15")
    private int boost;

    @Schema(description = "Number of agreeing corrections when the rule was created", example = "3")
    private int supportCount;

    private Instant createdAt;
}

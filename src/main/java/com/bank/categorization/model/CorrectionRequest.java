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
@Schema(description = "Human override of a decision's output")
public class CorrectionRequest {

    private CategoryValue correctedValue;

    @Schema(description = "Identity of the reviewer", example = "user-001")
    private String correctedBy;

    @Schema(description = "Optional free-text reason", example = "Stationery, not bank charges")
    private String reason;
}

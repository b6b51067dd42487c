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
@Schema(description = "One line of a split categorization")
public class SplitLine {

    @Schema(description = "Account code for this portion", example = "5200")
    private String accountCode;

    @Schema(description = "Account name", example = "Office Supplies")
    private String accountName;

    @Schema(description = "Portion of the transaction amount in cents", example = "2500")
    private long amountCents;
}

package com.bank.categorization.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "A normalized bank transaction submitted for categorization")
public class TransactionInput {

    @Schema(description = "External transaction identifier, unique within the tenant", example = "TXN-2024-000123")
    private String transactionId;

    @Schema(description = "Counterparty name as it appears on the statement", example = "ACME SUPPLY (PTY) LTD")
    private String payeeName;

    @Schema(description = "Free-text statement description", example = "POS purchase stationery")
    private String description;

    @Schema(description = "Transaction amount in cents", example = "12500")
    private long amountCents;

    @Schema(description = "True for money in, false for money out", example = "false")
    private boolean credit;

    @Schema(description = "Posting time with offset", example = "2024-03-01T10:15:30+02:00")
    private OffsetDateTime postedAt;

    @Schema(description = "Agent requesting the decision", example = "CATEGORIZER")
    private String agentType;
}

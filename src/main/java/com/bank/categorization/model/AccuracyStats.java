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
@Schema(description = "Decision accuracy for one tenant and agent type")
public class AccuracyStats {
    private String tenantId;
    private AgentType agentType;
    private long totalDecisions;

    @Schema(description = "Decisions that were confirmed or corrected")
    private long reviewedDecisions;

    private long correctDecisions;

    @Schema(description = "Percentage of reviewed decisions that were correct", example = "90")
    private long accuracyRate;
}

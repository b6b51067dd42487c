package com.bank.categorization.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "A registered tenant")
public class Tenant {

    @Schema(description = "Tenant identifier ([A-Za-z0-9_-], max 48 chars)", example = "tenant-001")
    private String tenantId;

    @Schema(description = "Display name", example = "Little Stars Creche")
    private String name;

    @Schema(description = "Per-tenant auto-apply threshold; global default when null", example = "85")
    private Integer autoApplyThreshold;

    @Builder.Default
    private boolean active = true;

    private Instant createdAt;
}

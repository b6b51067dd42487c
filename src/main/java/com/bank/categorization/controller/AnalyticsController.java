package com.bank.categorization.controller;

import com.bank.categorization.model.AccuracyStats;
import com.bank.categorization.service.AnalyticsService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/tenants/{tenantId}/analytics")
@Tag(name = "Analytics", description = "Decision accuracy from reviewer feedback")
public class AnalyticsController {

    private final AnalyticsService analyticsService;

    public AnalyticsController(AnalyticsService analyticsService) {
        this.analyticsService = analyticsService;
    }

    @Operation(summary = "Accuracy of reviewed decisions",
            description = "Correct / reviewed, as a rounded percentage. Omit agentType to include all agents.")
    @GetMapping("/accuracy")
    public ResponseEntity<AccuracyStats> getAccuracy(
            @PathVariable String tenantId,
            @Parameter(description = "CATEGORIZER or MATCHER") @RequestParam(required = false) String agentType) {
        return ResponseEntity.ok(analyticsService.getAccuracy(tenantId, agentType));
    }
}

package com.bank.categorization.controller;

import com.bank.categorization.model.Decision;
import com.bank.categorization.model.PagedResponse;
import com.bank.categorization.model.RoutingRequest;
import com.bank.categorization.model.RoutingResponse;
import com.bank.categorization.model.SimilarRationale;
import com.bank.categorization.service.DecisionQueryService;
import com.bank.categorization.service.DecisionRoutingService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/tenants/{tenantId}/decisions")
@Tag(name = "Decisions", description = "Route transactions to categorization decisions and read the audit trail")
public class DecisionController {

    private final DecisionRoutingService routingService;
    private final DecisionQueryService queryService;

    public DecisionController(DecisionRoutingService routingService, DecisionQueryService queryService) {
        this.routingService = routingService;
        this.queryService = queryService;
    }

    @Operation(summary = "Route a batch of transactions",
            description = "Matches learned rules, calls inference and scores each item. Items fail individually; " +
                    "an unknown tenant or a failed audit write fails the whole call.")
    @PostMapping("/route")
    public ResponseEntity<RoutingResponse> route(
            @Parameter(description = "Tenant ID", example = "tenant-001") @PathVariable String tenantId,
            @RequestBody RoutingRequest request) {
        return ResponseEntity.ok(routingService.routeBatch(tenantId, request.getItems()));
    }

    @Operation(summary = "Get a decision")
    @GetMapping("/{decisionId}")
    public ResponseEntity<Decision> getDecision(@PathVariable String tenantId, @PathVariable String decisionId) {
        return ResponseEntity.ok(queryService.getDecision(tenantId, decisionId));
    }

    @Operation(summary = "List decisions, newest first",
            description = "Cursor paging: pass nextCursor as 'before' to fetch the next page.")
    @GetMapping
    public ResponseEntity<PagedResponse<Decision>> listDecisions(
            @PathVariable String tenantId,
            @Parameter(description = "Page size (max 200)") @RequestParam(defaultValue = "50") int limit,
            @Parameter(description = "Return decisions created before this epoch-millis cursor")
            @RequestParam(required = false) Long before) {
        return ResponseEntity.ok(queryService.listDecisions(tenantId, limit, before));
    }

    @Operation(summary = "Get the reasoning chain of a decision")
    @GetMapping("/{decisionId}/rationale")
    public ResponseEntity<Map<String, String>> getRationale(@PathVariable String tenantId,
                                                            @PathVariable String decisionId) {
        String rationale = queryService.getRationale(tenantId, decisionId);
        return ResponseEntity.ok(Map.of(
                "decisionId", decisionId,
                "rationale", rationale == null ? "" : rationale));
    }

    @Operation(summary = "Find rationale similar to a query",
            description = "Searches only the tenant's own reasoning partition. Empty when semantic memory is unavailable.")
    @GetMapping("/rationale/similar")
    public ResponseEntity<List<SimilarRationale>> findSimilar(
            @PathVariable String tenantId,
            @Parameter(description = "Free-text query", example = "stationery purchase") @RequestParam String query,
            @Parameter(description = "Maximum results (default 5)") @RequestParam(required = false) Integer k) {
        return ResponseEntity.ok(queryService.findSimilarRationale(tenantId, query, k));
    }

    @Operation(summary = "Confirm a decision as correct")
    @PostMapping("/{decisionId}/confirmation")
    public ResponseEntity<Decision> confirm(@PathVariable String tenantId, @PathVariable String decisionId) {
        return ResponseEntity.ok(queryService.confirm(tenantId, decisionId));
    }
}

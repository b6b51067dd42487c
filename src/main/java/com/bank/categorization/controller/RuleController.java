package com.bank.categorization.controller;

import com.bank.categorization.model.LearnedRule;
import com.bank.categorization.model.TenantContext;
import com.bank.categorization.service.LearnedRuleService;
import com.bank.categorization.service.TenantService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/v1/tenants/{tenantId}/rules")
@Tag(name = "Learned Rules", description = "Inspect and remove rules learned from corrections")
public class RuleController {

    private final TenantService tenantService;
    private final LearnedRuleService ruleService;

    public RuleController(TenantService tenantService, LearnedRuleService ruleService) {
        this.tenantService = tenantService;
        this.ruleService = ruleService;
    }

    @Operation(summary = "List learned rules of a tenant")
    @GetMapping
    public ResponseEntity<List<LearnedRule>> listRules(@PathVariable String tenantId) {
        TenantContext tenant = tenantService.requireTenant(tenantId);
        return ResponseEntity.ok(ruleService.listRules(tenant));
    }

    @Operation(summary = "Get a learned rule")
    @GetMapping("/{ruleId}")
    public ResponseEntity<LearnedRule> getRule(@PathVariable String tenantId,
                                               @Parameter(description = "Rule ID") @PathVariable String ruleId) {
        TenantContext tenant = tenantService.requireTenant(tenantId);
        LearnedRule rule = ruleService.getRule(tenant, ruleId);
        if (rule == null) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(rule);
    }

    @Operation(summary = "Delete a learned rule", description = "Admin action; rules are never removed automatically.")
    @DeleteMapping("/{ruleId}")
    public ResponseEntity<Void> deleteRule(@PathVariable String tenantId, @PathVariable String ruleId) {
        TenantContext tenant = tenantService.requireTenant(tenantId);
        if (!ruleService.deleteRule(tenant, ruleId)) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.noContent().build();
    }
}

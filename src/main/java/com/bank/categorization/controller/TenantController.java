package com.bank.categorization.controller;

import com.bank.categorization.model.Tenant;
import com.bank.categorization.service.TenantService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/v1/tenants")
@Tag(name = "Tenants", description = "Register tenants and their auto-apply thresholds")
public class TenantController {

    private final TenantService tenantService;

    public TenantController(TenantService tenantService) {
        this.tenantService = tenantService;
    }

    @Operation(summary = "Register or update a tenant",
            description = "Tenant IDs are limited to letters, digits, '-' and '_' (max 48).")
    @PutMapping("/{tenantId}")
    public ResponseEntity<Tenant> register(
            @Parameter(description = "Tenant ID", example = "tenant-001") @PathVariable String tenantId,
            @RequestBody Tenant request) {
        return ResponseEntity.ok(tenantService.register(tenantId, request));
    }

    @Operation(summary = "Get a tenant")
    @GetMapping("/{tenantId}")
    public ResponseEntity<Tenant> getTenant(@PathVariable String tenantId) {
        return ResponseEntity.ok(tenantService.getTenant(tenantId));
    }

    @Operation(summary = "List tenants")
    @GetMapping
    public ResponseEntity<List<Tenant>> listTenants() {
        return ResponseEntity.ok(tenantService.listTenants());
    }
}

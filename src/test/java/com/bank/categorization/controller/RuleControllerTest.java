package com.bank.categorization.controller;

import com.bank.categorization.exception.UnknownTenantException;
import com.bank.categorization.model.TenantContext;
import com.bank.categorization.service.LearnedRuleService;
import com.bank.categorization.service.TenantService;
import com.bank.categorization.testutil.TestDataFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(RuleController.class)
class RuleControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private TenantService tenantService;

    @MockBean
    private LearnedRuleService ruleService;

    private final TenantContext tenant = TestDataFactory.tenant();

    @BeforeEach
    void setUp() {
        when(tenantService.requireTenant("tenant-001")).thenReturn(tenant);
    }

    @Test
    void listRules_success() throws Exception {
        when(ruleService.listRules(tenant)).thenReturn(List.of(TestDataFactory.createRule("ACME SUPPLY", "5200", 15, 3)));

        mockMvc.perform(get("/api/v1/tenants/tenant-001/rules"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$").isArray())
                .andExpect(jsonPath("$[0].signature").value("ACME SUPPLY"))
                .andExpect(jsonPath("$[0].target.accountCode").value("5200"));
    }

    @Test
    void getRule_found() throws Exception {
        when(ruleService.getRule(tenant, "R1")).thenReturn(TestDataFactory.createRule("ACME SUPPLY", "5200", 15, 3));

        mockMvc.perform(get("/api/v1/tenants/tenant-001/rules/R1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.boost").value(15));
    }

    @Test
    void getRule_notFound() throws Exception {
        when(ruleService.getRule(tenant, "MISSING")).thenReturn(null);

        mockMvc.perform(get("/api/v1/tenants/tenant-001/rules/MISSING"))
                .andExpect(status().isNotFound());
    }

    @Test
    void deleteRule_success() throws Exception {
        when(ruleService.deleteRule(tenant, "R1")).thenReturn(true);

        mockMvc.perform(delete("/api/v1/tenants/tenant-001/rules/R1"))
                .andExpect(status().isNoContent());
    }

    @Test
    void deleteRule_notFound() throws Exception {
        when(ruleService.deleteRule(tenant, "MISSING")).thenReturn(false);

        mockMvc.perform(delete("/api/v1/tenants/tenant-001/rules/MISSING"))
                .andExpect(status().isNotFound());
    }

    @Test
    void unknownTenant_returns404() throws Exception {
        when(tenantService.requireTenant("ghost")).thenThrow(new UnknownTenantException("ghost"));

        mockMvc.perform(get("/api/v1/tenants/ghost/rules"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("Unknown Tenant"));
    }
}

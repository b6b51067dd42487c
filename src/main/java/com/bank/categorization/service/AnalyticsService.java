package com.bank.categorization.service;

import com.bank.categorization.model.AccuracyStats;
import com.bank.categorization.model.AgentType;
import com.bank.categorization.model.TenantContext;
import com.bank.categorization.repository.DecisionRepository;
import org.springframework.stereotype.Service;

@Service
public class AnalyticsService {

    private final TenantService tenantService;
    private final DecisionRepository decisionRepository;

    public AnalyticsService(TenantService tenantService, DecisionRepository decisionRepository) {
        this.tenantService = tenantService;
        this.decisionRepository = decisionRepository;
    }

    /**
     * Accuracy of reviewed decisions. A blank agent type covers all agents.
     */
    public AccuracyStats getAccuracy(String tenantId, String agentType) {
        TenantContext tenant = tenantService.requireTenant(tenantId);
        AgentType agent = agentType == null || agentType.isBlank() ? null : AgentType.resolve(agentType);

        long[] counts = decisionRepository.countReviewOutcomes(tenant.tenantId(), agent);
        long reviewed = counts[1];
        long correct = counts[2];
        return AccuracyStats.builder()
                .tenantId(tenant.tenantId())
                .agentType(agent)
                .totalDecisions(counts[0])
                .reviewedDecisions(reviewed)
                .correctDecisions(correct)
                .accuracyRate(reviewed == 0 ? 0 : Math.round(100.0 * correct / reviewed))
                .build();
    }
}

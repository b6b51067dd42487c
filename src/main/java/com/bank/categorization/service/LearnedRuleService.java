package com.bank.categorization.service;

import com.bank.categorization.config.RoutingConfig;
import com.bank.categorization.model.LearnedRule;
import com.bank.categorization.model.TenantContext;
import com.bank.categorization.repository.LearnedRuleRepository;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Comparator;
import java.util.List;

/**
 * Read and admin access to learned rules. Rules are only ever created by
 * {@link PatternLearningService}; deletion is an explicit admin action.
 */
@Service
public class LearnedRuleService {

    private static final Logger log = LoggerFactory.getLogger(LearnedRuleService.class);

    private final LearnedRuleRepository ruleRepository;
    private final RoutingConfig routingConfig;

    public LearnedRuleService(LearnedRuleRepository ruleRepository, RoutingConfig routingConfig) {
        this.ruleRepository = ruleRepository;
        this.routingConfig = routingConfig;
    }

    @PostConstruct
    public void init() {
        ruleRepository.startCacheRefresh(routingConfig.getRuleCacheRefreshSeconds());
    }

    /**
     * Cached rules used for routing.
     */
    public List<LearnedRule> rulesFor(TenantContext tenant) {
        return ruleRepository.findByTenantCached(tenant.tenantId());
    }

    public List<LearnedRule> listRules(TenantContext tenant) {
        return ruleRepository.findByTenant(tenant.tenantId()).stream()
                .sorted(Comparator.comparing(LearnedRule::getSignature))
                .toList();
    }

    public LearnedRule getRule(TenantContext tenant, String ruleId) {
        return ruleRepository.findById(tenant.tenantId(), ruleId);
    }

    public boolean deleteRule(TenantContext tenant, String ruleId) {
        boolean deleted = ruleRepository.delete(tenant.tenantId(), ruleId);
        if (deleted) {
            log.info("Learned rule deleted: tenant={}, rule={}", tenant.tenantId(), ruleId);
        }
        return deleted;
    }
}

package com.bank.categorization.service;

import com.bank.categorization.exception.CorrectionConflictException;
import com.bank.categorization.exception.DecisionNotFoundException;
import com.bank.categorization.exception.InvalidRequestException;
import com.bank.categorization.model.Decision;
import com.bank.categorization.model.PagedResponse;
import com.bank.categorization.model.SimilarRationale;
import com.bank.categorization.model.TenantContext;
import com.bank.categorization.repository.DecisionRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * Read side of the decision audit trail, plus reviewer confirmation.
 */
@Service
public class DecisionQueryService {

    private static final Logger log = LoggerFactory.getLogger(DecisionQueryService.class);

    static final int MAX_PAGE_SIZE = 200;

    private final TenantService tenantService;
    private final DecisionRepository decisionRepository;
    private final ReasoningMemoryService reasoningMemoryService;

    public DecisionQueryService(TenantService tenantService,
                                DecisionRepository decisionRepository,
                                ReasoningMemoryService reasoningMemoryService) {
        this.tenantService = tenantService;
        this.decisionRepository = decisionRepository;
        this.reasoningMemoryService = reasoningMemoryService;
    }

    public Decision getDecision(String tenantId, String decisionId) {
        TenantContext tenant = tenantService.requireTenant(tenantId);
        return require(tenant, decisionId);
    }

    public PagedResponse<Decision> listDecisions(String tenantId, int limit, Long before) {
        TenantContext tenant = tenantService.requireTenant(tenantId);
        int pageSize = Math.max(1, Math.min(limit, MAX_PAGE_SIZE));
        return decisionRepository.findByTenant(tenant.tenantId(), pageSize, before);
    }

    /**
     * Rationale from semantic memory, or from the audit record when memory has none.
     */
    public String getRationale(String tenantId, String decisionId) {
        TenantContext tenant = tenantService.requireTenant(tenantId);
        Optional<String> stored = reasoningMemoryService.get(tenant, decisionId);
        if (stored.isPresent()) {
            return stored.get();
        }
        return require(tenant, decisionId).getRationale();
    }

    public List<SimilarRationale> findSimilarRationale(String tenantId, String queryText, Integer k) {
        TenantContext tenant = tenantService.requireTenant(tenantId);
        if (queryText == null || queryText.isBlank()) {
            throw new InvalidRequestException("query is required");
        }
        return reasoningMemoryService.findSimilar(tenant, queryText, k);
    }

    /**
     * Mark a decision as reviewed and correct.
     * @throws CorrectionConflictException if the decision has been corrected
     */
    public Decision confirm(String tenantId, String decisionId) {
        TenantContext tenant = tenantService.requireTenant(tenantId);
        Decision decision = require(tenant, decisionId);
        if (Boolean.TRUE.equals(decision.getWasCorrect())) {
            return decision;
        }
        if (!decisionRepository.markConfirmed(tenant.tenantId(), decisionId)) {
            throw new CorrectionConflictException("Decision " + decisionId + " has been corrected and cannot be confirmed");
        }
        log.info("Decision confirmed: tenant={}, decision={}", tenant.tenantId(), decisionId);
        return require(tenant, decisionId);
    }

    private Decision require(TenantContext tenant, String decisionId) {
        Decision decision = decisionRepository.findById(tenant.tenantId(), decisionId);
        if (decision == null) {
            throw new DecisionNotFoundException(tenant.tenantId(), decisionId);
        }
        return decision;
    }
}

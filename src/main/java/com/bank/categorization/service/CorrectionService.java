package com.bank.categorization.service;

import com.bank.categorization.config.MetricsConfig;
import com.bank.categorization.exception.CorrectionConflictException;
import com.bank.categorization.exception.DecisionNotFoundException;
import com.bank.categorization.exception.DecisionPersistenceException;
import com.bank.categorization.exception.InvalidRequestException;
import com.bank.categorization.model.CategoryValue;
import com.bank.categorization.model.Correction;
import com.bank.categorization.model.CorrectionRequest;
import com.bank.categorization.model.CorrectionResult;
import com.bank.categorization.model.Decision;
import com.bank.categorization.model.FeedbackData;
import com.bank.categorization.model.PatternOutcome;
import com.bank.categorization.model.PatternResult;
import com.bank.categorization.model.SplitLine;
import com.bank.categorization.model.TenantContext;
import com.bank.categorization.repository.CorrectionRepository;
import com.bank.categorization.repository.DecisionRepository;
import io.micrometer.observation.annotation.Observed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * Records human corrections.
 *
 * Flow:
 * 1. Resolve the tenant and load the decision
 * 2. Insert the correction (one per decision, enforced by the store)
 * 3. Annotate the decision as corrected
 * 4. Let the pattern learner count the correction
 * 5. Claim the feedback dispatch and hand the correction to the feedback loop
 *    without waiting for it
 *
 * A retry of a correction that stopped part way finishes the remaining steps.
 * Feedback goes out once per correction.
 */
@Service
public class CorrectionService {

    private static final Logger log = LoggerFactory.getLogger(CorrectionService.class);

    static final int MAX_LIST_LIMIT = 200;

    private final TenantService tenantService;
    private final DecisionRepository decisionRepository;
    private final CorrectionRepository correctionRepository;
    private final PatternLearningService patternLearningService;
    private final FeedbackLoopService feedbackLoopService;
    private final MetricsConfig metrics;

    public CorrectionService(TenantService tenantService,
                             DecisionRepository decisionRepository,
                             CorrectionRepository correctionRepository,
                             PatternLearningService patternLearningService,
                             FeedbackLoopService feedbackLoopService,
                             MetricsConfig metrics) {
        this.tenantService = tenantService;
        this.decisionRepository = decisionRepository;
        this.correctionRepository = correctionRepository;
        this.patternLearningService = patternLearningService;
        this.feedbackLoopService = feedbackLoopService;
        this.metrics = metrics;
    }

    @Observed(name = "corrections.record", contextualName = "record-correction")
    public CorrectionResult recordCorrection(String tenantId, String decisionId, CorrectionRequest request) {
        TenantContext tenant = tenantService.requireTenant(tenantId);
        validate(request);

        // 1. Load the decision being overridden
        Decision decision = decisionRepository.findById(tenant.tenantId(), decisionId);
        if (decision == null) {
            throw new DecisionNotFoundException(tenant.tenantId(), decisionId);
        }

        // 2. Insert the correction; the store rejects a second one for the decision
        Correction correction = Correction.builder()
                .tenantId(tenant.tenantId())
                .correctionId(UUID.randomUUID().toString())
                .decisionId(decisionId)
                .originalValue(decision.getOutputValue())
                .correctedValue(request.getCorrectedValue())
                .correctedBy(request.getCorrectedBy())
                .reason(request.getReason())
                .createdAt(Instant.now())
                .build();

        boolean created;
        try {
            created = correctionRepository.create(correction);
        } catch (RuntimeException e) {
            log.error("Correction write failed: tenant={}, decision={}", tenant.tenantId(), decisionId, e);
            throw new DecisionPersistenceException("Failed to persist correction for " + decisionId, e);
        }
        if (!created) {
            return replay(tenant, decision, request);
        }

        // 3. Annotate the decision; rationale and output stay as they were
        annotate(tenant, decisionId, request.getCorrectedValue());

        // 4. Pattern learning
        PatternResult pattern = learn(tenant, decision, request.getCorrectedValue());

        metrics.recordCorrection(tenant.tenantId(), pattern.getOutcome().name());
        log.info("Correction recorded: tenant={}, decision={}, {} -> {}, pattern={}",
                tenant.tenantId(), decisionId,
                decision.getOutputValue() == null ? null : decision.getOutputValue().getAccountCode(),
                request.getCorrectedValue().getAccountCode(), pattern.getOutcome());

        // 5. Feedback, fire and forget
        if (claimDispatch(tenant, decisionId)) {
            dispatchFeedback(tenant, decision, correction, pattern);
        }

        return CorrectionResult.builder()
                .correctionId(correction.getCorrectionId())
                .decisionId(decisionId)
                .patternCreated(pattern.isPatternCreated())
                .patternOutcome(pattern.getOutcome())
                .conflictingRule(pattern.getConflictingRule())
                .replayed(false)
                .build();
    }

    public List<Correction> listCorrections(String tenantId, int limit) {
        TenantContext tenant = tenantService.requireTenant(tenantId);
        int effectiveLimit = Math.max(1, Math.min(limit, MAX_LIST_LIMIT));
        return correctionRepository.findByTenant(tenant.tenantId(), effectiveLimit);
    }

    private CorrectionResult replay(TenantContext tenant, Decision decision, CorrectionRequest request) {
        Correction existing = correctionRepository.findByDecisionId(tenant.tenantId(), decision.getDecisionId());
        if (existing == null || !sameCorrection(existing, request)) {
            log.warn("Rejected second correction: tenant={}, decision={}", tenant.tenantId(), decision.getDecisionId());
            throw new CorrectionConflictException("Decision " + decision.getDecisionId() + " already has a different correction");
        }

        PatternOutcome outcome = existing.getPatternOutcome();
        if (!existing.isFeedbackDispatched()) {
            // the first attempt stopped part way; every step below is safe to repeat
            annotate(tenant, decision.getDecisionId(), existing.getCorrectedValue());
            PatternResult pattern;
            if (outcome == null) {
                // votes are create-only so this cannot double count
                pattern = learn(tenant, decision, existing.getCorrectedValue());
                metrics.recordCorrection(tenant.tenantId(), pattern.getOutcome().name());
            } else {
                pattern = PatternResult.builder()
                        .outcome(outcome)
                        .signature(decision.getSignature())
                        .targetCode(existing.getCorrectedValue().normalizedCode())
                        .build();
            }
            outcome = pattern.getOutcome();
            if (claimDispatch(tenant, decision.getDecisionId())) {
                log.info("Finishing interrupted correction: tenant={}, decision={}",
                        tenant.tenantId(), decision.getDecisionId());
                dispatchFeedback(tenant, decision, existing, pattern);
            }
        }
        log.debug("Correction replayed: tenant={}, decision={}", tenant.tenantId(), decision.getDecisionId());
        return CorrectionResult.builder()
                .correctionId(existing.getCorrectionId())
                .decisionId(decision.getDecisionId())
                .patternCreated(outcome == PatternOutcome.CREATED)
                .patternOutcome(outcome)
                .replayed(true)
                .build();
    }

    private PatternResult learn(TenantContext tenant, Decision decision, CategoryValue corrected) {
        PatternResult pattern = patternLearningService.learn(tenant, decision, corrected);
        correctionRepository.updatePatternOutcome(tenant.tenantId(), decision.getDecisionId(), pattern.getOutcome());
        return pattern;
    }

    private void annotate(TenantContext tenant, String decisionId, CategoryValue correctedTo) {
        try {
            decisionRepository.markCorrected(tenant.tenantId(), decisionId, correctedTo);
        } catch (RuntimeException e) {
            log.error("Decision annotation failed: tenant={}, decision={}", tenant.tenantId(), decisionId, e);
            throw new DecisionPersistenceException("Failed to annotate decision " + decisionId, e);
        }
    }

    private boolean claimDispatch(TenantContext tenant, String decisionId) {
        try {
            return correctionRepository.claimFeedbackDispatch(tenant.tenantId(), decisionId);
        } catch (RuntimeException e) {
            log.error("Feedback claim failed: tenant={}, decision={}", tenant.tenantId(), decisionId, e);
            throw new DecisionPersistenceException("Failed to record feedback dispatch for " + decisionId, e);
        }
    }

    private void dispatchFeedback(TenantContext tenant, Decision decision, Correction correction,
                                  PatternResult pattern) {
        FeedbackData data = FeedbackData.builder()
                .tenantId(tenant.tenantId())
                .decisionId(decision.getDecisionId())
                .originalValue(decision.getOutputValue())
                .correctedValue(correction.getCorrectedValue())
                .correctedBy(correction.getCorrectedBy())
                .reason(correction.getReason())
                .originalSource(decision.getSource())
                .originalConfidence(decision.getConfidence())
                .agentType(decision.getAgentType() == null ? null : decision.getAgentType().name())
                .patternResult(pattern)
                .build();
        try {
            feedbackLoopService.processFeedback(data).whenComplete((result, error) -> {
                if (error != null) {
                    log.warn("Feedback processing failed for decision {}: {}", decision.getDecisionId(), error.getMessage());
                } else if (result.hasErrors()) {
                    log.warn("Feedback for decision {} reached {} but failed for {}",
                            decision.getDecisionId(), result.getTargets(), result.getErrors().keySet());
                }
            });
        } catch (RuntimeException e) {
            log.warn("Feedback dispatch could not start for decision {}: {}", decision.getDecisionId(), e.getMessage());
        }
    }

    private static void validate(CorrectionRequest request) {
        if (request == null || request.getCorrectedValue() == null) {
            throw new InvalidRequestException("correctedValue is required");
        }
        String code = request.getCorrectedValue().getAccountCode();
        if (code == null || code.isBlank()) {
            throw new InvalidRequestException("correctedValue.accountCode is required");
        }
        if (request.getCorrectedBy() == null || request.getCorrectedBy().isBlank()) {
            throw new InvalidRequestException("correctedBy is required");
        }
    }

    static boolean sameCorrection(Correction existing, CorrectionRequest request) {
        CategoryValue stored = existing.getCorrectedValue();
        CategoryValue submitted = request.getCorrectedValue();
        return stored != null
                && stored.sameAccountAs(submitted)
                && Objects.equals(stored.getVatType(), submitted.getVatType())
                && splits(stored).equals(splits(submitted))
                && Objects.equals(existing.getCorrectedBy(), request.getCorrectedBy());
    }

    private static List<SplitLine> splits(CategoryValue value) {
        return value.getSplits() == null ? List.of() : value.getSplits();
    }
}

package com.bank.categorization.service;

import com.bank.categorization.config.LearningConfig;
import com.bank.categorization.model.CategoryValue;
import com.bank.categorization.model.Decision;
import com.bank.categorization.model.LearnedRule;
import com.bank.categorization.model.PatternOutcome;
import com.bank.categorization.model.PatternResult;
import com.bank.categorization.model.TenantContext;
import com.bank.categorization.model.VoteTally;
import com.bank.categorization.repository.CorrectionVoteRepository;
import com.bank.categorization.repository.LearnedRuleRepository;
import io.micrometer.observation.annotation.Observed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;

/**
 * Turns repeated agreeing corrections into learned rules.
 *
 * Each correction casts one vote (signature to account code). Once enough votes
 * agree and no rule covers the signature, a rule is created. An existing rule
 * with another target is reported as a conflict and left alone.
 */
@Service
public class PatternLearningService {

    private static final Logger log = LoggerFactory.getLogger(PatternLearningService.class);

    private final CorrectionVoteRepository voteRepository;
    private final LearnedRuleRepository ruleRepository;
    private final LearningConfig learningConfig;

    public PatternLearningService(CorrectionVoteRepository voteRepository,
                                  LearnedRuleRepository ruleRepository,
                                  LearningConfig learningConfig) {
        this.voteRepository = voteRepository;
        this.ruleRepository = ruleRepository;
        this.learningConfig = learningConfig;
    }

    @Observed(name = "patterns.learn", contextualName = "learn-pattern")
    public PatternResult learn(TenantContext tenant, Decision decision, CategoryValue corrected) {
        String signature = decision.getSignature();
        String targetCode = corrected.normalizedCode();
        if (signature == null || signature.isBlank()) {
            return PatternResult.builder().outcome(PatternOutcome.NO_SIGNATURE).targetCode(targetCode).build();
        }

        VoteTally tally = voteRepository.recordVote(tenant.tenantId(), signature, decision.getDecisionId(), targetCode);
        PatternResult.PatternResultBuilder result = PatternResult.builder()
                .signature(signature)
                .targetCode(targetCode)
                .agreeingCorrections(tally.agreeing());

        if (!tally.newVote()) {
            return result.outcome(PatternOutcome.DUPLICATE).build();
        }

        LearnedRule existing = ruleRepository.findBySignature(tenant.tenantId(), signature);
        if (existing != null) {
            return compareWithExisting(tenant, existing, corrected, result);
        }

        if (tally.agreeing() < learningConfig.getMinCorrectionsForRule()) {
            return result.outcome(PatternOutcome.BELOW_THRESHOLD).build();
        }

        LearnedRule rule = LearnedRule.builder()
                .tenantId(tenant.tenantId())
                .ruleId(LearnedRuleRepository.ruleIdFor(tenant.tenantId(), signature))
                .signature(signature)
                .keywords(new ArrayList<>(decision.getKeywords()))
                .target(CategoryValue.builder()
                        .accountCode(targetCode)
                        .accountName(corrected.getAccountName())
                        .vatType(corrected.getVatType())
                        .build())
                .boost(boostFor(tally.agreeing(), tally.total()))
                .supportCount(tally.agreeing())
                .createdAt(Instant.now())
                .build();

        if (!ruleRepository.createIfAbsent(rule)) {
            // lost the race to a concurrent correction
            LearnedRule winner = ruleRepository.findBySignature(tenant.tenantId(), signature);
            if (winner != null) {
                return compareWithExisting(tenant, winner, corrected, result);
            }
            return result.outcome(PatternOutcome.RULE_EXISTS).build();
        }

        log.info("Learned rule created: tenant={}, signature='{}' -> {}, support={}, boost={}",
                tenant.tenantId(), signature, targetCode, rule.getSupportCount(), rule.getBoost());
        return result.outcome(PatternOutcome.CREATED).rule(rule).build();
    }

    /**
     * Boost scaled by how unanimous the votes are, never above the configured base.
     */
    int boostFor(int agreeing, int total) {
        int base = learningConfig.getBaseRuleBoost();
        if (total <= 0) return base;
        long scaled = Math.round(base * (double) agreeing / total);
        return (int) Math.max(1, Math.min(base, scaled));
    }

    private PatternResult compareWithExisting(TenantContext tenant, LearnedRule existing, CategoryValue corrected,
                                              PatternResult.PatternResultBuilder result) {
        if (existing.getTarget() != null && existing.getTarget().sameAccountAs(corrected)) {
            return result.outcome(PatternOutcome.RULE_EXISTS).rule(existing).build();
        }
        log.warn("Correction conflicts with learned rule: tenant={}, signature='{}', rule target={}, corrected to={}",
                tenant.tenantId(), existing.getSignature(),
                existing.getTarget() == null ? null : existing.getTarget().getAccountCode(),
                corrected.getAccountCode());
        return result.outcome(PatternOutcome.CONFLICT).conflictingRule(existing).build();
    }
}

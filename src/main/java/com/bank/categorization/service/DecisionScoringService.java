package com.bank.categorization.service;

import com.bank.categorization.config.RoutingConfig;
import com.bank.categorization.model.CategoryValue;
import com.bank.categorization.model.DecisionSource;
import com.bank.categorization.model.DecisionStatus;
import com.bank.categorization.model.MatchType;
import com.bank.categorization.model.RuleMatch;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Combines inference confidence with the best learned rule and applies the
 * auto-apply threshold.
 *
 * A rule's boost counts only when its target agrees with the inferred account;
 * a disagreeing rule leaves the inference confidence untouched.
 */
@Service
public class DecisionScoringService {

    private final RoutingConfig routingConfig;

    public DecisionScoringService(RoutingConfig routingConfig) {
        this.routingConfig = routingConfig;
    }

    public ScoredDecision score(CategoryValue inferred, int inferenceConfidence,
                                Optional<RuleMatch> match, int threshold) {
        int confidence = clamp(inferenceConfidence);
        DecisionSource source = DecisionSource.INFERENCE;
        String matchedRuleId = null;

        if (match.isPresent() && match.get().rule().getTarget() != null
                && match.get().rule().getTarget().sameAccountAs(inferred)) {
            confidence = clamp(confidence + match.get().rule().getBoost());
            source = DecisionSource.HYBRID;
            matchedRuleId = match.get().rule().getRuleId();
        }
        return new ScoredDecision(confidence, source, statusFor(confidence, threshold), matchedRuleId);
    }

    /**
     * Resolve directly from a well-supported exact-signature rule, skipping inference.
     * Empty unless enabled in configuration.
     */
    public Optional<ScoredDecision> shortCircuit(Optional<RuleMatch> match, int threshold) {
        if (!routingConfig.isPatternShortCircuitEnabled() || match.isEmpty()) {
            return Optional.empty();
        }
        RuleMatch best = match.get();
        if (best.matchType() != MatchType.EXACT_SIGNATURE
                || best.rule().getTarget() == null
                || best.rule().getSupportCount() < routingConfig.getPatternShortCircuitMinSupport()) {
            return Optional.empty();
        }
        int confidence = clamp(routingConfig.getPatternShortCircuitBaseConfidence() + best.rule().getBoost());
        return Optional.of(new ScoredDecision(confidence, DecisionSource.PATTERN,
                statusFor(confidence, threshold), best.rule().getRuleId()));
    }

    DecisionStatus statusFor(int confidence, int threshold) {
        return confidence >= threshold ? DecisionStatus.AUTO_APPLIED : DecisionStatus.REVIEW_REQUIRED;
    }

    static int clamp(int confidence) {
        return Math.max(0, Math.min(100, confidence));
    }
}

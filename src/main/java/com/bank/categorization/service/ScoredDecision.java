package com.bank.categorization.service;

import com.bank.categorization.model.DecisionSource;
import com.bank.categorization.model.DecisionStatus;

/**
 * Final confidence, source and status of one routed item.
 */
public record ScoredDecision(int confidence, DecisionSource source, DecisionStatus status, String matchedRuleId) {
}

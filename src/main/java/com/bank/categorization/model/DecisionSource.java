package com.bank.categorization.model;

/**
 * Routing path that produced a decision. Also used as the action reported to
 * reward sinks when the decision is later corrected.
 */
public enum DecisionSource {
    PATTERN,
    INFERENCE,
    HYBRID
}

package com.bank.categorization.model;

public enum PatternOutcome {
    CREATED,
    BELOW_THRESHOLD,
    RULE_EXISTS,
    CONFLICT,
    DUPLICATE,
    NO_SIGNATURE
}

package com.bank.categorization.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PatternResult {
    private PatternOutcome outcome;
    private String signature;
    private String targetCode;
    private int agreeingCorrections;
    private LearnedRule rule;               // set when CREATED or RULE_EXISTS
    private LearnedRule conflictingRule;    // set when CONFLICT

    public boolean isPatternCreated() {
        return outcome == PatternOutcome.CREATED;
    }
}

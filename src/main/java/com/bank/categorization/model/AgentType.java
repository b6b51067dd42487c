package com.bank.categorization.model;

import java.util.Locale;

public enum AgentType {
    CATEGORIZER,
    MATCHER;

    /**
     * Resolves a caller-supplied agent type. Blank and unknown values map to CATEGORIZER.
     */
    public static AgentType resolve(String value) {
        if (value == null || value.isBlank()) return CATEGORIZER;
        try {
            return AgentType.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return CATEGORIZER;
        }
    }
}

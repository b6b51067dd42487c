package com.bank.categorization.model;

public enum CorrectionSeverity {
    /** Different top-level category. */
    STANDARD,
    /** Same top-level category, different sub-category. */
    PARTIAL
}

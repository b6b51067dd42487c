package com.bank.categorization.model;

public enum DecisionStatus {
    AUTO_APPLIED,
    REVIEW_REQUIRED,
    FAILED
}

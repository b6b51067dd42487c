package com.bank.categorization.model;

public enum FailureReason {
    VALIDATION_ERROR,
    SPLIT_MISMATCH,
    INFERENCE_TIMEOUT,
    INFERENCE_ERROR,
    CAPACITY_EXCEEDED
}

package com.bank.categorization.integration;

import com.bank.categorization.model.TenantContext;

import java.time.Duration;

/**
 * Candidate category plus base confidence for one transaction.
 * Implementations raise {@link InferenceTimeoutException} when the deadline passes
 * and {@link InferenceException} for any other failure.
 */
public interface InferenceClient {

    InferenceResult infer(InferenceRequest request, TenantContext tenant, Duration timeout);
}

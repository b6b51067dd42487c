package com.bank.categorization.integration;

import com.bank.categorization.model.CategoryValue;
import com.bank.categorization.model.TenantContext;

import java.time.Duration;

/**
 * Local fallback used when no inference service is configured. Assigns the
 * default income or bank-charges account with a confidence low enough that the
 * decision always goes to review.
 */
public class DefaultAccountInferenceClient implements InferenceClient {

    static final int FALLBACK_CONFIDENCE = 30;

    static final CategoryValue CREDIT_DEFAULT = CategoryValue.builder()
            .accountCode("4100").accountName("Other Income").vatType("EXEMPT").build();
    static final CategoryValue DEBIT_DEFAULT = CategoryValue.builder()
            .accountCode("8100").accountName("Bank Charges").vatType("NO_VAT").build();

    @Override
    public InferenceResult infer(InferenceRequest request, TenantContext tenant, Duration timeout) {
        CategoryValue template = request.credit() ? CREDIT_DEFAULT : DEBIT_DEFAULT;
        CategoryValue value = CategoryValue.builder()
                .accountCode(template.getAccountCode())
                .accountName(template.getAccountName())
                .vatType(template.getVatType())
                .build();
        String rationale = String.format("No inference service available; assigned default %s account %s (%s)",
                request.credit() ? "credit" : "debit", value.getAccountCode(), value.getAccountName());
        return InferenceResult.builder()
                .outputValue(value)
                .confidence(FALLBACK_CONFIDENCE)
                .rationale(rationale)
                .build();
    }
}

package com.bank.categorization.integration;

import com.bank.categorization.model.CategoryValue;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class InferenceResult {
    private CategoryValue outputValue;
    private int confidence;             // 0-100
    private Object rationale;           // plain text or a structured object
}

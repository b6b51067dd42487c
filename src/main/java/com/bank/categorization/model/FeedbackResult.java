package com.bank.categorization.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Which learning targets were notified for one correction. Observability only.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FeedbackResult {
    private boolean processed;

    @Builder.Default
    private List<String> targets = new ArrayList<>();

    @Builder.Default
    private Map<String, String> errors = new LinkedHashMap<>();

    public boolean hasErrors() {
        return errors != null && !errors.isEmpty();
    }
}

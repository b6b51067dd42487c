package com.bank.categorization.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Categorization output: account code, tax treatment and optional split lines")
public class CategoryValue {

    @Schema(description = "Accounting code", example = "5200")
    private String accountCode;

    @Schema(description = "Accounting code display name", example = "Office Supplies")
    private String accountName;

    @Schema(description = "Tax treatment", example = "STANDARD")
    private String vatType;

    @Schema(description = "Split lines when the transaction is spread over several accounts")
    @Builder.Default
    private List<SplitLine> splits = new ArrayList<>();

    @JsonIgnore
    public boolean isSplit() {
        return splits != null && !splits.isEmpty();
    }

    /**
     * Two values agree when their account codes are equal, ignoring case and surrounding whitespace.
     */
    public boolean sameAccountAs(CategoryValue other) {
        if (other == null || accountCode == null || other.accountCode == null) return false;
        return normalizedCode().equals(other.normalizedCode());
    }

    @JsonIgnore
    public String normalizedCode() {
        return accountCode == null ? "" : accountCode.trim().toUpperCase(Locale.ROOT);
    }
}

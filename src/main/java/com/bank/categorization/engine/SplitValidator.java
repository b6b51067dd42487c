package com.bank.categorization.engine;

import com.bank.categorization.config.RoutingConfig;
import com.bank.categorization.model.CategoryValue;
import com.bank.categorization.model.SplitLine;
import org.springframework.stereotype.Component;

import java.util.Optional;

@Component
public class SplitValidator {

    private final RoutingConfig routingConfig;

    public SplitValidator(RoutingConfig routingConfig) {
        this.routingConfig = routingConfig;
    }

    /**
     * Checks that split lines add up to the transaction amount.
     *
     * @return a description of the violation, or empty when the value is not split or balances
     */
    public Optional<String> validate(CategoryValue value, long totalAmountCents) {
        if (value == null || !value.isSplit()) {
            return Optional.empty();
        }
        long sum = 0;
        for (SplitLine line : value.getSplits()) {
            if (line == null) {
                return Optional.of("Split line is null");
            }
            sum += line.getAmountCents();
        }
        // credits may arrive signed either way; lines and amount compare by magnitude
        long difference = Math.abs(Math.abs(sum) - Math.abs(totalAmountCents));
        if (difference > routingConfig.getSplitToleranceCents()) {
            return Optional.of(String.format("Split total %d differs from amount %d by %d cents",
                    sum, totalAmountCents, difference));
        }
        return Optional.empty();
    }
}

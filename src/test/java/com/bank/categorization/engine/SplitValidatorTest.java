package com.bank.categorization.engine;

import com.bank.categorization.config.RoutingConfig;
import org.junit.jupiter.api.Test;

import static com.bank.categorization.testutil.TestDataFactory.category;
import static com.bank.categorization.testutil.TestDataFactory.line;
import static com.bank.categorization.testutil.TestDataFactory.split;
import static org.assertj.core.api.Assertions.assertThat;

class SplitValidatorTest {

    private final SplitValidator validator = new SplitValidator(new RoutingConfig());

    @Test
    void nonSplitValue_isAlwaysValid() {
        assertThat(validator.validate(category("5200", "Office Supplies"), 12500)).isEmpty();
    }

    @Test
    void balancedSplit_isValid() {
        assertThat(validator.validate(split(line("5200", 10000), line("6100", 2500)), 12500)).isEmpty();
    }

    @Test
    void withinTolerance_isValid() {
        assertThat(validator.validate(split(line("5200", 10000), line("6100", 2499)), 12500)).isEmpty();
    }

    @Test
    void twoCentsOff_isRejected() {
        assertThat(validator.validate(split(line("5200", 10000), line("6100", 2498)), 12500))
                .hasValueSatisfying(msg -> assertThat(msg).contains("by 2 cents"));
    }

    @Test
    void signedLinesAgainstSignedTotal_balance() {
        assertThat(validator.validate(split(line("4100", -6000), line("4200", -4000)), -10000)).isEmpty();
    }

    @Test
    void signedLinesOffByMoreThanTolerance_areRejected() {
        assertThat(validator.validate(split(line("4100", -6000), line("4200", -3000)), -10000)).isPresent();
    }

    @Test
    void creditAmountsCompareByMagnitude() {
        assertThat(validator.validate(split(line("4100", 6000), line("4200", 4000)), -10000)).isEmpty();
    }

    @Test
    void mismatch_describesDifference() {
        assertThat(validator.validate(split(line("5200", 10000), line("6100", 2000)), 12500))
                .hasValueSatisfying(msg -> assertThat(msg).contains("500"));
    }
}

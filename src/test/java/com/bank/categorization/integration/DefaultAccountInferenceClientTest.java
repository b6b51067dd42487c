package com.bank.categorization.integration;

import com.bank.categorization.model.AgentType;
import com.bank.categorization.testutil.TestDataFactory;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class DefaultAccountInferenceClientTest {

    private final DefaultAccountInferenceClient client = new DefaultAccountInferenceClient();

    @Test
    void credit_getsOtherIncomeExempt() {
        InferenceResult result = client.infer(
                new InferenceRequest("TXN-1", "parent fees", 250_000, true, AgentType.CATEGORIZER),
                TestDataFactory.tenant(), Duration.ofSeconds(1));

        assertThat(result.getOutputValue().getAccountCode()).isEqualTo("4100");
        assertThat(result.getOutputValue().getVatType()).isEqualTo("EXEMPT");
        assertThat(result.getConfidence()).isEqualTo(30);
    }

    @Test
    void debit_getsBankChargesBelowAnyThreshold() {
        InferenceResult result = client.infer(
                new InferenceRequest("TXN-2", "monthly fee", 4_500, false, AgentType.CATEGORIZER),
                TestDataFactory.tenant(), Duration.ofSeconds(1));

        assertThat(result.getOutputValue().getAccountCode()).isEqualTo("8100");
        assertThat(result.getOutputValue().getAccountName()).isEqualTo("Bank Charges");
        assertThat(result.getConfidence()).isLessThan(TestDataFactory.tenant().autoApplyThreshold());
        assertThat(result.getRationale().toString()).contains("8100");
    }

    @Test
    void returnedValue_isNotTheSharedTemplate() {
        InferenceResult first = client.infer(
                new InferenceRequest("TXN-3", "x", 1, false, AgentType.MATCHER), TestDataFactory.tenant(), Duration.ZERO);
        first.getOutputValue().setAccountCode("9999");

        InferenceResult second = client.infer(
                new InferenceRequest("TXN-4", "x", 1, false, AgentType.MATCHER), TestDataFactory.tenant(), Duration.ZERO);
        assertThat(second.getOutputValue().getAccountCode()).isEqualTo("8100");
    }
}

package com.bank.categorization.integration;

import com.bank.categorization.config.RoutingConfig;
import com.bank.categorization.model.AgentType;
import com.bank.categorization.model.TenantContext;
import com.bank.categorization.testutil.TestDataFactory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static com.bank.categorization.testutil.TestDataFactory.category;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InferenceGatewayTest {

    private final TenantContext tenant = TestDataFactory.tenant();
    private final InferenceRequest request =
            new InferenceRequest("TXN-1", "ACME SUPPLY | stationery", 12500, false, AgentType.CATEGORIZER);

    private ThreadPoolTaskExecutor executor;
    private RoutingConfig config;

    @BeforeEach
    void setUp() {
        executor = TestDataFactory.executor("inference-test-");
        config = new RoutingConfig();
        config.setInferenceTimeoutMs(200);
    }

    @AfterEach
    void tearDown() {
        executor.shutdown();
    }

    @Test
    void returnsClientResult() {
        InferenceGateway gateway = new InferenceGateway((req, t, timeout) -> InferenceResult.builder()
                .outputValue(category("5200", "Office Supplies")).confidence(88).rationale("ok").build(),
                executor, config);

        InferenceResult result = gateway.infer(request, tenant);

        assertThat(result.getConfidence()).isEqualTo(88);
    }

    @Test
    void saturatedPool_isReportedAsInferenceFailure() {
        InferenceGateway gateway = new InferenceGateway((req, t, timeout) -> InferenceResult.builder()
                .outputValue(category("5200", "Office Supplies")).confidence(88).build(),
                executor, config);
        executor.shutdown();

        assertThatThrownBy(() -> gateway.infer(request, tenant))
                .isInstanceOf(InferenceException.class)
                .isNotInstanceOf(InferenceTimeoutException.class)
                .hasMessageContaining("capacity");
    }

    @Test
    void passesConfiguredTimeoutToClient() {
        Duration[] seen = new Duration[1];
        InferenceGateway gateway = new InferenceGateway((req, t, timeout) -> {
            seen[0] = timeout;
            return InferenceResult.builder().outputValue(category("5200", "Office")).confidence(50).build();
        }, executor, config);

        gateway.infer(request, tenant);

        assertThat(seen[0]).isEqualTo(Duration.ofMillis(200));
    }

    @Test
    void slowClient_timesOutAtDeadline() {
        CountDownLatch never = new CountDownLatch(1);
        InferenceGateway gateway = new InferenceGateway((req, t, timeout) -> {
            try {
                never.await(10, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return InferenceResult.builder().outputValue(category("5200", "Office")).confidence(99).build();
        }, executor, config);

        long start = System.nanoTime();
        assertThatThrownBy(() -> gateway.infer(request, tenant)).isInstanceOf(InferenceTimeoutException.class);
        assertThat(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start)).isLessThan(5000);
    }

    @Test
    void clientInferenceException_isPropagatedUnchanged() {
        InferenceException failure = new InferenceException("bad output");
        InferenceGateway gateway = new InferenceGateway((req, t, timeout) -> {
            throw failure;
        }, executor, config);

        assertThatThrownBy(() -> gateway.infer(request, tenant)).isSameAs(failure);
    }

    @Test
    void otherClientErrors_areWrapped() {
        InferenceGateway gateway = new InferenceGateway((req, t, timeout) -> {
            throw new IllegalStateException("connection reset");
        }, executor, config);

        assertThatThrownBy(() -> gateway.infer(request, tenant))
                .isInstanceOf(InferenceException.class)
                .hasCauseInstanceOf(IllegalStateException.class);
    }

    @Test
    void missingOutput_isInferenceError() {
        InferenceGateway gateway = new InferenceGateway((req, t, timeout) ->
                InferenceResult.builder().confidence(90).build(), executor, config);

        assertThatThrownBy(() -> gateway.infer(request, tenant))
                .isInstanceOf(InferenceException.class)
                .isNotInstanceOf(InferenceTimeoutException.class);
    }
}

package com.bank.categorization.integration;

import com.bank.categorization.config.RoutingConfig;
import com.bank.categorization.model.TenantContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs inference calls on their own pool and enforces the hard deadline, whatever
 * the client implementation does with the timeout it is handed.
 */
@Component
public class InferenceGateway {

    private static final Logger log = LoggerFactory.getLogger(InferenceGateway.class);

    private final InferenceClient inferenceClient;
    private final ThreadPoolTaskExecutor inferenceExecutor;
    private final RoutingConfig routingConfig;

    public InferenceGateway(InferenceClient inferenceClient,
                            @Qualifier("inferenceExecutor") ThreadPoolTaskExecutor inferenceExecutor,
                            RoutingConfig routingConfig) {
        this.inferenceClient = inferenceClient;
        this.inferenceExecutor = inferenceExecutor;
        this.routingConfig = routingConfig;
    }

    public InferenceResult infer(InferenceRequest request, TenantContext tenant) {
        Duration timeout = Duration.ofMillis(routingConfig.getInferenceTimeoutMs());
        CompletableFuture<InferenceResult> call;
        try {
            call = CompletableFuture.supplyAsync(() -> inferenceClient.infer(request, tenant, timeout), inferenceExecutor);
        } catch (RejectedExecutionException e) {
            throw new InferenceException("Inference pool is at capacity", e);
        }
        try {
            InferenceResult result = call.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (result == null || result.getOutputValue() == null) {
                throw new InferenceException("Inference returned no output for " + request.transactionId());
            }
            return result;
        } catch (TimeoutException e) {
            call.cancel(true);
            log.warn("Inference timed out after {}ms: tenant={}, txn={}",
                    timeout.toMillis(), tenant.tenantId(), request.transactionId());
            throw new InferenceTimeoutException("Inference exceeded " + timeout.toMillis() + "ms", e);
        } catch (InterruptedException e) {
            call.cancel(true);
            Thread.currentThread().interrupt();
            throw new InferenceException("Interrupted while waiting for inference", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof InferenceException inferenceException) {
                throw inferenceException;
            }
            throw new InferenceException("Inference failed: " + cause.getMessage(), cause);
        }
    }
}

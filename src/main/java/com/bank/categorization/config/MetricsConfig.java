package com.bank.categorization.config;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

@Component
public class MetricsConfig {

    private final MeterRegistry registry;

    public MetricsConfig(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordDecision(String tenantId, String status, String source, int confidence) {
        Counter.builder("decision.count")
                .tag("tenant", tenantId)
                .tag("status", status)
                .tag("source", source)
                .register(registry)
                .increment();

        DistributionSummary.builder("decision.confidence")
                .tag("status", status)
                .register(registry)
                .record(confidence);
    }

    public void recordRoutingFailure(String reason) {
        Counter.builder("decision.failure.count")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    public void recordCorrection(String tenantId, String patternOutcome) {
        Counter.builder("correction.count")
                .tag("tenant", tenantId)
                .tag("pattern_outcome", patternOutcome)
                .register(registry)
                .increment();
    }

    public void recordFeedbackDispatch(String target, String status) {
        Counter.builder("feedback.dispatch.count")
                .tag("target", target)
                .tag("status", status)
                .register(registry)
                .increment();
    }

    public void recordSemanticWrite(String status) {
        Counter.builder("reasoning.write.count")
                .tag("status", status)
                .register(registry)
                .increment();
    }
}

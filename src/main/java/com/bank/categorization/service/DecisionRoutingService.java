package com.bank.categorization.service;

import com.bank.categorization.config.MetricsConfig;
import com.bank.categorization.engine.InputNormalizer;
import com.bank.categorization.engine.NormalizedInput;
import com.bank.categorization.engine.RuleMatcher;
import com.bank.categorization.engine.SplitValidator;
import com.bank.categorization.exception.DecisionPersistenceException;
import com.bank.categorization.exception.InvalidRequestException;
import com.bank.categorization.integration.InferenceException;
import com.bank.categorization.integration.InferenceGateway;
import com.bank.categorization.integration.InferenceRequest;
import com.bank.categorization.integration.InferenceResult;
import com.bank.categorization.integration.InferenceTimeoutException;
import com.bank.categorization.model.AgentType;
import com.bank.categorization.model.BatchStats;
import com.bank.categorization.model.CategoryValue;
import com.bank.categorization.model.Decision;
import com.bank.categorization.model.DecisionSource;
import com.bank.categorization.model.DecisionStatus;
import com.bank.categorization.model.FailureReason;
import com.bank.categorization.model.ItemResult;
import com.bank.categorization.model.LearnedRule;
import com.bank.categorization.model.RoutingResponse;
import com.bank.categorization.model.RuleMatch;
import com.bank.categorization.model.TenantContext;
import com.bank.categorization.model.TransactionInput;
import com.bank.categorization.repository.DecisionRepository;
import io.micrometer.observation.annotation.Observed;
import io.micrometer.tracing.Span;
import io.micrometer.tracing.Tracer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;

/**
 * Routes a batch of transactions to categorization decisions.
 *
 * Flow per item:
 * 1. Replay the stored decision if this transaction was already routed
 * 2. Normalize the input and find the best learned rule
 * 3. Resolve from the rule alone when short-circuiting is enabled
 * 4. Otherwise call inference under the hard timeout
 * 5. Score: boost on rule agreement, then apply the tenant threshold
 * 6. Validate split lines against the amount
 * 7. Persist the audit record, then queue the semantic write
 *
 * Inference, validation and capacity failures fail only their item. A failed
 * audit write fails the whole call.
 */
@Service
public class DecisionRoutingService {

    private static final Logger log = LoggerFactory.getLogger(DecisionRoutingService.class);

    private final TenantService tenantService;
    private final InputNormalizer inputNormalizer;
    private final RuleMatcher ruleMatcher;
    private final SplitValidator splitValidator;
    private final InferenceGateway inferenceGateway;
    private final DecisionScoringService scoringService;
    private final LearnedRuleService learnedRuleService;
    private final DecisionRepository decisionRepository;
    private final ReasoningMemoryService reasoningMemoryService;
    private final ThreadPoolTaskExecutor routerExecutor;
    private final Tracer tracer;
    private final MetricsConfig metrics;

    public DecisionRoutingService(TenantService tenantService,
                                  InputNormalizer inputNormalizer,
                                  RuleMatcher ruleMatcher,
                                  SplitValidator splitValidator,
                                  InferenceGateway inferenceGateway,
                                  DecisionScoringService scoringService,
                                  LearnedRuleService learnedRuleService,
                                  DecisionRepository decisionRepository,
                                  ReasoningMemoryService reasoningMemoryService,
                                  @Qualifier("routerExecutor") ThreadPoolTaskExecutor routerExecutor,
                                  Tracer tracer,
                                  MetricsConfig metrics) {
        this.tenantService = tenantService;
        this.inputNormalizer = inputNormalizer;
        this.ruleMatcher = ruleMatcher;
        this.splitValidator = splitValidator;
        this.inferenceGateway = inferenceGateway;
        this.scoringService = scoringService;
        this.learnedRuleService = learnedRuleService;
        this.decisionRepository = decisionRepository;
        this.reasoningMemoryService = reasoningMemoryService;
        this.routerExecutor = routerExecutor;
        this.tracer = tracer;
        this.metrics = metrics;
    }

    @Observed(name = "decisions.route", contextualName = "route-decisions")
    public RoutingResponse routeBatch(String tenantId, List<TransactionInput> items) {
        TenantContext tenant = tenantService.requireTenant(tenantId);
        if (items == null) {
            throw new InvalidRequestException("items is required");
        }

        // one rule snapshot for the whole batch
        List<LearnedRule> rules = learnedRuleService.rulesFor(tenant);

        // at most one pool's worth of items in flight per batch, so a large batch cannot fill the shared queue
        Semaphore inFlight = new Semaphore(Math.max(1, routerExecutor.getMaxPoolSize()));
        List<CompletableFuture<ItemResult>> futures = new ArrayList<>(items.size());
        for (TransactionInput item : items) {
            inFlight.acquireUninterruptibly();
            CompletableFuture<ItemResult> future;
            try {
                future = CompletableFuture.supplyAsync(() -> routeTraced(tenant, item, rules), routerExecutor);
            } catch (RejectedExecutionException e) {
                log.warn("Router pool saturated, failing item: tenant={}, txn={}",
                        tenant.tenantId(), item == null ? null : item.getTransactionId());
                future = CompletableFuture.completedFuture(
                        failed(item, FailureReason.CAPACITY_EXCEEDED, "Router is at capacity, retry later"));
            }
            future.whenComplete((result, error) -> inFlight.release());
            futures.add(future);
        }

        List<ItemResult> results = new ArrayList<>(items.size());
        for (CompletableFuture<ItemResult> future : futures) {
            try {
                results.add(future.join());
            } catch (CompletionException e) {
                if (e.getCause() instanceof RuntimeException cause) {
                    throw cause;
                }
                throw e;
            }
        }

        BatchStats stats = computeStats(results);
        log.info("Routed batch for tenant={}: total={}, autoApplied={}, review={}, failed={}",
                tenant.tenantId(), stats.getTotal(), stats.getAutoApplied(),
                stats.getReviewRequired(), stats.getFailed());
        return RoutingResponse.builder().results(results).stats(stats).build();
    }

    private ItemResult routeTraced(TenantContext tenant, TransactionInput item, List<LearnedRule> rules) {
        Span span = tracer.nextSpan()
                .name("decision.route.item")
                .tag("tenant.id", tenant.tenantId())
                .tag("transaction.id", String.valueOf(item.getTransactionId()))
                .start();
        try (Tracer.SpanInScope ws = tracer.withSpan(span)) {
            ItemResult result = routeItem(tenant, item, rules);
            span.tag("decision.status", result.getStatus().name());
            return result;
        } catch (RuntimeException e) {
            span.error(e);
            throw e;
        } finally {
            span.end();
        }
    }

    ItemResult routeItem(TenantContext tenant, TransactionInput item, List<LearnedRule> rules) {
        if (item == null || item.getTransactionId() == null || item.getTransactionId().isBlank()) {
            return failed(item, FailureReason.VALIDATION_ERROR, "transactionId is required");
        }
        if (isBlank(item.getPayeeName()) && isBlank(item.getDescription())) {
            return failed(item, FailureReason.VALIDATION_ERROR, "payeeName or description is required");
        }

        // 1. Idempotent replay
        String decisionId = decisionIdFor(tenant.tenantId(), item.getTransactionId());
        Decision existing = decisionRepository.findById(tenant.tenantId(), decisionId);
        if (existing != null) {
            return replayed(existing);
        }

        // 2. Rule lookup
        NormalizedInput normalized = inputNormalizer.normalize(item);
        Optional<RuleMatch> match = ruleMatcher.bestMatch(normalized, rules);
        AgentType agentType = AgentType.resolve(item.getAgentType());

        CategoryValue output;
        Object rationale;
        ScoredDecision scored;

        // 3. Pattern short-circuit
        Optional<ScoredDecision> shortCircuit = scoringService.shortCircuit(match, tenant.autoApplyThreshold());
        if (shortCircuit.isPresent()) {
            LearnedRule rule = match.get().rule();
            output = rule.getTarget();
            rationale = String.format("Matched learned rule '%s' -> %s (%d supporting corrections, boost %d)",
                    rule.getSignature(), rule.getTarget().getAccountCode(), rule.getSupportCount(), rule.getBoost());
            scored = shortCircuit.get();
        } else {
            // 4. Inference
            InferenceResult inference;
            try {
                inference = inferenceGateway.infer(new InferenceRequest(item.getTransactionId(),
                        normalized.inputText(), item.getAmountCents(), item.isCredit(), agentType), tenant);
            } catch (InferenceTimeoutException e) {
                return failed(item, FailureReason.INFERENCE_TIMEOUT, e.getMessage());
            } catch (InferenceException e) {
                log.warn("Inference failed: tenant={}, txn={}: {}", tenant.tenantId(), item.getTransactionId(), e.getMessage());
                return failed(item, FailureReason.INFERENCE_ERROR, e.getMessage());
            }
            output = inference.getOutputValue();
            rationale = inference.getRationale();
            // 5. Scoring
            scored = scoringService.score(output, inference.getConfidence(), match, tenant.autoApplyThreshold());
        }

        // 6. Split validation
        Optional<String> splitError = splitValidator.validate(output, item.getAmountCents());
        if (splitError.isPresent()) {
            return failed(item, FailureReason.SPLIT_MISMATCH, splitError.get());
        }

        // 7. Audit write, then best-effort semantic write
        Decision decision = Decision.builder()
                .tenantId(tenant.tenantId())
                .decisionId(decisionId)
                .transactionId(item.getTransactionId())
                .agentType(agentType)
                .inputHash(normalized.inputHash())
                .signature(normalized.signature())
                .keywords(new ArrayList<>(normalized.keywords()))
                .amountCents(item.getAmountCents())
                .outputValue(output)
                .confidence(scored.confidence())
                .source(scored.source())
                .status(scored.status())
                .matchedRuleId(scored.matchedRuleId())
                .rationale(reasoningMemoryService.canonicalText(rationale))
                .createdAt(Instant.now())
                .build();

        boolean created;
        try {
            created = decisionRepository.create(decision);
        } catch (RuntimeException e) {
            log.error("Audit write failed: tenant={}, decision={}", tenant.tenantId(), decisionId, e);
            throw new DecisionPersistenceException("Failed to persist decision " + decisionId, e);
        }
        if (!created) {
            // a concurrent request for the same transaction won
            Decision winner = decisionRepository.findById(tenant.tenantId(), decisionId);
            if (winner != null) {
                return replayed(winner);
            }
        }

        reasoningMemoryService.storeAsync(tenant, decisionId, rationale);
        metrics.recordDecision(tenant.tenantId(), scored.status().name(), scored.source().name(), scored.confidence());
        log.debug("Decision {} for txn={}: {} {} confidence={}", decisionId, item.getTransactionId(),
                scored.status(), scored.source(), scored.confidence());

        return ItemResult.builder()
                .transactionId(item.getTransactionId())
                .decisionId(decisionId)
                .status(scored.status())
                .confidence(scored.confidence())
                .source(scored.source())
                .outputValue(output)
                .matchedRuleId(scored.matchedRuleId())
                .rationale(decision.getRationale())
                .build();
    }

    /**
     * Same tenant and transaction always give the same decision id.
     */
    public static String decisionIdFor(String tenantId, String transactionId) {
        return UUID.nameUUIDFromBytes((tenantId + ":" + transactionId).getBytes(StandardCharsets.UTF_8)).toString();
    }

    static BatchStats computeStats(List<ItemResult> results) {
        int autoApplied = 0, review = 0, failed = 0, ruleResolved = 0, inferenceOnly = 0;
        long confidenceSum = 0;
        for (ItemResult r : results) {
            switch (r.getStatus()) {
                case AUTO_APPLIED -> autoApplied++;
                case REVIEW_REQUIRED -> review++;
                case FAILED -> failed++;
            }
            if (r.getStatus() == DecisionStatus.FAILED) continue;
            confidenceSum += r.getConfidence();
            if (r.getSource() == DecisionSource.INFERENCE) {
                inferenceOnly++;
            } else {
                ruleResolved++;
            }
        }
        int decided = autoApplied + review;
        return BatchStats.builder()
                .total(results.size())
                .autoApplied(autoApplied)
                .reviewRequired(review)
                .failed(failed)
                .averageConfidence(decided == 0 ? 0 : round2((double) confidenceSum / decided))
                .ruleResolvedFraction(decided == 0 ? 0 : round2((double) ruleResolved / decided))
                .inferenceOnlyFraction(decided == 0 ? 0 : round2((double) inferenceOnly / decided))
                .build();
    }

    private ItemResult failed(TransactionInput item, FailureReason reason, String detail) {
        metrics.recordRoutingFailure(reason.name());
        return ItemResult.builder()
                .transactionId(item == null ? null : item.getTransactionId())
                .status(DecisionStatus.FAILED)
                .confidence(0)
                .failureReason(reason)
                .failureDetail(detail)
                .build();
    }

    private static ItemResult replayed(Decision decision) {
        return ItemResult.builder()
                .transactionId(decision.getTransactionId())
                .decisionId(decision.getDecisionId())
                .status(decision.getStatus())
                .confidence(decision.getConfidence())
                .source(decision.getSource())
                .outputValue(decision.getOutputValue())
                .matchedRuleId(decision.getMatchedRuleId())
                .rationale(decision.getRationale())
                .replayed(true)
                .build();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private static double round2(double value) {
        return Math.round(value * 100.0) / 100.0;
    }
}

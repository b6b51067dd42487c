package com.bank.categorization.service;

import com.bank.categorization.config.MemoryConfig;
import com.bank.categorization.config.MetricsConfig;
import com.bank.categorization.integration.EmbeddingProvider;
import com.bank.categorization.model.ReasoningPartition;
import com.bank.categorization.model.ReasoningRecord;
import com.bank.categorization.model.SimilarRationale;
import com.bank.categorization.model.TenantContext;
import com.bank.categorization.repository.ReasoningRepository;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Best-effort semantic memory of decision rationale. Nothing in here throws to
 * its caller: failures are logged, counted and turned into "nothing found".
 */
@Service
public class ReasoningMemoryService {

    private static final Logger log = LoggerFactory.getLogger(ReasoningMemoryService.class);

    private final ReasoningRepository reasoningRepository;
    private final EmbeddingProvider embeddingProvider;
    private final ThreadPoolTaskExecutor memoryExecutor;
    private final MemoryConfig memoryConfig;
    private final MetricsConfig metrics;
    private final ObjectMapper canonicalMapper;

    public ReasoningMemoryService(ReasoningRepository reasoningRepository,
                                  EmbeddingProvider embeddingProvider,
                                  @Qualifier("memoryExecutor") ThreadPoolTaskExecutor memoryExecutor,
                                  MemoryConfig memoryConfig,
                                  MetricsConfig metrics) {
        this.reasoningRepository = reasoningRepository;
        this.embeddingProvider = embeddingProvider;
        this.memoryExecutor = memoryExecutor;
        this.memoryConfig = memoryConfig;
        this.metrics = metrics;
        this.canonicalMapper = JsonMapper.builder()
                .enable(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY)
                .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
                .build();
    }

    /**
     * Queue the semantic write for a decision. Returns immediately; the future
     * completes with whether a record was stored and never completes exceptionally.
     */
    public CompletableFuture<Boolean> storeAsync(TenantContext tenant, String decisionId, Object rationale) {
        try {
            return CompletableFuture.supplyAsync(() -> store(tenant, decisionId, rationale), memoryExecutor);
        } catch (RuntimeException e) {
            // executor rejected the task
            log.warn("Semantic write not queued: tenant={}, decision={}: {}",
                    tenant.tenantId(), decisionId, e.getMessage());
            metrics.recordSemanticWrite("rejected");
            return CompletableFuture.completedFuture(false);
        }
    }

    boolean store(TenantContext tenant, String decisionId, Object rationale) {
        ReasoningPartition partition = tenant.reasoningPartition();
        try {
            String chain = canonicalText(rationale);
            float[] embedding = embeddingProvider.embed(chain);
            boolean stored = reasoningRepository.insert(partition, ReasoningRecord.builder()
                    .tenantId(tenant.tenantId())
                    .decisionId(decisionId)
                    .chain(chain)
                    .embedding(embedding)
                    .storedAt(Instant.now())
                    .build());
            metrics.recordSemanticWrite(stored ? "stored" : "duplicate");
            return stored;
        } catch (Exception e) {
            log.warn("Semantic write failed: partition={}, decision={}: {}", partition, decisionId, e.getMessage());
            metrics.recordSemanticWrite("failed");
            return false;
        }
    }

    /**
     * Rationale text for a decision, or empty when absent or when the store is unavailable.
     */
    public Optional<String> get(TenantContext tenant, String decisionId) {
        try {
            ReasoningRecord record = reasoningRepository.findByDecisionId(tenant.reasoningPartition(), decisionId);
            return Optional.ofNullable(record).map(ReasoningRecord::getChain);
        } catch (Exception e) {
            log.warn("Rationale lookup failed: tenant={}, decision={}: {}",
                    tenant.tenantId(), decisionId, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Up to {@code k} rationale records of this tenant most similar to the query,
     * best first. Empty when the query cannot be embedded or the store is unavailable.
     */
    public List<SimilarRationale> findSimilar(TenantContext tenant, String queryText, Integer k) {
        int limit = resolveLimit(k);
        try {
            float[] query = embeddingProvider.embed(queryText);
            return reasoningRepository.scan(tenant.reasoningPartition()).stream()
                    .filter(r -> r.getEmbedding() != null && r.getEmbedding().length == query.length)
                    .map(r -> new SimilarRationale(r.getDecisionId(), r.getChain(), cosine(query, r.getEmbedding())))
                    .sorted(Comparator.comparingDouble(SimilarRationale::similarity).reversed())
                    .limit(limit)
                    .toList();
        } catch (Exception e) {
            log.warn("Similar rationale search failed: tenant={}: {}", tenant.tenantId(), e.getMessage());
            return List.of();
        }
    }

    /**
     * Strings are stored as-is; anything else as JSON with sorted keys, so equal
     * structures always produce the same text.
     */
    public String canonicalText(Object rationale) {
        if (rationale == null) return "";
        if (rationale instanceof String text) return text;
        try {
            return canonicalMapper.writeValueAsString(rationale);
        } catch (Exception e) {
            return String.valueOf(rationale);
        }
    }

    private int resolveLimit(Integer k) {
        if (k == null || k <= 0) return memoryConfig.getDefaultSimilarLimit();
        return Math.min(k, memoryConfig.getMaxSimilarLimit());
    }

    static double cosine(float[] a, float[] b) {
        double dot = 0, normA = 0, normB = 0;
        for (int i = 0; i < a.length; i++) {
            dot += a[i] * b[i];
            normA += a[i] * a[i];
            normB += b[i] * b[i];
        }
        if (normA == 0 || normB == 0) return 0;
        return dot / (Math.sqrt(normA) * Math.sqrt(normB));
    }
}

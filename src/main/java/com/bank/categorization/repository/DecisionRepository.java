package com.bank.categorization.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.AerospikeException;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.ResultCode;
import com.aerospike.client.policy.GenerationPolicy;
import com.aerospike.client.policy.Policy;
import com.aerospike.client.policy.ScanPolicy;
import com.aerospike.client.policy.WritePolicy;
import com.bank.categorization.config.AerospikeConfig;
import com.bank.categorization.model.AgentType;
import com.bank.categorization.model.CategoryValue;
import com.bank.categorization.model.Decision;
import com.bank.categorization.model.DecisionSource;
import com.bank.categorization.model.DecisionStatus;
import com.bank.categorization.model.PagedResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.function.Predicate;

/**
 * Audit trail of decisions. Records are keyed by tenant and decision id and are
 * never deleted; after creation only the review bins change.
 */
@Repository
public class DecisionRepository {

    private static final Logger log = LoggerFactory.getLogger(DecisionRepository.class);

    private final AerospikeClient client;
    private final String namespace;
    private final WritePolicy writePolicy;
    private final WritePolicy createOnlyPolicy;
    private final Policy readPolicy;

    public DecisionRepository(AerospikeClient client,
                              @Qualifier("aerospikeNamespace") String namespace,
                              @Qualifier("defaultWritePolicy") WritePolicy writePolicy,
                              @Qualifier("createOnlyWritePolicy") WritePolicy createOnlyPolicy,
                              @Qualifier("defaultReadPolicy") Policy readPolicy) {
        this.client = client;
        this.namespace = namespace;
        this.writePolicy = writePolicy;
        this.createOnlyPolicy = createOnlyPolicy;
        this.readPolicy = readPolicy;
    }

    /**
     * Insert a new decision.
     * @return false if a decision with the same id already exists for the tenant
     */
    public boolean create(Decision decision) {
        Key key = key(decision.getTenantId(), decision.getDecisionId());
        try {
            client.put(createOnlyPolicy, key,
                    new Bin("tenantId", decision.getTenantId()),
                    new Bin("decisionId", decision.getDecisionId()),
                    new Bin("transactionId", decision.getTransactionId()),
                    new Bin("agentType", decision.getAgentType().name()),
                    new Bin("inputHash", decision.getInputHash()),
                    new Bin("signature", decision.getSignature()),
                    new Bin("keywords", JsonBinCodec.write(decision.getKeywords())),
                    new Bin("amountCents", decision.getAmountCents()),
                    new Bin("outputValue", JsonBinCodec.write(decision.getOutputValue())),
                    new Bin("confidence", decision.getConfidence()),
                    new Bin("source", decision.getSource().name()),
                    new Bin("status", decision.getStatus().name()),
                    new Bin("matchedRuleId", decision.getMatchedRuleId()),
                    new Bin("rationale", decision.getRationale()),
                    new Bin("createdAt", decision.getCreatedAt().toEpochMilli()));
            return true;
        } catch (AerospikeException e) {
            if (e.getResultCode() == ResultCode.KEY_EXISTS_ERROR) {
                return false;
            }
            throw e;
        }
    }

    public Decision findById(String tenantId, String decisionId) {
        Record record = client.get(readPolicy, key(tenantId, decisionId));
        if (record == null) return null;
        return mapRecord(record);
    }

    /**
     * Annotate a decision as corrected. Rationale and output are left untouched.
     */
    public void markCorrected(String tenantId, String decisionId, CategoryValue correctedTo) {
        client.put(writePolicy, key(tenantId, decisionId),
                new Bin("wasCorrect", false),
                new Bin("correctedTo", JsonBinCodec.write(correctedTo)),
                new Bin("reviewedAt", System.currentTimeMillis()));
    }

    /**
     * Mark a decision as confirmed correct, unless it was corrected in the meantime.
     * @return false if the decision is missing or already corrected
     */
    public boolean markConfirmed(String tenantId, String decisionId) {
        Key key = key(tenantId, decisionId);
        Record record = client.get(readPolicy, key);
        if (record == null) return false;
        if (Boolean.FALSE.equals(wasCorrect(record))) {
            log.debug("Decision {} already corrected, not confirming", decisionId);
            return false;
        }

        WritePolicy guarded = new WritePolicy(writePolicy);
        guarded.generationPolicy = GenerationPolicy.EXPECT_GEN_EQUAL;
        guarded.generation = record.generation;
        try {
            client.put(guarded, key,
                    new Bin("wasCorrect", true),
                    new Bin("reviewedAt", System.currentTimeMillis()));
            return true;
        } catch (AerospikeException e) {
            if (e.getResultCode() == ResultCode.GENERATION_ERROR) {
                // a concurrent review got there first
                return false;
            }
            throw e;
        }
    }

    public PagedResponse<Decision> findByTenant(String tenantId, int limit, Long before) {
        List<Decision> results = scan(tenantId, record -> {
            long createdAt = record.getLong("createdAt");
            return before == null || createdAt < before;
        });

        results.sort(Comparator.comparing(Decision::getCreatedAt).reversed());
        boolean hasMore = results.size() > limit;
        List<Decision> page = hasMore ? new ArrayList<>(results.subList(0, limit)) : results;
        String nextCursor = hasMore ? String.valueOf(page.get(page.size() - 1).getCreatedAt().toEpochMilli()) : null;
        return new PagedResponse<>(page, hasMore, nextCursor);
    }

    /**
     * Counts for accuracy statistics: [total, reviewed, correct].
     */
    public long[] countReviewOutcomes(String tenantId, AgentType agentType) {
        long[] counts = new long[3];
        ScanPolicy scanPolicy = new ScanPolicy();
        scanPolicy.concurrentNodes = true;

        client.scanAll(scanPolicy, namespace, AerospikeConfig.SET_DECISIONS,
                (key, record) -> {
                    if (!tenantId.equals(record.getString("tenantId"))) return;
                    if (agentType != null && !agentType.name().equals(record.getString("agentType"))) return;
                    Boolean wasCorrect = wasCorrect(record);
                    synchronized (counts) {
                        counts[0]++;
                        if (wasCorrect != null) counts[1]++;
                        if (Boolean.TRUE.equals(wasCorrect)) counts[2]++;
                    }
                });
        return counts;
    }

    private List<Decision> scan(String tenantId, Predicate<Record> filter) {
        List<Decision> results = new ArrayList<>();
        ScanPolicy scanPolicy = new ScanPolicy();
        scanPolicy.concurrentNodes = true;

        client.scanAll(scanPolicy, namespace, AerospikeConfig.SET_DECISIONS,
                (key, record) -> {
                    try {
                        if (!tenantId.equals(record.getString("tenantId"))) return;
                        if (!filter.test(record)) return;
                        Decision decision = mapRecord(record);
                        synchronized (results) {
                            results.add(decision);
                        }
                    } catch (Exception e) {
                        log.warn("Failed to read decision record: {}", e.getMessage());
                    }
                });
        return results;
    }

    private Key key(String tenantId, String decisionId) {
        return new Key(namespace, AerospikeConfig.SET_DECISIONS, tenantId + ":" + decisionId);
    }

    private static Boolean wasCorrect(Record record) {
        Object value = record.getValue("wasCorrect");
        if (value == null) return null;
        if (value instanceof Boolean b) return b;
        // servers without boolean support store it as an integer
        return ((Number) value).longValue() != 0;
    }

    private Decision mapRecord(Record record) {
        Object reviewedAt = record.getValue("reviewedAt");
        return Decision.builder()
                .tenantId(record.getString("tenantId"))
                .decisionId(record.getString("decisionId"))
                .transactionId(record.getString("transactionId"))
                .agentType(AgentType.resolve(record.getString("agentType")))
                .inputHash(record.getString("inputHash"))
                .signature(record.getString("signature"))
                .keywords(JsonBinCodec.readList(record.getString("keywords")))
                .amountCents(record.getLong("amountCents"))
                .outputValue(JsonBinCodec.readCategory(record.getString("outputValue")))
                .confidence(record.getInt("confidence"))
                .source(DecisionSource.valueOf(record.getString("source")))
                .status(DecisionStatus.valueOf(record.getString("status")))
                .matchedRuleId(record.getString("matchedRuleId"))
                .rationale(record.getString("rationale"))
                .createdAt(Instant.ofEpochMilli(record.getLong("createdAt")))
                .wasCorrect(wasCorrect(record))
                .correctedTo(JsonBinCodec.readCategory(record.getString("correctedTo")))
                .reviewedAt(reviewedAt == null ? null : Instant.ofEpochMilli(((Number) reviewedAt).longValue()))
                .build();
    }
}

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
import com.bank.categorization.model.Correction;
import com.bank.categorization.model.PatternOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Corrections keyed by tenant and decision id, so a decision can carry at most one.
 */
@Repository
public class CorrectionRepository {

    private static final Logger log = LoggerFactory.getLogger(CorrectionRepository.class);

    private final AerospikeClient client;
    private final String namespace;
    private final WritePolicy writePolicy;
    private final WritePolicy createOnlyPolicy;
    private final Policy readPolicy;

    public CorrectionRepository(AerospikeClient client,
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
     * @return false if the decision already has a correction
     */
    public boolean create(Correction correction) {
        Key key = key(correction.getTenantId(), correction.getDecisionId());
        try {
            client.put(createOnlyPolicy, key,
                    new Bin("tenantId", correction.getTenantId()),
                    new Bin("correctionId", correction.getCorrectionId()),
                    new Bin("decisionId", correction.getDecisionId()),
                    new Bin("originalValue", JsonBinCodec.write(correction.getOriginalValue())),
                    new Bin("correctedValue", JsonBinCodec.write(correction.getCorrectedValue())),
                    new Bin("correctedBy", correction.getCorrectedBy()),
                    new Bin("reason", correction.getReason()),
                    new Bin("createdAt", correction.getCreatedAt().toEpochMilli()));
            return true;
        } catch (AerospikeException e) {
            if (e.getResultCode() == ResultCode.KEY_EXISTS_ERROR) {
                return false;
            }
            throw e;
        }
    }

    /**
     * Record what the pattern learner concluded for this correction, for replays.
     */
    public void updatePatternOutcome(String tenantId, String decisionId, PatternOutcome outcome) {
        client.put(writePolicy, key(tenantId, decisionId), new Bin("patternOutcome", outcome.name()));
    }

    /**
     * Claim the single feedback dispatch for this correction.
     * @return true only for the caller that flipped the flag
     */
    public boolean claimFeedbackDispatch(String tenantId, String decisionId) {
        Key key = key(tenantId, decisionId);
        Record record = client.get(readPolicy, key);
        if (record == null || feedbackDispatched(record)) return false;

        WritePolicy guarded = new WritePolicy(writePolicy);
        guarded.generationPolicy = GenerationPolicy.EXPECT_GEN_EQUAL;
        guarded.generation = record.generation;
        try {
            client.put(guarded, key, new Bin("feedbackDispatched", true));
            return true;
        } catch (AerospikeException e) {
            if (e.getResultCode() == ResultCode.GENERATION_ERROR) {
                // a concurrent retry claimed it
                return false;
            }
            throw e;
        }
    }

    public Correction findByDecisionId(String tenantId, String decisionId) {
        Record record = client.get(readPolicy, key(tenantId, decisionId));
        if (record == null) return null;
        return mapRecord(record);
    }

    public List<Correction> findByTenant(String tenantId, int limit) {
        List<Correction> results = new ArrayList<>();
        ScanPolicy scanPolicy = new ScanPolicy();
        scanPolicy.concurrentNodes = true;

        client.scanAll(scanPolicy, namespace, AerospikeConfig.SET_CORRECTIONS,
                (key, record) -> {
                    try {
                        if (!tenantId.equals(record.getString("tenantId"))) return;
                        Correction correction = mapRecord(record);
                        synchronized (results) {
                            results.add(correction);
                        }
                    } catch (Exception e) {
                        log.warn("Failed to read correction record: {}", e.getMessage());
                    }
                });

        results.sort(Comparator.comparing(Correction::getCreatedAt).reversed());
        return results.size() > limit ? new ArrayList<>(results.subList(0, limit)) : results;
    }

    private Key key(String tenantId, String decisionId) {
        return new Key(namespace, AerospikeConfig.SET_CORRECTIONS, tenantId + ":" + decisionId);
    }

    private static boolean feedbackDispatched(Record record) {
        Object value = record.getValue("feedbackDispatched");
        if (value == null) return false;
        if (value instanceof Boolean b) return b;
        return ((Number) value).longValue() != 0;
    }

    private Correction mapRecord(Record record) {
        String outcome = record.getString("patternOutcome");
        return Correction.builder()
                .tenantId(record.getString("tenantId"))
                .correctionId(record.getString("correctionId"))
                .decisionId(record.getString("decisionId"))
                .originalValue(JsonBinCodec.readCategory(record.getString("originalValue")))
                .correctedValue(JsonBinCodec.readCategory(record.getString("correctedValue")))
                .correctedBy(record.getString("correctedBy"))
                .reason(record.getString("reason"))
                .patternOutcome(outcome == null ? null : PatternOutcome.valueOf(outcome))
                .feedbackDispatched(feedbackDispatched(record))
                .createdAt(Instant.ofEpochMilli(record.getLong("createdAt")))
                .build();
    }
}
